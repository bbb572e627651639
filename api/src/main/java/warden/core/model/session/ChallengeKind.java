package warden.core.model.session;

/**
 * Purpose of a delegation challenge.
 */
public enum ChallengeKind {
    /** Bind a new session key to a delegate. */
    CREATE,
    /** Extend an active session key. */
    RENEW
}
