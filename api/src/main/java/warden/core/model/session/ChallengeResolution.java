package warden.core.model.session;

/**
 * Result of completing a delegation challenge.
 */
public sealed interface ChallengeResolution {

    /**
     * The challenge was resolved by this call.
     *
     * @param challenge the resolved challenge
     * @param session   the session key after the resolution
     * @param error     {@link SessionKeyError#CHALLENGE_FAILED} when the delegation failed, else null
     */
    record Resolved(DelegationChallenge challenge, SessionKey session, SessionKeyError error)
            implements ChallengeResolution {}

    /**
     * The challenge had already been resolved; nothing changed.
     */
    record AlreadyResolved(DelegationChallenge challenge) implements ChallengeResolution {}

    record Refused(SessionKeyError error, String message) implements ChallengeResolution {}
}
