package warden.core.model.session;

/**
 * Result of starting a session key creation.
 */
public sealed interface CreationResult {

    /**
     * A pending session key was stored and its delegation challenge emitted.
     */
    record Started(String sessionKeyId, String challengeId, SessionKey session) implements CreationResult {}

    record Refused(SessionKeyError error, String message) implements CreationResult {}
}
