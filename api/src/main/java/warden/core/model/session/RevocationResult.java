package warden.core.model.session;

/**
 * Result of revoking or expiring a session key.
 */
public sealed interface RevocationResult {

    /**
     * The session key was moved to a terminal status by this call.
     */
    record Terminated(SessionKey session) implements RevocationResult {}

    /**
     * The session key was already terminal.
     */
    record AlreadyTerminal(SessionKey session) implements RevocationResult {}

    record Refused(SessionKeyError error) implements RevocationResult {}

    default boolean succeeded() {
        return !(this instanceof Refused);
    }
}
