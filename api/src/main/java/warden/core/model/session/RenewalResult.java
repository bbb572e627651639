package warden.core.model.session;

/**
 * Result of starting a session key renewal.
 */
public sealed interface RenewalResult {

    record Started(String sessionKeyId, String challengeId) implements RenewalResult {}

    record Refused(SessionKeyError error, String message) implements RenewalResult {}
}
