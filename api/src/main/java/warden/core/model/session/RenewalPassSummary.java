package warden.core.model.session;

/**
 * Counts from one renewal scheduler pass.
 *
 * @param renewalsStarted   renewals started for session keys nearing their expiry
 * @param sessionsExpired   session keys moved to EXPIRED
 * @param challengesExpired challenges resolved as expired
 * @param sessionsSettled   PENDING or RENEWING session keys that received the outcome of an
 *                          already resolved (or lost) challenge
 * @param failures          transitions that could not be applied and are retried next pass
 */
public record RenewalPassSummary(
        int renewalsStarted, int sessionsExpired, int challengesExpired, int sessionsSettled, int failures) {

    public static RenewalPassSummary empty() {
        return new RenewalPassSummary(0, 0, 0, 0, 0);
    }
}
