package warden.core.port.out;

import warden.core.model.session.ChallengeKind;
import warden.core.model.session.ChallengeStatus;
import warden.core.model.session.RenewalPassSummary;
import warden.core.model.session.SessionKeyError;
import warden.core.model.session.SessionKeyStatus;

/**
 * Port interface for recording session key metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface SessionKeyMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an authorization decision.
     *
     * @param reason the rejection reason, or null when admitted
     * @param amount the requested amount
     */
    void recordAuthorization(SessionKeyError reason, long amount);

    /**
     * Record a reversal.
     *
     * @param clamped whether the counter was clamped at zero
     */
    void recordReversal(boolean clamped);

    void recordChallenge(ChallengeKind kind, ChallengeStatus status);

    void recordTermination(SessionKeyStatus status);

    void recordRenewalPass(RenewalPassSummary summary);

    /**
     * Record a storage operation timeout.
     *
     * @param repository the repository name
     * @param operation the operation name
     */
    void recordStorageTimeout(String repository, String operation);

    /**
     * Record a storage operation failure other than a timeout.
     *
     * @param repository the repository name
     * @param operation the operation name
     */
    void recordStorageFailure(String repository, String operation);
}
