package warden.core.model.session;

/**
 * Status of a delegation challenge.
 *
 * <p>Only {@link #AWAITING_CONFIRMATION} admits transitions; every other
 * status is final so duplicate confirmations resolve once.
 */
public enum ChallengeStatus {
    AWAITING_CONFIRMATION,
    CONFIRMED,
    FAILED,
    EXPIRED;

    public boolean isResolved() {
        return this != AWAITING_CONFIRMATION;
    }
}
