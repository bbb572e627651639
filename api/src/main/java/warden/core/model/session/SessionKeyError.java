package warden.core.model.session;

/**
 * Reasons a session key operation can be refused.
 *
 * <p>Retryable reasons describe transient conditions: repeating the same
 * request without new input may succeed.
 */
public enum SessionKeyError {
    NOT_FOUND(false),
    NOT_YET_ACTIVE(false),
    INACTIVE(false),
    EXPIRED(false),
    ACTION_NOT_PERMITTED(false),
    PER_TRANSACTION_LIMIT_EXCEEDED(false),
    SPENDING_LIMIT_EXCEEDED(false),
    CONTENTION(true),
    CHALLENGE_FAILED(true),
    INVALID_OVERRIDE(false),
    INVALID_AMOUNT(false),
    RENEWAL_QUOTA_EXHAUSTED(false),
    RENEWAL_IN_PROGRESS(false),
    STORE_UNAVAILABLE(true);

    private final boolean retryable;

    SessionKeyError(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
