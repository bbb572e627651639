package warden.core.model.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only ledger entry for an authorization decision or a reversal.
 *
 * @param recordId     unique record identifier
 * @param sessionKeyId session key the entry belongs to
 * @param walletId     wallet of the session key
 * @param userId       user of the session key
 * @param action       requested action tag (null for reversals)
 * @param amount       amount requested, or released for reversals
 * @param timestamp    decision time
 * @param outcome      ledger outcome
 * @param reason       rejection reason or reversal note (may be null)
 */
public record ExecutionRecord(
        String recordId,
        String sessionKeyId,
        String walletId,
        String userId,
        String action,
        long amount,
        Instant timestamp,
        ExecutionOutcome outcome,
        String reason) {

    public ExecutionRecord {
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(sessionKeyId, "sessionKeyId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public static ExecutionRecord admitted(
            String recordId, SessionKey session, String action, long amount, Instant now) {
        return new ExecutionRecord(
                recordId,
                session.sessionKeyId(),
                session.walletId(),
                session.userId(),
                action,
                amount,
                now,
                ExecutionOutcome.ADMITTED,
                null);
    }

    public static ExecutionRecord rejected(
            String recordId, SessionKey session, String action, long amount, SessionKeyError reason, Instant now) {
        return new ExecutionRecord(
                recordId,
                session.sessionKeyId(),
                session.walletId(),
                session.userId(),
                action,
                amount,
                now,
                ExecutionOutcome.REJECTED,
                reason.name());
    }

    public static ExecutionRecord reversed(
            String recordId, SessionKey session, long amount, String note, Instant now) {
        return new ExecutionRecord(
                recordId,
                session.sessionKeyId(),
                session.walletId(),
                session.userId(),
                null,
                amount,
                now,
                ExecutionOutcome.REVERSED,
                note);
    }

    /**
     * Signed contribution of this entry to the reserved amount.
     */
    public long spendingDelta() {
        return switch (outcome) {
            case ADMITTED -> amount;
            case REVERSED -> -amount;
            case REJECTED -> 0L;
        };
    }
}
