package warden.core.model.session;

/**
 * Result of releasing a previously reserved amount.
 */
public sealed interface ReversalResult {

    /**
     * @param spendingUsed reserved amount after the reversal
     * @param clamped      true when the requested amount exceeded the reserved amount
     *                     and the counter was clamped at zero
     */
    record Reversed(long spendingUsed, boolean clamped) implements ReversalResult {}

    record Refused(SessionKeyError reason) implements ReversalResult {}
}
