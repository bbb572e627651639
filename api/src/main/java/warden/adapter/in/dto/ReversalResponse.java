package warden.adapter.in.dto;

/**
 * Result of a reversal.
 *
 * @param sessionKeyId session key the amount was released on
 * @param spendingUsed reserved amount after the reversal
 * @param clamped      whether the request exceeded the reserved amount
 */
public record ReversalResponse(String sessionKeyId, long spendingUsed, boolean clamped) {}
