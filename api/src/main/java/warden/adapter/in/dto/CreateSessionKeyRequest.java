package warden.adapter.in.dto;

import java.time.Duration;
import java.util.Set;

import warden.core.model.session.SessionOverrides;

/**
 * DTO for session key creation requests.
 *
 * <p>Every permission field is optional and may only narrow the agent's catalog defaults.
 *
 * @param walletId                owning wallet (required)
 * @param userId                  owning user (required)
 * @param agentType               catalog entry to derive permissions from (required)
 * @param spendingLimit           cumulative cap in the smallest currency unit
 * @param duration                ISO-8601 duration, e.g. {@code PT24H}
 * @param allowedActions          subset of the agent's actions
 * @param maxAmountPerTransaction per-action cap
 * @param autoRenew               whether the scheduler may renew the session key
 * @param maxRenewals             number of renewals allowed
 */
public record CreateSessionKeyRequest(
        String walletId,
        String userId,
        String agentType,
        Long spendingLimit,
        Duration duration,
        Set<String> allowedActions,
        Long maxAmountPerTransaction,
        Boolean autoRenew,
        Integer maxRenewals) {

    public SessionOverrides toOverrides() {
        return new SessionOverrides(
                spendingLimit, duration, allowedActions, maxAmountPerTransaction, autoRenew, maxRenewals);
    }
}
