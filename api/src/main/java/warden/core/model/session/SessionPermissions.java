package warden.core.model.session;

import java.util.Set;

/**
 * Permission set embedded in a session key.
 *
 * <p>Amounts are expressed in the smallest currency unit (e.g. USDC micro-units).
 * The invariant {@code 0 <= spendingUsed <= spendingLimit} holds for every
 * instance; the spending limit never changes for the life of a session.
 *
 * @param allowedActions          action tags the agent may request
 * @param spendingLimit           cumulative cap for the session
 * @param spendingUsed            amount currently reserved against the cap
 * @param maxAmountPerTransaction per-action cap, or null when uncapped
 * @param autoRenew               whether the renewal scheduler may extend the session
 * @param maxRenewals             number of extensions allowed
 * @param renewalsUsed            number of extensions already granted
 */
public record SessionPermissions(
        Set<String> allowedActions,
        long spendingLimit,
        long spendingUsed,
        Long maxAmountPerTransaction,
        boolean autoRenew,
        int maxRenewals,
        int renewalsUsed) {

    public SessionPermissions {
        allowedActions = allowedActions == null ? Set.of() : Set.copyOf(allowedActions);
        if (spendingLimit < 0) {
            throw new IllegalArgumentException("spendingLimit must not be negative");
        }
        if (spendingUsed < 0 || spendingUsed > spendingLimit) {
            throw new IllegalArgumentException(
                    "spendingUsed must be within [0, %d], was %d".formatted(spendingLimit, spendingUsed));
        }
        if (maxAmountPerTransaction != null && maxAmountPerTransaction < 0) {
            throw new IllegalArgumentException("maxAmountPerTransaction must not be negative");
        }
        if (maxRenewals < 0 || renewalsUsed < 0) {
            throw new IllegalArgumentException("renewal counters must not be negative");
        }
    }

    /**
     * Remaining budget of the session.
     */
    public long headroom() {
        return spendingLimit - spendingUsed;
    }

    public boolean allows(String action) {
        return action != null && allowedActions.contains(action);
    }

    /**
     * Check if {@code amount} can be reserved without exceeding the cap.
     *
     * <p>Written as a comparison against the headroom so that very large
     * amounts cannot overflow.
     */
    public boolean fits(long amount) {
        return amount <= headroom();
    }

    public boolean exceedsPerTransactionCap(long amount) {
        return maxAmountPerTransaction != null && amount > maxAmountPerTransaction;
    }

    public boolean hasRenewalsLeft() {
        return renewalsUsed < maxRenewals;
    }

    public SessionPermissions withSpendingUsed(long spendingUsed) {
        return new SessionPermissions(
                allowedActions,
                spendingLimit,
                spendingUsed,
                maxAmountPerTransaction,
                autoRenew,
                maxRenewals,
                renewalsUsed);
    }

    public SessionPermissions withRenewalUsed() {
        return new SessionPermissions(
                allowedActions,
                spendingLimit,
                spendingUsed,
                maxAmountPerTransaction,
                autoRenew,
                maxRenewals,
                renewalsUsed + 1);
    }
}
