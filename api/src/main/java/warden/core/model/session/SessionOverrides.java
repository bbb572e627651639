package warden.core.model.session;

import java.time.Duration;
import java.util.Set;

/**
 * User-supplied narrowing of an agent's default permissions. Null fields keep the default.
 */
public record SessionOverrides(
        Long spendingLimit,
        Duration duration,
        Set<String> allowedActions,
        Long maxAmountPerTransaction,
        Boolean autoRenew,
        Integer maxRenewals) {

    public SessionOverrides {
        allowedActions = allowedActions == null ? null : Set.copyOf(allowedActions);
    }

    public static SessionOverrides none() {
        return new SessionOverrides(null, null, null, null, null, null);
    }
}
