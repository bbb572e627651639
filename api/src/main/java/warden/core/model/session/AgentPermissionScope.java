package warden.core.model.session;

import java.time.Duration;
import java.util.Set;

/**
 * Default permissions granted to an agent type.
 *
 * @param agentType               catalog key
 * @param displayName             human-readable name
 * @param description             what the agent does
 * @param allowedActions          action tags the agent may request
 * @param spendingLimit           default cumulative cap
 * @param maxAmountPerTransaction default per-action cap, or null when uncapped
 * @param duration                default session duration
 */
public record AgentPermissionScope(
        String agentType,
        String displayName,
        String description,
        Set<String> allowedActions,
        long spendingLimit,
        Long maxAmountPerTransaction,
        Duration duration) {

    public AgentPermissionScope {
        allowedActions = allowedActions == null ? Set.of() : Set.copyOf(allowedActions);
    }

    /**
     * Empty-capability scope returned for unknown agent types.
     */
    public static AgentPermissionScope unknown(String agentType, Duration minimumDuration) {
        return new AgentPermissionScope(
                agentType, "Unknown agent", "No permissions granted", Set.of(), 0L, null, minimumDuration);
    }

    public boolean grantsNothing() {
        return allowedActions.isEmpty() && spendingLimit == 0L;
    }
}
