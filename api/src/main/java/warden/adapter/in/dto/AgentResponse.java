package warden.adapter.in.dto;

import java.time.Duration;
import java.util.List;

import warden.core.model.session.AgentPermissionScope;

/**
 * Catalog entry of an agent type.
 */
public record AgentResponse(
        String agentType,
        String displayName,
        String description,
        List<String> allowedActions,
        long spendingLimit,
        Long maxAmountPerTransaction,
        Duration duration) {

    public static AgentResponse fromModel(AgentPermissionScope model) {
        return new AgentResponse(
                model.agentType(),
                model.displayName(),
                model.description(),
                model.allowedActions().stream().sorted().toList(),
                model.spendingLimit(),
                model.maxAmountPerTransaction(),
                model.duration());
    }
}
