package warden.adapter.in.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import warden.core.model.session.SessionKey;

/**
 * Read model of a session key.
 */
public record SessionKeyResponse(
        String sessionKeyId,
        String walletId,
        String userId,
        String agentType,
        String delegateAddress,
        String status,
        String statusReason,
        List<String> allowedActions,
        long spendingLimit,
        long spendingUsed,
        long headroom,
        Long maxAmountPerTransaction,
        boolean autoRenew,
        int maxRenewals,
        int renewalsUsed,
        Duration duration,
        Instant createdAt,
        Instant expiresAt,
        Instant updatedAt) {

    public static SessionKeyResponse fromModel(SessionKey model) {
        var permissions = model.permissions();
        return new SessionKeyResponse(
                model.sessionKeyId(),
                model.walletId(),
                model.userId(),
                model.agentType(),
                model.delegateAddress(),
                model.status().name(),
                model.statusReason(),
                permissions.allowedActions().stream().sorted().toList(),
                permissions.spendingLimit(),
                permissions.spendingUsed(),
                permissions.headroom(),
                permissions.maxAmountPerTransaction(),
                permissions.autoRenew(),
                permissions.maxRenewals(),
                permissions.renewalsUsed(),
                model.duration(),
                model.createdAt(),
                model.expiresAt(),
                model.updatedAt());
    }
}
