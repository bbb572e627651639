package warden.core.service.session;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.CreationResult;
import warden.core.model.session.ExecutionRecord;
import warden.core.model.session.RenewalResult;
import warden.core.model.session.RevocationResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionOverrides;
import warden.core.model.session.SpendingSummary;
import warden.core.port.in.SessionKeyManagement;
import warden.core.port.out.SessionKeyRepository;

/**
 * Session key operations exposed to users.
 *
 * <p>Reads apply passive expiry: a session key found past its expiry in an
 * enforceable status is expired before it is returned.
 */
@ApplicationScoped
public class SessionKeyService implements SessionKeyManagement {

    private final ChallengeCoordinator coordinator;
    private final RevocationService revocationService;
    private final ExecutionAuditService auditService;
    private final SessionKeyRepository sessionKeys;
    private final Clock clock;

    @Inject
    public SessionKeyService(
            ChallengeCoordinator coordinator,
            RevocationService revocationService,
            ExecutionAuditService auditService,
            SessionKeyRepository sessionKeys,
            Clock clock) {
        this.coordinator = coordinator;
        this.revocationService = revocationService;
        this.auditService = auditService;
        this.sessionKeys = sessionKeys;
        this.clock = clock;
    }

    @Override
    public Uni<CreationResult> create(String walletId, String userId, String agentType, SessionOverrides overrides) {
        return coordinator.beginCreate(walletId, userId, agentType, overrides);
    }

    @Override
    public Uni<RenewalResult> renew(String sessionKeyId) {
        return coordinator.beginRenewal(sessionKeyId);
    }

    @Override
    public Uni<RevocationResult> revoke(String sessionKeyId, String reason) {
        return revocationService.revoke(sessionKeyId, reason);
    }

    @Override
    public Uni<Optional<SessionKey>> get(String sessionKeyId) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(found);
            }
            return expireIfDue(found.get()).map(Optional::of);
        });
    }

    @Override
    public Uni<List<SessionKey>> listByWallet(String walletId) {
        return sessionKeys.findByWallet(walletId).flatMap(sessions -> {
            if (sessions.isEmpty()) {
                return Uni.createFrom().item(sessions);
            }
            return Uni.join()
                    .all(sessions.stream().map(this::expireIfDue).toList())
                    .andFailFast();
        });
    }

    @Override
    public Uni<List<ExecutionRecord>> executions(String sessionKeyId) {
        return auditService.sessionLedger(sessionKeyId);
    }

    @Override
    public Uni<List<ExecutionRecord>> walletExecutions(String walletId, int limit) {
        return auditService.walletLedger(walletId, limit);
    }

    @Override
    public Uni<List<ExecutionRecord>> userExecutions(String userId, int limit) {
        return auditService.userLedger(userId, limit);
    }

    @Override
    public Uni<Optional<SpendingSummary>> spending(String sessionKeyId) {
        return auditService.spending(sessionKeyId);
    }

    private Uni<SessionKey> expireIfDue(SessionKey session) {
        if (!session.status().isEnforceable() || !session.isPastExpiry(clock.instant())) {
            return Uni.createFrom().item(session);
        }
        return revocationService.expire(session.sessionKeyId()).flatMap(result -> sessionKeys
                .findById(session.sessionKeyId())
                .map(latest -> latest.orElse(session)));
    }
}
