package warden.adapter.out.storage.memory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.UpdateOutcome;
import warden.core.port.out.SessionKeyRepository;

/**
 * In-memory implementation of SessionKeyRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Session keys are lost on restart and not shared across instances.
 *
 * <p>Conditional updates run inside {@link ConcurrentMap#compute}, which makes the
 * version check and the write atomic per session key. The wallet slot is claimed
 * with a second {@code compute} on the wallet index, so two session keys of the
 * same wallet can never both become enforceable.
 */
public class InMemorySessionKeyRepository implements SessionKeyRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionKeyRepository.class);

    private final ConcurrentMap<String, SessionKey> sessionKeys = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> enforceableByWallet = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> insertIfAbsent(SessionKey sessionKey) {
        return Uni.createFrom().item(() -> {
            if (sessionKey.status().holdsWalletSlot()) {
                throw new IllegalArgumentException("New session keys must not be enforceable");
            }
            SessionKey existing = sessionKeys.putIfAbsent(sessionKey.sessionKeyId(), sessionKey);
            if (existing == null) {
                LOG.debugf("Session key stored: %s for wallet %s", sessionKey.sessionKeyId(), sessionKey.walletId());
                return true;
            }
            LOG.debugf("Session key ID collision detected: %s", sessionKey.sessionKeyId());
            return false;
        });
    }

    @Override
    public Uni<Optional<SessionKey>> findById(String sessionKeyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessionKeys.get(sessionKeyId)));
    }

    @Override
    public Uni<UpdateOutcome> compareAndSet(SessionKey updated, long expectedVersion) {
        return Uni.createFrom().item(() -> {
            var outcome = new AtomicReference<>(UpdateOutcome.STALE);
            var id = updated.sessionKeyId();
            sessionKeys.computeIfPresent(id, (key, current) -> {
                if (current.version() != expectedVersion) {
                    return current;
                }
                if (updated.status().holdsWalletSlot()) {
                    var holder = enforceableByWallet.compute(
                            current.walletId(), (wallet, existing) -> existing == null ? id : existing);
                    if (!id.equals(holder)) {
                        outcome.set(UpdateOutcome.WALLET_CONFLICT);
                        return current;
                    }
                } else if (current.status().holdsWalletSlot()) {
                    enforceableByWallet.remove(current.walletId(), id);
                }
                outcome.set(UpdateOutcome.APPLIED);
                return updated;
            });
            return outcome.get();
        });
    }

    @Override
    public Uni<List<SessionKey>> findByWallet(String walletId) {
        return Uni.createFrom().item(() -> sessionKeys.values().stream()
                .filter(sessionKey -> sessionKey.walletId().equals(walletId))
                .sorted(Comparator.comparing(SessionKey::createdAt).reversed())
                .toList());
    }

    @Override
    public Uni<Optional<SessionKey>> findEnforceableByWallet(String walletId) {
        return Uni.createFrom().item(() -> {
            var sessionKeyId = enforceableByWallet.get(walletId);
            return sessionKeyId == null ? Optional.empty() : Optional.ofNullable(sessionKeys.get(sessionKeyId));
        });
    }

    @Override
    public Uni<List<SessionKey>> findByStatus(Collection<SessionKeyStatus> statuses) {
        return Uni.createFrom().item(() -> sessionKeys.values().stream()
                .filter(sessionKey -> statuses.contains(sessionKey.status()))
                .toList());
    }

    /**
     * Return the current session key count (for health checks).
     */
    public int getSessionKeyCount() {
        return sessionKeys.size();
    }
}
