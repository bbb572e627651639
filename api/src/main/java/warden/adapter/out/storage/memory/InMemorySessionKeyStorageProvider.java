package warden.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.core.port.out.DelegationChallengeRepository;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyRepository;
import warden.spi.SessionKeyStorageProvider;

/**
 * In-memory session key storage provider.
 *
 * <p>This provider is always available and serves as a fallback when
 * Redis or other storage backends are unavailable.
 *
 * <p><strong>Warning:</strong> Spending counters are per instance with in-memory
 * storage, so running several instances multiplies every spending limit.
 * Not recommended for production.
 */
@ApplicationScoped
public class InMemorySessionKeyStorageProvider implements SessionKeyStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionKeyStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private final InMemorySessionKeyRepository sessionKeys = new InMemorySessionKeyRepository();
    private final InMemoryDelegationChallengeRepository challenges = new InMemoryDelegationChallengeRepository();
    private final InMemoryExecutionRecordRepository executionRecords;

    @Inject
    public InMemorySessionKeyStorageProvider(SessionKeyConfig config) {
        this.executionRecords = new InMemoryExecutionRecordRepository(config.ledger().walletRetention());
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public SessionKeyRepository sessionKeys() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session key storage is in-memory only!");
            LOG.warn("  Spending limits are NOT shared between instances.");
            LOG.warn("  Configure Redis or a custom SessionKeyStorageProvider for production.");
            LOG.warn("========================================================================");
        }
        return sessionKeys;
    }

    @Override
    public ExecutionRecordRepository executionRecords() {
        return executionRecords;
    }

    @Override
    public DelegationChallengeRepository challenges() {
        return challenges;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-key-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessionKeys", sessionKeys.getSessionKeyCount())
                .build());
    }
}
