package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.core.port.out.DelegationChallengeRepository;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyMetrics;
import warden.core.port.out.SessionKeyRepository;
import warden.spi.SessionKeyStorageProvider;

/**
 * Redis-based session key storage provider.
 *
 * <p>This is the recommended provider for production deployments. Spending
 * counters are shared by every instance, so limits hold across a cluster.
 */
@ApplicationScoped
public class RedisSessionKeyStorageProvider implements SessionKeyStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisSessionKeyStorageProvider.class);
    private static final int PRIORITY = 100; // High priority

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionKeyConfig config;
    private final SessionKeyMetrics metrics;

    private RedisSessionKeyRepository sessionKeys;
    private RedisExecutionRecordRepository executionRecords;
    private RedisDelegationChallengeRepository challenges;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisSessionKeyStorageProvider(
            ReactiveRedisDataSource redisDataSource, SessionKeyConfig config, SessionKeyMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        // Check availability asynchronously at startup
        redisDataSource
                .key(String.class)
                .exists("test-connection")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis session key storage is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis session key storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        // Wait for the async check to complete (with timeout)
        try {
            if (!checkLatch.await(6, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized SessionKeyRepository sessionKeys() {
        if (sessionKeys == null) {
            sessionKeys = new RedisSessionKeyRepository(redisDataSource, keyPrefix(), helper("session-keys"));
            LOG.info("Created Redis session key repository with prefix: " + keyPrefix());
        }
        return sessionKeys;
    }

    @Override
    public synchronized ExecutionRecordRepository executionRecords() {
        if (executionRecords == null) {
            executionRecords = new RedisExecutionRecordRepository(
                    redisDataSource, keyPrefix(), config.ledger().walletRetention(), helper("execution-records"));
        }
        return executionRecords;
    }

    @Override
    public synchronized DelegationChallengeRepository challenges() {
        if (challenges == null) {
            challenges = new RedisDelegationChallengeRepository(redisDataSource, keyPrefix(), helper("challenges"));
        }
        return challenges;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // Use cached availability state to avoid blocking on health checks
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("session-key-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", keyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("session-key-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis not available or check not completed")
                .build());
    }

    private RedisTimeoutHelper helper(String repositoryName) {
        return new RedisTimeoutHelper(config.storage().redis().timeout(), metrics, repositoryName);
    }

    private String keyPrefix() {
        return config.storage().redis().keyPrefix();
    }
}
