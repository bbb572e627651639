package warden.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.SessionKeyMetrics;

/**
 * Helper for applying timeouts and failure accounting to Redis operations.
 *
 * <p>Session key storage backs spending decisions, so every operation is
 * fail-fast: a timeout surfaces as {@link RedisTimeoutException} and other
 * failures propagate unchanged. Callers in the core translate both into a
 * retryable {@code STORE_UNAVAILABLE} outcome.
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code warden.storage.timeouts.total}) and
 * non-timeout failures ({@code warden.storage.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final SessionKeyMetrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param repositoryName the repository name for metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, SessionKeyMetrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply the timeout to an operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof RedisTimeoutException))
                .invoke(error -> {
                    LOG.warnv(
                            "Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStorageTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStorageFailure(repositoryName, operationName);
        }
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }
    }
}
