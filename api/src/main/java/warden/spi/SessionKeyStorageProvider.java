package warden.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import warden.core.port.out.DelegationChallengeRepository;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyRepository;

/**
 * SPI for session key storage backends.
 *
 * <p>A provider supplies the three repositories that make up the session key
 * store: session keys, the execution ledger and delegation challenges. All three
 * must share one backend so that a wallet's records stay consistent.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage, shared across instances</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (warden.session-keys.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface SessionKeyStorageProvider {

    /**
     * Return the provider name used in {@code warden.session-keys.storage.provider}.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    SessionKeyRepository sessionKeys();

    ExecutionRecordRepository executionRecords();

    DelegationChallengeRepository challenges();

    /**
     * Create a health indicator for this storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
