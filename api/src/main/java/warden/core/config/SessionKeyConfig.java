package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for session key lifecycle and enforcement.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.session-keys.challenge-ttl=PT15M
 * warden.session-keys.enforcement.max-attempts=5
 * warden.session-keys.storage.provider=redis
 * warden.session-keys.storage.redis.key-prefix=warden:
 * }</pre>
 */
@ConfigMapping(prefix = "warden.session-keys")
public interface SessionKeyConfig {

    /**
     * How long a delegation challenge may await confirmation before it is treated as failed.
     */
    @WithName("challenge-ttl")
    @WithDefault("PT15M")
    Duration challengeTtl();

    /**
     * Duration granted to agent types missing from the catalog.
     */
    @WithName("minimum-duration")
    @WithDefault("PT1H")
    Duration minimumDuration();

    /**
     * Renewal quota granted when the user does not narrow it.
     */
    @WithName("default-max-renewals")
    @WithDefault("3")
    int defaultMaxRenewals();

    @WithName("default-auto-renew")
    @WithDefault("true")
    boolean defaultAutoRenew();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Enforcement configuration.
     */
    EnforcementConfig enforcement();

    /**
     * Revocation configuration.
     */
    RevocationConfig revocation();

    /**
     * Ledger configuration.
     */
    LedgerConfig ledger();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    interface IdGenerationConfig {

        /**
         * Attempts to find an unused session key ID before giving up.
         */
        @WithDefault("3")
        int maxRetries();
    }

    interface EnforcementConfig {

        /**
         * Conditional update attempts per authorization or reversal before reporting contention.
         */
        @WithDefault("5")
        int maxAttempts();
    }

    interface RevocationConfig {

        /**
         * Conditional update attempts for a terminal transition or for applying the
         * outcome of a resolved delegation challenge.
         *
         * <p>These transitions win against concurrent spend updates, so this
         * bound is only reached when the store keeps losing writes.
         */
        @WithDefault("50")
        int maxAttempts();
    }

    interface LedgerConfig {

        /**
         * Number of entries retained in each wallet's and each user's audit index.
         */
        @WithName("wallet-retention")
        @WithDefault("1000")
        int walletRetention();

        /**
         * Default page size for wallet and user audit queries.
         */
        @WithName("default-limit")
        @WithDefault("100")
        int defaultLimit();
    }

    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * @return Provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();

        /**
         * Redis configuration.
         */
        RedisConfig redis();

        interface RedisConfig {

            /**
             * Redis key prefix.
             *
             * @return Key prefix (default: warden:)
             */
            @WithDefault("warden:")
            String keyPrefix();

            /**
             * Timeout applied to each Redis operation.
             */
            @WithDefault("PT2S")
            Duration timeout();
        }
    }
}
