package warden.core.service.session;

import java.time.Duration;

import warden.core.config.SessionKeyConfig;

/**
 * Mutable SessionKeyConfig for unit tests.
 */
class TestSessionKeyConfig implements SessionKeyConfig {

    Duration challengeTtl = Duration.ofMinutes(15);
    Duration minimumDuration = Duration.ofHours(1);
    int defaultMaxRenewals = 3;
    boolean defaultAutoRenew = true;
    int maxIdRetries = 3;
    int enforcementAttempts = 5;
    int revocationAttempts = 50;
    int walletRetention = 1000;
    int defaultLedgerLimit = 100;
    String storageProvider = "memory";

    @Override
    public Duration challengeTtl() {
        return challengeTtl;
    }

    @Override
    public Duration minimumDuration() {
        return minimumDuration;
    }

    @Override
    public int defaultMaxRenewals() {
        return defaultMaxRenewals;
    }

    @Override
    public boolean defaultAutoRenew() {
        return defaultAutoRenew;
    }

    @Override
    public IdGenerationConfig idGeneration() {
        return () -> maxIdRetries;
    }

    @Override
    public EnforcementConfig enforcement() {
        return () -> enforcementAttempts;
    }

    @Override
    public RevocationConfig revocation() {
        return () -> revocationAttempts;
    }

    @Override
    public LedgerConfig ledger() {
        return new LedgerConfig() {
            @Override
            public int walletRetention() {
                return walletRetention;
            }

            @Override
            public int defaultLimit() {
                return defaultLedgerLimit;
            }
        };
    }

    @Override
    public StorageConfig storage() {
        return new StorageConfig() {
            @Override
            public String provider() {
                return storageProvider;
            }

            @Override
            public RedisConfig redis() {
                return new RedisConfig() {
                    @Override
                    public String keyPrefix() {
                        return "warden:";
                    }

                    @Override
                    public Duration timeout() {
                        return Duration.ofSeconds(2);
                    }
                };
            }
        };
    }
}
