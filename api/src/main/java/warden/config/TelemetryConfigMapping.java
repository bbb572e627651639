package warden.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.telemetry.enabled=true
 * warden.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
