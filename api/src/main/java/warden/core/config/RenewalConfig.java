package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the renewal scheduler.
 *
 * <p>A session is renewed once the time left drops below
 * {@code max(duration * look-ahead-fraction, look-ahead-floor)}.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.renewal.enabled=true
 * warden.renewal.interval=1m
 * warden.renewal.look-ahead-fraction=0.1
 * warden.renewal.look-ahead-floor=PT1H
 * }</pre>
 */
@ConfigMapping(prefix = "warden.renewal")
public interface RenewalConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Scheduler interval, in the format accepted by {@code @Scheduled(every = ...)}.
     */
    @WithDefault("1m")
    String interval();

    @WithName("look-ahead-fraction")
    @WithDefault("0.1")
    double lookAheadFraction();

    @WithName("look-ahead-floor")
    @WithDefault("PT1H")
    Duration lookAheadFloor();
}
