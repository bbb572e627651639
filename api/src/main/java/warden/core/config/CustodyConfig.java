package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the custody provider integration.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.custody.mode=http
 * warden.custody.http.endpoint=https://custody.internal/delegations
 * warden.custody.http.timeout=PT5S
 * }</pre>
 */
@ConfigMapping(prefix = "warden.custody")
public interface CustodyConfig {

    /**
     * Custody provider adapter: {@code log} accepts and logs every request,
     * {@code http} posts requests to {@link HttpConfig#endpoint()}.
     */
    @WithDefault("log")
    String mode();

    HttpConfig http();

    interface HttpConfig {

        /**
         * URL receiving delegation requests as JSON.
         */
        Optional<String> endpoint();

        @WithDefault("PT5S")
        Duration timeout();
    }
}
