package warden.adapter.out.custody;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.core.config.CustodyConfig;
import warden.core.port.out.CustodyProvider;

/**
 * CDI producer for the custody provider.
 *
 * <p>Selects the adapter named by {@code warden.custody.mode}:
 * <ul>
 *   <li>log - Logs and accepts every request (default, development only)</li>
 *   <li>http - Posts requests to {@code warden.custody.http.endpoint}</li>
 * </ul>
 */
@ApplicationScoped
public class CustodyProviderLoader {

    private static final Logger LOG = Logger.getLogger(CustodyProviderLoader.class);

    private final CustodyConfig config;
    private final Vertx vertx;

    @Inject
    public CustodyProviderLoader(CustodyConfig config, Vertx vertx) {
        this.config = config;
        this.vertx = vertx;
    }

    @Produces
    @ApplicationScoped
    public CustodyProvider produceCustodyProvider() {
        final var mode = config.mode();
        if ("http".equals(mode)) {
            final var endpoint = config.http()
                    .endpoint()
                    .filter(url -> !url.isBlank())
                    .orElseThrow(() -> new IllegalStateException(
                            "warden.custody.http.endpoint is required when warden.custody.mode=http"));
            LOG.infov("Using HTTP custody provider: {0}", endpoint);
            return new HttpCustodyProvider(WebClient.create(vertx), endpoint, config.http().timeout());
        }

        if (!"log".equals(mode)) {
            LOG.warnv("Unknown custody mode {0}, falling back to log", mode);
        }
        LOG.warn("Custody provider is in log mode: delegation requests are only logged");
        return new LoggingCustodyProvider();
    }
}
