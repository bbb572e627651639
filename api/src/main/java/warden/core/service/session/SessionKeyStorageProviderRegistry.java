package warden.core.service.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.spi.SessionKeyStorageProvider;
import warden.spi.StorageProviderException;

/**
 * Registry for session key storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (warden.session-keys.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class SessionKeyStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(SessionKeyStorageProviderRegistry.class);

    private final Instance<SessionKeyStorageProvider> providers;
    private final SessionKeyConfig config;

    private volatile SessionKeyStorageProvider selectedProvider;

    @Inject
    public SessionKeyStorageProviderRegistry(Instance<SessionKeyStorageProvider> providers, SessionKeyConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider at startup, on a worker thread, rather than lazily on
     * the first request where the event loop forbids blocking.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Session key storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public SessionKeyStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            synchronized (this) {
                if (selectedProvider == null) {
                    selectedProvider = selectProvider();
                }
            }
        }
        return selectedProvider;
    }

    private SessionKeyStorageProvider selectProvider() {
        String configuredProvider = config.storage().provider();

        // Only the configured provider is checked; unused backends are never contacted
        Optional<SessionKeyStorageProvider> configured = providers.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .filter(SessionKeyStorageProvider::isAvailable)
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured session key storage provider: %s", configuredProvider);
            return configured.get();
        }

        List<SessionKeyStorageProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(SessionKeyStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available session key storage providers: %s",
                availableProviders.stream().map(SessionKeyStorageProvider::name).toList());

        if (!configuredProvider.equals("memory")) {
            LOG.warnf(
                    "Configured session key storage provider '%s' is not available, falling back",
                    configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            SessionKeyStorageProvider provider = availableProviders.get(0);
            LOG.infof(
                    "Using session key storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        // Memory provider is always available
        throw new StorageProviderException("No session key storage providers available");
    }

    /**
     * Get all available providers.
     *
     * @return List of available providers
     */
    public List<SessionKeyStorageProvider> getAvailableProviders() {
        return providers.stream().filter(SessionKeyStorageProvider::isAvailable).toList();
    }
}
