package warden.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import warden.core.port.out.DelegationChallengeRepository;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyRepository;
import warden.core.service.session.SessionKeyStorageProviderRegistry;

/**
 * CDI producer for the session key store repositories.
 *
 * <p>Delegates to the {@link SessionKeyStorageProviderRegistry}, which selects the
 * storage provider based on configuration and availability. All three repositories
 * come from the same provider.
 *
 * @see warden.spi.SessionKeyStorageProvider
 */
@ApplicationScoped
public class SessionKeyStoreProducer {

    private final SessionKeyStorageProviderRegistry registry;

    @Inject
    public SessionKeyStoreProducer(SessionKeyStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public SessionKeyRepository sessionKeyRepository() {
        return registry.getSelectedProvider().sessionKeys();
    }

    @Produces
    @ApplicationScoped
    public ExecutionRecordRepository executionRecordRepository() {
        return registry.getSelectedProvider().executionRecords();
    }

    @Produces
    @ApplicationScoped
    public DelegationChallengeRepository delegationChallengeRepository() {
        return registry.getSelectedProvider().challenges();
    }
}
