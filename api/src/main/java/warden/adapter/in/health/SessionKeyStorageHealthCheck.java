package warden.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import warden.core.service.session.SessionKeyStorageProviderRegistry;

/**
 * Readiness check for the selected session key storage provider.
 *
 * <p>Enforcement decisions cannot be made without the store, so the service
 * reports DOWN whenever the selected provider does.
 */
@Readiness
@ApplicationScoped
public class SessionKeyStorageHealthCheck implements HealthCheck {

    private final SessionKeyStorageProviderRegistry registry;

    @Inject
    public SessionKeyStorageHealthCheck(SessionKeyStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        var provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("session-key-storage-" + provider.name())
                        .up()
                        .withData("type", provider.name())
                        .build());
    }
}
