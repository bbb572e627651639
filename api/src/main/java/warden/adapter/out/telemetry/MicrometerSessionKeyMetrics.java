package warden.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import warden.config.TelemetryConfigMapping;
import warden.core.model.session.ChallengeKind;
import warden.core.model.session.ChallengeStatus;
import warden.core.model.session.RenewalPassSummary;
import warden.core.model.session.SessionKeyError;
import warden.core.model.session.SessionKeyStatus;
import warden.core.port.out.SessionKeyMetrics;

/**
 * Records session key metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.authorizations.total} - Authorization decisions by outcome and reason</li>
 *   <li>{@code warden.authorizations.amount} - Admitted amounts</li>
 *   <li>{@code warden.reversals.total} - Reversals, tagged when clamped at zero</li>
 *   <li>{@code warden.challenges.total} - Delegation challenges by kind and status</li>
 *   <li>{@code warden.sessions.terminated.total} - Terminal transitions by status</li>
 *   <li>{@code warden.renewal.passes.total} - Renewal scheduler passes</li>
 *   <li>{@code warden.storage.timeouts.total} / {@code warden.storage.failures.total} - Storage errors</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSessionKeyMetrics implements SessionKeyMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerSessionKeyMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthorization(SessionKeyError reason, long amount) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.authorizations.total")
                .description("Authorization decisions for delegated agent actions")
                .tag("outcome", reason == null ? "admitted" : "rejected")
                .tag("reason", reason == null ? "none" : reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();

        if (reason == null) {
            DistributionSummary.builder("warden.authorizations.amount")
                    .description("Amounts reserved by admitted actions")
                    .baseUnit("micro_units")
                    .register(registry)
                    .record(amount);
        }
    }

    @Override
    public void recordReversal(boolean clamped) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.reversals.total")
                .description("Released reservations")
                .tag("clamped", String.valueOf(clamped))
                .register(registry)
                .increment();
    }

    @Override
    public void recordChallenge(ChallengeKind kind, ChallengeStatus status) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.challenges.total")
                .description("Delegation challenges by kind and status")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordTermination(SessionKeyStatus status) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.sessions.terminated.total")
                .description("Session keys moved to a terminal status")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRenewalPass(RenewalPassSummary summary) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.renewal.passes.total")
                .description("Renewal scheduler passes")
                .register(registry)
                .increment();
        Counter.builder("warden.renewal.started.total")
                .description("Renewals started by the scheduler")
                .register(registry)
                .increment(summary.renewalsStarted());
        Counter.builder("warden.renewal.settled.total")
                .description("Session keys settled against an already resolved challenge")
                .register(registry)
                .increment(summary.sessionsSettled());
    }

    @Override
    public void recordStorageTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.storage.timeouts.total")
                .description("Storage operations that exceeded their timeout")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageFailure(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.storage.failures.total")
                .description("Storage operations that failed")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
