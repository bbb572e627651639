package warden.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the agent permission catalog.
 *
 * <p>Entries extend or override the built-in agent table. Fields left unset keep
 * the built-in value, or the empty-capability default for new agent types.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.catalog.default-duration=P7D
 * warden.catalog.agents.payroll.display-name=Payroll Agent
 * warden.catalog.agents.payroll.allowed-actions=transfer
 * warden.catalog.agents.payroll.spending-limit=2500000000
 * warden.catalog.agents.payroll.max-amount-per-transaction=500000000
 * }</pre>
 */
@ConfigMapping(prefix = "warden.catalog")
public interface PermissionCatalogConfig {

    /**
     * Duration granted to built-in agents.
     */
    @WithName("default-duration")
    @WithDefault("P7D")
    Duration defaultDuration();

    /**
     * Per-agent entries keyed by agent type.
     */
    Map<String, AgentConfig> agents();

    interface AgentConfig {

        Optional<String> displayName();

        Optional<String> description();

        Optional<List<String>> allowedActions();

        Optional<Long> spendingLimit();

        Optional<Long> maxAmountPerTransaction();

        Optional<Duration> duration();
    }
}
