package warden.core.service.session;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.PermissionCatalogConfig;
import warden.core.config.SessionKeyConfig;
import warden.core.model.session.AgentPermissionScope;

/**
 * Default permission scopes per agent type.
 *
 * <p>Amounts are in USDC micro-units (6 decimals). Built-in entries can be
 * overridden or extended under {@code warden.catalog.agents.<type>}.
 *
 * <p>Lookups never fail: unknown or blank agent types resolve to an
 * empty-capability scope that admits no action.
 */
@ApplicationScoped
public class PermissionCatalog {

    private static final Logger LOG = Logger.getLogger(PermissionCatalog.class);

    private final Map<String, AgentPermissionScope> scopes;
    private final Duration minimumDuration;

    @Inject
    public PermissionCatalog(PermissionCatalogConfig config, SessionKeyConfig sessionKeyConfig) {
        this.minimumDuration = sessionKeyConfig.minimumDuration();
        this.scopes = buildScopes(config);
        LOG.infof("Permission catalog loaded with %d agent types", scopes.size());
    }

    /**
     * Resolve the default scope of an agent type.
     *
     * @param agentType agent type, case-insensitive
     * @return the scope, or an empty-capability scope when unknown
     */
    public AgentPermissionScope defaultsFor(String agentType) {
        if (agentType == null || agentType.isBlank()) {
            return AgentPermissionScope.unknown(agentType, minimumDuration);
        }
        var scope = scopes.get(normalize(agentType));
        if (scope == null) {
            LOG.debugf("Unknown agent type %s, granting no permissions", agentType);
            return AgentPermissionScope.unknown(agentType, minimumDuration);
        }
        return scope;
    }

    /**
     * Check if an agent type is present in the catalog.
     */
    public boolean isKnown(String agentType) {
        return agentType != null && scopes.containsKey(normalize(agentType));
    }

    /**
     * List every catalog entry ordered by agent type.
     */
    public List<AgentPermissionScope> all() {
        return scopes.values().stream()
                .sorted(Comparator.comparing(AgentPermissionScope::agentType))
                .toList();
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, AgentPermissionScope> buildScopes(PermissionCatalogConfig config) {
        var duration = config.defaultDuration();
        var result = new LinkedHashMap<String, AgentPermissionScope>();
        for (var scope : builtIn(duration)) {
            result.put(scope.agentType(), scope);
        }

        for (var entry : config.agents().entrySet()) {
            var agentType = normalize(entry.getKey());
            var overrides = entry.getValue();
            var base = result.getOrDefault(
                    agentType,
                    new AgentPermissionScope(agentType, agentType, "", Set.of(), 0L, null, duration));

            var actions = overrides
                    .allowedActions()
                    .map(PermissionCatalog::normalizeActions)
                    .orElse(base.allowedActions());

            result.put(
                    agentType,
                    new AgentPermissionScope(
                            agentType,
                            overrides.displayName().orElse(base.displayName()),
                            overrides.description().orElse(base.description()),
                            actions,
                            overrides.spendingLimit().orElse(base.spendingLimit()),
                            overrides.maxAmountPerTransaction().orElse(base.maxAmountPerTransaction()),
                            overrides.duration().orElse(base.duration())));
            LOG.debugf("Catalog entry %s configured", agentType);
        }
        return Map.copyOf(result);
    }

    private static Set<String> normalizeActions(List<String> actions) {
        var normalized = new HashSet<String>();
        for (var action : actions) {
            if (action != null && !action.isBlank()) {
                normalized.add(normalize(action));
            }
        }
        return normalized;
    }

    private static List<AgentPermissionScope> builtIn(Duration duration) {
        return List.of(
                new AgentPermissionScope(
                        "inera",
                        "Arcle Assistant",
                        "Manages your finances, sends money, converts currency, moves funds across networks",
                        Set.of("transfer", "approve", "swap", "bridge", "cctp", "gateway"),
                        100_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "payments",
                        "Payments Agent",
                        "Sends payments, processes subscriptions, handles payment links",
                        Set.of("transfer"),
                        10_000_000_000L,
                        1_000_000_000L,
                        duration),
                new AgentPermissionScope(
                        "invoice",
                        "Invoice Agent",
                        "Creates invoices, generates payment links, tracks payments",
                        Set.of("transfer"),
                        5_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "remittance",
                        "Remittance Agent",
                        "Sends cross-border payments, converts currency",
                        Set.of("transfer", "bridge", "cctp", "gateway"),
                        50_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "defi",
                        "DeFi Agent",
                        "Makes trades, manages yield, handles swaps",
                        Set.of("transfer", "approve", "swap"),
                        20_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "fx",
                        "FX Agent",
                        "Converts currency, manages exchange rates",
                        Set.of("transfer", "swap"),
                        10_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "commerce",
                        "Commerce Agent",
                        "Places orders, tracks deliveries, manages marketplace",
                        Set.of("transfer", "approve"),
                        5_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "insights",
                        "Insights Agent",
                        "Provides spending reports and analytics (read-only)",
                        Set.of(),
                        0L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "merchant",
                        "Merchant Agent",
                        "Processes payments, handles settlements",
                        Set.of("transfer"),
                        20_000_000_000L,
                        null,
                        duration),
                new AgentPermissionScope(
                        "compliance",
                        "Compliance Agent",
                        "Monitors transactions for security (read-only)",
                        Set.of(),
                        0L,
                        null,
                        duration));
    }
}
