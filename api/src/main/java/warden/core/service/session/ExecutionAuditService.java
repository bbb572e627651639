package warden.core.service.session;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.core.model.session.ExecutionOutcome;
import warden.core.model.session.ExecutionRecord;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SpendingSummary;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyRepository;

/**
 * Read side of the execution ledger.
 */
@ApplicationScoped
public class ExecutionAuditService {

    private static final Logger LOG = Logger.getLogger(ExecutionAuditService.class);

    private final ExecutionRecordRepository ledger;
    private final SessionKeyRepository sessionKeys;
    private final SessionKeyConfig config;

    @Inject
    public ExecutionAuditService(
            ExecutionRecordRepository ledger, SessionKeyRepository sessionKeys, SessionKeyConfig config) {
        this.ledger = ledger;
        this.sessionKeys = sessionKeys;
        this.config = config;
    }

    public Uni<List<ExecutionRecord>> sessionLedger(String sessionKeyId) {
        return ledger.findBySessionKey(sessionKeyId);
    }

    /**
     * List a wallet's most recent ledger entries.
     *
     * @param limit requested page size; non-positive values use the configured default and
     *              values above the retained window are capped
     */
    public Uni<List<ExecutionRecord>> walletLedger(String walletId, int limit) {
        return ledger.findRecentByWallet(walletId, pageSize(limit));
    }

    /**
     * List a user's most recent ledger entries across all of their session keys.
     *
     * @param limit requested page size, bounded like {@link #walletLedger(String, int)}
     */
    public Uni<List<ExecutionRecord>> userLedger(String userId, int limit) {
        return ledger.findRecentByUser(userId, pageSize(limit));
    }

    private int pageSize(int limit) {
        var retention = config.ledger().walletRetention();
        return limit <= 0 ? config.ledger().defaultLimit() : Math.min(limit, retention);
    }

    /**
     * Recompute a session key's reserved amount from its ledger and compare it with the counter.
     */
    public Uni<Optional<SpendingSummary>> spending(String sessionKeyId) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<SpendingSummary>empty());
            }
            return ledger.findBySessionKey(sessionKeyId).map(entries -> Optional.of(summarize(found.get(), entries)));
        });
    }

    static SpendingSummary summarize(SessionKey session, List<ExecutionRecord> entries) {
        long ledgerSpend = 0;
        int admitted = 0;
        int rejected = 0;
        int reversed = 0;
        for (var entry : entries) {
            ledgerSpend += entry.spendingDelta();
            if (entry.outcome() == ExecutionOutcome.ADMITTED) {
                admitted++;
            } else if (entry.outcome() == ExecutionOutcome.REJECTED) {
                rejected++;
            } else {
                reversed++;
            }
        }
        var summary = new SpendingSummary(
                session.sessionKeyId(),
                session.permissions().spendingLimit(),
                session.permissions().spendingUsed(),
                ledgerSpend,
                admitted,
                rejected,
                reversed);
        if (!summary.consistent()) {
            LOG.warnf(
                    "Ledger of session key %s adds up to %d but the counter holds %d",
                    session.sessionKeyId(), ledgerSpend, summary.spendingUsed());
        }
        return summary;
    }
}
