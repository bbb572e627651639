package warden.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.CreationResult;
import warden.core.model.session.ExecutionRecord;
import warden.core.model.session.RenewalResult;
import warden.core.model.session.RevocationResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionOverrides;
import warden.core.model.session.SpendingSummary;

/**
 * Inbound port for users managing their session keys.
 */
public interface SessionKeyManagement {

    /**
     * Start creating a session key for an agent.
     *
     * @param walletId  owning wallet
     * @param userId    owning user
     * @param agentType catalog entry to derive permissions from
     * @param overrides optional narrowing of the agent defaults
     * @return the started creation or the reason it was refused
     */
    Uni<CreationResult> create(String walletId, String userId, String agentType, SessionOverrides overrides);

    /**
     * Start a manual renewal.
     */
    Uni<RenewalResult> renew(String sessionKeyId);

    /**
     * Revoke a session key.
     */
    Uni<RevocationResult> revoke(String sessionKeyId, String reason);

    /**
     * Read a session key, applying passive expiry.
     */
    Uni<Optional<SessionKey>> get(String sessionKeyId);

    /**
     * List a wallet's session keys, applying passive expiry.
     */
    Uni<List<SessionKey>> listByWallet(String walletId);

    /**
     * List the execution ledger of a session key.
     */
    Uni<List<ExecutionRecord>> executions(String sessionKeyId);

    /**
     * List the most recent ledger entries of a wallet.
     */
    Uni<List<ExecutionRecord>> walletExecutions(String walletId, int limit);

    /**
     * List the most recent ledger entries of a user across all of their session keys.
     */
    Uni<List<ExecutionRecord>> userExecutions(String userId, int limit);

    /**
     * Reconcile a session key's reserved amount against its ledger.
     */
    Uni<Optional<SpendingSummary>> spending(String sessionKeyId);
}
