package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.ExecutionRecord;

/**
 * Outbound port for the append-only execution ledger.
 */
public interface ExecutionRecordRepository {

    /**
     * Append a ledger entry.
     */
    Uni<Void> append(ExecutionRecord record);

    /**
     * List the entries of a session key ordered by timestamp.
     */
    Uni<List<ExecutionRecord>> findBySessionKey(String sessionKeyId);

    /**
     * List the most recent entries of a wallet, newest first.
     *
     * <p>Implementations retain a bounded number of entries per wallet.
     *
     * @param walletId wallet identifier
     * @param limit    maximum number of entries to return
     */
    Uni<List<ExecutionRecord>> findRecentByWallet(String walletId, int limit);

    /**
     * List the most recent entries across all session keys of a user, newest first.
     *
     * <p>Implementations retain the same bounded number of entries per user as per wallet.
     *
     * @param userId user identifier
     * @param limit  maximum number of entries to return
     */
    Uni<List<ExecutionRecord>> findRecentByUser(String userId, int limit);
}
