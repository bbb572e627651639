package warden.core.model.session;

/**
 * Reconciliation of a session key's reserved amount against its execution ledger.
 *
 * @param sessionKeyId  session key
 * @param spendingLimit cumulative cap
 * @param spendingUsed  reserved amount on the session record
 * @param ledgerSpend   reserved amount recomputed from the ledger
 * @param admitted      number of admitted entries
 * @param rejected      number of rejected entries
 * @param reversed      number of reversal entries
 */
public record SpendingSummary(
        String sessionKeyId,
        long spendingLimit,
        long spendingUsed,
        long ledgerSpend,
        int admitted,
        int rejected,
        int reversed) {

    public boolean consistent() {
        return spendingUsed == ledgerSpend;
    }
}
