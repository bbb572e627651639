package warden.adapter.in.dto;

import warden.core.model.session.SpendingSummary;

/**
 * Reconciliation of a session key's reserved amount against its ledger.
 */
public record SpendingResponse(
        String sessionKeyId,
        long spendingLimit,
        long spendingUsed,
        long ledgerSpend,
        boolean consistent,
        int admitted,
        int rejected,
        int reversed) {

    public static SpendingResponse fromModel(SpendingSummary model) {
        return new SpendingResponse(
                model.sessionKeyId(),
                model.spendingLimit(),
                model.spendingUsed(),
                model.ledgerSpend(),
                model.consistent(),
                model.admitted(),
                model.rejected(),
                model.reversed());
    }
}
