package warden.core.model.session;

/**
 * Outcome recorded in the execution ledger.
 */
public enum ExecutionOutcome {
    ADMITTED,
    REJECTED,
    REVERSED
}
