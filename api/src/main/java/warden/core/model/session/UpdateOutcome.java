package warden.core.model.session;

/**
 * Result of a conditional session key update.
 */
public enum UpdateOutcome {
    /** The stored version matched and the update was written. */
    APPLIED,
    /** The stored version changed since the caller read it (or the record is gone). */
    STALE,
    /** The update would give the wallet a second enforceable session key. */
    WALLET_CONFLICT
}
