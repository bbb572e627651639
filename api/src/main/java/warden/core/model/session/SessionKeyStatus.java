package warden.core.model.session;

/**
 * Lifecycle status of a session key.
 *
 * <p>Session keys transition through these states:
 * <pre>
 * PENDING → ACTIVE ⇄ RENEWING
 *    │         │        │
 *    └─────────┴────────┴──→ EXPIRED | REVOKED
 * </pre>
 *
 * <ul>
 *   <li>{@link #PENDING} - Created, waiting for the custody provider to confirm the delegation</li>
 *   <li>{@link #ACTIVE} - Delegation confirmed, agent actions may be authorized</li>
 *   <li>{@link #RENEWING} - Renewal challenge in flight; enforced exactly like ACTIVE</li>
 *   <li>{@link #EXPIRED} - Past its expiry time (terminal)</li>
 *   <li>{@link #REVOKED} - Invalidated by the user, anomaly detection or a failed challenge (terminal)</li>
 * </ul>
 */
public enum SessionKeyStatus {
    PENDING,
    ACTIVE,
    RENEWING,
    EXPIRED,
    REVOKED;

    /**
     * Terminal states admit no further transitions.
     */
    public boolean isTerminal() {
        return this == EXPIRED || this == REVOKED;
    }

    /**
     * Whether the enforcer may admit actions for a session in this state.
     */
    public boolean isEnforceable() {
        return this == ACTIVE || this == RENEWING;
    }

    /**
     * Whether a session in this state occupies its wallet's single active slot.
     */
    public boolean holdsWalletSlot() {
        return isEnforceable();
    }
}
