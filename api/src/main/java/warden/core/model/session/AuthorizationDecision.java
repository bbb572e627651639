package warden.core.model.session;

/**
 * Decision returned by the delegated execution enforcer for an agent action or a
 * multi-step operation.
 */
public sealed interface AuthorizationDecision {

    /**
     * The amount was reserved against the session's spending limit.
     *
     * @param sessionKeyId session key the action was charged to
     * @param spendingUsed reserved amount after this action
     * @param headroom     remaining budget after this action
     */
    record Admitted(String sessionKeyId, long spendingUsed, long headroom) implements AuthorizationDecision {}

    /**
     * The action was refused; nothing was reserved.
     *
     * @param reason   why the action was refused
     * @param headroom remaining budget when the refusal was caused by the spending limit, else null
     * @param step     zero-based index of the step that failed its own checks, else null
     */
    record Rejected(SessionKeyError reason, Long headroom, Integer step) implements AuthorizationDecision {

        public Rejected(SessionKeyError reason, Long headroom) {
            this(reason, headroom, null);
        }

        public Rejected(SessionKeyError reason) {
            this(reason, null, null);
        }
    }

    default boolean isAdmitted() {
        return this instanceof Admitted;
    }

    static AuthorizationDecision reject(SessionKeyError reason) {
        return new Rejected(reason);
    }
}
