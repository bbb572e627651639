package warden.adapter.in.dto;

import warden.core.model.session.AuthorizationDecision;

/**
 * Authorization decision returned to agents.
 *
 * @param admitted     whether the action may be signed
 * @param sessionKeyId session key the decision was made against
 * @param reason       rejection reason (null when admitted)
 * @param retryable    whether the same request may succeed later
 * @param spendingUsed reserved amount after the decision (null when rejected)
 * @param headroom     remaining budget, when known
 * @param step         zero-based index of the failing step of a multi-step request
 */
public record AuthorizationResponse(
        boolean admitted,
        String sessionKeyId,
        String reason,
        boolean retryable,
        Long spendingUsed,
        Long headroom,
        Integer step) {

    public static AuthorizationResponse fromModel(String sessionKeyId, AuthorizationDecision decision) {
        if (decision instanceof AuthorizationDecision.Admitted admitted) {
            return new AuthorizationResponse(
                    true, sessionKeyId, null, false, admitted.spendingUsed(), admitted.headroom(), null);
        }
        var rejected = (AuthorizationDecision.Rejected) decision;
        return new AuthorizationResponse(
                false,
                sessionKeyId,
                rejected.reason().name(),
                rejected.reason().retryable(),
                null,
                rejected.headroom(),
                rejected.step());
    }
}
