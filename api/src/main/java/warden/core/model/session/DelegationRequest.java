package warden.core.model.session;

import java.time.Duration;
import java.util.Set;

/**
 * Delegation challenge sent to the custody provider for user confirmation.
 */
public record DelegationRequest(
        String challengeId,
        ChallengeKind kind,
        String sessionKeyId,
        String walletId,
        String userId,
        String agentType,
        Set<String> allowedActions,
        long spendingLimit,
        Duration duration) {

    public static DelegationRequest of(DelegationChallenge challenge, SessionKey session) {
        return new DelegationRequest(
                challenge.challengeId(),
                challenge.kind(),
                session.sessionKeyId(),
                session.walletId(),
                session.userId(),
                session.agentType(),
                session.permissions().allowedActions(),
                session.permissions().spendingLimit(),
                session.duration());
    }
}
