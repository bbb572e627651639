package warden.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An in-flight request for the user to confirm a delegation with the custody provider.
 *
 * @param challengeId     unique challenge identifier
 * @param sessionKeyId    session key the challenge belongs to
 * @param walletId        wallet of the session key
 * @param kind            create or renew
 * @param status          challenge status
 * @param createdAt       creation time
 * @param resolvedAt      resolution time (null while awaiting confirmation)
 * @param delegateAddress delegate confirmed by the custody provider (may be null)
 */
public record DelegationChallenge(
        String challengeId,
        String sessionKeyId,
        String walletId,
        ChallengeKind kind,
        ChallengeStatus status,
        Instant createdAt,
        Instant resolvedAt,
        String delegateAddress) {

    public DelegationChallenge {
        Objects.requireNonNull(challengeId, "challengeId is required");
        Objects.requireNonNull(sessionKeyId, "sessionKeyId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static DelegationChallenge awaiting(
            String challengeId, SessionKey session, ChallengeKind kind, Instant now) {
        return new DelegationChallenge(
                challengeId,
                session.sessionKeyId(),
                session.walletId(),
                kind,
                ChallengeStatus.AWAITING_CONFIRMATION,
                now,
                null,
                null);
    }

    /**
     * Check if the challenge has been waiting longer than {@code ttl}.
     */
    public boolean isStale(Instant now, Duration ttl) {
        return status == ChallengeStatus.AWAITING_CONFIRMATION
                && !now.isBefore(createdAt.plus(ttl));
    }

    public DelegationChallenge resolve(ChallengeStatus newStatus, String confirmedDelegate, Instant now) {
        if (!newStatus.isResolved()) {
            throw new IllegalArgumentException("Not a resolved status: " + newStatus);
        }
        return new DelegationChallenge(
                challengeId, sessionKeyId, walletId, kind, newStatus, createdAt, now, confirmedDelegate);
    }
}
