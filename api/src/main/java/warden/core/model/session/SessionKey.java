package warden.core.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A time-boxed, permission-scoped delegation credential that lets an agent
 * request signed transactions on a wallet's behalf.
 *
 * <p>Records are immutable. Every mutation produces a copy with an incremented
 * {@code version}; repositories persist a copy only if the stored version still
 * matches the version the caller read (compare-and-swap).
 *
 * @param sessionKeyId    unique session key identifier
 * @param walletId        owning wallet (custody provider identifier)
 * @param userId          owning user (custody provider identifier)
 * @param agentType       catalog entry the session was created from
 * @param delegateAddress on-chain signer bound by the custody provider (null while pending)
 * @param status          current lifecycle status
 * @param permissions     embedded permission set and usage counters
 * @param createdAt       creation timestamp
 * @param expiresAt       expiry timestamp, always after {@code createdAt}
 * @param duration        granted duration, used to extend the session on renewal
 * @param version         record version for conditional updates
 * @param statusReason    reason for the last terminal transition (null otherwise)
 * @param updatedAt       timestamp of the last mutation
 * @param challengeId     challenge whose outcome the session key is waiting for while
 *                        PENDING or RENEWING (null otherwise)
 */
public record SessionKey(
        String sessionKeyId,
        String walletId,
        String userId,
        String agentType,
        String delegateAddress,
        SessionKeyStatus status,
        SessionPermissions permissions,
        Instant createdAt,
        Instant expiresAt,
        Duration duration,
        long version,
        String statusReason,
        Instant updatedAt,
        String challengeId) {

    public SessionKey {
        Objects.requireNonNull(sessionKeyId, "sessionKeyId is required");
        Objects.requireNonNull(walletId, "walletId is required");
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(permissions, "permissions is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        Objects.requireNonNull(duration, "duration is required");
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Create a new session awaiting delegation confirmation.
     */
    public static SessionKey pending(
            String sessionKeyId,
            String challengeId,
            String walletId,
            String userId,
            String agentType,
            SessionPermissions permissions,
            Duration duration,
            Instant now) {
        return new SessionKey(
                sessionKeyId,
                walletId,
                userId,
                agentType,
                null,
                SessionKeyStatus.PENDING,
                permissions,
                now,
                now.plus(duration),
                duration,
                0L,
                null,
                now,
                challengeId);
    }

    /**
     * Check if the session key is still waiting for the outcome of {@code challengeId}.
     */
    public boolean awaits(String challengeId) {
        return (status == SessionKeyStatus.PENDING || status == SessionKeyStatus.RENEWING)
                && challengeId != null
                && challengeId.equals(this.challengeId);
    }

    /**
     * Check if the session has reached its expiry time.
     */
    public boolean isPastExpiry(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Transition PENDING to ACTIVE after the custody provider confirmed the delegation.
     */
    public SessionKey activate(String delegateAddress, Instant now) {
        if (status != SessionKeyStatus.PENDING) {
            throw new IllegalStateException("Can only activate PENDING session keys, current status: " + status);
        }
        return new SessionKey(
                sessionKeyId,
                walletId,
                userId,
                agentType,
                delegateAddress,
                SessionKeyStatus.ACTIVE,
                permissions,
                createdAt,
                now.plus(duration),
                duration,
                version + 1,
                null,
                now,
                null);
    }

    /**
     * Transition ACTIVE to RENEWING while the renewal challenge {@code renewalChallengeId} is in flight.
     */
    public SessionKey beginRenewal(String renewalChallengeId, Instant now) {
        if (status != SessionKeyStatus.ACTIVE) {
            throw new IllegalStateException("Can only renew ACTIVE session keys, current status: " + status);
        }
        Objects.requireNonNull(renewalChallengeId, "renewalChallengeId is required");
        return withStatus(SessionKeyStatus.RENEWING, null, now, renewalChallengeId);
    }

    /**
     * Complete a renewal: extend the expiry by the original duration and count the renewal.
     *
     * <p>The spending limit and the accumulated spend are carried over unchanged.
     */
    public SessionKey completeRenewal(String newDelegateAddress, Instant now) {
        if (status != SessionKeyStatus.RENEWING) {
            throw new IllegalStateException(
                    "Can only complete renewal of RENEWING session keys, current status: " + status);
        }
        return new SessionKey(
                sessionKeyId,
                walletId,
                userId,
                agentType,
                newDelegateAddress != null ? newDelegateAddress : delegateAddress,
                SessionKeyStatus.ACTIVE,
                permissions.withRenewalUsed(),
                createdAt,
                expiresAt.plus(duration),
                duration,
                version + 1,
                null,
                now,
                null);
    }

    /**
     * Return from RENEWING to ACTIVE after a failed renewal.
     */
    public SessionKey abandonRenewal(Instant now) {
        if (status != SessionKeyStatus.RENEWING) {
            throw new IllegalStateException(
                    "Can only abandon renewal of RENEWING session keys, current status: " + status);
        }
        return withStatus(SessionKeyStatus.ACTIVE, null, now, null);
    }

    /**
     * Transition to a terminal status.
     */
    public SessionKey terminate(SessionKeyStatus terminalStatus, String reason, Instant now) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Session key is already terminal: " + status);
        }
        return withStatus(terminalStatus, reason, now, null);
    }

    /**
     * Copy with a new reserved amount.
     */
    public SessionKey withSpendingUsed(long spendingUsed, Instant now) {
        return new SessionKey(
                sessionKeyId,
                walletId,
                userId,
                agentType,
                delegateAddress,
                status,
                permissions.withSpendingUsed(spendingUsed),
                createdAt,
                expiresAt,
                duration,
                version + 1,
                statusReason,
                now,
                challengeId);
    }

    private SessionKey withStatus(SessionKeyStatus newStatus, String reason, Instant now, String newChallengeId) {
        return new SessionKey(
                sessionKeyId,
                walletId,
                userId,
                agentType,
                delegateAddress,
                newStatus,
                permissions,
                createdAt,
                expiresAt,
                duration,
                version + 1,
                reason,
                now,
                newChallengeId);
    }
}
