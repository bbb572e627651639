package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.core.model.session.AgentPermissionScope;
import warden.core.model.session.ChallengeKind;
import warden.core.model.session.ChallengeOutcome;
import warden.core.model.session.ChallengeResolution;
import warden.core.model.session.ChallengeStatus;
import warden.core.model.session.CreationResult;
import warden.core.model.session.DelegationChallenge;
import warden.core.model.session.DelegationRequest;
import warden.core.model.session.RenewalResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyError;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.SessionOverrides;
import warden.core.model.session.SessionPermissions;
import warden.core.model.session.UpdateOutcome;
import warden.core.port.in.ChallengeCompletion;
import warden.core.port.out.CustodyProvider;
import warden.core.port.out.DelegationChallengeRepository;
import warden.core.port.out.SessionKeyMetrics;
import warden.core.port.out.SessionKeyRepository;

/**
 * Drives the delegation handshake with the custody provider.
 *
 * <h2>Creation</h2>
 * <ol>
 *   <li>Derive permissions from the catalog, narrowed by user overrides</li>
 *   <li>Store the session key as PENDING under a fresh ID, bound to a fresh challenge ID</li>
 *   <li>Store the CREATE challenge and emit it to the custody provider</li>
 *   <li>On confirmation, activate the session key and supersede the wallet's previous one</li>
 * </ol>
 *
 * <h2>Renewal</h2>
 * <ol>
 *   <li>Store a RENEW challenge</li>
 *   <li>Move the session key from ACTIVE to RENEWING, bound to that challenge
 *       (conditional on the read version)</li>
 *   <li>Emit the challenge to the custody provider</li>
 *   <li>On confirmation, extend the expiry by the granted duration</li>
 * </ol>
 *
 * <p>Neither flow waits for the user: confirmations arrive through
 * {@link #completeChallenge(String, ChallengeOutcome)}, which resolves each
 * challenge exactly once.
 *
 * <p>A challenge is resolved before its outcome is written to the session key.
 * When that write does not land, the session key keeps pointing at the resolved
 * challenge; a repeated confirmation or {@link #settle(String)} applies the
 * outcome again.
 */
@ApplicationScoped
public class ChallengeCoordinator implements ChallengeCompletion {

    private static final Logger LOG = Logger.getLogger(ChallengeCoordinator.class);

    private final PermissionCatalog catalog;
    private final SessionKeyRepository sessionKeys;
    private final DelegationChallengeRepository challenges;
    private final CustodyProvider custodyProvider;
    private final RevocationService revocationService;
    private final SessionKeyIdGenerator idGenerator;
    private final SessionKeyMetrics metrics;
    private final Clock clock;
    private final SessionKeyConfig config;

    @Inject
    public ChallengeCoordinator(
            PermissionCatalog catalog,
            SessionKeyRepository sessionKeys,
            DelegationChallengeRepository challenges,
            CustodyProvider custodyProvider,
            RevocationService revocationService,
            SessionKeyIdGenerator idGenerator,
            SessionKeyMetrics metrics,
            Clock clock,
            SessionKeyConfig config) {
        this.catalog = catalog;
        this.sessionKeys = sessionKeys;
        this.challenges = challenges;
        this.custodyProvider = custodyProvider;
        this.revocationService = revocationService;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.config = config;
    }

    // -------------------------------------------------------------------------
    // Creation
    // -------------------------------------------------------------------------

    /**
     * Start creating a session key.
     *
     * @param walletId  owning wallet
     * @param userId    owning user
     * @param agentType catalog entry to derive permissions from
     * @param overrides narrowing of the catalog defaults (may be null)
     * @return the started creation or the reason it was refused; never a failed Uni
     */
    public Uni<CreationResult> beginCreate(
            String walletId, String userId, String agentType, SessionOverrides overrides) {
        if (walletId == null || walletId.isBlank()) {
            return refuseCreate(SessionKeyError.INVALID_OVERRIDE, "walletId is required");
        }
        if (userId == null || userId.isBlank()) {
            return refuseCreate(SessionKeyError.INVALID_OVERRIDE, "userId is required");
        }

        var scope = catalog.defaultsFor(agentType);
        Grant grant;
        try {
            grant = narrow(scope, overrides == null ? SessionOverrides.none() : overrides);
        } catch (InvalidOverrideException e) {
            LOG.debugf("Refusing session key for wallet %s: %s", walletId, e.getMessage());
            return refuseCreate(SessionKeyError.INVALID_OVERRIDE, e.getMessage());
        }

        var now = clock.instant();
        var challengeId = idGenerator.generate();
        return insertWithRetry(walletId, userId, scope.agentType(), grant, challengeId, now, 1)
                .flatMap(session -> {
                    if (session == null) {
                        return refuseCreate(SessionKeyError.CONTENTION, "Could not allocate a session key ID");
                    }
                    var challenge = DelegationChallenge.awaiting(challengeId, session, ChallengeKind.CREATE, now);
                    return challenges
                            .save(challenge)
                            .flatMap(ignored -> emit(challenge, session))
                            .flatMap(accepted -> {
                                if (accepted) {
                                    LOG.infof(
                                            "Session key %s pending for wallet %s (agent %s, challenge %s)",
                                            session.sessionKeyId(),
                                            walletId,
                                            session.agentType(),
                                            challenge.challengeId());
                                    return Uni.createFrom()
                                            .<CreationResult>item(new CreationResult.Started(
                                                    session.sessionKeyId(), challenge.challengeId(), session));
                                }
                                return failEmittedChallenge(challenge)
                                        .<CreationResult>replaceWith(new CreationResult.Refused(
                                                SessionKeyError.CHALLENGE_FAILED,
                                                "Custody provider did not accept the delegation request"));
                            });
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Storage failure while creating a session key for wallet %s", walletId);
                    return new CreationResult.Refused(SessionKeyError.STORE_UNAVAILABLE, "Session key store unavailable");
                });
    }

    private Uni<SessionKey> insertWithRetry(
            String walletId,
            String userId,
            String agentType,
            Grant grant,
            String challengeId,
            Instant now,
            int attempt) {
        var session = SessionKey.pending(
                idGenerator.generate(),
                challengeId,
                walletId,
                userId,
                agentType,
                grant.permissions(),
                grant.duration(),
                now);
        return sessionKeys.insertIfAbsent(session).flatMap(inserted -> {
            if (inserted) {
                return Uni.createFrom().item(session);
            }
            if (attempt >= config.idGeneration().maxRetries()) {
                LOG.errorf("Failed to allocate a unique session key ID after %d attempts", attempt);
                return Uni.createFrom().nullItem();
            }
            LOG.warnf("Session key ID collision on attempt %d, retrying", attempt);
            return insertWithRetry(walletId, userId, agentType, grant, challengeId, now, attempt + 1);
        });
    }

    private Grant narrow(AgentPermissionScope scope, SessionOverrides overrides) {
        long spendingLimit = scope.spendingLimit();
        if (overrides.spendingLimit() != null) {
            if (overrides.spendingLimit() < 0) {
                throw new InvalidOverrideException("spendingLimit must not be negative");
            }
            if (overrides.spendingLimit() > scope.spendingLimit()) {
                throw new InvalidOverrideException(
                        "spendingLimit may not exceed the agent default of " + scope.spendingLimit());
            }
            spendingLimit = overrides.spendingLimit();
        }

        Duration duration = scope.duration();
        if (overrides.duration() != null) {
            if (overrides.duration().isZero() || overrides.duration().isNegative()) {
                throw new InvalidOverrideException("duration must be positive");
            }
            if (overrides.duration().compareTo(scope.duration()) > 0) {
                throw new InvalidOverrideException("duration may not exceed the agent default of " + scope.duration());
            }
            duration = overrides.duration();
        }

        Set<String> actions = scope.allowedActions();
        if (overrides.allowedActions() != null) {
            var requested = new HashSet<String>();
            for (var action : overrides.allowedActions()) {
                if (action != null && !action.isBlank()) {
                    requested.add(action.trim().toLowerCase(Locale.ROOT));
                }
            }
            if (!scope.allowedActions().containsAll(requested)) {
                var extra = new HashSet<>(requested);
                extra.removeAll(scope.allowedActions());
                throw new InvalidOverrideException("actions not granted to agent " + scope.agentType() + ": " + extra);
            }
            actions = requested;
        }

        Long perTransaction = scope.maxAmountPerTransaction();
        if (overrides.maxAmountPerTransaction() != null) {
            if (overrides.maxAmountPerTransaction() < 0) {
                throw new InvalidOverrideException("maxAmountPerTransaction must not be negative");
            }
            if (perTransaction != null && overrides.maxAmountPerTransaction() > perTransaction) {
                throw new InvalidOverrideException(
                        "maxAmountPerTransaction may not exceed the agent default of " + perTransaction);
            }
            perTransaction = overrides.maxAmountPerTransaction();
        }

        int maxRenewals = config.defaultMaxRenewals();
        if (overrides.maxRenewals() != null) {
            if (overrides.maxRenewals() < 0 || overrides.maxRenewals() > config.defaultMaxRenewals()) {
                throw new InvalidOverrideException(
                        "maxRenewals must be within [0, " + config.defaultMaxRenewals() + "]");
            }
            maxRenewals = overrides.maxRenewals();
        }

        boolean autoRenew = overrides.autoRenew() != null ? overrides.autoRenew() : config.defaultAutoRenew();

        return new Grant(
                new SessionPermissions(actions, spendingLimit, 0L, perTransaction, autoRenew, maxRenewals, 0),
                duration);
    }

    // -------------------------------------------------------------------------
    // Renewal
    // -------------------------------------------------------------------------

    /**
     * Start renewing a session key.
     *
     * <p>Two concurrent starts for the same session key cannot both succeed: the
     * ACTIVE to RENEWING transition is conditional on the version each caller read.
     *
     * @param sessionKeyId session key identifier
     * @return the started renewal or the reason it was refused; never a failed Uni
     */
    public Uni<RenewalResult> beginRenewal(String sessionKeyId) {
        return beginRenewal(sessionKeyId, 1).onFailure().recoverWithItem(error -> {
            LOG.warnf(error, "Storage failure while renewing session key %s", sessionKeyId);
            return new RenewalResult.Refused(SessionKeyError.STORE_UNAVAILABLE, "Session key store unavailable");
        });
    }

    private Uni<RenewalResult> beginRenewal(String sessionKeyId, int attempt) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return refuseRenewal(SessionKeyError.NOT_FOUND, "Session key not found");
            }
            var current = found.get();
            var now = clock.instant();
            switch (current.status()) {
                case PENDING:
                    return refuseRenewal(SessionKeyError.NOT_YET_ACTIVE, "Session key is not active yet");
                case RENEWING:
                    return refuseRenewal(SessionKeyError.RENEWAL_IN_PROGRESS, "Renewal already in progress");
                case EXPIRED:
                case REVOKED:
                    return refuseRenewal(SessionKeyError.INACTIVE, "Session key is " + current.status());
                default:
                    break;
            }
            if (current.isPastExpiry(now)) {
                return revocationService
                        .expire(sessionKeyId)
                        .<RenewalResult>replaceWith(new RenewalResult.Refused(SessionKeyError.EXPIRED, "Session key has expired"));
            }
            if (!current.permissions().hasRenewalsLeft()) {
                return refuseRenewal(SessionKeyError.RENEWAL_QUOTA_EXHAUSTED, "No renewals left");
            }

            var challengeId = idGenerator.generate();
            var renewing = current.beginRenewal(challengeId, now);
            var challenge = DelegationChallenge.awaiting(challengeId, renewing, ChallengeKind.RENEW, now);
            return challenges
                    .save(challenge)
                    .flatMap(ignored -> sessionKeys.compareAndSet(renewing, current.version()))
                    .flatMap(outcome -> {
                        if (outcome == UpdateOutcome.APPLIED) {
                            return Uni.createFrom().item(Boolean.TRUE);
                        }
                        // Never emitted
                        return challenges
                                .resolveIfAwaiting(challenge.resolve(ChallengeStatus.FAILED, null, now))
                                .replaceWith(Boolean.FALSE);
                    })
                    .flatMap(applied -> {
                        if (!applied) {
                            if (attempt >= config.enforcement().maxAttempts()) {
                                return refuseRenewal(
                                        SessionKeyError.CONTENTION, "Session key is being modified concurrently");
                            }
                            return beginRenewal(sessionKeyId, attempt + 1);
                        }
                        return emit(challenge, renewing).flatMap(accepted -> {
                            if (accepted) {
                                LOG.infof(
                                        "Renewal of session key %s started (challenge %s)",
                                        sessionKeyId, challenge.challengeId());
                                return Uni.createFrom()
                                        .<RenewalResult>item(new RenewalResult.Started(
                                                sessionKeyId, challenge.challengeId()));
                            }
                            return failEmittedChallenge(challenge)
                                    .<RenewalResult>replaceWith(new RenewalResult.Refused(
                                            SessionKeyError.CHALLENGE_FAILED,
                                            "Custody provider did not accept the renewal request"));
                        });
                    });
        });
    }

    // -------------------------------------------------------------------------
    // Completion
    // -------------------------------------------------------------------------

    @Override
    public Uni<ChallengeResolution> completeChallenge(String challengeId, ChallengeOutcome outcome) {
        return challenges
                .findById(challengeId)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom()
                                .<ChallengeResolution>item(new ChallengeResolution.Refused(
                                        SessionKeyError.NOT_FOUND, "Challenge not found"));
                    }
                    var challenge = found.get();
                    if (challenge.status().isResolved()) {
                        return reapplyIfUnsettled(challenge);
                    }

                    var now = clock.instant();
                    ChallengeStatus status;
                    if (challenge.isStale(now, config.challengeTtl())) {
                        status = ChallengeStatus.EXPIRED;
                    } else {
                        status = outcome.success() ? ChallengeStatus.CONFIRMED : ChallengeStatus.FAILED;
                    }
                    var resolved = challenge.resolve(status, outcome.delegateAddress(), now);

                    return challenges.resolveIfAwaiting(resolved).flatMap(won -> {
                        if (!won) {
                            return challenges
                                    .findById(challengeId)
                                    .map(latest -> (ChallengeResolution)
                                            new ChallengeResolution.AlreadyResolved(latest.orElse(challenge)));
                        }
                        metrics.recordChallenge(resolved.kind(), resolved.status());
                        LOG.infof(
                                "Challenge %s (%s) for session key %s resolved as %s",
                                challengeId, resolved.kind(), resolved.sessionKeyId(), resolved.status());
                        return applyResolution(resolved);
                    });
                })
                .onFailure()
                .recoverWithItem(error -> {
                    if (error instanceof ContentionException) {
                        LOG.warnf(
                                "Challenge %s is resolved but its session key update did not land: %s",
                                challengeId, error.getMessage());
                        return new ChallengeResolution.Refused(SessionKeyError.CONTENTION, error.getMessage());
                    }
                    LOG.warnf(error, "Storage failure while completing challenge %s", challengeId);
                    return new ChallengeResolution.Refused(
                            SessionKeyError.STORE_UNAVAILABLE, "Session key store unavailable");
                });
    }

    /**
     * Resolve every challenge that has been awaiting confirmation longer than the TTL.
     *
     * @return number of challenges expired by this call
     */
    public Uni<Integer> expireStaleChallenges() {
        var now = clock.instant();
        return challenges.findAwaiting().flatMap(awaiting -> {
            List<DelegationChallenge> stale = awaiting.stream()
                    .filter(challenge -> challenge.isStale(now, config.challengeTtl()))
                    .toList();
            if (stale.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            return Uni.join()
                    .all(stale.stream()
                            .map(challenge -> completeChallenge(challenge.challengeId(), ChallengeOutcome.failed())
                                    .map(resolution -> resolution instanceof ChallengeResolution.Resolved ? 1 : 0))
                            .toList())
                    .andCollectFailures()
                    .map(counts -> counts.stream().mapToInt(Integer::intValue).sum());
        });
    }

    /**
     * Bring a PENDING or RENEWING session key in line with the challenge it waits for.
     *
     * <ul>
     *   <li>A resolved challenge has its outcome applied again</li>
     *   <li>A challenge that no longer exists fails the delegation once the session
     *       key has been left untouched for the challenge TTL</li>
     *   <li>A challenge still awaiting confirmation is left to {@link #expireStaleChallenges()}</li>
     * </ul>
     *
     * @param sessionKeyId session key identifier
     * @return true if this call moved the session key out of its wait
     */
    public Uni<Boolean> settle(String sessionKeyId) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Boolean.FALSE);
            }
            var session = found.get();
            var challengeId = session.challengeId();
            if (!session.awaits(challengeId)) {
                return Uni.createFrom().item(Boolean.FALSE);
            }
            return challenges.findById(challengeId).flatMap(challenge -> {
                if (challenge.isPresent()) {
                    if (!challenge.get().status().isResolved()) {
                        return Uni.createFrom().item(Boolean.FALSE);
                    }
                    LOG.warnf(
                            "Session key %s is still %s after challenge %s was %s, applying the outcome again",
                            sessionKeyId, session.status(), challengeId, challenge.get().status());
                    return applyResolution(challenge.get()).map(resolution -> settled(resolution, challengeId));
                }
                if (clock.instant().isBefore(session.updatedAt().plus(config.challengeTtl()))) {
                    return Uni.createFrom().item(Boolean.FALSE);
                }
                LOG.warnf(
                        "Challenge %s of session key %s no longer exists, failing the delegation",
                        challengeId, sessionKeyId);
                return failDelegation(sessionKeyId, challengeId)
                        .map(updated -> updated != null && !updated.awaits(challengeId));
            });
        });
    }

    private static boolean settled(ChallengeResolution resolution, String challengeId) {
        return resolution instanceof ChallengeResolution.Resolved resolved
                && resolved.session() != null
                && !resolved.session().awaits(challengeId);
    }

    /**
     * Apply the outcome of an already resolved challenge if its session key never received it.
     */
    private Uni<ChallengeResolution> reapplyIfUnsettled(DelegationChallenge challenge) {
        return sessionKeys.findById(challenge.sessionKeyId()).flatMap(session -> {
            if (session.isPresent() && session.get().awaits(challenge.challengeId())) {
                LOG.warnf(
                        "Challenge %s is %s but session key %s is still %s, applying the outcome again",
                        challenge.challengeId(),
                        challenge.status(),
                        challenge.sessionKeyId(),
                        session.get().status());
                return applyResolution(challenge);
            }
            LOG.debugf("Challenge %s already %s, ignoring confirmation", challenge.challengeId(), challenge.status());
            return Uni.createFrom().<ChallengeResolution>item(new ChallengeResolution.AlreadyResolved(challenge));
        });
    }

    private Uni<ChallengeResolution> applyResolution(DelegationChallenge challenge) {
        var confirmed = challenge.status() == ChallengeStatus.CONFIRMED;
        if (confirmed && challenge.kind() == ChallengeKind.CREATE) {
            return activate(challenge, 1).map(session -> new ChallengeResolution.Resolved(challenge, session, null));
        }

        if (confirmed) {
            return transition(challenge.sessionKeyId(), current -> {
                        if (!current.awaits(challenge.challengeId())) {
                            return null;
                        }
                        var now = clock.instant();
                        if (current.isPastExpiry(now)) {
                            return current.terminate(SessionKeyStatus.EXPIRED, RevocationService.REASON_EXPIRED, now);
                        }
                        return current.completeRenewal(challenge.delegateAddress(), now);
                    })
                    .map(session -> {
                        if (session != null && session.status() == SessionKeyStatus.EXPIRED) {
                            return new ChallengeResolution.Resolved(challenge, session, SessionKeyError.EXPIRED);
                        }
                        if (session != null && session.status() == SessionKeyStatus.ACTIVE) {
                            LOG.infof(
                                    "Session key %s renewed until %s (%d of %d renewals used)",
                                    session.sessionKeyId(),
                                    session.expiresAt(),
                                    session.permissions().renewalsUsed(),
                                    session.permissions().maxRenewals());
                        }
                        return new ChallengeResolution.Resolved(challenge, session, null);
                    });
        }
        return failDelegation(challenge.sessionKeyId(), challenge.challengeId())
                .map(session -> new ChallengeResolution.Resolved(challenge, session, SessionKeyError.CHALLENGE_FAILED));
    }

    private Uni<SessionKey> activate(DelegationChallenge challenge, int attempt) {
        var sessionKeyId = challenge.sessionKeyId();
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().nullItem();
            }
            var current = found.get();
            if (!current.awaits(challenge.challengeId())) {
                LOG.debugf("Session key %s is %s, confirmation has no effect", sessionKeyId, current.status());
                return Uni.createFrom().item(current);
            }
            var active = current.activate(challenge.delegateAddress(), clock.instant());
            return sessionKeys.compareAndSet(active, current.version()).flatMap(outcome -> {
                if (outcome == UpdateOutcome.APPLIED) {
                    LOG.infof(
                            "Session key %s active for wallet %s until %s",
                            sessionKeyId, active.walletId(), active.expiresAt());
                    return Uni.createFrom().item(active);
                }
                if (attempt >= config.revocation().maxAttempts()) {
                    throw new ContentionException("Could not activate session key " + sessionKeyId);
                }
                if (outcome == UpdateOutcome.WALLET_CONFLICT) {
                    return supersede(current.walletId(), sessionKeyId)
                            .flatMap(ignored -> activate(challenge, attempt + 1));
                }
                return activate(challenge, attempt + 1);
            });
        });
    }

    private Uni<Void> supersede(String walletId, String replacementId) {
        return sessionKeys.findEnforceableByWallet(walletId).flatMap(previous -> {
            if (previous.isEmpty() || previous.get().sessionKeyId().equals(replacementId)) {
                return Uni.createFrom().voidItem();
            }
            LOG.infof(
                    "Session key %s supersedes %s for wallet %s",
                    replacementId, previous.get().sessionKeyId(), walletId);
            return revocationService
                    .revoke(previous.get().sessionKeyId(), RevocationService.REASON_SUPERSEDED)
                    .replaceWithVoid();
        });
    }

    /**
     * Undo the state a failed challenge left behind: a pending session key is
     * revoked, a renewing one returns to ACTIVE (or EXPIRED once past its expiry).
     */
    private Uni<SessionKey> failDelegation(String sessionKeyId, String challengeId) {
        return transition(sessionKeyId, current -> {
            if (!current.awaits(challengeId)) {
                return null;
            }
            var now = clock.instant();
            if (current.status() == SessionKeyStatus.PENDING) {
                return current.terminate(SessionKeyStatus.REVOKED, RevocationService.REASON_CHALLENGE_FAILED, now);
            }
            if (current.isPastExpiry(now)) {
                return current.terminate(SessionKeyStatus.EXPIRED, RevocationService.REASON_EXPIRED, now);
            }
            return current.abandonRenewal(now);
        });
    }

    /**
     * Apply {@code change} to the stored session key, re-reading on version conflicts.
     *
     * <p>{@code change} returns null when the current state needs no update.
     */
    private Uni<SessionKey> transition(String sessionKeyId, Function<SessionKey, SessionKey> change) {
        return transition(sessionKeyId, change, 1);
    }

    private Uni<SessionKey> transition(String sessionKeyId, Function<SessionKey, SessionKey> change, int attempt) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().nullItem();
            }
            var current = found.get();
            var updated = change.apply(current);
            if (updated == null) {
                return Uni.createFrom().item(current);
            }
            return sessionKeys.compareAndSet(updated, current.version()).flatMap(outcome -> {
                if (outcome == UpdateOutcome.APPLIED) {
                    if (updated.status().isTerminal()) {
                        metrics.recordTermination(updated.status());
                        LOG.infof(
                                "Session key %s is now %s (%s)", sessionKeyId, updated.status(), updated.statusReason());
                    }
                    return Uni.createFrom().item(updated);
                }
                if (attempt >= config.revocation().maxAttempts()) {
                    throw new ContentionException("Could not update session key " + sessionKeyId);
                }
                return transition(sessionKeyId, change, attempt + 1);
            });
        });
    }

    // -------------------------------------------------------------------------
    // Custody provider
    // -------------------------------------------------------------------------

    private Uni<Boolean> emit(DelegationChallenge challenge, SessionKey session) {
        metrics.recordChallenge(challenge.kind(), challenge.status());
        return custodyProvider
                .requestDelegation(DelegationRequest.of(challenge, session))
                .replaceWith(Boolean.TRUE)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(
                            "Custody provider %s refused challenge %s: %s",
                            custodyProvider.name(), challenge.challengeId(), error.getMessage());
                    return Boolean.FALSE;
                });
    }

    private Uni<ChallengeResolution> failEmittedChallenge(DelegationChallenge challenge) {
        return completeChallenge(challenge.challengeId(), ChallengeOutcome.failed());
    }

    private static Uni<CreationResult> refuseCreate(SessionKeyError error, String message) {
        return Uni.createFrom().item(new CreationResult.Refused(error, message));
    }

    private static Uni<RenewalResult> refuseRenewal(SessionKeyError error, String message) {
        return Uni.createFrom().item(new RenewalResult.Refused(error, message));
    }

    private record Grant(SessionPermissions permissions, Duration duration) {}

    private static class InvalidOverrideException extends RuntimeException {

        InvalidOverrideException(String message) {
            super(message);
        }
    }

    private static class ContentionException extends RuntimeException {

        ContentionException(String message) {
            super(message);
        }
    }
}
