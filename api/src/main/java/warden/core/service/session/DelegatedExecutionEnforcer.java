package warden.core.service.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.core.model.session.AuthorizationDecision;
import warden.core.model.session.ExecutionRecord;
import warden.core.model.session.ExecutionStep;
import warden.core.model.session.ReversalResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyError;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.UpdateOutcome;
import warden.core.port.in.DelegatedExecution;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyMetrics;
import warden.core.port.out.SessionKeyRepository;

/**
 * Decides whether an agent action may be signed under a session key.
 *
 * <p>Checks run in a fixed order and the first failing check determines the
 * rejection reason:
 * <ol>
 *   <li>amount is not negative</li>
 *   <li>session key exists</li>
 *   <li>session key is not terminal</li>
 *   <li>session key is not pending</li>
 *   <li>session key has not reached its expiry (otherwise it is expired on the spot)</li>
 *   <li>action is allowed</li>
 *   <li>amount is within the per-transaction cap</li>
 *   <li>amount fits in the remaining budget</li>
 * </ol>
 *
 * <p>The amount is then reserved with a write conditional on the version read
 * in the first step. A lost race restarts the checks against the fresh record,
 * so concurrent authorizations can never push the reserved amount past the limit.
 *
 * <p>A multi-step operation runs the action and per-transaction checks for every
 * step, then checks the combined amount against the remaining budget and
 * reserves it with a single conditional write.
 */
@ApplicationScoped
public class DelegatedExecutionEnforcer implements DelegatedExecution {

    private static final Logger LOG = Logger.getLogger(DelegatedExecutionEnforcer.class);

    private final SessionKeyRepository sessionKeys;
    private final ExecutionRecordRepository ledger;
    private final RevocationService revocationService;
    private final SessionKeyIdGenerator idGenerator;
    private final SessionKeyMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;

    @Inject
    public DelegatedExecutionEnforcer(
            SessionKeyRepository sessionKeys,
            ExecutionRecordRepository ledger,
            RevocationService revocationService,
            SessionKeyIdGenerator idGenerator,
            SessionKeyMetrics metrics,
            Clock clock,
            SessionKeyConfig config) {
        this.sessionKeys = sessionKeys;
        this.ledger = ledger;
        this.revocationService = revocationService;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAttempts = config.enforcement().maxAttempts();
    }

    @Override
    public Uni<AuthorizationDecision> authorize(String sessionKeyId, String action, long amount) {
        if (amount < 0) {
            metrics.recordAuthorization(SessionKeyError.INVALID_AMOUNT, amount);
            return Uni.createFrom().item(AuthorizationDecision.reject(SessionKeyError.INVALID_AMOUNT));
        }
        var normalizedAction = action == null ? null : action.trim().toLowerCase(Locale.ROOT);

        return authorize(sessionKeyId, normalizedAction, amount, 1)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Storage failure while authorizing against session key %s", sessionKeyId);
                    return AuthorizationDecision.reject(SessionKeyError.STORE_UNAVAILABLE);
                })
                .invoke(decision -> {
                    if (decision instanceof AuthorizationDecision.Rejected rejected) {
                        metrics.recordAuthorization(rejected.reason(), amount);
                    } else {
                        metrics.recordAuthorization(null, amount);
                    }
                });
    }

    private Uni<AuthorizationDecision> authorize(String sessionKeyId, String action, long amount, int attempt) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Rejecting %s: session key %s not found", action, sessionKeyId);
                return Uni.createFrom().item(AuthorizationDecision.reject(SessionKeyError.NOT_FOUND));
            }
            var session = found.get();
            var now = clock.instant();

            if (session.status().isTerminal()) {
                return reject(session, action, amount, SessionKeyError.INACTIVE, null);
            }
            if (session.status() == SessionKeyStatus.PENDING) {
                return reject(session, action, amount, SessionKeyError.NOT_YET_ACTIVE, null);
            }
            if (session.isPastExpiry(now)) {
                return revocationService
                        .expire(sessionKeyId)
                        .flatMap(ignored -> reject(session, action, amount, SessionKeyError.EXPIRED, null));
            }

            var permissions = session.permissions();
            if (!permissions.allows(action)) {
                return reject(session, action, amount, SessionKeyError.ACTION_NOT_PERMITTED, null);
            }
            if (permissions.exceedsPerTransactionCap(amount)) {
                return reject(session, action, amount, SessionKeyError.PER_TRANSACTION_LIMIT_EXCEEDED, null);
            }
            if (!permissions.fits(amount)) {
                return reject(session, action, amount, SessionKeyError.SPENDING_LIMIT_EXCEEDED, permissions.headroom());
            }

            var reserved = session.withSpendingUsed(permissions.spendingUsed() + amount, now);
            return sessionKeys.compareAndSet(reserved, session.version()).flatMap(outcome -> {
                if (outcome == UpdateOutcome.APPLIED) {
                    return admitted(reserved, action, amount);
                }
                if (attempt >= maxAttempts) {
                    LOG.warnf(
                            "Authorization against session key %s lost %d consecutive races", sessionKeyId, attempt);
                    return reject(session, action, amount, SessionKeyError.CONTENTION, null);
                }
                LOG.debugf("Version conflict on session key %s, retrying (attempt %d)", sessionKeyId, attempt);
                return authorize(sessionKeyId, action, amount, attempt + 1);
            });
        });
    }

    @Override
    public Uni<AuthorizationDecision> authorizeAll(String sessionKeyId, List<ExecutionStep> steps) {
        if (steps == null || steps.isEmpty()) {
            metrics.recordAuthorization(SessionKeyError.INVALID_AMOUNT, 0);
            return Uni.createFrom().item(new AuthorizationDecision.Rejected(SessionKeyError.INVALID_AMOUNT));
        }
        var normalized = new ArrayList<ExecutionStep>(steps.size());
        long total = 0;
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            if (step == null || step.amount() < 0) {
                metrics.recordAuthorization(SessionKeyError.INVALID_AMOUNT, total);
                return Uni.createFrom().item(new AuthorizationDecision.Rejected(SessionKeyError.INVALID_AMOUNT, null, i));
            }
            var action = step.action() == null ? null : step.action().trim().toLowerCase(Locale.ROOT);
            normalized.add(new ExecutionStep(action, step.amount()));
            // Saturate: an overflowing total can never fit the budget
            total = total > Long.MAX_VALUE - step.amount() ? Long.MAX_VALUE : total + step.amount();
        }
        long combined = total;

        return authorizeAll(sessionKeyId, normalized, combined, 1)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(
                            error,
                            "Storage failure while authorizing %d steps against session key %s",
                            normalized.size(),
                            sessionKeyId);
                    return AuthorizationDecision.reject(SessionKeyError.STORE_UNAVAILABLE);
                })
                .invoke(decision -> {
                    if (decision instanceof AuthorizationDecision.Rejected rejected) {
                        metrics.recordAuthorization(rejected.reason(), combined);
                    } else {
                        metrics.recordAuthorization(null, combined);
                    }
                });
    }

    private Uni<AuthorizationDecision> authorizeAll(
            String sessionKeyId, List<ExecutionStep> steps, long total, int attempt) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Rejecting %d steps: session key %s not found", steps.size(), sessionKeyId);
                return Uni.createFrom().item(AuthorizationDecision.reject(SessionKeyError.NOT_FOUND));
            }
            var session = found.get();
            var now = clock.instant();

            if (session.status().isTerminal()) {
                return rejectAll(session, steps, SessionKeyError.INACTIVE, null);
            }
            if (session.status() == SessionKeyStatus.PENDING) {
                return rejectAll(session, steps, SessionKeyError.NOT_YET_ACTIVE, null);
            }
            if (session.isPastExpiry(now)) {
                return revocationService
                        .expire(sessionKeyId)
                        .flatMap(ignored -> rejectAll(session, steps, SessionKeyError.EXPIRED, null));
            }

            var permissions = session.permissions();
            for (int i = 0; i < steps.size(); i++) {
                var step = steps.get(i);
                SessionKeyError failure = null;
                if (!permissions.allows(step.action())) {
                    failure = SessionKeyError.ACTION_NOT_PERMITTED;
                } else if (permissions.exceedsPerTransactionCap(step.amount())) {
                    failure = SessionKeyError.PER_TRANSACTION_LIMIT_EXCEEDED;
                }
                if (failure != null) {
                    return rejectStep(session, step, i, failure);
                }
            }
            if (!permissions.fits(total)) {
                return rejectAll(session, steps, SessionKeyError.SPENDING_LIMIT_EXCEEDED, permissions.headroom());
            }

            var reserved = session.withSpendingUsed(permissions.spendingUsed() + total, now);
            return sessionKeys.compareAndSet(reserved, session.version()).flatMap(outcome -> {
                if (outcome == UpdateOutcome.APPLIED) {
                    return admittedAll(reserved, steps);
                }
                if (attempt >= maxAttempts) {
                    LOG.warnf(
                            "Multi-step authorization against session key %s lost %d consecutive races",
                            sessionKeyId, attempt);
                    return rejectAll(session, steps, SessionKeyError.CONTENTION, null);
                }
                LOG.debugf("Version conflict on session key %s, retrying (attempt %d)", sessionKeyId, attempt);
                return authorizeAll(sessionKeyId, steps, total, attempt + 1);
            });
        });
    }

    private Uni<AuthorizationDecision> admittedAll(SessionKey reserved, List<ExecutionStep> steps) {
        var permissions = reserved.permissions();
        LOG.debugf(
                "Admitted %d steps on session key %s (%d of %d used)",
                steps.size(), reserved.sessionKeyId(), permissions.spendingUsed(), permissions.spendingLimit());
        var appends = steps.stream()
                .map(step -> appendQuietly(ExecutionRecord.admitted(
                        idGenerator.generate(), reserved, step.action(), step.amount(), reserved.updatedAt())))
                .toList();
        return Uni.join()
                .all(appends)
                .andCollectFailures()
                .replaceWith(new AuthorizationDecision.Admitted(
                        reserved.sessionKeyId(), permissions.spendingUsed(), permissions.headroom()));
    }

    private Uni<AuthorizationDecision> rejectStep(
            SessionKey session, ExecutionStep step, int index, SessionKeyError reason) {
        LOG.debugf(
                "Rejecting step %d (%s of %d) on session key %s: %s",
                index, step.action(), step.amount(), session.sessionKeyId(), reason);
        var record = ExecutionRecord.rejected(
                idGenerator.generate(), session, step.action(), step.amount(), reason, clock.instant());
        return appendQuietly(record).replaceWith(new AuthorizationDecision.Rejected(reason, null, index));
    }

    private Uni<AuthorizationDecision> rejectAll(
            SessionKey session, List<ExecutionStep> steps, SessionKeyError reason, Long headroom) {
        LOG.debugf("Rejecting %d steps on session key %s: %s", steps.size(), session.sessionKeyId(), reason);
        var now = clock.instant();
        var appends = steps.stream()
                .map(step -> appendQuietly(ExecutionRecord.rejected(
                        idGenerator.generate(), session, step.action(), step.amount(), reason, now)))
                .toList();
        return Uni.join()
                .all(appends)
                .andCollectFailures()
                .replaceWith(new AuthorizationDecision.Rejected(reason, headroom));
    }

    private Uni<AuthorizationDecision> admitted(SessionKey reserved, String action, long amount) {
        var permissions = reserved.permissions();
        var record = ExecutionRecord.admitted(idGenerator.generate(), reserved, action, amount, reserved.updatedAt());
        LOG.debugf(
                "Admitted %s of %d on session key %s (%d of %d used)",
                action, amount, reserved.sessionKeyId(), permissions.spendingUsed(), permissions.spendingLimit());
        return appendQuietly(record)
                .replaceWith(new AuthorizationDecision.Admitted(
                        reserved.sessionKeyId(), permissions.spendingUsed(), permissions.headroom()));
    }

    private Uni<AuthorizationDecision> reject(
            SessionKey session, String action, long amount, SessionKeyError reason, Long headroom) {
        LOG.debugf("Rejecting %s of %d on session key %s: %s", action, amount, session.sessionKeyId(), reason);
        var record = ExecutionRecord.rejected(idGenerator.generate(), session, action, amount, reason, clock.instant());
        return appendQuietly(record).replaceWith(new AuthorizationDecision.Rejected(reason, headroom));
    }

    @Override
    public Uni<ReversalResult> reverse(String sessionKeyId, long amount) {
        if (amount < 0) {
            return Uni.createFrom().item(new ReversalResult.Refused(SessionKeyError.INVALID_AMOUNT));
        }
        return reverse(sessionKeyId, amount, 1).onFailure().recoverWithItem(error -> {
            LOG.warnf(error, "Storage failure while reversing on session key %s", sessionKeyId);
            return new ReversalResult.Refused(SessionKeyError.STORE_UNAVAILABLE);
        });
    }

    private Uni<ReversalResult> reverse(String sessionKeyId, long amount, int attempt) {
        return sessionKeys.findById(sessionKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().<ReversalResult>item(new ReversalResult.Refused(SessionKeyError.NOT_FOUND));
            }
            var session = found.get();
            if (session.status() == SessionKeyStatus.PENDING) {
                return Uni.createFrom()
                        .<ReversalResult>item(new ReversalResult.Refused(SessionKeyError.NOT_YET_ACTIVE));
            }

            var used = session.permissions().spendingUsed();
            var clamped = amount > used;
            var released = clamped ? used : amount;
            var updated = session.withSpendingUsed(used - released, clock.instant());

            return sessionKeys.compareAndSet(updated, session.version()).flatMap(outcome -> {
                if (outcome != UpdateOutcome.APPLIED) {
                    if (attempt >= maxAttempts) {
                        return Uni.createFrom()
                                .<ReversalResult>item(new ReversalResult.Refused(SessionKeyError.CONTENTION));
                    }
                    return reverse(sessionKeyId, amount, attempt + 1);
                }

                String note = null;
                if (clamped) {
                    LOG.warnf(
                            "Reversal of %d on session key %s exceeds the reserved %d, clamping at zero",
                            amount, sessionKeyId, used);
                    note = "requested " + amount + ", clamped to " + released;
                }
                metrics.recordReversal(clamped);
                LOG.debugf("Released %d on session key %s", released, sessionKeyId);
                var record = ExecutionRecord.reversed(
                        idGenerator.generate(), updated, released, note, updated.updatedAt());
                return appendQuietly(record)
                        .<ReversalResult>replaceWith(new ReversalResult.Reversed(updated.permissions().spendingUsed(), clamped));
            });
        });
    }

    /**
     * Append a ledger entry without failing the decision it documents.
     *
     * <p>The session record stays authoritative; a missing entry shows up in the
     * spending reconciliation.
     */
    private Uni<Void> appendQuietly(ExecutionRecord record) {
        return ledger.append(record).onFailure().recoverWithItem(error -> {
            LOG.warnf(
                    "Failed to append %s ledger entry for session key %s: %s",
                    record.outcome(), record.sessionKeyId(), error.getMessage());
            return null;
        });
    }
}
