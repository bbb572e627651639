package warden.core.service.session;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.SessionKeyConfig;
import warden.core.model.session.RevocationResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyError;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.UpdateOutcome;
import warden.core.port.out.SessionKeyMetrics;
import warden.core.port.out.SessionKeyRepository;

/**
 * Moves session keys to a terminal status.
 *
 * <p>Terminal transitions are unconditional: a concurrent authorization or
 * renewal that changes the record version only causes the transition to be
 * re-applied on the fresh copy. Both operations are idempotent and never
 * fail the returned Uni.
 */
@ApplicationScoped
public class RevocationService {

    private static final Logger LOG = Logger.getLogger(RevocationService.class);

    public static final String REASON_EXPIRED = "expired";
    public static final String REASON_SUPERSEDED = "superseded";
    public static final String REASON_CHALLENGE_FAILED = "challenge failed";
    public static final String REASON_USER = "revoked by user";

    private final SessionKeyRepository repository;
    private final SessionKeyMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;

    @Inject
    public RevocationService(
            SessionKeyRepository repository, SessionKeyMetrics metrics, Clock clock, SessionKeyConfig config) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAttempts = config.revocation().maxAttempts();
    }

    /**
     * Revoke a session key.
     *
     * @param sessionKeyId session key identifier
     * @param reason       recorded on the session key; defaults to {@value #REASON_USER}
     */
    public Uni<RevocationResult> revoke(String sessionKeyId, String reason) {
        var effectiveReason = reason == null || reason.isBlank() ? REASON_USER : reason;
        return terminate(sessionKeyId, SessionKeyStatus.REVOKED, effectiveReason, 1);
    }

    /**
     * Expire a session key that reached its expiry time.
     */
    public Uni<RevocationResult> expire(String sessionKeyId) {
        return terminate(sessionKeyId, SessionKeyStatus.EXPIRED, REASON_EXPIRED, 1);
    }

    private Uni<RevocationResult> terminate(
            String sessionKeyId, SessionKeyStatus terminalStatus, String reason, int attempt) {
        return repository
                .findById(sessionKeyId)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom().<RevocationResult>item(new RevocationResult.Refused(
                                SessionKeyError.NOT_FOUND));
                    }
                    var current = found.get();
                    if (current.status().isTerminal()) {
                        return Uni.createFrom().<RevocationResult>item(new RevocationResult.AlreadyTerminal(current));
                    }

                    var terminated = current.terminate(terminalStatus, reason, clock.instant());
                    return repository
                            .compareAndSet(terminated, current.version())
                            .flatMap(outcome -> {
                                if (outcome == UpdateOutcome.APPLIED) {
                                    onTerminated(terminated);
                                    return Uni.createFrom()
                                            .<RevocationResult>item(new RevocationResult.Terminated(terminated));
                                }
                                if (attempt >= maxAttempts) {
                                    LOG.warnf(
                                            "Giving up %s of session key %s after %d attempts",
                                            terminalStatus, sessionKeyId, attempt);
                                    return Uni.createFrom().<RevocationResult>item(new RevocationResult.Refused(
                                            SessionKeyError.CONTENTION));
                                }
                                return terminate(sessionKeyId, terminalStatus, reason, attempt + 1);
                            });
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Storage failure while terminating session key %s", sessionKeyId);
                    return new RevocationResult.Refused(SessionKeyError.STORE_UNAVAILABLE);
                });
    }

    private void onTerminated(SessionKey session) {
        LOG.infof(
                "Session key %s of wallet %s is now %s (%s)",
                session.sessionKeyId(), session.walletId(), session.status(), session.statusReason());
        metrics.recordTermination(session.status());
    }
}
