package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RenewalConfig;
import warden.core.model.session.RenewalPassSummary;
import warden.core.model.session.RenewalResult;
import warden.core.model.session.RevocationResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyStatus;
import warden.core.port.out.SessionKeyMetrics;
import warden.core.port.out.SessionKeyRepository;

/**
 * Recurring lifecycle job for session keys.
 *
 * <p>Each pass:
 * <ol>
 *   <li>Starts renewal of ACTIVE session keys with auto-renew enabled, renewals
 *       left and an expiry inside the look-ahead window</li>
 *   <li>Expires PENDING, ACTIVE and RENEWING session keys past their expiry</li>
 *   <li>Resolves delegation challenges awaiting confirmation past their TTL as expired</li>
 *   <li>Settles PENDING and RENEWING session keys whose challenge was resolved without
 *       the outcome reaching the session key</li>
 * </ol>
 *
 * <p>The look-ahead window is {@code max(duration * look-ahead-fraction, look-ahead-floor)}.
 * Starting a renewal is guarded by the ACTIVE to RENEWING transition, so passes
 * running on several instances never renew a session key twice.
 */
@ApplicationScoped
public class RenewalScheduler {

    private static final Logger LOG = Logger.getLogger(RenewalScheduler.class);

    private final SessionKeyRepository sessionKeys;
    private final ChallengeCoordinator coordinator;
    private final RevocationService revocationService;
    private final SessionKeyMetrics metrics;
    private final RenewalConfig config;
    private final Clock clock;

    @Inject
    public RenewalScheduler(
            SessionKeyRepository sessionKeys,
            ChallengeCoordinator coordinator,
            RevocationService revocationService,
            SessionKeyMetrics metrics,
            RenewalConfig config,
            Clock clock) {
        this.sessionKeys = sessionKeys;
        this.coordinator = coordinator;
        this.revocationService = revocationService;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(every = "${warden.renewal.interval:1m}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledPass() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return runPass()
                .onFailure()
                .invoke(e -> LOG.error("Renewal pass failed", e))
                .onFailure()
                .recoverWithNull()
                .replaceWithVoid();
    }

    /**
     * Run one pass over the stored session keys.
     *
     * @return counts of the transitions performed
     */
    public Uni<RenewalPassSummary> runPass() {
        var now = clock.instant();
        return sessionKeys
                .findByStatus(EnumSet.of(SessionKeyStatus.PENDING, SessionKeyStatus.ACTIVE, SessionKeyStatus.RENEWING))
                .flatMap(candidates -> {
                    var overdue = candidates.stream()
                            .filter(session -> session.isPastExpiry(now))
                            .toList();
                    var renewable = candidates.stream()
                            .filter(session -> isDueForRenewal(session, now))
                            .toList();
                    var unsettled = candidates.stream()
                            .filter(session -> session.status() != SessionKeyStatus.ACTIVE)
                            .filter(session -> !session.isPastExpiry(now))
                            .toList();
                    return Uni.combine()
                            .all()
                            .unis(startRenewals(renewable), expireAll(overdue), expireChallenges(), settleAll(unsettled))
                            .asTuple();
                })
                .map(counts -> {
                    var renewals = counts.getItem1();
                    var expirations = counts.getItem2();
                    var settlements = counts.getItem4();
                    var summary = new RenewalPassSummary(
                            renewals[0],
                            expirations[0],
                            counts.getItem3(),
                            settlements[0],
                            renewals[1] + expirations[1] + settlements[1]);
                    if (summary.renewalsStarted() > 0
                            || summary.sessionsExpired() > 0
                            || summary.challengesExpired() > 0
                            || summary.sessionsSettled() > 0
                            || summary.failures() > 0) {
                        LOG.infof(
                                "Renewal pass: %d renewals started, %d session keys expired, %d challenges expired, "
                                        + "%d session keys settled, %d failures",
                                summary.renewalsStarted(),
                                summary.sessionsExpired(),
                                summary.challengesExpired(),
                                summary.sessionsSettled(),
                                summary.failures());
                    } else {
                        LOG.debug("Renewal pass: nothing to do");
                    }
                    metrics.recordRenewalPass(summary);
                    return summary;
                });
    }

    /**
     * Check if a session key should be renewed by this pass.
     */
    boolean isDueForRenewal(SessionKey session, Instant now) {
        if (session.status() != SessionKeyStatus.ACTIVE) {
            return false;
        }
        var permissions = session.permissions();
        if (!permissions.autoRenew() || !permissions.hasRenewalsLeft() || session.isPastExpiry(now)) {
            return false;
        }
        var remaining = Duration.between(now, session.expiresAt());
        return remaining.compareTo(lookAhead(session.duration())) <= 0;
    }

    Duration lookAhead(Duration sessionDuration) {
        var fraction = Duration.ofMillis((long) (sessionDuration.toMillis() * config.lookAheadFraction()));
        var floor = config.lookAheadFloor();
        return fraction.compareTo(floor) >= 0 ? fraction : floor;
    }

    /**
     * @return {started, failed}
     */
    private Uni<int[]> startRenewals(List<SessionKey> renewable) {
        if (renewable.isEmpty()) {
            return Uni.createFrom().item(new int[] {0, 0});
        }
        return Uni.join()
                .all(renewable.stream()
                        .map(session -> coordinator
                                .beginRenewal(session.sessionKeyId())
                                .map(result -> {
                                    if (result instanceof RenewalResult.Refused refused) {
                                        LOG.debugf(
                                                "Scheduler did not renew session key %s: %s",
                                                session.sessionKeyId(), refused.error());
                                        return refused.error().retryable() ? -1 : 0;
                                    }
                                    return 1;
                                }))
                        .toList())
                .andCollectFailures()
                .map(RenewalScheduler::tally);
    }

    /**
     * @return {expired, failed}
     */
    private Uni<int[]> expireAll(List<SessionKey> overdue) {
        if (overdue.isEmpty()) {
            return Uni.createFrom().item(new int[] {0, 0});
        }
        return Uni.join()
                .all(overdue.stream()
                        .map(session -> revocationService
                                .expire(session.sessionKeyId())
                                .map(result -> {
                                    if (result instanceof RevocationResult.Terminated) {
                                        return 1;
                                    }
                                    return result.succeeded() ? 0 : -1;
                                }))
                        .toList())
                .andCollectFailures()
                .map(RenewalScheduler::tally);
    }

    /**
     * @return {settled, failed}
     */
    private Uni<int[]> settleAll(List<SessionKey> unsettled) {
        if (unsettled.isEmpty()) {
            return Uni.createFrom().item(new int[] {0, 0});
        }
        return Uni.join()
                .all(unsettled.stream()
                        .map(session -> coordinator
                                .settle(session.sessionKeyId())
                                .map(settled -> settled ? 1 : 0)
                                .onFailure()
                                .recoverWithItem(error -> {
                                    LOG.warnf(
                                            "Could not settle session key %s: %s",
                                            session.sessionKeyId(), error.getMessage());
                                    return -1;
                                }))
                        .toList())
                .andCollectFailures()
                .map(RenewalScheduler::tally);
    }

    private Uni<Integer> expireChallenges() {
        return coordinator.expireStaleChallenges();
    }

    private static int[] tally(List<Integer> outcomes) {
        int done = 0;
        int failed = 0;
        for (int outcome : outcomes) {
            if (outcome > 0) {
                done++;
            } else if (outcome < 0) {
                failed++;
            }
        }
        return new int[] {done, failed};
    }
}
