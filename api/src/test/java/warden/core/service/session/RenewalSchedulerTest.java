package warden.core.service.session;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.config.RenewalConfig;
import warden.core.model.session.ChallengeKind;
import warden.core.model.session.ChallengeOutcome;
import warden.core.model.session.CreationResult;
import warden.core.model.session.RenewalPassSummary;
import warden.core.model.session.RenewalResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.SessionOverrides;
import warden.core.model.session.SessionPermissions;
import warden.core.port.out.SessionKeyRepository;

@DisplayName("RenewalScheduler")
class RenewalSchedulerTest {

    private SessionKeyEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SessionKeyEngine();
    }

    private RenewalPassSummary runPass() {
        return engine.scheduler.runPass().await().indefinitely();
    }

    @Nested
    @DisplayName("look-ahead window")
    class LookAheadTests {

        @Test
        @DisplayName("should use a tenth of the duration for long sessions")
        void shouldUseFractionForLongSessions() {
            assertEquals(Duration.ofHours(16).plusMinutes(48), engine.scheduler.lookAhead(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("should use the floor for short sessions")
        void shouldUseFloorForShortSessions() {
            assertEquals(Duration.ofHours(1), engine.scheduler.lookAhead(Duration.ofHours(2)));
        }

        @Test
        @DisplayName("should only renew inside the window")
        void shouldOnlyRenewInsideWindow() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            engine.clock.set(session.expiresAt().minus(Duration.ofHours(17)));
            assertFalse(engine.scheduler.isDueForRenewal(engine.load(session.sessionKeyId()), engine.clock.instant()));

            engine.clock.set(session.expiresAt().minus(Duration.ofHours(16)));
            assertTrue(engine.scheduler.isDueForRenewal(engine.load(session.sessionKeyId()), engine.clock.instant()));
        }
    }

    @Nested
    @DisplayName("renewals")
    class RenewalTests {

        @Test
        @DisplayName("should start a renewal for a session key due for renewal")
        void shouldStartDueRenewal() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.clock.set(session.expiresAt().minus(Duration.ofHours(2)));

            var summary = runPass();

            assertEquals(new RenewalPassSummary(1, 0, 0, 0, 0), summary);
            assertEquals(SessionKeyStatus.RENEWING, engine.load(session.sessionKeyId()).status());
            assertEquals(ChallengeKind.RENEW, engine.custody.last().kind());
            verify(engine.metrics).recordRenewalPass(summary);
        }

        @Test
        @DisplayName("should not start a second renewal on the next pass")
        void shouldNotRenewTwice() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.clock.set(session.expiresAt().minus(Duration.ofHours(2)));
            runPass();
            engine.clock.advance(Duration.ofMinutes(1));

            assertEquals(RenewalPassSummary.empty(), runPass());
        }

        @Test
        @DisplayName("should carry the limit and the reserved amount over a completed renewal")
        void shouldCarryOverSpending() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.enforcer.authorize(session.sessionKeyId(), "transfer", 60_00).await().indefinitely();
            engine.clock.set(session.expiresAt().minus(Duration.ofHours(2)));
            runPass();

            engine.coordinator
                    .completeChallenge(engine.custody.last().challengeId(), ChallengeOutcome.confirmed(null))
                    .await()
                    .indefinitely();

            var renewed = engine.load(session.sessionKeyId());
            assertEquals(SessionKeyStatus.ACTIVE, renewed.status());
            assertEquals(session.expiresAt().plus(Duration.ofDays(7)), renewed.expiresAt());
            assertEquals(1, renewed.permissions().renewalsUsed());
            assertEquals(60_00, renewed.permissions().spendingUsed());
            assertEquals(100_00, renewed.permissions().spendingLimit());
            assertFalse(engine.enforcer
                    .authorize(session.sessionKeyId(), "transfer", 50_00)
                    .await()
                    .indefinitely()
                    .isAdmitted());
        }

        @Test
        @DisplayName("should skip session keys without auto-renew")
        void shouldSkipWithoutAutoRenew() {
            var session = engine.activeSession(
                    "wallet-1", SessionKeyEngine.TIPPING, new SessionOverrides(null, null, null, null, false, null));
            engine.clock.set(session.expiresAt().minus(Duration.ofHours(2)));

            assertEquals(RenewalPassSummary.empty(), runPass());
            assertEquals(SessionKeyStatus.ACTIVE, engine.load(session.sessionKeyId()).status());
        }

        @Test
        @DisplayName("should skip session keys with no renewals left")
        void shouldSkipExhaustedQuota() {
            var session = engine.activeSession(
                    "wallet-1", SessionKeyEngine.TIPPING, new SessionOverrides(null, null, null, null, null, 0));
            engine.clock.set(session.expiresAt().minus(Duration.ofHours(2)));

            assertEquals(RenewalPassSummary.empty(), runPass());
        }

        @Test
        @DisplayName("should count renewals the custody provider refused as failures")
        void shouldCountRefusedRenewals() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.clock.set(session.expiresAt().minus(Duration.ofHours(2)));
            engine.custody.refuse = true;

            var summary = runPass();

            assertEquals(0, summary.renewalsStarted());
            assertEquals(1, summary.failures());
            assertEquals(SessionKeyStatus.ACTIVE, engine.load(session.sessionKeyId()).status());
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should expire active and renewing session keys past their expiry")
        void shouldExpireOverdueSessionKeys() {
            var config = new TestSessionKeyConfig();
            config.challengeTtl = Duration.ofDays(30);
            engine = new SessionKeyEngine(config);
            var active = engine.activeSession(
                    "wallet-1", SessionKeyEngine.TIPPING, new SessionOverrides(null, null, null, null, false, null));
            var renewing = engine.activeSession("wallet-2", SessionKeyEngine.TIPPING, null);
            engine.coordinator.beginRenewal(renewing.sessionKeyId()).await().indefinitely();
            engine.clock.set(active.expiresAt());

            var summary = runPass();

            assertEquals(2, summary.sessionsExpired());
            assertEquals(SessionKeyStatus.EXPIRED, engine.load(active.sessionKeyId()).status());
            assertEquals(SessionKeyStatus.EXPIRED, engine.load(renewing.sessionKeyId()).status());
            assertEquals(RevocationService.REASON_EXPIRED, engine.load(active.sessionKeyId()).statusReason());
        }

        @Test
        @DisplayName("should expire stale delegation challenges")
        void shouldExpireStaleChallenges() {
            var started = (CreationResult.Started) engine.coordinator
                    .beginCreate("wallet-1", "user-1", SessionKeyEngine.TIPPING, null)
                    .await()
                    .indefinitely();
            engine.clock.advance(engine.config.challengeTtl.plusSeconds(1));

            var summary = runPass();

            assertEquals(1, summary.challengesExpired());
            assertEquals(SessionKeyStatus.REVOKED, engine.load(started.sessionKeyId()).status());
        }
    }

    @Nested
    @DisplayName("settlement")
    class SettlementTests {

        @Test
        @DisplayName("should finish a renewal whose confirmation never reached the session key")
        void shouldFinishConfirmedRenewal() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            var started = (RenewalResult.Started) engine.coordinator
                    .beginRenewal(session.sessionKeyId())
                    .await()
                    .indefinitely();
            engine.sessionKeys.staleWrites = engine.config.revocationAttempts;
            engine.coordinator
                    .completeChallenge(started.challengeId(), ChallengeOutcome.confirmed(null))
                    .await()
                    .indefinitely();
            assertEquals(SessionKeyStatus.RENEWING, engine.load(session.sessionKeyId()).status());

            var summary = runPass();

            assertEquals(1, summary.sessionsSettled());
            assertEquals(0, summary.failures());
            var renewed = engine.load(session.sessionKeyId());
            assertEquals(SessionKeyStatus.ACTIVE, renewed.status());
            assertEquals(session.expiresAt().plus(Duration.ofDays(7)), renewed.expiresAt());
            assertEquals(RenewalPassSummary.empty(), runPass());
        }

        @Test
        @DisplayName("should revoke a pending session key whose challenge is gone once the TTL has passed")
        void shouldRevokeOrphanedPendingSessionKey() {
            var orphan = SessionKey.pending(
                    "sk-orphan",
                    "ch-orphan",
                    "wallet-1",
                    "user-1",
                    SessionKeyEngine.TIPPING,
                    new SessionPermissions(Set.of("transfer"), 100_00, 0, null, true, 3, 0),
                    Duration.ofDays(7),
                    engine.clock.instant());
            engine.sessionKeys.insertIfAbsent(orphan).await().indefinitely();

            engine.clock.advance(Duration.ofMinutes(5));
            assertEquals(0, runPass().sessionsSettled());
            assertEquals(SessionKeyStatus.PENDING, engine.load("sk-orphan").status());

            engine.clock.advance(engine.config.challengeTtl);
            assertEquals(1, runPass().sessionsSettled());

            var revoked = engine.load("sk-orphan");
            assertEquals(SessionKeyStatus.REVOKED, revoked.status());
            assertEquals(RevocationService.REASON_CHALLENGE_FAILED, revoked.statusReason());
        }

        @Test
        @DisplayName("should leave session keys with a challenge in flight alone")
        void shouldLeaveAwaitingSessionKeys() {
            var started = (CreationResult.Started) engine.coordinator
                    .beginCreate("wallet-1", "user-1", SessionKeyEngine.TIPPING, null)
                    .await()
                    .indefinitely();

            assertEquals(RenewalPassSummary.empty(), runPass());
            assertEquals(SessionKeyStatus.PENDING, engine.load(started.sessionKeyId()).status());
        }
    }

    @Nested
    @DisplayName("scheduledPass")
    class ScheduledPassTests {

        @Test
        @DisplayName("should swallow storage failures so the next pass runs")
        void shouldRecoverFromFailures() {
            var repository = mock(SessionKeyRepository.class);
            when(repository.findByStatus(any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("store offline")));
            var scheduler = new RenewalScheduler(
                    repository, engine.coordinator, engine.revocation, engine.metrics, enabled(true), engine.clock);

            assertDoesNotThrow(() -> scheduler.scheduledPass().await().indefinitely());
            verify(engine.metrics, never()).recordRenewalPass(any());
        }

        @Test
        @DisplayName("should do nothing when disabled")
        void shouldDoNothingWhenDisabled() {
            var repository = mock(SessionKeyRepository.class);
            var scheduler = new RenewalScheduler(
                    repository, engine.coordinator, engine.revocation, engine.metrics, enabled(false), engine.clock);

            scheduler.scheduledPass().await().indefinitely();

            verify(repository, never()).findByStatus(any());
        }

        private RenewalConfig enabled(boolean enabled) {
            return new RenewalConfig() {
                @Override
                public boolean enabled() {
                    return enabled;
                }

                @Override
                public String interval() {
                    return "1m";
                }

                @Override
                public double lookAheadFraction() {
                    return 0.1;
                }

                @Override
                public Duration lookAheadFloor() {
                    return Duration.ofHours(1);
                }
            };
        }
    }
}
