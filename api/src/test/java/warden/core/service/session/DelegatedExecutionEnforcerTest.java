package warden.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.session.AuthorizationDecision;
import warden.core.model.session.CreationResult;
import warden.core.model.session.ExecutionOutcome;
import warden.core.model.session.ExecutionRecord;
import warden.core.model.session.ExecutionStep;
import warden.core.model.session.ReversalResult;
import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyError;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.SessionOverrides;
import warden.core.model.session.SessionPermissions;
import warden.core.model.session.UpdateOutcome;
import warden.core.port.out.ExecutionRecordRepository;
import warden.core.port.out.SessionKeyRepository;

@DisplayName("DelegatedExecutionEnforcer")
class DelegatedExecutionEnforcerTest {

    private SessionKeyEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SessionKeyEngine();
    }

    private AuthorizationDecision authorize(String sessionKeyId, String action, long amount) {
        return engine.enforcer.authorize(sessionKeyId, action, amount).await().indefinitely();
    }

    private SessionKeyError rejection(AuthorizationDecision decision) {
        return assertInstanceOf(AuthorizationDecision.Rejected.class, decision).reason();
    }

    @Nested
    @DisplayName("scenario")
    class ScenarioTests {

        @Test
        @DisplayName("should admit, cap, filter actions and stop after revocation")
        void shouldEnforceLifecycleScenario() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            assertEquals(Duration.ofDays(7), session.duration());

            var first = assertInstanceOf(AuthorizationDecision.Admitted.class, authorize(session.sessionKeyId(), "transfer", 40_00));
            assertEquals(40_00, first.spendingUsed());

            var over = assertInstanceOf(
                    AuthorizationDecision.Rejected.class, authorize(session.sessionKeyId(), "transfer", 70_00));
            assertEquals(SessionKeyError.SPENDING_LIMIT_EXCEEDED, over.reason());
            assertEquals(60_00L, over.headroom());

            assertEquals(
                    SessionKeyError.ACTION_NOT_PERMITTED, rejection(authorize(session.sessionKeyId(), "bridge", 10_00)));

            engine.revocation.revoke(session.sessionKeyId(), null).await().indefinitely();

            assertEquals(SessionKeyError.INACTIVE, rejection(authorize(session.sessionKeyId(), "transfer", 1_00)));
            assertEquals(40_00, engine.load(session.sessionKeyId()).permissions().spendingUsed());
        }
    }

    @Nested
    @DisplayName("check order")
    class CheckOrderTests {

        @Test
        @DisplayName("should reject negative amounts before looking up the session key")
        void shouldRejectNegativeAmount() {
            assertEquals(SessionKeyError.INVALID_AMOUNT, rejection(authorize("missing", "transfer", -1)));
        }

        @Test
        @DisplayName("should reject unknown session keys")
        void shouldRejectUnknownSessionKey() {
            assertEquals(SessionKeyError.NOT_FOUND, rejection(authorize("missing", "transfer", 1)));
        }

        @Test
        @DisplayName("should reject pending session keys")
        void shouldRejectPendingSessionKey() {
            var started = (CreationResult.Started) engine.coordinator
                    .beginCreate("wallet-1", "user-1", SessionKeyEngine.TIPPING, null)
                    .await()
                    .indefinitely();

            assertEquals(
                    SessionKeyError.NOT_YET_ACTIVE, rejection(authorize(started.sessionKeyId(), "transfer", 1)));
        }

        @Test
        @DisplayName("should report the action before the amount")
        void shouldCheckActionBeforeAmount() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            assertEquals(
                    SessionKeyError.ACTION_NOT_PERMITTED,
                    rejection(authorize(session.sessionKeyId(), "swap", 1_000_000)));
        }

        @Test
        @DisplayName("should match actions case-insensitively")
        void shouldNormalizeAction() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            assertTrue(authorize(session.sessionKeyId(), " Transfer ", 1).isAdmitted());
        }

        @Test
        @DisplayName("should enforce the per-transaction cap before the budget")
        void shouldEnforcePerTransactionCap() {
            var session = engine.activeSession(
                    "wallet-1", SessionKeyEngine.TIPPING, new SessionOverrides(null, null, null, 10_00L, null, null));

            assertEquals(
                    SessionKeyError.PER_TRANSACTION_LIMIT_EXCEEDED,
                    rejection(authorize(session.sessionKeyId(), "transfer", 10_01)));
            assertTrue(authorize(session.sessionKeyId(), "transfer", 10_00).isAdmitted());
        }

        @Test
        @DisplayName("should admit a zero amount")
        void shouldAdmitZeroAmount() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            var admitted = assertInstanceOf(
                    AuthorizationDecision.Admitted.class, authorize(session.sessionKeyId(), "transfer", 0));
            assertEquals(0, admitted.spendingUsed());
        }

        @Test
        @DisplayName("should admit an amount that exactly exhausts the budget")
        void shouldAdmitExactRemainder() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            var admitted = assertInstanceOf(
                    AuthorizationDecision.Admitted.class, authorize(session.sessionKeyId(), "transfer", 100_00));
            assertEquals(0, admitted.headroom());
            assertEquals(
                    SessionKeyError.SPENDING_LIMIT_EXCEEDED, rejection(authorize(session.sessionKeyId(), "transfer", 1)));
        }

        @Test
        @DisplayName("should not overflow on very large amounts")
        void shouldRejectHugeAmount() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorize(session.sessionKeyId(), "transfer", 1_00);

            assertEquals(
                    SessionKeyError.SPENDING_LIMIT_EXCEEDED,
                    rejection(authorize(session.sessionKeyId(), "transfer", Long.MAX_VALUE)));
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should expire a session key on the next authorization without the scheduler")
        void shouldExpireLazily() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.clock.advance(Duration.ofDays(7));

            assertEquals(SessionKeyError.EXPIRED, rejection(authorize(session.sessionKeyId(), "transfer", 1)));

            var stored = engine.load(session.sessionKeyId());
            assertEquals(SessionKeyStatus.EXPIRED, stored.status());
            assertEquals(RevocationService.REASON_EXPIRED, stored.statusReason());
            assertEquals(SessionKeyError.INACTIVE, rejection(authorize(session.sessionKeyId(), "transfer", 1)));
        }

        @Test
        @DisplayName("should admit up to the instant before expiry")
        void shouldAdmitBeforeExpiry() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.clock.set(session.expiresAt().minusMillis(1));

            assertTrue(authorize(session.sessionKeyId(), "transfer", 1).isAdmitted());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should admit exactly the amounts that fit when racing")
        void shouldNeverExceedLimitUnderConcurrency() throws Exception {
            var config = new TestSessionKeyConfig();
            config.enforcementAttempts = 1_000;
            engine = new SessionKeyEngine(config);
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            int callers = 32;
            long amount = 7_00; // 32 * 7.00 = 224.00 > 100.00
            ExecutorService executor = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            List<Future<AuthorizationDecision>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < callers; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return authorize(session.sessionKeyId(), "transfer", amount);
                    }));
                }
                start.countDown();

                int admitted = 0;
                for (var future : futures) {
                    var decision = future.get(30, TimeUnit.SECONDS);
                    if (decision.isAdmitted()) {
                        admitted++;
                    } else {
                        assertEquals(SessionKeyError.SPENDING_LIMIT_EXCEEDED, rejection(decision));
                    }
                }

                assertEquals(14, admitted);
                assertEquals(14 * amount, engine.load(session.sessionKeyId()).permissions().spendingUsed());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should report contention after exhausting attempts")
        void shouldReportContention() {
            var config = new TestSessionKeyConfig();
            var repository = mock(SessionKeyRepository.class);
            var session = SessionKey.pending(
                            "sk-1",
                            "ch-1",
                            "wallet-1",
                            "user-1",
                            "tipping",
                            new SessionPermissions(Set.of("transfer"), 100, 0, null, true, 3, 0),
                            Duration.ofDays(1),
                            SessionKeyEngine.START)
                    .activate("0xdelegate", SessionKeyEngine.START);
            when(repository.findById("sk-1")).thenReturn(Uni.createFrom().item(Optional.of(session)));
            when(repository.compareAndSet(any(), anyLong()))
                    .thenReturn(Uni.createFrom().item(UpdateOutcome.STALE));
            var ledger = mock(ExecutionRecordRepository.class);
            when(ledger.append(any())).thenReturn(Uni.createFrom().voidItem());
            var clock = new MutableClock(SessionKeyEngine.START);
            var revocation = new RevocationService(repository, engine.metrics, clock, config);
            var enforcer = new DelegatedExecutionEnforcer(
                    repository, ledger, revocation, new SessionKeyIdGenerator(), engine.metrics, clock, config);

            var decision = enforcer.authorize("sk-1", "transfer", 1).await().indefinitely();

            assertEquals(SessionKeyError.CONTENTION, rejection(decision));
            assertTrue(SessionKeyError.CONTENTION.retryable());
        }

        @Test
        @DisplayName("should report an unavailable store instead of failing")
        void shouldReportStoreUnavailable() {
            var repository = mock(SessionKeyRepository.class);
            when(repository.findById("sk-1"))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));
            var config = new TestSessionKeyConfig();
            var clock = new MutableClock(SessionKeyEngine.START);
            var enforcer = new DelegatedExecutionEnforcer(
                    repository,
                    mock(ExecutionRecordRepository.class),
                    new RevocationService(repository, engine.metrics, clock, config),
                    new SessionKeyIdGenerator(),
                    engine.metrics,
                    clock,
                    config);

            var decision = enforcer.authorize("sk-1", "transfer", 1).await().indefinitely();

            assertEquals(SessionKeyError.STORE_UNAVAILABLE, rejection(decision));
            verify(engine.metrics).recordAuthorization(eq(SessionKeyError.STORE_UNAVAILABLE), eq(1L));
        }
    }

    @Nested
    @DisplayName("authorizeAll")
    class AuthorizeAllTests {

        private AuthorizationDecision authorizeAll(String sessionKeyId, ExecutionStep... steps) {
            return engine.enforcer.authorizeAll(sessionKeyId, List.of(steps)).await().indefinitely();
        }

        @Test
        @DisplayName("should reserve the combined amount in one write")
        void shouldReserveCombinedAmount() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorize(session.sessionKeyId(), "transfer", 10_00);

            var admitted = assertInstanceOf(
                    AuthorizationDecision.Admitted.class,
                    authorizeAll(
                            session.sessionKeyId(),
                            new ExecutionStep("Transfer", 30_00),
                            new ExecutionStep("transfer", 20_00)));

            assertEquals(60_00, admitted.spendingUsed());
            assertEquals(40_00, admitted.headroom());
            var stored = engine.load(session.sessionKeyId());
            assertEquals(60_00, stored.permissions().spendingUsed());
            assertEquals(session.version() + 2, stored.version());
        }

        @Test
        @DisplayName("should reject all steps when only the total exceeds the budget")
        void shouldRejectTotalOverBudget() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            var rejected = assertInstanceOf(
                    AuthorizationDecision.Rejected.class,
                    authorizeAll(
                            session.sessionKeyId(),
                            new ExecutionStep("transfer", 60_00),
                            new ExecutionStep("transfer", 50_00)));

            assertEquals(SessionKeyError.SPENDING_LIMIT_EXCEEDED, rejected.reason());
            assertEquals(100_00L, rejected.headroom());
            assertNull(rejected.step());
            assertEquals(0, engine.load(session.sessionKeyId()).permissions().spendingUsed());
        }

        @Test
        @DisplayName("should name the first step that fails its own checks")
        void shouldReportFailingStep() {
            var session = engine.activeSession(
                    "wallet-1", SessionKeyEngine.TIPPING, new SessionOverrides(null, null, null, 20_00L, null, null));

            var notPermitted = assertInstanceOf(
                    AuthorizationDecision.Rejected.class,
                    authorizeAll(
                            session.sessionKeyId(),
                            new ExecutionStep("transfer", 1_00),
                            new ExecutionStep("bridge", 1_00),
                            new ExecutionStep("transfer", 30_00)));
            var overCap = assertInstanceOf(
                    AuthorizationDecision.Rejected.class,
                    authorizeAll(
                            session.sessionKeyId(),
                            new ExecutionStep("transfer", 1_00),
                            new ExecutionStep("transfer", 30_00)));

            assertEquals(SessionKeyError.ACTION_NOT_PERMITTED, notPermitted.reason());
            assertEquals(1, notPermitted.step());
            assertEquals(SessionKeyError.PER_TRANSACTION_LIMIT_EXCEEDED, overCap.reason());
            assertEquals(1, overCap.step());
            assertEquals(0, engine.load(session.sessionKeyId()).permissions().spendingUsed());
        }

        @Test
        @DisplayName("should reject empty operations and negative amounts before the lookup")
        void shouldRejectInvalidSteps() {
            var empty = engine.enforcer.authorizeAll("missing", List.of()).await().indefinitely();
            var negative = assertInstanceOf(
                    AuthorizationDecision.Rejected.class,
                    authorizeAll("missing", new ExecutionStep("transfer", 1), new ExecutionStep("transfer", -1)));

            assertEquals(SessionKeyError.INVALID_AMOUNT, rejection(empty));
            assertEquals(SessionKeyError.INVALID_AMOUNT, negative.reason());
            assertEquals(1, negative.step());
        }

        @Test
        @DisplayName("should reject amounts whose sum overflows")
        void shouldRejectOverflowingTotal() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            var decision = authorizeAll(
                    session.sessionKeyId(),
                    new ExecutionStep("transfer", Long.MAX_VALUE),
                    new ExecutionStep("transfer", 1));

            assertEquals(SessionKeyError.SPENDING_LIMIT_EXCEEDED, rejection(decision));
        }

        @Test
        @DisplayName("should apply the session checks before the step checks")
        void shouldCheckSessionFirst() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            engine.revocation.revoke(session.sessionKeyId(), null).await().indefinitely();

            var rejected = assertInstanceOf(
                    AuthorizationDecision.Rejected.class,
                    authorizeAll(session.sessionKeyId(), new ExecutionStep("bridge", 1_00)));

            assertEquals(SessionKeyError.INACTIVE, rejected.reason());
            assertNull(rejected.step());
            assertEquals(SessionKeyError.NOT_FOUND, rejection(authorizeAll("missing", new ExecutionStep("transfer", 1))));
        }

        @Test
        @DisplayName("should retry lost races and report contention once attempts run out")
        void shouldRetryLostRaces() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            engine.sessionKeys.staleWrites = engine.config.enforcementAttempts - 1;
            assertTrue(authorizeAll(session.sessionKeyId(), new ExecutionStep("transfer", 5_00)).isAdmitted());

            engine.sessionKeys.staleWrites = engine.config.enforcementAttempts;
            assertEquals(
                    SessionKeyError.CONTENTION,
                    rejection(authorizeAll(session.sessionKeyId(), new ExecutionStep("transfer", 5_00))));
            assertEquals(5_00, engine.load(session.sessionKeyId()).permissions().spendingUsed());
        }

        @Test
        @DisplayName("should record one ledger entry per step")
        void shouldRecordEachStep() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorizeAll(session.sessionKeyId(), new ExecutionStep("transfer", 10_00), new ExecutionStep("transfer", 5_00));
            authorizeAll(session.sessionKeyId(), new ExecutionStep("transfer", 80_00), new ExecutionStep("transfer", 10_00));

            var entries = engine.ledger.findBySessionKey(session.sessionKeyId()).await().indefinitely();

            assertEquals(4, entries.size());
            assertEquals(
                    List.of(
                            ExecutionOutcome.ADMITTED,
                            ExecutionOutcome.ADMITTED,
                            ExecutionOutcome.REJECTED,
                            ExecutionOutcome.REJECTED),
                    entries.stream().map(ExecutionRecord::outcome).toList());
            assertEquals(15_00, entries.stream().mapToLong(ExecutionRecord::spendingDelta).sum());
        }
    }

    @Nested
    @DisplayName("ledger")
    class LedgerTests {

        @Test
        @DisplayName("should record admissions and rejections")
        void shouldRecordDecisions() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorize(session.sessionKeyId(), "transfer", 10_00);
            authorize(session.sessionKeyId(), "bridge", 5_00);

            var entries = engine.ledger.findBySessionKey(session.sessionKeyId()).await().indefinitely();

            assertEquals(2, entries.size());
            assertEquals(ExecutionOutcome.ADMITTED, entries.get(0).outcome());
            assertNull(entries.get(0).reason());
            assertEquals(ExecutionOutcome.REJECTED, entries.get(1).outcome());
            assertEquals(SessionKeyError.ACTION_NOT_PERMITTED.name(), entries.get(1).reason());
        }

        @Test
        @DisplayName("should admit even when the ledger append fails")
        void shouldAdmitWhenLedgerFails() {
            var ledger = mock(ExecutionRecordRepository.class);
            when(ledger.append(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("ledger down")));
            var enforcer = new DelegatedExecutionEnforcer(
                    engine.sessionKeys,
                    ledger,
                    engine.revocation,
                    engine.idGenerator,
                    engine.metrics,
                    engine.clock,
                    engine.config);
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);

            var decision = enforcer.authorize(session.sessionKeyId(), "transfer", 5_00).await().indefinitely();

            assertTrue(decision.isAdmitted());
            assertEquals(5_00, engine.load(session.sessionKeyId()).permissions().spendingUsed());
        }
    }

    @Nested
    @DisplayName("reverse")
    class ReverseTests {

        @Test
        @DisplayName("should release a reserved amount")
        void shouldReleaseAmount() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorize(session.sessionKeyId(), "transfer", 30_00);

            var result = engine.enforcer.reverse(session.sessionKeyId(), 10_00).await().indefinitely();

            var reversed = assertInstanceOf(ReversalResult.Reversed.class, result);
            assertEquals(20_00, reversed.spendingUsed());
            assertEquals(false, reversed.clamped());
            assertTrue(authorize(session.sessionKeyId(), "transfer", 80_00).isAdmitted());
        }

        @Test
        @DisplayName("should clamp at zero and record the released amount")
        void shouldClampAtZero() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorize(session.sessionKeyId(), "transfer", 5_00);

            var reversed = assertInstanceOf(
                    ReversalResult.Reversed.class,
                    engine.enforcer.reverse(session.sessionKeyId(), 9_00).await().indefinitely());

            assertEquals(0, reversed.spendingUsed());
            assertTrue(reversed.clamped());
            var entries = engine.ledger.findBySessionKey(session.sessionKeyId()).await().indefinitely();
            var last = entries.get(entries.size() - 1);
            assertEquals(ExecutionOutcome.REVERSED, last.outcome());
            assertEquals(5_00, last.amount());
            verify(engine.metrics).recordReversal(true);
        }

        @Test
        @DisplayName("should keep the ledger consistent with the counter")
        void shouldReconcile() {
            var session = engine.activeSession("wallet-1", SessionKeyEngine.TIPPING, null);
            authorize(session.sessionKeyId(), "transfer", 30_00);
            authorize(session.sessionKeyId(), "transfer", 90_00);
            engine.enforcer.reverse(session.sessionKeyId(), 40_00).await().indefinitely();

            var summary = engine.audit.spending(session.sessionKeyId()).await().indefinitely().orElseThrow();

            assertTrue(summary.consistent());
            assertEquals(0, summary.ledgerSpend());
            assertEquals(1, summary.admitted());
            assertEquals(1, summary.rejected());
            assertEquals(1, summary.reversed());
        }

        @Test
        @DisplayName("should refuse negative amounts and unknown session keys")
        void shouldRefuseInvalidReversals() {
            assertEquals(
                    new ReversalResult.Refused(SessionKeyError.INVALID_AMOUNT),
                    engine.enforcer.reverse("missing", -1).await().indefinitely());
            assertEquals(
                    new ReversalResult.Refused(SessionKeyError.NOT_FOUND),
                    engine.enforcer.reverse("missing", 1).await().indefinitely());
        }
    }
}
