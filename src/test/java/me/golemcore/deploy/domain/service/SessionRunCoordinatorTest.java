package me.golemcore.deploy.domain.service;

import me.golemcore.deploy.domain.model.AgentResponse;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.SessionSnapshot;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.domain.workflow.IntentExtractor;
import me.golemcore.deploy.domain.workflow.WorkflowEngine;
import me.golemcore.deploy.infrastructure.config.AutoConfiguration;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.AuditStorePort;
import me.golemcore.deploy.port.outbound.StoragePort;
import me.golemcore.deploy.ratelimit.TokenBucketRateLimiter;
import me.golemcore.deploy.security.InputSanitizer;
import me.golemcore.deploy.security.SecretRedactor;
import me.golemcore.deploy.testsupport.InMemorySecretStore;
import me.golemcore.deploy.testsupport.MutableClock;
import me.golemcore.deploy.testsupport.TestCredentialBrokers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRunCoordinatorTest {

    private ExecutorService executor;
    private MutableClock clock;
    private CredentialBroker credentialBroker;
    private AuditSink auditSink;
    private TokenBucketRateLimiter rateLimiter;
    private EscalationService escalationService;
    private SessionManager sessionManager;
    private WorkflowEngine workflowEngine;
    private SessionRunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        DeployProperties properties = new DeployProperties();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        credentialBroker = TestCredentialBrokers.create(properties, new InMemorySecretStore(), clock);
        auditSink = new AuditSink(mock(AuditStorePort.class), properties, clock);
        rateLimiter = new TokenBucketRateLimiter(properties);
        StoragePort storage = mock(StoragePort.class);
        when(storage.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        escalationService = new EscalationService(storage, auditSink, new SecretRedactor(),
                AutoConfiguration.objectMapper(), clock);
        sessionManager = new SessionManager(credentialBroker, new InputSanitizer(), new SecretRedactor(),
                properties, clock);
        workflowEngine = mock(WorkflowEngine.class);
        coordinator = new SessionRunCoordinator(sessionManager, workflowEngine, new IntentExtractor(), executor,
                List.of(credentialBroker, auditSink, rateLimiter, escalationService));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunTurnsOfOneSessionSequentiallyInArrivalOrder() throws Exception {
        List<String> handled = new CopyOnWriteArrayList<>();
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        when(workflowEngine.handle(any(DeploymentSession.class), anyString())).thenAnswer(invocation -> {
            int now = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            handled.add(invocation.getArgument(1));
            concurrent.decrementAndGet();
            return response(invocation.getArgument(0));
        });

        CompletableFuture<AgentResponse> first = coordinator.submit("s1", "alice", "one");
        CompletableFuture<AgentResponse> second = coordinator.submit("s1", "alice", "two");
        CompletableFuture<AgentResponse> third = coordinator.submit("s1", "alice", "three");
        CompletableFuture.allOf(first, second, third).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("one", "two", "three"), handled);
        assertEquals(1, maxConcurrent.get());
        assertEquals("s1", third.get().getSessionId());
    }

    @Test
    void shouldRunDifferentSessionsInParallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        when(workflowEngine.handle(any(DeploymentSession.class), anyString())).thenAnswer(invocation -> {
            bothStarted.countDown();
            assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
            return response(invocation.getArgument(0));
        });

        CompletableFuture<AgentResponse> a = coordinator.submit("a", "alice", "hello");
        CompletableFuture<AgentResponse> b = coordinator.submit("b", "bob", "hello");

        assertEquals("a", a.get(5, TimeUnit.SECONDS).getSessionId());
        assertEquals("b", b.get(5, TimeUnit.SECONDS).getSessionId());
    }

    @Test
    void shouldFlagRunningTurnWhenCancelArrives() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(workflowEngine.handle(any(DeploymentSession.class), anyString())).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return response(invocation.getArgument(0));
        });

        coordinator.submit("s1", "alice", "deploy an ec2 instance");
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isRunning("s1"));

        coordinator.submit("s1", "alice", "cancel");
        DeploymentSession session = sessionManager.get("s1").orElseThrow();
        assertTrue(session.isCancelRequested());

        release.countDown();
        verify(workflowEngine, timeout(5000)).handle(session, "cancel");
    }

    @Test
    void shouldQueueExplicitCancel() throws Exception {
        coordinator.submit("s1", "alice", "hello").get(5, TimeUnit.SECONDS);
        when(workflowEngine.cancel(any(DeploymentSession.class))).thenAnswer(
                invocation -> response(invocation.getArgument(0)));

        coordinator.cancel("s1").get(5, TimeUnit.SECONDS);

        DeploymentSession session = sessionManager.get("s1").orElseThrow();
        assertTrue(session.isCancelRequested());
        verify(workflowEngine).cancel(session);
    }

    @Test
    void shouldRejectCancelForUnknownSession() {
        assertThrows(DeploymentException.class, () -> coordinator.cancel("missing"));
    }

    @Test
    void shouldPropagateEngineFailureAndKeepDraining() throws Exception {
        when(workflowEngine.handle(any(DeploymentSession.class), anyString()))
                .thenThrow(new IllegalStateException("boom"))
                .thenAnswer(invocation -> response(invocation.getArgument(0)));

        CompletableFuture<AgentResponse> failing = coordinator.submit("s1", "alice", "one");
        CompletableFuture<AgentResponse> next = coordinator.submit("s1", "alice", "two");

        ExecutionException error = assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertNotNull(next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldCheckOnlySessionsAwaitingConfirmation() throws Exception {
        DeploymentSession waiting = sessionManager.open("waiting", "alice");
        waiting.setConfirmationDeadline(Instant.parse("2026-03-01T10:10:00Z"));
        sessionManager.open("idle", "alice");
        CountDownLatch checked = new CountDownLatch(1);
        doAnswer(invocation -> {
            checked.countDown();
            return true;
        }).when(workflowEngine).expireConfirmation(waiting);

        assertEquals(1, coordinator.expireConfirmations());
        assertTrue(checked.await(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldDescribeSessionWithReadiness() throws Exception {
        coordinator.submit("s1", "alice", "hello").get(5, TimeUnit.SECONDS);

        SessionSnapshot snapshot = coordinator.describe("s1").orElseThrow();

        assertEquals("s1", snapshot.sessionId());
        assertEquals(Stage.INTAKE, snapshot.stage());
        assertTrue(coordinator.describe("missing").isEmpty());
    }

    // ===== Close =====

    @Test
    void shouldCloseSessionAndReleaseSessionScopedState() throws Exception {
        coordinator.submit("s1", "alice", "hello").get(5, TimeUnit.SECONDS);
        DeploymentSession session = sessionManager.get("s1").orElseThrow();
        auditSink.emit(AuditEvent.builder().sessionId("s1").kind(AuditEvent.Kind.STAGE_TRANSITION)
                .status(AuditStatus.SUCCESS).build());
        escalationService.raise(session, ErrorCode.ROLLBACK_FAILURE, "manual cleanup", "Terminate it manually");
        rateLimiter.tryConsumePlanning("s1");
        assertEquals(Optional.of("alice"), credentialBroker.boundPrincipal("s1"));
        long lastSequence = auditSink.events("s1").get(auditSink.events("s1").size() - 1).sequence();

        assertTrue(coordinator.close("s1"));

        assertTrue(sessionManager.get("s1").isEmpty());
        assertFalse(coordinator.isRunning("s1"));
        assertTrue(credentialBroker.boundPrincipal("s1").isEmpty());
        assertTrue(auditSink.events("s1").isEmpty());
        assertTrue(escalationService.list("s1").isEmpty());
        assertTrue(rateLimiter.getBucketStates().stream().noneMatch(state -> state.getKey().endsWith(":s1")));

        AuditEvent afterReopen = auditSink.emit(AuditEvent.builder().sessionId("s1")
                .kind(AuditEvent.Kind.STAGE_TRANSITION).status(AuditStatus.SUCCESS).build());
        assertEquals(lastSequence + 1, afterReopen.sequence());
    }

    @Test
    void shouldRefuseToCloseRunningSession() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(workflowEngine.handle(any(DeploymentSession.class), anyString())).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return response(invocation.getArgument(0));
        });
        CompletableFuture<AgentResponse> turn = coordinator.submit("s1", "alice", "deploy an ec2 instance");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertThrows(IllegalStateException.class, () -> coordinator.close("s1"));

        release.countDown();
        turn.get(5, TimeUnit.SECONDS);
        assertTrue(sessionManager.get("s1").isPresent());
        assertEquals(Optional.of("alice"), credentialBroker.boundPrincipal("s1"));
    }

    @Test
    void shouldReportUnknownSessionOnClose() {
        assertFalse(coordinator.close("missing"));
    }

    @Test
    void shouldCloseOnlySessionsIdleBeyondTimeout() {
        sessionManager.open("stale", "alice");
        DeploymentSession waiting = sessionManager.open("waiting", "alice");
        waiting.setConfirmationDeadline(Instant.parse("2026-03-02T10:00:00Z"));
        clock.advance(Duration.ofHours(2));
        sessionManager.open("fresh", "bob");

        assertEquals(1, coordinator.closeIdleSessions(Duration.ofHours(1)));

        assertTrue(sessionManager.get("stale").isEmpty());
        assertTrue(sessionManager.get("waiting").isPresent());
        assertTrue(sessionManager.get("fresh").isPresent());
    }

    private static AgentResponse response(DeploymentSession session) {
        return AgentResponse.builder().sessionId(session.getId()).stage(session.getStage()).build();
    }
}
