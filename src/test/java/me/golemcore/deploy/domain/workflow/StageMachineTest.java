package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.ComplianceState;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.DryRunResult;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.domain.model.StepKind;
import me.golemcore.deploy.domain.service.AuditSink;
import me.golemcore.deploy.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.ArgumentMatchers.any;

class StageMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AuditSink auditSink;
    private StageMachine stageMachine;
    private DeploymentSession session;

    @BeforeEach
    void setUp() {
        auditSink = mock(AuditSink.class);
        stageMachine = new StageMachine(auditSink, new MutableClock(NOW));
        session = new DeploymentSession("s1", "alice", Instant.EPOCH, 50);
    }

    @Test
    void shouldMoveAlongLegalEdgeAndEmitTransition() {
        Stage stage = stageMachine.apply(session, Transition.REQUIREMENTS_COMPLETE, "instance in us-east-1");

        assertEquals(Stage.CONTEXT_SYNC, stage);
        assertEquals(Stage.CONTEXT_SYNC, session.getStage());
        assertEquals(NOW, session.getUpdatedAt());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).emit(captor.capture());
        AuditEvent event = captor.getValue();
        assertEquals(AuditEvent.Kind.STAGE_TRANSITION, event.kind());
        assertEquals(Stage.CONTEXT_SYNC, event.stage());
        assertEquals(AuditStatus.SUCCESS, event.status());
        assertEquals("INTAKE -> CONTEXT_SYNC: instance in us-east-1", event.detail());
    }

    @Test
    void shouldRejectSkippingComplianceReview() {
        session.setStage(Stage.PLAN_DRAFT);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> stageMachine.apply(session, Transition.COMPLIANCE_APPROVED, null));

        assertTrue(error.getMessage().contains("COMPLIANCE_APPROVED"));
        assertEquals(Stage.PLAN_DRAFT, session.getStage());
        verify(auditSink, never()).emit(any());
    }

    @Test
    void shouldMarkFailureEventsWhenEnteringFailed() {
        session.setStage(Stage.PREFLIGHT);

        stageMachine.apply(session, Transition.PREFLIGHT_FAILED, "bad region", ErrorCode.VALIDATION_ERROR);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).emit(captor.capture());
        assertEquals(AuditStatus.FAILURE, captor.getValue().status());
        assertEquals(ErrorCode.VALIDATION_ERROR, captor.getValue().errorCode());
    }

    // ===== Execution guard =====

    @Test
    void shouldRefuseExecutionWithoutPassedDryRun() {
        session.setStage(Stage.DRY_RUN);
        session.setActivePlan(plan(false, ComplianceState.APPROVED, null));

        assertThrows(IllegalStateException.class,
                () -> stageMachine.apply(session, Transition.DRY_RUN_PASSED, null));
    }

    @Test
    void shouldRefuseExecutionOfUnconfirmedDestructivePlan() {
        session.setStage(Stage.DRY_RUN);
        session.setActivePlan(plan(true, ComplianceState.APPROVED, passedDryRun(1)));

        assertThrows(IllegalStateException.class,
                () -> stageMachine.apply(session, Transition.DRY_RUN_PASSED, null));

        session.getActivePlan().setConfirmed(true);
        assertEquals(Stage.EXECUTION, stageMachine.apply(session, Transition.DRY_RUN_PASSED, null));
    }

    @Test
    void shouldRefuseExecutionWhenDryRunBelongsToOlderRevision() {
        session.setStage(Stage.DRY_RUN);
        Plan plan = plan(false, ComplianceState.APPROVED, passedDryRun(1));
        plan.setRevision(2);
        session.setActivePlan(plan);

        assertThrows(IllegalStateException.class,
                () -> stageMachine.apply(session, Transition.DRY_RUN_PASSED, null));
    }

    // ===== Transition table =====

    @ParameterizedTest
    @EnumSource(value = Stage.class, names = { "VALIDATION", "CLOSURE", "FAILED", "ROLLBACK" })
    void shouldNotCancelOnceChangesAreApplied(Stage stage) {
        assertFalse(Transition.CANCELLED.allowedFrom(stage));
    }

    @ParameterizedTest
    @EnumSource(value = Stage.class, names = { "CLOSURE", "FAILED" })
    void shouldAcceptNewIntentOnlyFromTerminalStages(Stage stage) {
        assertTrue(Transition.NEW_INTENT.allowedFrom(stage));
    }

    @Test
    void shouldReachExecutionOnlyFromDryRun() {
        List<Transition> intoExecution = new ArrayList<>();
        for (Transition transition : Transition.values()) {
            if (transition.getTarget() == Stage.EXECUTION) {
                intoExecution.add(transition);
            }
        }
        assertEquals(List.of(Transition.DRY_RUN_PASSED), intoExecution);
        for (Stage stage : Stage.values()) {
            assertEquals(stage == Stage.DRY_RUN, Transition.DRY_RUN_PASSED.allowedFrom(stage), stage.name());
        }
    }

    private static Plan plan(boolean destructive, ComplianceState compliance, DryRunResult dryRun) {
        PlanStep step = PlanStep.builder()
                .id("scale")
                .kind(StepKind.DEPLOY)
                .action("update_service")
                .destructive(destructive)
                .build();
        return Plan.builder()
                .id("p1")
                .steps(new ArrayList<>(List.of(step)))
                .complianceState(compliance)
                .dryRun(dryRun)
                .build();
    }

    private static DryRunResult passedDryRun(int revision) {
        return DryRunResult.builder().revision(revision).success(true).build();
    }
}
