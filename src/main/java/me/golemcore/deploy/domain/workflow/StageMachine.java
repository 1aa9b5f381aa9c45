package me.golemcore.deploy.domain.workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.domain.service.AuditSink;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Applies {@link Transition}s to a session. Every accepted move is written to
 * the audit sink as a stage transition event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StageMachine {

    private final AuditSink auditSink;
    private final Clock clock;

    public Stage apply(DeploymentSession session, Transition transition, String detail) {
        return apply(session, transition, detail, null);
    }

    /**
     * Move the session along {@code transition}.
     *
     * @throws IllegalStateException
     *             when the edge does not start at the session's current stage, or
     *             when Execution is entered without an approved, dry-run-passed
     *             and (where destructive) confirmed plan
     */
    public Stage apply(DeploymentSession session, Transition transition, String detail, ErrorCode errorCode) {
        Stage from = session.getStage();
        if (!transition.allowedFrom(from)) {
            throw new IllegalStateException("Illegal transition " + transition + " from " + from
                    + " in session " + session.getId());
        }
        if (transition == Transition.DRY_RUN_PASSED) {
            Plan plan = session.getActivePlan();
            if (plan == null || !plan.isReadyForExecution()) {
                throw new IllegalStateException("Plan is not ready for execution in session " + session.getId());
            }
        }
        Stage to = transition.getTarget();
        session.setStage(to);
        session.setUpdatedAt(clock.instant());

        auditSink.emit(AuditEvent.builder()
                .sessionId(session.getId())
                .kind(AuditEvent.Kind.STAGE_TRANSITION)
                .stage(to)
                .status(to == Stage.FAILED ? AuditStatus.FAILURE : AuditStatus.SUCCESS)
                .errorCode(errorCode)
                .correlationId(session.getActivePlan() != null ? session.getActivePlan().getId() : null)
                .detail(from + " -> " + to + (detail != null ? ": " + detail : ""))
                .build());
        log.info("[Workflow] Session {} {} -> {} ({})", session.getId(), from, to, transition);
        return to;
    }
}
