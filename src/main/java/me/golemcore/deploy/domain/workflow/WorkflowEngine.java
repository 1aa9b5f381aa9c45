package me.golemcore.deploy.domain.workflow;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.gateway.ToolGateway;
import me.golemcore.deploy.domain.model.AgentResponse;
import me.golemcore.deploy.domain.model.ComplianceState;
import me.golemcore.deploy.domain.model.ComplianceVerdict;
import me.golemcore.deploy.domain.model.ConversationTurn;
import me.golemcore.deploy.domain.model.DeploymentIntent;
import me.golemcore.deploy.domain.model.DeploymentRecord;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.DeploymentTarget;
import me.golemcore.deploy.domain.model.DryRunResult;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.InvocationContext;
import me.golemcore.deploy.domain.model.InvocationMode;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.domain.model.PlanStep.StepStatus;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.domain.model.ToolResult;
import me.golemcore.deploy.domain.service.ComplianceService;
import me.golemcore.deploy.domain.service.CredentialBroker;
import me.golemcore.deploy.domain.service.DeploymentRecordService;
import me.golemcore.deploy.domain.service.EscalationService;
import me.golemcore.deploy.domain.service.SessionManager;
import me.golemcore.deploy.domain.workflow.CompensationPlanner.Compensation;
import me.golemcore.deploy.domain.workflow.CompensationPlanner.CompensationPlan;
import me.golemcore.deploy.domain.workflow.IntentExtractor.Command;
import me.golemcore.deploy.domain.workflow.IntentExtractor.ParsedMessage;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Deployment state machine driver. One call to {@link #handle} processes one
 * user turn: it applies commands and intent updates, then runs stage handlers
 * until a stage has to wait for the user, an operator or the end of the
 * workflow.
 *
 * <p>
 * Flow: Intake → ContextSync → Preflight → PlanDraft → ComplianceReview →
 * DryRun → Execution → Validation → Closure, with Failed as the terminal
 * error stage and Rollback between a failed or cancelled Execution and
 * Failed. Every stage move goes through {@link StageMachine}, and every
 * external effect goes through {@link ToolGateway}.
 *
 * <p>
 * Callers must not run two turns of the same session concurrently; the
 * {@code SessionRunCoordinator} serialises them.
 */
@Service
@Slf4j
public class WorkflowEngine {

    private static final Set<ErrorCode> RETRYABLE = Set.of(ErrorCode.TIMEOUT, ErrorCode.TOOL_FAILURE,
            ErrorCode.RATE_LIMITED);
    private static final String CREDENTIALS_REMEDIATION = "Store AWS credentials with POST /api/credentials "
            + "(access_key_id, secret_access_key) and send the request again";

    private final StageMachine stageMachine;
    private final IntentExtractor intentExtractor;
    private final PlanComposer planComposer;
    private final CompensationPlanner compensationPlanner;
    private final HealthEvaluator healthEvaluator;
    private final ToolGateway toolGateway;
    private final CredentialBroker credentialBroker;
    private final ComplianceService complianceService;
    private final EscalationService escalationService;
    private final DeploymentRecordService deploymentRecordService;
    private final SessionManager sessionManager;
    private final DeployProperties properties;
    private final Clock clock;

    public WorkflowEngine(StageMachine stageMachine, IntentExtractor intentExtractor, PlanComposer planComposer,
            CompensationPlanner compensationPlanner, HealthEvaluator healthEvaluator, ToolGateway toolGateway,
            CredentialBroker credentialBroker, ComplianceService complianceService,
            EscalationService escalationService, DeploymentRecordService deploymentRecordService,
            SessionManager sessionManager, DeployProperties properties, Clock clock) {
        this.stageMachine = stageMachine;
        this.intentExtractor = intentExtractor;
        this.planComposer = planComposer;
        this.compensationPlanner = compensationPlanner;
        this.healthEvaluator = healthEvaluator;
        this.toolGateway = toolGateway;
        this.credentialBroker = credentialBroker;
        this.complianceService = complianceService;
        this.escalationService = escalationService;
        this.deploymentRecordService = deploymentRecordService;
        this.sessionManager = sessionManager;
        this.properties = properties;
        this.clock = clock;
    }

    public AgentResponse handle(DeploymentSession session, String message) {
        ConversationTurn userTurn = sessionManager.appendTurn(session, ConversationTurn.Role.USER, message);
        ParsedMessage parsed = intentExtractor.parse(userTurn.content());
        Turn turn = new Turn(session);

        if (parsed.command() == Command.CANCEL) {
            session.clearCancel();
            applyCancel(turn);
            return finish(turn);
        }
        if (session.isAwaitingConfirmation()) {
            handleConfirmationReply(turn, parsed.command());
            return finish(turn);
        }
        if (parsed.command() == Command.NEW_DEPLOYMENT) {
            if (!session.getStage().isTerminal() && session.getStage() != Stage.INTAKE) {
                turn.reply("A deployment is in progress at " + session.getStage()
                        + ". Cancel it before starting a new one.", ErrorCode.VALIDATION_ERROR,
                        "Send 'cancel' first");
                return finish(turn);
            }
            if (session.getStage().isTerminal()) {
                stageMachine.apply(session, Transition.NEW_INTENT, "new deployment requested");
            }
            session.resetForNewIntent();
        }

        if (session.getStage().isTerminal()) {
            if (!parsed.hasIntent()) {
                turn.reply(terminalReminder(session), null, null);
                return finish(turn);
            }
            boolean closed = session.getStage() == Stage.CLOSURE;
            stageMachine.apply(session, Transition.NEW_INTENT, closed ? "new deployment" : "retry with amendments");
            if (closed) {
                session.resetForNewIntent();
            } else {
                session.resetForRetry();
            }
        }

        if (session.getStage() == Stage.INTAKE || session.getStage() == Stage.PLAN_DRAFT) {
            if (session.getIntent().mergeFrom(parsed.intent())) {
                turn.trace(session.getStage(), "Updated deployment request", null, describeIntent(session));
            }
        }
        advance(turn);
        return finish(turn);
    }

    /**
     * Apply a cancellation requested while no turn was running.
     */
    public AgentResponse cancel(DeploymentSession session) {
        Turn turn = new Turn(session);
        if (!session.isCancelRequested()) {
            return AgentResponse.builder()
                    .sessionId(session.getId())
                    .finalAnswer("Cancellation was handled by the running turn; stage is " + session.getStage() + ".")
                    .stage(session.getStage())
                    .errorCode(session.getLastErrorCode())
                    .build();
        }
        session.clearCancel();
        applyCancel(turn);
        return finish(turn);
    }

    /**
     * Explicit operator escalation path: let the vetoed revision through and
     * continue the workflow from plan drafting.
     */
    public AgentResponse overrideCompliance(DeploymentSession session, String operator, String reason) {
        complianceService.override(session, operator, reason);
        Turn turn = new Turn(session);
        turn.trace(session.getStage(), "Operator " + operator + " overrode the compliance veto", null, reason);
        advance(turn);
        return finish(turn);
    }

    /**
     * Drop a pending destructive-step confirmation whose window has passed.
     *
     * @return true when the session was waiting and has now expired
     */
    public boolean expireConfirmation(DeploymentSession session) {
        Instant deadline = session.getConfirmationDeadline();
        if (deadline == null || !clock.instant().isAfter(deadline)) {
            return false;
        }
        session.setConfirmationDeadline(null);
        Plan plan = session.getActivePlan();
        if (plan != null) {
            plan.setDryRun(null);
            plan.setConfirmed(false);
        }
        stageMachine.apply(session, Transition.DRY_RUN_FAILED, "confirmation window expired",
                ErrorCode.CONFIRMATION_REQUIRED);
        recordError(session, ErrorCode.CONFIRMATION_REQUIRED, "Confirmation window expired",
                "Send any message to re-run the dry run and confirm within "
                        + properties.getSession().getConfirmationTimeout());
        log.info("[Workflow] Session {} confirmation expired", session.getId());
        return true;
    }

    private void advance(Turn turn) {
        DeploymentSession session = turn.session;
        int budget = Math.max(1, properties.getWorkflow().getMaxStagesPerTurn());
        for (int i = 0; i < budget; i++) {
            if (session.isCancelRequested() && isCancellable(session.getStage())) {
                session.clearCancel();
                applyCancel(turn);
                return;
            }
            StageOutcome outcome = switch (session.getStage()) {
            case INTAKE -> intake(turn);
            case CONTEXT_SYNC -> contextSync(turn);
            case PREFLIGHT -> preflight(turn);
            case PLAN_DRAFT -> planDraft(turn);
            case COMPLIANCE_REVIEW -> complianceReview(turn);
            case DRY_RUN -> dryRun(turn);
            case EXECUTION -> execution(turn);
            case VALIDATION -> validation(turn);
            case CLOSURE -> closure(turn);
            case ROLLBACK -> rollbackAndFail(turn, ErrorCode.TOOL_FAILURE, "Rollback resumed", null);
            case FAILED -> StageOutcome.WAIT;
            };
            if (outcome == StageOutcome.WAIT) {
                return;
            }
        }
        log.warn("[Workflow] Session {} reached the per-turn stage budget at {}", session.getId(),
                session.getStage());
    }

    private StageOutcome intake(Turn turn) {
        DeploymentSession session = turn.session;
        List<String> missing = session.getIntent().missingFields();
        if (!credentialBroker.hasCredentials(session.getId())) {
            String text = "I need AWS credentials for principal '" + session.getPrincipal()
                    + "' before I can plan this deployment.";
            if (!missing.isEmpty()) {
                text += " I will also need: " + String.join(", ", missing) + ".";
            }
            turn.trace(Stage.INTAKE, "Credential check", null, "no credentials stored");
            turn.reply(text, ErrorCode.CREDENTIALS_MISSING, CREDENTIALS_REMEDIATION);
            return StageOutcome.WAIT;
        }
        if (!missing.isEmpty()) {
            turn.reply("To plan this deployment I still need: " + String.join(", ", missing) + ".",
                    ErrorCode.VALIDATION_ERROR, "Reply with the missing values");
            return StageOutcome.WAIT;
        }
        turn.trace(Stage.INTAKE, "Requirements complete", null, describeIntent(session));
        stageMachine.apply(session, Transition.REQUIREMENTS_COMPLETE, describeIntent(session));
        return StageOutcome.CONTINUE;
    }

    private StageOutcome contextSync(Turn turn) {
        DeploymentSession session = turn.session;
        String summary = describeIntent(session) + "; " + session.getTurnCount() + " conversation turn(s) considered";
        session.setContextSummary(summary);
        turn.trace(Stage.CONTEXT_SYNC, "Summarised context", null, summary);
        stageMachine.apply(session, Transition.CONTEXT_SUMMARISED, null);
        return StageOutcome.CONTINUE;
    }

    private StageOutcome preflight(Turn turn) {
        DeploymentSession session = turn.session;
        List<String> problems = validateIntent(session.getIntent());
        if (!problems.isEmpty()) {
            return fail(turn, Transition.PREFLIGHT_FAILED, ErrorCode.VALIDATION_ERROR,
                    "Preflight checks failed: " + String.join("; ", problems) + ".",
                    "Correct the values above and send them again");
        }
        String buildCheck = properties.getWorkflow().getBuildCheckCommand();
        if (buildCheck != null && !buildCheck.isBlank()) {
            ToolResult result = toolGateway.invoke(context(session, Stage.PREFLIGHT, InvocationMode.LIVE),
                    "run_build_check", Map.of(), false);
            turn.trace(Stage.PREFLIGHT, "Build check", "run_build_check",
                    result.isSuccess() ? "passed" : result.getError());
            if (!result.isSuccess()) {
                return fail(turn, Transition.PREFLIGHT_FAILED, result.getErrorCode(),
                        "Build check failed: " + result.getError(), result.getRemediation());
            }
        }
        turn.trace(Stage.PREFLIGHT, "Preflight checks passed", null, null);
        stageMachine.apply(session, Transition.PREFLIGHT_PASSED, null);
        return StageOutcome.CONTINUE;
    }

    private StageOutcome planDraft(Turn turn) {
        DeploymentSession session = turn.session;
        List<PlanStep> steps = planComposer.compose(session.getIntent());
        String fingerprint = planComposer.fingerprint(steps);
        Instant now = clock.instant();
        Plan plan = session.getActivePlan();
        if (plan == null) {
            plan = Plan.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(session.getId())
                    .fingerprint(fingerprint)
                    .steps(new ArrayList<>(steps))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            session.setActivePlan(plan);
        } else if (plan.revise(steps, fingerprint, now)) {
            turn.trace(Stage.PLAN_DRAFT, "Revised plan", null, "revision " + plan.getRevision());
        } else if (plan.isEscalated() && !plan.hasOverrideForCurrentRevision()) {
            turn.reply("Plan revision " + plan.getRevision() + " is on hold for operator review: "
                    + String.join("; ", plan.getComplianceFindings()) + ".", ErrorCode.COMPLIANCE_VETO,
                    "Amend the request, or ask an operator to override the veto");
            return StageOutcome.WAIT;
        }
        turn.trace(Stage.PLAN_DRAFT, "Drafted plan revision " + plan.getRevision(), null, describeSteps(plan));
        stageMachine.apply(session, Transition.PLAN_COMPOSED,
                "revision " + plan.getRevision() + ", " + plan.getSteps().size() + " steps");
        return StageOutcome.CONTINUE;
    }

    private StageOutcome complianceReview(Turn turn) {
        DeploymentSession session = turn.session;
        Plan plan = session.getActivePlan();
        ComplianceVerdict verdict = complianceService.review(session, plan);
        turn.trace(Stage.COMPLIANCE_REVIEW, "Compliance review", null, verdict.reason());
        if (verdict.approved()) {
            stageMachine.apply(session, Transition.COMPLIANCE_APPROVED, "revision " + plan.getRevision());
            return StageOutcome.CONTINUE;
        }
        stageMachine.apply(session, Transition.COMPLIANCE_VETOED, verdict.reason(), ErrorCode.COMPLIANCE_VETO);
        replyVeto(turn, plan, verdict);
        return StageOutcome.WAIT;
    }

    private StageOutcome dryRun(Turn turn) {
        DeploymentSession session = turn.session;
        Plan plan = session.getActivePlan();
        if (!credentialBroker.hasCredentials(session.getId())) {
            turn.reply("AWS credentials are required to preview the plan.", ErrorCode.CREDENTIALS_MISSING,
                    CREDENTIALS_REMEDIATION);
            return StageOutcome.WAIT;
        }

        List<String> findings = new ArrayList<>();
        ToolResult failure = null;
        int retries = Math.max(0, properties.getWorkflow().getDryRunRetries());
        for (PlanStep step : plan.mutatingSteps()) {
            ToolResult result = invokeWithRetries(context(session, Stage.DRY_RUN, InvocationMode.PREVIEW),
                    step.getAction(), resolveParams(step, plan, true), false, retries);
            turn.trace(Stage.DRY_RUN, "Preview: " + step.getDescription(), step.getAction(),
                    result.isSuccess() ? "ok" : result.getError());
            if (!result.isSuccess()) {
                findings.add(step.getId() + ": " + result.getError());
                failure = result;
                break;
            }
            findings.add(step.getId() + ": ok");
        }

        // a veto outranks a dry-run outcome
        ComplianceVerdict recheck = complianceService.evaluate(plan);
        if (!recheck.approved()) {
            plan.setDryRun(null);
            plan.setComplianceState(ComplianceState.REJECTED);
            plan.setComplianceFindings(new ArrayList<>(recheck.violations()));
            stageMachine.apply(session, Transition.DRY_RUN_VETOED, recheck.reason(), ErrorCode.COMPLIANCE_VETO);
            replyVeto(turn, plan, recheck);
            return StageOutcome.WAIT;
        }

        plan.setDryRun(DryRunResult.builder()
                .revision(plan.getRevision())
                .success(failure == null)
                .completedAt(clock.instant())
                .findings(findings)
                .remediation(failure != null ? failure.getRemediation() : null)
                .build());
        if (failure != null) {
            return fail(turn, Transition.DRY_RUN_FAILED, failure.getErrorCode(),
                    "Dry run of plan revision " + plan.getRevision() + " failed at " + failure.getAction() + ": "
                            + failure.getError(),
                    failure.getRemediation());
        }

        if (plan.hasDestructiveSteps() && !plan.isConfirmed()) {
            Instant deadline = clock.instant().plus(properties.getSession().getConfirmationTimeout());
            session.setConfirmationDeadline(deadline);
            List<String> destructive = plan.getSteps().stream()
                    .filter(PlanStep::isDestructive)
                    .map(PlanStep::getDescription)
                    .toList();
            turn.reply("Dry run passed. The plan changes running resources: " + String.join("; ", destructive)
                    + ". Reply 'confirm' before " + deadline + " to execute, or 'cancel'.",
                    ErrorCode.CONFIRMATION_REQUIRED, "Reply 'confirm' to proceed");
            return StageOutcome.WAIT;
        }
        stageMachine.apply(session, Transition.DRY_RUN_PASSED, "revision " + plan.getRevision());
        return StageOutcome.CONTINUE;
    }

    private StageOutcome execution(Turn turn) {
        DeploymentSession session = turn.session;
        Plan plan = session.getActivePlan();
        plan.lock();
        for (PlanStep step : plan.mutatingSteps()) {
            if (step.getStatus() != StepStatus.PENDING) {
                continue;
            }
            if (session.isCancelRequested()) {
                session.clearCancel();
                applyCancel(turn);
                return StageOutcome.WAIT;
            }
            boolean confirm = step.isDestructive() && plan.isConfirmed();
            ToolResult result = invokeBound(session, Stage.EXECUTION, InvocationMode.LIVE, step, plan, confirm);
            turn.trace(Stage.EXECUTION, step.getDescription(), step.getAction(),
                    result.isSuccess() ? "done" : result.getError());
            if (!result.isSuccess()) {
                step.setStatus(StepStatus.FAILED);
                step.setError(result.getError());
                stageMachine.apply(session, Transition.EXECUTION_FAILED, step.getId() + ": " + result.getError(),
                        result.getErrorCode());
                return rollbackAndFail(turn, result.getErrorCode(),
                        "Step '" + step.getDescription() + "' failed: " + result.getError(),
                        result.getRemediation());
            }
            step.setStatus(StepStatus.COMPLETED);
            step.setResult(result.getData() != null ? new LinkedHashMap<>(result.getData()) : new LinkedHashMap<>());
        }
        stageMachine.apply(session, Transition.EXECUTION_SUCCEEDED, null);
        return StageOutcome.CONTINUE;
    }

    private StageOutcome validation(Turn turn) {
        DeploymentSession session = turn.session;
        Plan plan = session.getActivePlan();
        int attempts = 1 + Math.max(0, properties.getWorkflow().getValidationRetries());
        for (PlanStep step : plan.validationSteps()) {
            String problem = null;
            String remediation = null;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                ToolResult result = invokeBound(session, Stage.VALIDATION, InvocationMode.LIVE, step, plan, false);
                boolean retryable = true;
                if (result.isSuccess()) {
                    problem = healthEvaluator.evaluate(step, result.getData());
                    remediation = "Inspect the resource in the console; it was left running for diagnosis";
                    if (problem == null) {
                        step.setStatus(StepStatus.COMPLETED);
                        step.setResult(new LinkedHashMap<>(result.getData()));
                    }
                } else {
                    problem = result.getError();
                    remediation = result.getRemediation();
                    retryable = RETRYABLE.contains(result.getErrorCode());
                }
                turn.trace(Stage.VALIDATION, step.getDescription(), step.getAction(),
                        problem == null ? "healthy" : problem);
                if (problem == null || !retryable) {
                    break;
                }
            }
            if (problem != null) {
                step.setStatus(StepStatus.FAILED);
                step.setError(problem);
                deploymentRecordService.record(session, plan, DeploymentRecord.Status.FAILED,
                        "Validation failed: " + problem);
                return fail(turn, Transition.VALIDATION_FAILED, ErrorCode.TOOL_FAILURE,
                        "Deployment executed but validation failed: " + problem + ".", remediation);
            }
        }
        stageMachine.apply(session, Transition.VALIDATION_PASSED, null);
        return StageOutcome.CONTINUE;
    }

    private StageOutcome closure(Turn turn) {
        DeploymentSession session = turn.session;
        if (session.getDeploymentId() != null) {
            turn.reply(terminalReminder(session), null, null);
            return StageOutcome.WAIT;
        }
        Plan plan = session.getActivePlan();
        String summary = closureSummary(session, plan);
        DeploymentRecord deployment = deploymentRecordService.record(session, plan,
                DeploymentRecord.Status.SUCCEEDED, summary);
        turn.trace(Stage.CLOSURE, "Recorded deployment", null, deployment.getId());
        turn.reply(summary + " Deployment id: " + deployment.getId() + ".", null, null);
        return StageOutcome.WAIT;
    }

    /**
     * Issue compensating actions for whatever the plan already changed, then
     * move to Failed. A compensation that fails is escalated as a rollback
     * failure and never retried.
     */
    private StageOutcome rollbackAndFail(Turn turn, ErrorCode cause, String failure, String remediation) {
        DeploymentSession session = turn.session;
        Plan plan = session.getActivePlan();
        CompensationPlan compensation = compensationPlanner.plan(plan);
        List<String> notes = new ArrayList<>();
        List<String> rollbackErrors = new ArrayList<>();
        for (Compensation action : compensation.actions()) {
            ToolResult result = toolGateway.invoke(context(session, Stage.ROLLBACK, InvocationMode.COMPENSATION),
                    action.action(), action.params(), true);
            if (result.isSuccess()) {
                action.source().setStatus(StepStatus.COMPENSATED);
                notes.add(action.description());
            } else if (action.tolerateMissing() && isNotFound(result.getProviderCode())) {
                notes.add(action.description() + " (nothing to undo)");
            } else {
                rollbackErrors.add(action.description() + ": " + result.getError());
            }
            turn.trace(Stage.ROLLBACK, "Compensate: " + action.description(), action.action(),
                    result.isSuccess() ? "done" : result.getError());
        }

        StringBuilder text = new StringBuilder(failure).append('.');
        if (!notes.isEmpty()) {
            text.append(" Rolled back: ").append(String.join("; ", notes)).append('.');
        }
        if (!compensation.residue().isEmpty()) {
            text.append(" Left in place: ").append(String.join("; ", compensation.residue())).append('.');
        }

        if (!rollbackErrors.isEmpty()) {
            String reason = "Rollback failed: " + String.join("; ", rollbackErrors);
            escalationService.raise(session, ErrorCode.ROLLBACK_FAILURE, failure + ". " + reason,
                    "Clean up the listed resources manually");
            text.append(' ').append(reason).append(". An operator has been notified.");
            stageMachine.apply(session, Transition.ROLLBACK_COMPLETED, reason, ErrorCode.ROLLBACK_FAILURE);
            deploymentRecordService.record(session, plan, DeploymentRecord.Status.FAILED, text.toString());
            recordError(session, ErrorCode.ROLLBACK_FAILURE, text.toString(), "Clean up the listed resources manually");
            turn.reply(text.toString(), ErrorCode.ROLLBACK_FAILURE, "Clean up the listed resources manually");
            return StageOutcome.WAIT;
        }

        if (cause != ErrorCode.CANCELLED) {
            escalationService.raise(session, cause, failure, remediation);
            text.append(" An operator has been notified.");
        }
        stageMachine.apply(session, Transition.ROLLBACK_COMPLETED, failure, cause);
        deploymentRecordService.record(session, plan, DeploymentRecord.Status.ROLLED_BACK, text.toString());
        recordError(session, cause, text.toString(), remediation);
        turn.reply(text.toString(), cause, remediation);
        return StageOutcome.WAIT;
    }

    private void applyCancel(Turn turn) {
        DeploymentSession session = turn.session;
        session.setConfirmationDeadline(null);
        Stage stage = session.getStage();
        if (stage.isTerminal()) {
            turn.reply("There is no deployment in progress to cancel.", null, null);
            return;
        }
        Plan plan = session.getActivePlan();
        if (stage == Stage.ROLLBACK || (stage == Stage.EXECUTION && plan != null && plan.isMutationCommitted())) {
            if (stage == Stage.EXECUTION) {
                stageMachine.apply(session, Transition.CANCEL_WITH_ROLLBACK, "cancelled by user",
                        ErrorCode.CANCELLED);
            }
            rollbackAndFail(turn, ErrorCode.CANCELLED, "Deployment cancelled by user", null);
            return;
        }
        if (stage == Stage.VALIDATION) {
            turn.reply("The deployment has already been applied and is being validated; it cannot be cancelled.",
                    ErrorCode.VALIDATION_ERROR, null);
            return;
        }
        stageMachine.apply(session, Transition.CANCELLED, "cancelled by user", ErrorCode.CANCELLED);
        recordError(session, ErrorCode.CANCELLED, "Deployment cancelled by user", null);
        turn.reply("Deployment cancelled. Nothing was changed.", ErrorCode.CANCELLED, null);
    }

    private void handleConfirmationReply(Turn turn, Command command) {
        DeploymentSession session = turn.session;
        if (expireConfirmation(session)) {
            turn.reply("The confirmation window expired and the dry run was discarded. Send any message to "
                    + "re-run it.", ErrorCode.CONFIRMATION_REQUIRED, session.getLastRemediation());
            return;
        }
        if (command == Command.CONFIRM) {
            Plan plan = session.getActivePlan();
            plan.setConfirmed(true);
            session.setConfirmationDeadline(null);
            turn.trace(Stage.DRY_RUN, "User confirmed destructive steps", null, "revision " + plan.getRevision());
            stageMachine.apply(session, Transition.DRY_RUN_PASSED, "confirmed revision " + plan.getRevision());
            advance(turn);
            return;
        }
        if (command == Command.DECLINE) {
            applyCancel(turn);
            return;
        }
        turn.reply("Waiting for confirmation of destructive steps. Reply 'confirm' to execute or 'cancel' to stop.",
                ErrorCode.CONFIRMATION_REQUIRED, "Reply 'confirm' to proceed");
    }

    private StageOutcome fail(Turn turn, Transition transition, ErrorCode code, String message, String remediation) {
        DeploymentSession session = turn.session;
        stageMachine.apply(session, transition, message, code);
        recordError(session, code, message, remediation);
        turn.reply(message, code, remediation);
        return StageOutcome.WAIT;
    }

    private void replyVeto(Turn turn, Plan plan, ComplianceVerdict verdict) {
        String text = "Compliance review vetoed plan revision " + plan.getRevision() + ": " + verdict.reason() + ".";
        if (plan.isEscalated()) {
            text += " The plan has been escalated; it stays on hold until an operator overrides the veto or you "
                    + "amend the request.";
        } else {
            text += " Amend the request to continue.";
        }
        recordError(turn.session, ErrorCode.COMPLIANCE_VETO, text, "Change the request to satisfy the policy");
        turn.reply(text, ErrorCode.COMPLIANCE_VETO, "Change the request to satisfy the policy");
    }

    private ToolResult invokeWithRetries(InvocationContext context, String action, Map<String, Object> params,
            boolean confirm, int retries) {
        ToolResult result = toolGateway.invoke(context, action, params, confirm);
        for (int attempt = 1; attempt <= retries && !result.isSuccess()
                && RETRYABLE.contains(result.getErrorCode()); attempt++) {
            log.info("[Workflow] Retrying {} in {} ({}/{}) after {}", action, context.stage(), attempt, retries,
                    result.getErrorCode());
            result = toolGateway.invoke(context, action, params, confirm);
        }
        return result;
    }

    private ToolResult invokeBound(DeploymentSession session, Stage stage, InvocationMode mode, PlanStep step,
            Plan plan, boolean confirm) {
        Map<String, Object> params;
        try {
            params = resolveParams(step, plan, false);
        } catch (IllegalStateException e) {
            return ToolResult.failure(step.getAction(), ErrorCode.TOOL_FAILURE, e.getMessage(),
                    "Re-run the deployment; an earlier step returned no usable result");
        }
        return toolGateway.invoke(context(session, stage, mode), step.getAction(), params, confirm);
    }

    /**
     * Fill bound parameters from earlier step results. Previews use a
     * placeholder for values that only exist after execution.
     */
    static Map<String, Object> resolveParams(PlanStep step, Plan plan, boolean preview) {
        Map<String, Object> params = new LinkedHashMap<>(step.getParams());
        for (Map.Entry<String, String> binding : step.getBindings().entrySet()) {
            String reference = binding.getValue();
            int dot = reference.indexOf('.');
            String sourceId = reference.substring(0, dot);
            String key = reference.substring(dot + 1);
            Object value = plan.getSteps().stream()
                    .filter(candidate -> candidate.getId().equals(sourceId))
                    .filter(candidate -> candidate.getStatus() == StepStatus.COMPLETED)
                    .map(candidate -> candidate.getResult().get(key))
                    .findFirst()
                    .orElse(null);
            if (value == null) {
                if (!preview) {
                    throw new IllegalStateException("Step '" + sourceId + "' produced no '" + key + "' for step '"
                            + step.getId() + "'");
                }
                value = "<pending:" + reference + ">";
            }
            params.put(binding.getKey(), value);
        }
        return params;
    }

    private static boolean isCancellable(Stage stage) {
        return stage != Stage.VALIDATION && stage != Stage.CLOSURE && !stage.isTerminal();
    }

    private static InvocationContext context(DeploymentSession session, Stage stage, InvocationMode mode) {
        return InvocationContext.of(session, stage, mode);
    }

    private static boolean isNotFound(String providerCode) {
        return providerCode != null && (providerCode.contains("NotFound") || providerCode.startsWith("NoSuch"));
    }

    private static List<String> validateIntent(DeploymentIntent intent) {
        List<String> problems = new ArrayList<>();
        try {
            ParameterSupport.validateRegion(intent.getRegion());
        } catch (ParameterValidationException e) {
            problems.add(e.getMessage());
        }
        if (intent.getBucketName() != null) {
            try {
                ParameterSupport.validateBucketName(intent.getBucketName());
            } catch (ParameterValidationException e) {
                problems.add(e.getMessage());
            }
        }
        boolean needsLocalFile = intent.getRepoUrl() == null
                && (intent.getTarget() == DeploymentTarget.FUNCTION || intent.getTarget() == DeploymentTarget.STORAGE);
        if (needsLocalFile && !Files.isRegularFile(Paths.get(intent.getLocalPath()))) {
            problems.add("File not found: " + intent.getLocalPath());
        }
        return problems;
    }

    private static void recordError(DeploymentSession session, ErrorCode code, String message, String remediation) {
        session.setLastErrorCode(code);
        session.setLastError(message);
        session.setLastRemediation(remediation);
    }

    private static String describeIntent(DeploymentSession session) {
        DeploymentIntent intent = session.getIntent();
        StringBuilder text = new StringBuilder();
        text.append(intent.getTarget() != null ? intent.getTarget().name().toLowerCase(Locale.ROOT)
                : "unspecified target");
        if (intent.getRegion() != null) {
            text.append(" in ").append(intent.getRegion());
        }
        if (intent.getRepoUrl() != null) {
            text.append(" from repository");
        } else if (intent.getLocalPath() != null) {
            text.append(" from ").append(intent.getLocalPath());
        }
        return text.toString();
    }

    private static String describeSteps(Plan plan) {
        List<String> lines = new ArrayList<>();
        for (PlanStep step : plan.getSteps()) {
            lines.add(step.getId() + "=" + step.getAction());
        }
        return String.join(", ", lines);
    }

    private static String closureSummary(DeploymentSession session, Plan plan) {
        DeploymentIntent intent = session.getIntent();
        List<String> facts = new ArrayList<>();
        for (PlanStep step : plan.mutatingSteps()) {
            Map<String, Object> result = step.getResult();
            addFact(facts, "instances", result.get("instance_ids"));
            addFact(facts, "function", result.get("function_arn"));
            addFact(facts, "service", result.get("service_arn"));
            addFact(facts, "object", result.get("object"));
        }
        String where = intent.getTarget().name().toLowerCase(Locale.ROOT) + " deployment in "
                + intent.getRegion();
        return facts.isEmpty()
                ? "Completed " + where + "."
                : "Completed " + where + ": " + String.join(", ", facts) + ".";
    }

    private static void addFact(List<String> facts, String label, Object value) {
        if (value != null) {
            facts.add(label + " " + value);
        }
    }

    private static String terminalReminder(DeploymentSession session) {
        if (session.getStage() == Stage.CLOSURE) {
            return "The last deployment completed (id " + session.getDeploymentId()
                    + "). Describe a new deployment to start again.";
        }
        return "The last deployment failed: " + session.getLastError()
                + " Send corrected details to retry, or 'new deployment' to start over.";
    }

    private AgentResponse finish(Turn turn) {
        DeploymentSession session = turn.session;
        String answer = turn.answer != null
                ? turn.answer
                : "Working on your deployment; current stage is " + session.getStage() + ".";
        sessionManager.appendTurn(session, ConversationTurn.Role.ASSISTANT, answer);
        return AgentResponse.builder()
                .sessionId(session.getId())
                .finalAnswer(answer)
                .stage(session.getStage())
                .errorCode(turn.errorCode)
                .remediation(turn.remediation)
                .awaitingConfirmation(session.isAwaitingConfirmation())
                .thoughtProcess(turn.steps)
                .build();
    }

    private enum StageOutcome {
        CONTINUE, WAIT
    }

    private static final class Turn {

        private final DeploymentSession session;
        private final List<AgentResponse.ThoughtStep> steps = new ArrayList<>();
        private String answer;
        private ErrorCode errorCode;
        private String remediation;

        private Turn(DeploymentSession session) {
            this.session = session;
        }

        void trace(Stage stage, String thought, String action, String observation) {
            steps.add(new AgentResponse.ThoughtStep(stage, thought, action, observation));
        }

        void reply(String text, ErrorCode code, String hint) {
            this.answer = text;
            this.errorCode = code;
            this.remediation = hint;
        }
    }
}
