package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.model.AgentResponse;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.ComplianceState;
import me.golemcore.deploy.domain.model.DeploymentRecord;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.DeploymentTarget;
import me.golemcore.deploy.domain.model.DryRunResult;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.EscalationRecord;
import me.golemcore.deploy.domain.model.InvocationContext;
import me.golemcore.deploy.domain.model.InvocationOutcome;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.domain.model.StepKind;
import me.golemcore.deploy.domain.model.ToolInvocation;
import me.golemcore.deploy.domain.model.ToolResult;
import me.golemcore.deploy.testsupport.TestCredentialBrokers;
import me.golemcore.deploy.testsupport.WorkflowFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end turns through the workflow engine against the sandbox cloud.
 */
class WorkflowScenarioTest {

    private static final String PRINCIPAL = "alice";
    private static final String LAUNCH_REQUEST = "deploy an ec2 instance t3.micro in us-east-1 with ami ami-0abc1234 "
            + "and key pair dev-key";
    private static final Pattern ACCESS_KEY_SHAPE = Pattern.compile("\\b(?:AKIA|ASIA)[A-Z0-9]{16}\\b");
    private static final Pattern SECRET_KEY_SHAPE = Pattern
            .compile("(?<![A-Za-z0-9/+=])[A-Za-z0-9/+]{40}(?![A-Za-z0-9/+=])");
    private static final String CONTAINER_REQUEST = "deploy container image nginx:latest to ecs cluster demo "
            + "service web in us-east-1";

    @TempDir
    Path tempDir;

    private WorkflowFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new WorkflowFixture(tempDir);
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    // ===== Credentials =====

    @Test
    void shouldAskForCredentialsWithoutCallingTheGateway() {
        DeploymentSession session = fixture.sessionManager.open("s-a", PRINCIPAL);

        AgentResponse response = fixture.engine.handle(session,
                "launch a t3.micro instance in us-east-1 with key dev-key");

        assertEquals(ErrorCode.CREDENTIALS_MISSING, response.getErrorCode());
        assertEquals(Stage.INTAKE, response.getStage());
        assertTrue(response.getFinalAnswer().contains("AWS credentials for principal 'alice'"));
        assertTrue(response.getFinalAnswer().contains("image id"));
        assertNotNull(response.getRemediation());
        assertTrue(fixture.toolEvents("s-a").isEmpty());
        assertTrue(fixture.sandbox.getLiveCalls().isEmpty());
    }

    @Test
    void shouldResumeOnceCredentialsAndMissingFieldsArrive() {
        DeploymentSession session = fixture.sessionManager.open("s-a2", PRINCIPAL);
        fixture.engine.handle(session, "launch a t3.micro instance in us-east-1 with key dev-key");

        fixture.storeCredentials(PRINCIPAL);
        AgentResponse response = fixture.engine.handle(session, "use ami ami-0abc1234");

        assertEquals(Stage.CLOSURE, response.getStage());
        assertNull(response.getErrorCode());
        assertEquals("dev-key", session.getIntent().getKeyName());
    }

    // ===== Happy path =====

    @Test
    void shouldLaunchInstanceThroughEveryStage() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-b", PRINCIPAL);

        AgentResponse response = fixture.engine.handle(session, LAUNCH_REQUEST);

        assertEquals(Stage.CLOSURE, response.getStage());
        assertNull(response.getErrorCode());
        assertTrue(response.getFinalAnswer().startsWith("Completed instance deployment in us-east-1"));
        assertTrue(response.getFinalAnswer().contains("Deployment id: " + session.getDeploymentId()));

        List<AuditEvent> dryRun = fixture.toolEvents("s-b", Stage.DRY_RUN, AuditStatus.SUCCESS);
        List<AuditEvent> execution = fixture.toolEvents("s-b", Stage.EXECUTION, AuditStatus.SUCCESS);
        assertEquals(1, dryRun.size());
        assertEquals(1, execution.size());
        assertEquals("launch_ec2", dryRun.get(0).tool());
        assertEquals("launch_ec2", execution.get(0).tool());
        assertEquals(1, fixture.toolEvents("s-b", Stage.VALIDATION, AuditStatus.SUCCESS).size());

        assertEquals(1, fixture.sandbox.getInstances().size());
        assertEquals(List.of("RunInstances", "DescribeInstances"), fixture.sandbox.getLiveCalls());
        DeploymentRecord recorded = fixture.deploymentRecordService.find(session.getDeploymentId()).orElseThrow();
        assertEquals(DeploymentRecord.Status.SUCCEEDED, recorded.getStatus());
        assertEquals(1, recorded.getPlanRevision());
    }

    @Test
    void shouldVisitStagesInOrder() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-order", PRINCIPAL);

        fixture.engine.handle(session, LAUNCH_REQUEST);

        List<Stage> visited = fixture.auditSink.events("s-order").stream()
                .filter(event -> event.kind() == AuditEvent.Kind.STAGE_TRANSITION)
                .map(AuditEvent::stage)
                .toList();
        assertEquals(List.of(Stage.CONTEXT_SYNC, Stage.PREFLIGHT, Stage.PLAN_DRAFT, Stage.COMPLIANCE_REVIEW,
                Stage.DRY_RUN, Stage.EXECUTION, Stage.VALIDATION, Stage.CLOSURE), visited);
    }

    @Test
    void shouldUploadLocalFileToBucket() throws IOException {
        fixture.storeCredentials(PRINCIPAL);
        Path site = Files.createDirectories(tempDir.resolve("site")).resolve("index.html");
        Files.writeString(site, "<h1>hello</h1>");
        DeploymentSession session = fixture.sessionManager.open("s-s3", PRINCIPAL);

        AgentResponse response = fixture.engine.handle(session,
                "upload file " + site + " to s3://site-assets-2026 in us-east-1");

        assertEquals(Stage.CLOSURE, response.getStage());
        assertTrue(response.getFinalAnswer().contains("object index.html"));
        assertEquals(List.of("CreateBucket", "PutObject", "ListObjectsV2"), fixture.sandbox.getLiveCalls());
    }

    @Test
    void shouldFailPreflightForMissingLocalFile() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-pre", PRINCIPAL);

        AgentResponse response = fixture.engine.handle(session,
                "upload file /definitely/not/here/site.zip to s3://site-assets-2026 in us-east-1");

        assertEquals(Stage.FAILED, response.getStage());
        assertEquals(ErrorCode.VALIDATION_ERROR, response.getErrorCode());
        assertTrue(response.getFinalAnswer().contains("File not found"));
        assertTrue(fixture.toolEvents("s-pre").isEmpty());
    }

    // ===== Failure and rollback =====

    @Test
    void shouldCompensateAndFailWhenServiceCreationIsDenied() {
        fixture.storeCredentials(PRINCIPAL);
        fixture.sandbox.failNext("CreateService", "AccessDeniedException",
                "User is not authorized to perform ecs:CreateService");
        DeploymentSession session = fixture.sessionManager.open("s-c", PRINCIPAL);

        AgentResponse response = fixture.engine.handle(session, CONTAINER_REQUEST);

        assertEquals(Stage.FAILED, response.getStage());
        assertEquals(ErrorCode.TOOL_FAILURE, response.getErrorCode());
        String answer = response.getFinalAnswer();
        assertTrue(answer.contains("Step 'Create service web with 1 task(s)' failed"));
        assertTrue(answer.contains("AccessDeniedException"));
        assertTrue(answer.contains("Scale service web to zero tasks (nothing to undo)"));
        assertTrue(answer.contains("Cluster demo was created"));
        assertTrue(answer.contains("An operator has been notified"));

        List<AuditEvent> rollback = fixture.toolEvents("s-c").stream()
                .filter(event -> event.stage() == Stage.ROLLBACK)
                .toList();
        assertEquals(1, rollback.size());
        assertEquals("update_service", rollback.get(0).tool());

        List<EscalationRecord> escalations = fixture.escalationService.list("s-c");
        assertEquals(1, escalations.size());
        assertEquals(ErrorCode.TOOL_FAILURE, escalations.get(0).errorCode());
        DeploymentRecord recorded = fixture.deploymentRecordService.find(session.getDeploymentId()).orElseThrow();
        assertEquals(DeploymentRecord.Status.ROLLED_BACK, recorded.getStatus());
    }

    @Test
    void shouldRetryAfterFailureWithAmendedIntent() {
        fixture.storeCredentials(PRINCIPAL);
        fixture.sandbox.failNext("RunInstances", "InstanceLimitExceeded",
                "You have requested more instances than your current instance limit allows");
        DeploymentSession session = fixture.sessionManager.open("s-retry", PRINCIPAL);

        AgentResponse failed = fixture.engine.handle(session, LAUNCH_REQUEST);
        assertEquals(Stage.FAILED, failed.getStage());
        assertTrue(failed.getFinalAnswer().contains("InstanceLimitExceeded"));
        assertTrue(fixture.sandbox.getInstances().isEmpty());

        AgentResponse reminder = fixture.engine.handle(session, "what happened?");
        assertEquals(Stage.FAILED, reminder.getStage());
        assertTrue(reminder.getFinalAnswer().startsWith("The last deployment failed"));

        AgentResponse retried = fixture.engine.handle(session, "use t3.small instead");
        assertEquals(Stage.CLOSURE, retried.getStage());
        assertEquals("t3.small", session.getIntent().getInstanceType());
        assertEquals(1, fixture.sandbox.getInstances().size());
    }

    // ===== Compliance =====

    @Test
    void shouldEscalateRepeatedVetoAndContinueAfterOverride() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-veto", PRINCIPAL);
        String request = LAUNCH_REQUEST.replace("t3.micro", "m5.large");

        AgentResponse first = fixture.engine.handle(session, request);
        assertEquals(ErrorCode.COMPLIANCE_VETO, first.getErrorCode());
        assertEquals(Stage.PLAN_DRAFT, first.getStage());
        assertFalse(session.getActivePlan().isEscalated());

        AgentResponse second = fixture.engine.handle(session, "please try again");
        assertEquals(ErrorCode.COMPLIANCE_VETO, second.getErrorCode());
        assertTrue(second.getFinalAnswer().contains("escalated"));
        assertTrue(session.getActivePlan().isEscalated());
        assertEquals(1, fixture.escalationService.list("s-veto").size());

        AgentResponse held = fixture.engine.handle(session, "and now?");
        assertTrue(held.getFinalAnswer().contains("on hold for operator review"));
        assertTrue(fixture.sandbox.getLiveCalls().isEmpty());

        AgentResponse overridden = fixture.engine.overrideCompliance(session, "ops-lead", "capacity test approved");
        assertEquals(Stage.CLOSURE, overridden.getStage());
        assertEquals(1, session.getActivePlan().getRevision());
    }

    @Test
    void shouldStartNewRevisionWhenVetoedRequestIsAmended() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-amend", PRINCIPAL);

        fixture.engine.handle(session, LAUNCH_REQUEST.replace("t3.micro", "m5.large"));
        AgentResponse amended = fixture.engine.handle(session, "use t3.small instead");

        assertEquals(Stage.CLOSURE, amended.getStage());
        assertEquals(2, session.getActivePlan().getRevision());
        assertEquals(ComplianceState.APPROVED, session.getActivePlan().getComplianceState());
    }

    // ===== Destructive confirmation =====

    @Test
    void shouldRequireConfirmationBeforeTerminatingInstance() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-d", PRINCIPAL);
        InvocationContext direct = InvocationContext.direct(session.getId(), PRINCIPAL);
        ToolResult launched = fixture.gateway.invoke(direct, "launch_ec2",
                Map.of("ami_id", "ami-0abc1234", "instance_type", "t3.micro"), false);
        String instanceId = String.valueOf(((List<?>) launched.getData().get("instance_ids")).get(0));

        ToolResult refused = fixture.gateway.invoke(direct, "terminate_ec2", Map.of("instance_id", instanceId),
                false);

        assertEquals(ErrorCode.CONFIRMATION_REQUIRED, refused.getErrorCode());
        assertFalse(fixture.sandbox.getLiveCalls().contains("TerminateInstances"));
        assertEquals("running", instanceState(instanceId));

        ToolResult confirmed = fixture.gateway.invoke(direct, "terminate_ec2", Map.of("instance_id", instanceId),
                true);

        assertTrue(confirmed.isSuccess());
        assertEquals("terminated", instanceState(instanceId));
    }

    @Test
    void shouldExecuteDestructiveStepAfterUserConfirms() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-confirm", PRINCIPAL);
        createRunningService(session);
        awaitConfirmation(session, scaleServicePlan(session));

        AgentResponse waiting = fixture.engine.handle(session, "what now?");
        assertEquals(ErrorCode.CONFIRMATION_REQUIRED, waiting.getErrorCode());
        assertTrue(waiting.isAwaitingConfirmation());

        AgentResponse response = fixture.engine.handle(session, "confirm");

        assertEquals(Stage.CLOSURE, response.getStage());
        assertFalse(response.isAwaitingConfirmation());
        assertTrue(fixture.sandbox.getLiveCalls().contains("UpdateService"));
    }

    @Test
    void shouldCancelWhenUserDeclinesConfirmation() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-decline", PRINCIPAL);
        createRunningService(session);
        awaitConfirmation(session, scaleServicePlan(session));

        AgentResponse response = fixture.engine.handle(session, "no");

        assertEquals(Stage.FAILED, response.getStage());
        assertEquals(ErrorCode.CANCELLED, response.getErrorCode());
        assertFalse(fixture.sandbox.getLiveCalls().contains("UpdateService"));
    }

    @Test
    void shouldExpireConfirmationAfterTimeout() {
        DeploymentSession session = fixture.sessionManager.open("s-expire", PRINCIPAL);
        Plan plan = scaleServicePlan(session);
        awaitConfirmation(session, plan);

        assertFalse(fixture.engine.expireConfirmation(session));

        fixture.clock.advance(fixture.properties.getSession().getConfirmationTimeout().plus(Duration.ofSeconds(1)));

        assertTrue(fixture.engine.expireConfirmation(session));
        assertEquals(Stage.PLAN_DRAFT, session.getStage());
        assertNull(plan.getDryRun());
        assertFalse(session.isAwaitingConfirmation());
        assertEquals(ErrorCode.CONFIRMATION_REQUIRED, session.getLastErrorCode());
        assertFalse(fixture.engine.expireConfirmation(session));
    }

    // ===== Cancellation =====

    @Test
    void shouldCancelBeforeAnythingChanged() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-cancel", PRINCIPAL);

        AgentResponse partial = fixture.engine.handle(session, "deploy an ec2 instance in us-east-1");
        assertEquals(ErrorCode.VALIDATION_ERROR, partial.getErrorCode());
        assertTrue(partial.getFinalAnswer().startsWith("To plan this deployment I still need"));

        AgentResponse cancelled = fixture.engine.handle(session, "cancel");

        assertEquals(Stage.FAILED, cancelled.getStage());
        assertEquals(ErrorCode.CANCELLED, cancelled.getErrorCode());
        assertEquals("Deployment cancelled. Nothing was changed.", cancelled.getFinalAnswer());
    }

    @Test
    void shouldApplyCancellationRequestedBetweenTurns() {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-cancel2", PRINCIPAL);
        fixture.engine.handle(session, "deploy an ec2 instance in us-east-1");

        session.requestCancel();
        AgentResponse response = fixture.engine.cancel(session);

        assertEquals(Stage.FAILED, response.getStage());
        assertFalse(session.isCancelRequested());
    }

    @Test
    void shouldRefuseNewDeploymentWhileOneIsInProgress() {
        DeploymentSession session = fixture.sessionManager.open("s-new", PRINCIPAL);
        session.setStage(Stage.PLAN_DRAFT);

        AgentResponse response = fixture.engine.handle(session, "new deployment");

        assertEquals(ErrorCode.VALIDATION_ERROR, response.getErrorCode());
        assertEquals(Stage.PLAN_DRAFT, response.getStage());
    }

    // ===== Concurrency =====

    @Test
    void shouldQueueEleventhConcurrentCallInsteadOfRejectingIt() throws Exception {
        fixture.storeCredentials(PRINCIPAL);
        DeploymentSession session = fixture.sessionManager.open("s-e", PRINCIPAL);
        InvocationContext direct = InvocationContext.direct(session.getId(), PRINCIPAL);
        ExecutorService pool = Executors.newFixedThreadPool(11);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ToolResult>> futures = new ArrayList<>();
            for (int i = 0; i < 11; i++) {
                Callable<ToolResult> call = () -> {
                    start.await();
                    return fixture.gateway.invoke(direct, "describe_images", Map.of(), false);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            for (Future<ToolResult> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(11, fixture.toolEvents("s-e").size());
        assertEquals(10, fixture.gateway.getAvailablePermits());
        assertEquals(0, fixture.gateway.getInFlight());
    }

    // ===== Records =====

    @Test
    void shouldKeepSecretsOutOfEveryPersistedRecordAndConfirmEveryDestructiveCall() throws Exception {
        fixture.storeCredentials(PRINCIPAL);
        List<DeploymentSession> sessions = new ArrayList<>();

        DeploymentSession launch = fixture.sessionManager.open("s-b", PRINCIPAL);
        sessions.add(launch);
        assertEquals(Stage.CLOSURE, fixture.engine.handle(launch, LAUNCH_REQUEST).getStage());

        fixture.sandbox.failNext("CreateService", "AccessDeniedException",
                "User is not authorized to perform ecs:CreateService");
        DeploymentSession container = fixture.sessionManager.open("s-c", PRINCIPAL);
        sessions.add(container);
        assertEquals(Stage.FAILED, fixture.engine.handle(container, CONTAINER_REQUEST).getStage());

        DeploymentSession terminate = fixture.sessionManager.open("s-d", PRINCIPAL);
        sessions.add(terminate);
        InvocationContext direct = InvocationContext.direct(terminate.getId(), PRINCIPAL);
        ToolResult launched = fixture.gateway.invoke(direct, "launch_ec2",
                Map.of("ami_id", "ami-0abc1234", "instance_type", "t3.micro"), false);
        String instanceId = String.valueOf(((List<?>) launched.getData().get("instance_ids")).get(0));
        fixture.gateway.invoke(direct, "terminate_ec2", Map.of("instance_id", instanceId), false);
        assertTrue(fixture.gateway.invoke(direct, "terminate_ec2", Map.of("instance_id", instanceId), true)
                .isSuccess());

        assertTrue(fixture.auditSink.flush());
        List<ToolInvocation> invocations = fixture.auditStore.invocations();
        List<Object> records = new ArrayList<>();
        records.addAll(fixture.auditStore.events());
        records.addAll(invocations);
        records.addAll(fixture.deploymentRecordService.list());
        for (DeploymentSession session : sessions) {
            records.add(session.getActivePlan());
            records.addAll(session.getTurnsSnapshot());
            records.addAll(fixture.escalationService.list(session.getId()));
        }
        StringBuilder persisted = new StringBuilder();
        for (Object record : records) {
            persisted.append(fixture.objectMapper.writeValueAsString(record)).append('\n');
        }
        try (Stream<Path> files = Files.walk(Path.of(fixture.properties.getStorage().getLocal().getBasePath()))) {
            for (Path file : files.filter(Files::isRegularFile).toList()) {
                persisted.append(Files.readString(file)).append('\n');
            }
        }

        String text = persisted.toString();
        assertFalse(fixture.deploymentRecordService.list().isEmpty());
        assertFalse(fixture.escalationService.list("s-c").isEmpty());
        assertFalse(text.contains(TestCredentialBrokers.SECRET_KEY));
        assertFalse(text.contains(TestCredentialBrokers.ACCESS_KEY));
        assertFalse(ACCESS_KEY_SHAPE.matcher(text).find());
        Matcher secretShape = SECRET_KEY_SHAPE.matcher(text);
        while (secretShape.find()) {
            String candidate = secretShape.group();
            assertFalse(!candidate.equals(candidate.toLowerCase(Locale.ROOT))
                    && !candidate.equals(candidate.toUpperCase(Locale.ROOT)),
                    "secret-shaped value persisted: " + candidate);
        }

        List<ToolInvocation> executedDestructive = invocations.stream()
                .filter(invocation -> fixture.catalog.find(invocation.action())
                        .map(ActionDefinition::destructive).orElse(false))
                .filter(invocation -> invocation.outcome() != InvocationOutcome.DENIED && !invocation.dryRun())
                .toList();
        assertFalse(executedDestructive.isEmpty());
        assertTrue(executedDestructive.stream().allMatch(ToolInvocation::confirmed));
        assertTrue(invocations.stream().anyMatch(invocation -> "terminate_ec2".equals(invocation.action())
                && invocation.outcome() == InvocationOutcome.DENIED && !invocation.confirmed()));
    }

    private String instanceState(String instanceId) {
        return fixture.sandbox.getInstances().stream()
                .filter(instance -> instanceId.equals(instance.get("InstanceId")))
                .map(instance -> String.valueOf(((Map<?, ?>) instance.get("State")).get("Name")))
                .findFirst()
                .orElseThrow();
    }

    private void createRunningService(DeploymentSession session) {
        InvocationContext direct = InvocationContext.direct(session.getId(), PRINCIPAL);
        assertTrue(fixture.gateway.invoke(direct, "create_cluster", Map.of("cluster_name", "demo"), false)
                .isSuccess());
        ToolResult task = fixture.gateway.invoke(direct, "register_task_definition", Map.of(
                "family", "web",
                "container_definitions", List.of(Map.of("name", "web", "image", "nginx:latest"))), false);
        assertTrue(task.isSuccess());
        assertTrue(fixture.gateway.invoke(direct, "create_service", Map.of(
                "cluster", "demo",
                "service_name", "web",
                "task_definition", task.getData().get("task_definition_arn"),
                "desired_count", 1), false).isSuccess());
    }

    private Plan scaleServicePlan(DeploymentSession session) {
        session.getIntent().setTarget(DeploymentTarget.CONTAINER);
        session.getIntent().setRegion("us-east-1");
        PlanStep scale = PlanStep.builder()
                .id("scale")
                .kind(StepKind.DEPLOY)
                .action("update_service")
                .description("Scale service web to 2 tasks")
                .params(Map.of("region", "us-east-1", "cluster", "demo", "service_name", "web",
                        "desired_count", 2))
                .destructive(true)
                .build();
        PlanStep verify = PlanStep.builder()
                .id("verify")
                .kind(StepKind.VALIDATE)
                .action("describe_services")
                .description("Check service web is active")
                .params(Map.of("region", "us-east-1", "cluster", "demo", "service_name", "web"))
                .build();
        return Plan.builder()
                .id("plan-" + session.getId())
                .sessionId(session.getId())
                .fingerprint("fixed")
                .steps(new ArrayList<>(List.of(scale, verify)))
                .complianceState(ComplianceState.APPROVED)
                .dryRun(DryRunResult.builder().revision(1).success(true).findings(List.of("scale: ok")).build())
                .createdAt(fixture.clock.instant())
                .updatedAt(fixture.clock.instant())
                .build();
    }

    private void awaitConfirmation(DeploymentSession session, Plan plan) {
        session.setActivePlan(plan);
        session.setStage(Stage.DRY_RUN);
        session.setConfirmationDeadline(fixture.clock.instant()
                .plus(fixture.properties.getSession().getConfirmationTimeout()));
    }
}
