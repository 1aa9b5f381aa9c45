package me.golemcore.deploy.domain.gateway;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.CloudProviderException;
import me.golemcore.deploy.domain.model.CredentialHandle;
import me.golemcore.deploy.domain.model.CredentialMaterial;
import me.golemcore.deploy.domain.model.CredentialsMissingException;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.InvocationContext;
import me.golemcore.deploy.domain.model.InvocationMode;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.RateLimitResult;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.domain.model.ToolInvocation;
import me.golemcore.deploy.domain.model.ToolResult;
import me.golemcore.deploy.domain.service.AuditSink;
import me.golemcore.deploy.domain.service.CredentialBroker;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.RateLimitPort;
import me.golemcore.deploy.security.SecretRedactor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Single entry point for every side-effecting action.
 *
 * <p>
 * A call passes, in order: catalog lookup, stage capability check,
 * confirmation gate, rate limits, the global concurrency gate, credential
 * resolution and finally the bounded execution of the handler. Whatever the
 * path, exactly one {@link ToolInvocation} and one tool audit event are
 * recorded, and everything that leaves the gateway is redacted.
 */
@Component
@Slf4j
public class ToolGateway {

    private static final String STATUS = "status";
    private static final String ACTION = "action";

    private final ActionCatalog catalog;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final RateLimitPort rateLimiter;
    private final CredentialBroker credentialBroker;
    private final AuditSink auditSink;
    private final SecretRedactor redactor;
    private final ObjectMapper objectMapper;
    private final DeployProperties properties;
    private final Clock clock;

    private final Semaphore concurrencyGate;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final ExecutorService executor;

    public ToolGateway(ActionCatalog catalog, ToolConfirmationPolicy confirmationPolicy, RateLimitPort rateLimiter,
            CredentialBroker credentialBroker, AuditSink auditSink, SecretRedactor redactor,
            ObjectMapper objectMapper, DeployProperties properties, Clock clock) {
        this.catalog = catalog;
        this.confirmationPolicy = confirmationPolicy;
        this.rateLimiter = rateLimiter;
        this.credentialBroker = credentialBroker;
        this.auditSink = auditSink;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.concurrencyGate = new Semaphore(Math.max(1, properties.getGateway().getMaxConcurrent()), true);
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "gateway-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Run one catalog action.
     *
     * @param rawParams
     *            a map or a JSON object string
     * @param confirm
     *            explicit user confirmation for destructive actions
     */
    public ToolResult invoke(InvocationContext context, String action, Object rawParams, boolean confirm) {
        String invocationId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        Map<String, Object> params = Map.of();
        ToolResult result;
        try {
            params = ParameterSupport.coerceParams(rawParams);
            result = admitAndExecute(context, action, params, confirm);
        } catch (ParameterValidationException e) {
            result = ToolResult.failure(action, ErrorCode.VALIDATION_ERROR, e.getMessage(), e.getRemediation());
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return finish(context, invocationId, action, params, confirm, startedAt, latencyMs, result);
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getAvailablePermits() {
        return concurrencyGate.availablePermits();
    }

    private ToolResult admitAndExecute(InvocationContext context, String action, Map<String, Object> params,
            boolean confirm) {
        ActionDefinition definition = catalog.find(action).orElse(null);
        if (definition == null) {
            return ToolResult.denied(action, ErrorCode.UNSUPPORTED_ACTION,
                    "Unsupported action '" + action + "'. Supported actions: " + catalog.names(),
                    "Choose one of the supported actions");
        }

        ToolResult capabilityDenial = checkCapability(context, definition);
        if (capabilityDenial != null) {
            return capabilityDenial;
        }

        if (confirmationPolicy.requiresConfirmation(definition, context.mode()) && !confirm) {
            log.info("[Gateway] Confirmation missing for '{}': {}", action,
                    redactor.redact(confirmationPolicy.describeAction(action, params)));
            return ToolResult.denied(action, ErrorCode.CONFIRMATION_REQUIRED,
                    confirmationPolicy.confirmationMessage(action),
                    "Review the operation and repeat it with confirm=true");
        }

        ToolResult rateDenial = applyRateLimits(context, definition);
        if (rateDenial != null) {
            return rateDenial;
        }

        Duration admissionTimeout = properties.getGateway().getAdmissionTimeout();
        boolean admitted;
        try {
            admitted = concurrencyGate.tryAcquire(admissionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(action, ErrorCode.CANCELLED, "Interrupted while waiting for a gateway slot",
                    "Retry the action");
        }
        if (!admitted) {
            return ToolResult.timeout(action, "No gateway slot became free within " + admissionTimeout.toSeconds()
                    + "s");
        }
        inFlight.incrementAndGet();
        GatewaySlot slot = new GatewaySlot();
        try {
            return execute(context, definition, params, slot);
        } finally {
            if (!slot.isHandedOff()) {
                slot.release();
            }
        }
    }

    private ToolResult checkCapability(InvocationContext context, ActionDefinition definition) {
        StageCapability required = requiredCapability(context.mode(), definition);
        if (required == null) {
            return ToolResult.denied(definition.name(), ErrorCode.CAPABILITY_DENIED,
                    "Action '" + definition.name() + "' cannot be used as a compensation",
                    "Use a compensating action");
        }
        if (context.stage() != null && !context.stage().permits(required)) {
            return ToolResult.denied(definition.name(), ErrorCode.CAPABILITY_DENIED,
                    "Stage " + context.stage() + " does not permit " + required + " actions such as '"
                            + definition.name() + "'",
                    "Advance the workflow to a stage that permits this action");
        }
        return null;
    }

    static StageCapability requiredCapability(InvocationMode mode, ActionDefinition definition) {
        return switch (mode) {
        case PREVIEW -> StageCapability.PREVIEW;
        case COMPENSATION -> definition.compensating() ? StageCapability.COMPENSATE : null;
        case LIVE -> definition.capability();
        };
    }

    private ToolResult applyRateLimits(InvocationContext context, ActionDefinition definition) {
        if (definition.category().isCloud()) {
            String caller = context.callerId() != null ? context.callerId() : context.sessionId();
            if (!awaitToken(() -> rateLimiter.tryConsumeExternal(caller))) {
                return ToolResult.denied(definition.name(), ErrorCode.RATE_LIMITED,
                        "External call budget exhausted for caller " + caller,
                        "Wait a moment before retrying");
            }
        }
        if (context.stage() != null && context.stage().isPlanning()) {
            if (!awaitToken(() -> rateLimiter.tryConsumePlanning(context.sessionId()))) {
                return ToolResult.denied(definition.name(), ErrorCode.RATE_LIMITED,
                        "Planning call budget exhausted for session " + context.sessionId(),
                        "Wait a minute before asking for another planning call");
            }
        }
        return null;
    }

    private boolean awaitToken(Supplier<RateLimitResult> attempt) {
        long deadline = System.nanoTime() + properties.getRateLimit().getAdmissionTimeout().toNanos();
        while (true) {
            RateLimitResult result = attempt.get();
            if (result.isAllowed()) {
                return true;
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            long waitMs = result.getWaitTime() != null ? Math.max(1, result.getWaitTime().toMillis()) : 50;
            if (remainingMs <= 0 || waitMs > remainingMs) {
                log.debug("[Gateway] Rate limit wait exceeds admission window: {}", result.getReason());
                return false;
            }
            try {
                Thread.sleep(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private ToolResult execute(InvocationContext context, ActionDefinition definition, Map<String, Object> params,
            GatewaySlot slot) {
        String action = definition.name();
        CredentialHandle handle = null;
        if (definition.requiresCredentials()) {
            try {
                handle = credentialBroker.resolve(context.sessionId());
            } catch (CredentialsMissingException e) {
                return ToolResult.denied(action, ErrorCode.CREDENTIALS_MISSING, e.getMessage(), e.getRemediation());
            }
        }

        boolean dryRun = context.mode() == InvocationMode.PREVIEW;
        CredentialHandle credentialHandle = handle;
        Future<Map<String, Object>> future = executor.submit(() -> {
            if (!slot.start()) {
                return Map.of();
            }
            try {
                if (credentialHandle == null) {
                    return redactor.redact(runHandler(definition, params, null, dryRun, context));
                }
                return credentialBroker.withCredential(credentialHandle, material -> {
                    List<String> literals = new ArrayList<>(material.secretValues());
                    try {
                        return redactor.redact(runHandler(definition, params, material, dryRun, context), literals);
                    } finally {
                        literals.clear();
                    }
                });
            } finally {
                slot.release();
            }
        });
        slot.handOff();

        Duration timeout = definition.shellClass() ? properties.getGateway().getShellTimeout()
                : properties.getGateway().getCloudTimeout();
        try {
            Map<String, Object> data = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Map<String, Object> summarized = ResultSummarizer.summarizeMap(data,
                    properties.getGateway().getMaxListItems(), properties.getGateway().getMaxOutputLength());
            return ToolResult.success(action, null, summarized);
        } catch (TimeoutException e) {
            abandon(future, slot);
            log.warn("[Gateway] Action '{}' timed out after {}s", action, timeout.toSeconds());
            return ToolResult.timeout(action, "Action '" + action + "' timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            abandon(future, slot);
            Thread.currentThread().interrupt();
            return ToolResult.failure(action, ErrorCode.CANCELLED, "Action '" + action + "' was interrupted",
                    "Retry the action");
        } catch (ExecutionException e) {
            return mapFailure(action, e.getCause() != null ? e.getCause() : e);
        }
    }

    // A running handler keeps its slot until it actually returns, even if it
    // ignores the interrupt.
    private void abandon(Future<?> future, GatewaySlot slot) {
        future.cancel(true);
        if (slot.abandonIfNotStarted()) {
            slot.release();
        }
    }

    private Map<String, Object> runHandler(ActionDefinition definition, Map<String, Object> params,
            CredentialMaterial material, boolean dryRun, InvocationContext context) {
        String region = ParameterSupport.optionalString(params, "region");
        if (region == null && material != null) {
            region = material.getRegion();
        }
        if (region == null) {
            region = properties.getWorkflow().getDefaultRegion();
        }
        ActionRequest request = new ActionRequest(definition.name(), params, region, dryRun, material,
                context.sessionId());
        Map<String, Object> data = definition.handler().handle(request);
        return data != null ? data : Map.of();
    }

    private ToolResult mapFailure(String action, Throwable error) {
        if (error instanceof ParameterValidationException validation) {
            return ToolResult.failure(action, ErrorCode.VALIDATION_ERROR, validation.getMessage(),
                    validation.getRemediation());
        }
        if (error instanceof CredentialsMissingException missing) {
            return ToolResult.denied(action, ErrorCode.CREDENTIALS_MISSING, missing.getMessage(),
                    missing.getRemediation());
        }
        if (error instanceof CloudProviderException provider) {
            String message = provider.getProviderCode() != null
                    ? provider.getProviderCode() + ": " + provider.getMessage()
                    : provider.getMessage();
            return ToolResult.failure(action, ErrorCode.TOOL_FAILURE, message,
                    RemediationAdvisor.forProviderError(provider)).toBuilder()
                    .providerCode(provider.getProviderCode())
                    .build();
        }
        if (error instanceof DeploymentException deployment) {
            return ToolResult.failure(action, deployment.getErrorCode(), deployment.getMessage(),
                    deployment.getRemediation());
        }
        log.error("[Gateway] Action '{}' failed", action, error);
        return ToolResult.failure(action, ErrorCode.TOOL_FAILURE,
                "Action '" + action + "' failed: " + safeCauseMessage(error),
                "Inspect the error and retry once the cause is fixed");
    }

    private ToolResult finish(InvocationContext context, String invocationId, String action,
            Map<String, Object> params, boolean confirm, Instant startedAt, long latencyMs, ToolResult raw) {
        ToolResult result = raw.toBuilder()
                .invocationId(invocationId)
                .error(redactor.redact(raw.getError()))
                .remediation(redactor.redact(raw.getRemediation()))
                .latencyMs(latencyMs)
                .build();
        result.setOutput(renderOutput(result));

        ToolInvocation invocation = ToolInvocation.builder()
                .id(invocationId)
                .sessionId(context.sessionId())
                .callerId(context.callerId())
                .stage(context.stage())
                .action(action)
                .params(redactor.redact(params))
                .confirmed(confirm)
                .dryRun(context.mode() == InvocationMode.PREVIEW)
                .outcome(result.getOutcome())
                .errorCode(result.getErrorCode())
                .outputSummary(ResultSummarizer.truncate(result.getOutput(), 500))
                .startedAt(startedAt)
                .latencyMs(latencyMs)
                .build();
        auditSink.record(invocation);
        auditSink.emit(AuditEvent.builder()
                .sessionId(context.sessionId())
                .kind(AuditEvent.Kind.TOOL_INVOCATION)
                .stage(context.stage())
                .tool(action)
                .status(AuditStatus.of(result.getOutcome()))
                .latencyMs(latencyMs)
                .errorCode(result.getErrorCode())
                .correlationId(invocationId)
                .detail(result.isSuccess() ? context.mode().name().toLowerCase(Locale.ROOT) : result.getError())
                .build());

        if (result.isSuccess()) {
            log.info("[Gateway] {} '{}' succeeded in {}ms", context.mode(), action, latencyMs);
        } else {
            log.info("[Gateway] {} '{}' {} ({}): {}", context.mode(), action, result.getOutcome(),
                    result.getErrorCode(), result.getError());
        }
        return result;
    }

    private String renderOutput(ToolResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isSuccess()) {
            body.put(STATUS, "success");
            body.put(ACTION, result.getAction());
            body.put("result", result.getData());
        } else {
            body.put(STATUS, "error");
            body.put(ACTION, result.getAction());
            body.put("message", result.getError());
        }
        try {
            return ResultSummarizer.truncate(objectMapper.writeValueAsString(body),
                    properties.getGateway().getMaxOutputLength());
        } catch (JsonProcessingException e) {
            log.warn("[Gateway] Failed to render output for '{}'", result.getAction(), e);
            return String.valueOf(body);
        }
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * One permit of the concurrency gate. The worker that runs the handler owns
     * it once handed off; the caller only frees it when the handler never started.
     */
    private final class GatewaySlot {

        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int ABANDONED = 2;

        private final AtomicInteger state = new AtomicInteger(PENDING);
        private final AtomicBoolean released = new AtomicBoolean();
        private volatile boolean handedOff;

        boolean start() {
            return state.compareAndSet(PENDING, RUNNING);
        }

        boolean abandonIfNotStarted() {
            return state.compareAndSet(PENDING, ABANDONED);
        }

        void handOff() {
            handedOff = true;
        }

        boolean isHandedOff() {
            return handedOff;
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                inFlight.decrementAndGet();
                concurrencyGate.release();
            }
        }
    }
}
