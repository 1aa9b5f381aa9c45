package me.golemcore.deploy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.adapter.inbound.web.dto.ActionInvocationRequest;
import me.golemcore.deploy.domain.gateway.ActionCatalog;
import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.gateway.ToolGateway;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.InvocationContext;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.ToolResult;
import me.golemcore.deploy.domain.service.CredentialBroker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic action entry point. Calls go through the tool gateway with no
 * workflow stage, so the confirmation gate, rate limits and audit still apply.
 */
@RestController
@RequestMapping("/api/actions")
@RequiredArgsConstructor
@Slf4j
public class ActionsController {

    private static final String DIRECT_SESSION_PREFIX = "direct:";

    private final ToolGateway toolGateway;
    private final ActionCatalog actionCatalog;
    private final CredentialBroker credentialBroker;

    @GetMapping
    public Mono<ResponseEntity<List<Map<String, Object>>>> listActions() {
        List<Map<String, Object>> actions = actionCatalog.definitions().stream()
                .map(ActionsController::describe)
                .toList();
        return Mono.just(ResponseEntity.ok(actions));
    }

    @PostMapping
    public Mono<ResponseEntity<ToolResult>> invoke(@RequestBody ActionInvocationRequest request) {
        if (request.getAction() == null || request.getAction().isBlank()) {
            return Mono.error(new ParameterValidationException("action is required",
                    "Name one of the actions listed by GET /api/actions"));
        }
        String principal = request.getPrincipal();
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : DIRECT_SESSION_PREFIX + (principal != null ? principal : "anonymous");
        if (!credentialBroker.claimSession(sessionId, principal)) {
            log.warn("[API] Direct action {} refused: session {} belongs to another principal",
                    request.getAction(), sessionId);
            return Mono.error(new DeploymentException(ErrorCode.CAPABILITY_DENIED,
                    "Session " + sessionId + " belongs to another principal",
                    "Omit session_id or use a session opened by the same principal"));
        }
        log.debug("[API] Direct action {} for session {}", request.getAction(), sessionId);

        InvocationContext context = InvocationContext.direct(sessionId, principal != null ? principal : sessionId);
        return Mono.fromCallable(() -> toolGateway.invoke(context, request.getAction().trim(), request.getParams(),
                request.isConfirm()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static Map<String, Object> describe(ActionDefinition definition) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", definition.name());
        entry.put("category", definition.category());
        entry.put("capability", definition.capability());
        entry.put("destructive", definition.destructive());
        entry.put("description", definition.description());
        return entry;
    }
}
