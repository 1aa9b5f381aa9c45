package me.golemcore.deploy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.adapter.inbound.web.dto.ComplianceOverrideRequest;
import me.golemcore.deploy.domain.model.AgentResponse;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.EscalationRecord;
import me.golemcore.deploy.domain.model.SessionSnapshot;
import me.golemcore.deploy.domain.service.AuditSink;
import me.golemcore.deploy.domain.service.EscalationService;
import me.golemcore.deploy.domain.service.SessionManager;
import me.golemcore.deploy.domain.service.SessionRunCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Session inspection and operator controls.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private final SessionRunCoordinator sessionRunCoordinator;
    private final SessionManager sessionManager;
    private final AuditSink auditSink;
    private final EscalationService escalationService;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSnapshot>>> listSessions() {
        List<SessionSnapshot> snapshots = sessionManager.all().stream()
                .map(session -> sessionManager.describe(session, sessionRunCoordinator.isRunning(session.getId())))
                .sorted(Comparator.comparing(SessionSnapshot::updatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        return Mono.just(ResponseEntity.ok(snapshots));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionSnapshot>> getSession(@PathVariable String id) {
        SessionSnapshot snapshot = sessionRunCoordinator.describe(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found"));
        return Mono.just(ResponseEntity.ok(snapshot));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> closeSession(@PathVariable String id) {
        if (!sessionRunCoordinator.close(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        log.info("[API] Session {} closed", id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<AgentResponse>> cancel(@PathVariable String id) {
        return Mono.defer(() -> Mono.fromFuture(sessionRunCoordinator.cancel(id)))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/compliance-override")
    public Mono<ResponseEntity<AgentResponse>> overrideCompliance(@PathVariable String id,
            @RequestBody ComplianceOverrideRequest request) {
        log.info("[API] Compliance override requested for session {} by {}", id, request.getOperator());
        return Mono.defer(() -> Mono.fromFuture(
                sessionRunCoordinator.overrideCompliance(id, request.getOperator(), request.getReason())))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/audit")
    public Mono<ResponseEntity<List<AuditEvent>>> audit(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(auditSink.events(id)));
    }

    @GetMapping("/{id}/escalations")
    public Mono<ResponseEntity<List<EscalationRecord>>> escalations(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(escalationService.list(id)));
    }
}
