package me.golemcore.deploy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.deploy.adapter.inbound.web.dto.TelemetryResponse;
import me.golemcore.deploy.domain.gateway.ToolGateway;
import me.golemcore.deploy.domain.service.AuditSink;
import me.golemcore.deploy.domain.service.SessionManager;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.util.Map;

/**
 * Liveness and telemetry endpoints.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SystemController {

    private final AuditSink auditSink;
    private final ToolGateway toolGateway;
    private final SessionManager sessionManager;
    private final CloudProviderPort cloudProviderPort;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of("status", "ok")));
    }

    @GetMapping("/system/telemetry")
    public Mono<ResponseEntity<TelemetryResponse>> telemetry() {
        TelemetryResponse response = TelemetryResponse.builder()
                .auditDropped(auditSink.droppedCount())
                .auditPending(auditSink.pendingCount())
                .gatewayInFlight(toolGateway.getInFlight())
                .gatewayAvailablePermits(toolGateway.getAvailablePermits())
                .openSessions(sessionManager.all().size())
                .cloudProvider(cloudProviderPort.getProviderId())
                .cloudConfigured(cloudProviderPort.isConfigured())
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
