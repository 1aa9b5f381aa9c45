package me.golemcore.deploy.adapter.inbound.web.controller;

import me.golemcore.deploy.adapter.inbound.web.dto.TelemetryResponse;
import me.golemcore.deploy.domain.gateway.ToolGateway;
import me.golemcore.deploy.domain.service.AuditSink;
import me.golemcore.deploy.domain.service.SessionManager;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SystemControllerTest {

    private AuditSink auditSink;
    private ToolGateway toolGateway;
    private SessionManager sessionManager;
    private CloudProviderPort cloudProviderPort;
    private SystemController controller;

    @BeforeEach
    void setUp() {
        auditSink = mock(AuditSink.class);
        toolGateway = mock(ToolGateway.class);
        sessionManager = mock(SessionManager.class);
        cloudProviderPort = mock(CloudProviderPort.class);
        controller = new SystemController(auditSink, toolGateway, sessionManager, cloudProviderPort);
    }

    @Test
    void shouldReportHealth() {
        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals("ok", response.getBody().get("status")))
                .verifyComplete();
    }

    @Test
    void shouldReportTelemetry() {
        when(auditSink.droppedCount()).thenReturn(3L);
        when(auditSink.pendingCount()).thenReturn(7);
        when(toolGateway.getInFlight()).thenReturn(2);
        when(toolGateway.getAvailablePermits()).thenReturn(8);
        when(sessionManager.all()).thenReturn(List.of());
        when(cloudProviderPort.getProviderId()).thenReturn("sandbox");
        when(cloudProviderPort.isConfigured()).thenReturn(true);

        StepVerifier.create(controller.telemetry())
                .assertNext(response -> {
                    TelemetryResponse body = response.getBody();
                    assertEquals(3L, body.getAuditDropped());
                    assertEquals(7, body.getAuditPending());
                    assertEquals(2, body.getGatewayInFlight());
                    assertEquals(8, body.getGatewayAvailablePermits());
                    assertEquals(0, body.getOpenSessions());
                    assertEquals("sandbox", body.getCloudProvider());
                    assertTrue(body.isCloudConfigured());
                })
                .verifyComplete();
    }
}
