package me.golemcore.deploy.domain.service;

import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.AuditStorePort;
import me.golemcore.deploy.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AlertNotifierTest {

    private AuditSink auditSink;
    private AlertNotifier notifier;

    @BeforeEach
    void setUp() {
        auditSink = new AuditSink(mock(AuditStorePort.class), new DeployProperties(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        notifier = new AlertNotifier(auditSink);
        notifier.register();
    }

    @Test
    void shouldCountFailuresVetoesAndEscalations() {
        auditSink.emit(event(Stage.EXECUTION, AuditStatus.FAILURE, ErrorCode.TOOL_FAILURE));
        auditSink.emit(event(Stage.COMPLIANCE_REVIEW, AuditStatus.VETO, ErrorCode.COMPLIANCE_VETO));
        auditSink.emit(event(Stage.ROLLBACK, AuditStatus.ESCALATED, ErrorCode.ROLLBACK_FAILURE));

        assertEquals(3, notifier.getAlertCount());
    }

    @Test
    void shouldIgnoreSuccessfulEvents() {
        auditSink.emit(event(Stage.EXECUTION, AuditStatus.SUCCESS, null));

        assertEquals(0, notifier.getAlertCount());
    }

    private static AuditEvent event(Stage stage, AuditStatus status, ErrorCode errorCode) {
        return AuditEvent.builder()
                .sessionId("s1")
                .kind(AuditEvent.Kind.TOOL_INVOCATION)
                .stage(stage)
                .tool("launch_ec2")
                .status(status)
                .errorCode(errorCode)
                .build();
    }
}
