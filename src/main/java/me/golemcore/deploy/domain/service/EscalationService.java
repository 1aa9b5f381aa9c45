package me.golemcore.deploy.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.EscalationRecord;
import me.golemcore.deploy.port.outbound.StoragePort;
import me.golemcore.deploy.security.SecretRedactor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands a session over to a human operator. Each escalation is appended to
 * {@code escalations/<session>.jsonl} and emitted as an {@code ESCALATED}
 * audit event, which alert subscribers receive.
 */
@Service
@Slf4j
public class EscalationService implements SessionScopedState {

    private static final String DIRECTORY = "escalations";

    private final StoragePort storagePort;
    private final AuditSink auditSink;
    private final SecretRedactor redactor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, List<EscalationRecord>> bySession = new ConcurrentHashMap<>();

    public EscalationService(StoragePort storagePort, AuditSink auditSink, SecretRedactor redactor,
            ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.auditSink = auditSink;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public EscalationRecord raise(DeploymentSession session, ErrorCode errorCode, String reason,
            String remediation) {
        int revision = session.getActivePlan() != null ? session.getActivePlan().getRevision() : 0;
        EscalationRecord escalation = EscalationRecord.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .stage(session.getStage())
                .errorCode(errorCode)
                .reason(redactor.redact(reason))
                .remediation(redactor.redact(remediation))
                .planRevision(revision)
                .raisedAt(clock.instant())
                .build();
        bySession.computeIfAbsent(session.getId(), key -> new CopyOnWriteArrayList<>()).add(escalation);
        persist(escalation);
        auditSink.emit(AuditEvent.builder()
                .sessionId(session.getId())
                .kind(AuditEvent.Kind.ESCALATION)
                .stage(session.getStage())
                .status(AuditStatus.ESCALATED)
                .errorCode(errorCode)
                .correlationId(escalation.id())
                .detail(escalation.reason())
                .build());
        log.warn("[Escalation] Session {} escalated at {} ({}): {}", session.getId(), session.getStage(),
                errorCode, escalation.reason());
        return escalation;
    }

    public List<EscalationRecord> list(String sessionId) {
        return new ArrayList<>(bySession.getOrDefault(sessionId, List.of()));
    }

    @Override
    public void evictSession(String sessionId) {
        bySession.remove(sessionId);
    }

    private void persist(EscalationRecord escalation) {
        try {
            String json = objectMapper.writeValueAsString(escalation) + "\n";
            storagePort.appendText(DIRECTORY, safeName(escalation.sessionId()) + ".jsonl", json).join();
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - the audit event still carries it
            log.warn("[Escalation] Failed to persist escalation {}: {}", escalation.id(), e.getMessage());
        }
    }

    private static String safeName(String sessionId) {
        return sessionId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
