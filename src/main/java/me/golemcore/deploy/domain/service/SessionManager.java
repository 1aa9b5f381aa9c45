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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.ConversationTurn;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.SessionSnapshot;
import me.golemcore.deploy.domain.model.SessionSnapshot.Readiness;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.security.InputSanitizer;
import me.golemcore.deploy.security.SecretRedactor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns deployment sessions and their bounded conversation windows. Turns are
 * sanitised and redacted before they are kept, so credential material never
 * reaches the conversational buffer.
 */
@Service
@Slf4j
public class SessionManager {

    private final CredentialBroker credentialBroker;
    private final InputSanitizer inputSanitizer;
    private final SecretRedactor redactor;
    private final DeployProperties properties;
    private final Clock clock;
    private final Map<String, DeploymentSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(CredentialBroker credentialBroker, InputSanitizer inputSanitizer, SecretRedactor redactor,
            DeployProperties properties, Clock clock) {
        this.credentialBroker = credentialBroker;
        this.inputSanitizer = inputSanitizer;
        this.redactor = redactor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Return the session with {@code sessionId}, creating it when absent. A
     * blank id creates a new session with a random id.
     */
    public DeploymentSession open(String sessionId, String principal) {
        String id = sessionId != null && !sessionId.isBlank() ? sessionId.trim() : UUID.randomUUID().toString();
        String owner = principal != null && !principal.isBlank()
                ? principal.trim()
                : properties.getSession().getDefaultPrincipal();
        return sessions.computeIfAbsent(id, key -> {
            credentialBroker.bindSession(key, owner);
            log.info("[Session] Opened session {} for principal {}", key, owner);
            return new DeploymentSession(key, owner, clock.instant(), properties.getSession().getTurnWindow());
        });
    }

    public Optional<DeploymentSession> get(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    public Collection<DeploymentSession> all() {
        return List.copyOf(sessions.values());
    }

    /**
     * Sessions without a conversation turn for longer than {@code idleTimeout}.
     */
    public List<DeploymentSession> idle(Duration idleTimeout) {
        Instant cutoff = clock.instant().minus(idleTimeout);
        return sessions.values().stream()
                .filter(session -> session.getUpdatedAt().isBefore(cutoff))
                .toList();
    }

    public ConversationTurn appendTurn(DeploymentSession session, ConversationTurn.Role role, String content) {
        String text = role == ConversationTurn.Role.USER ? inputSanitizer.sanitize(content) : content;
        ConversationTurn turn = ConversationTurn.builder()
                .role(role)
                .content(redactor.redact(text))
                .stage(session.getStage())
                .timestamp(clock.instant())
                .build();
        session.addTurn(turn);
        return turn;
    }

    public boolean close(String sessionId) {
        DeploymentSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("[Session] Closed session {}", sessionId);
        }
        return removed != null;
    }

    public SessionSnapshot describe(DeploymentSession session, boolean running) {
        Plan plan = session.getActivePlan();
        return SessionSnapshot.builder()
                .sessionId(session.getId())
                .principal(session.getPrincipal())
                .stage(session.getStage())
                .readiness(readiness(session, running))
                .planRevision(plan != null ? plan.getRevision() : null)
                .complianceState(plan != null ? plan.getComplianceState() : null)
                .complianceFindings(plan != null ? new ArrayList<>(plan.getComplianceFindings()) : List.of())
                .dryRunPassed(plan != null && plan.isDryRunPassed())
                .awaitingConfirmation(session.isAwaitingConfirmation())
                .confirmationDeadline(session.getConfirmationDeadline())
                .missingFields(session.getStage() == Stage.INTAKE ? session.getIntent().missingFields() : List.of())
                .turnCount(session.getTurnCount())
                .lastErrorCode(session.getLastErrorCode())
                .lastError(session.getLastError())
                .remediation(session.getLastRemediation())
                .deploymentId(session.getDeploymentId())
                .updatedAt(session.getUpdatedAt())
                .build();
    }

    static Readiness readiness(DeploymentSession session, boolean running) {
        if (running) {
            return Readiness.RUNNING;
        }
        if (session.getStage() == Stage.FAILED) {
            return Readiness.FAILED;
        }
        if (session.getStage() == Stage.CLOSURE) {
            return Readiness.CLOSED;
        }
        if (session.isAwaitingConfirmation()) {
            return Readiness.AWAITING_CONFIRMATION;
        }
        if (session.getStage() == Stage.INTAKE || session.getStage() == Stage.PLAN_DRAFT) {
            return Readiness.AWAITING_INPUT;
        }
        return Readiness.READY;
    }
}
