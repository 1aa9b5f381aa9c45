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
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.ComplianceState;
import me.golemcore.deploy.domain.model.ComplianceVerdict;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;

/**
 * Compliance review of plan revisions.
 *
 * <p>
 * {@link #evaluate(Plan)} is a pure policy check. {@link #review} applies the
 * verdict to the plan, counts vetoes per revision and escalates once the
 * count reaches {@code deploy.workflow.veto-escalation-threshold}. A vetoed
 * revision only passes after an operator override.
 */
@Service
@Slf4j
public class ComplianceService {

    private final CompliancePolicy policy;
    private final EscalationService escalationService;
    private final AuditSink auditSink;
    private final DeployProperties properties;
    private final Clock clock;

    public ComplianceService(CompliancePolicy policy, EscalationService escalationService, AuditSink auditSink,
            DeployProperties properties, Clock clock) {
        this.policy = policy;
        this.escalationService = escalationService;
        this.auditSink = auditSink;
        this.properties = properties;
        this.clock = clock;
    }

    public ComplianceVerdict evaluate(Plan plan) {
        if (plan.hasOverrideForCurrentRevision()) {
            return ComplianceVerdict.approve(plan.getRevision());
        }
        return policy.evaluate(plan);
    }

    public ComplianceVerdict review(DeploymentSession session, Plan plan) {
        ComplianceVerdict verdict = evaluate(plan);
        if (verdict.approved()) {
            plan.setComplianceState(ComplianceState.APPROVED);
            plan.setComplianceFindings(new ArrayList<>());
            emit(session, AuditStatus.SUCCESS, null, plan.hasOverrideForCurrentRevision()
                    ? "approved by operator override (" + plan.getOverride().getOperator() + ")"
                    : "approved revision " + plan.getRevision());
            log.info("[Compliance] Session {} plan revision {} approved", session.getId(), plan.getRevision());
            return verdict;
        }

        plan.setComplianceState(ComplianceState.REJECTED);
        plan.setComplianceFindings(new ArrayList<>(verdict.violations()));
        plan.setVetoCount(plan.getVetoCount() + 1);
        emit(session, AuditStatus.VETO, ErrorCode.COMPLIANCE_VETO, verdict.reason());
        log.info("[Compliance] Session {} plan revision {} vetoed ({} of {}): {}", session.getId(),
                plan.getRevision(), plan.getVetoCount(), threshold(), verdict.reason());

        if (!plan.isEscalated() && plan.getVetoCount() >= threshold()) {
            plan.setEscalated(true);
            escalationService.raise(session, ErrorCode.COMPLIANCE_VETO,
                    "Plan revision " + plan.getRevision() + " vetoed " + plan.getVetoCount() + " times: "
                            + verdict.reason(),
                    "An operator must approve an override or the request must be amended");
        }
        return verdict;
    }

    /**
     * Explicit human decision letting the current, vetoed revision pass.
     */
    public void override(DeploymentSession session, String operator, String reason) {
        Plan plan = session.getActivePlan();
        if (plan == null || plan.getComplianceState() != ComplianceState.REJECTED) {
            throw new DeploymentException(ErrorCode.VALIDATION_ERROR,
                    "Session " + session.getId() + " has no vetoed plan to override",
                    "Overrides apply only after a compliance veto");
        }
        if (operator == null || operator.isBlank() || reason == null || reason.isBlank()) {
            throw new DeploymentException(ErrorCode.VALIDATION_ERROR, "Operator and reason are required",
                    "Provide the approving operator and a justification");
        }
        plan.setOverride(Plan.ComplianceOverride.builder()
                .revision(plan.getRevision())
                .operator(operator)
                .reason(reason)
                .decidedAt(clock.instant())
                .build());
        plan.setComplianceState(ComplianceState.PENDING);
        log.warn("[Compliance] Operator {} overrode veto of session {} revision {}: {}", operator,
                session.getId(), plan.getRevision(), reason);
    }

    private int threshold() {
        return Math.max(1, properties.getWorkflow().getVetoEscalationThreshold());
    }

    private void emit(DeploymentSession session, AuditStatus status, ErrorCode errorCode, String detail) {
        auditSink.emit(AuditEvent.builder()
                .sessionId(session.getId())
                .kind(AuditEvent.Kind.COMPLIANCE_VERDICT)
                .stage(Stage.COMPLIANCE_REVIEW)
                .status(status)
                .errorCode(errorCode)
                .correlationId(session.getActivePlan() != null ? session.getActivePlan().getId() : null)
                .detail(detail)
                .build());
    }
}
