package me.golemcore.deploy.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered deployment steps for one session, versioned by revision.
 *
 * <p>
 * The revision only moves forward when the step content changes. Compliance
 * verdict, dry-run result and user confirmation all belong to a single revision
 * and are reset on revise. Once execution starts the plan is locked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String id;
    private String sessionId;

    @Builder.Default
    private int revision = 1;

    private String fingerprint;

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();

    @Builder.Default
    private ComplianceState complianceState = ComplianceState.PENDING;

    @Builder.Default
    private List<String> complianceFindings = new ArrayList<>();

    private int vetoCount;
    private boolean escalated;
    private ComplianceOverride override;

    private DryRunResult dryRun;
    private boolean confirmed;
    private boolean locked;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Replace the steps when their content differs from the current revision.
     *
     * @return true when a new revision was created
     */
    public boolean revise(List<PlanStep> newSteps, String newFingerprint, Instant now) {
        if (locked) {
            throw new IllegalStateException("Plan " + id + " is locked for execution");
        }
        if (Objects.equals(fingerprint, newFingerprint)) {
            return false;
        }
        revision++;
        fingerprint = newFingerprint;
        steps = new ArrayList<>(newSteps);
        complianceState = ComplianceState.PENDING;
        complianceFindings = new ArrayList<>();
        vetoCount = 0;
        escalated = false;
        override = null;
        dryRun = null;
        confirmed = false;
        updatedAt = now;
        return true;
    }

    public boolean hasDestructiveSteps() {
        return steps.stream().anyMatch(PlanStep::isDestructive);
    }

    public boolean isDryRunPassed() {
        return dryRun != null && dryRun.isSuccess() && dryRun.getRevision() == revision;
    }

    /**
     * Guard for entering Execution: approved by compliance, dry run passed on this
     * very revision, and confirmed by the user when destructive.
     */
    public boolean isReadyForExecution() {
        return complianceState == ComplianceState.APPROVED
                && isDryRunPassed()
                && (confirmed || !hasDestructiveSteps());
    }

    public boolean hasOverrideForCurrentRevision() {
        return override != null && override.getRevision() == revision;
    }

    public List<PlanStep> mutatingSteps() {
        return steps.stream().filter(step -> step.getKind() != StepKind.VALIDATE).toList();
    }

    public List<PlanStep> validationSteps() {
        return steps.stream().filter(step -> step.getKind() == StepKind.VALIDATE).toList();
    }

    /**
     * True once any live step changed cloud state.
     */
    public boolean isMutationCommitted() {
        return mutatingSteps().stream()
                .anyMatch(step -> step.getStatus() == PlanStep.StepStatus.COMPLETED);
    }

    public void lock() {
        this.locked = true;
    }

    /**
     * Human operator decision that lets a vetoed revision pass compliance.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ComplianceOverride {
        private int revision;
        private String operator;
        private String reason;
        private Instant decidedAt;
    }
}
