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

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a session exposed to the transport layer.
 */
@Builder
public record SessionSnapshot(
        String sessionId,
        String principal,
        Stage stage,
        Readiness readiness,
        Integer planRevision,
        ComplianceState complianceState,
        List<String> complianceFindings,
        boolean dryRunPassed,
        boolean awaitingConfirmation,
        Instant confirmationDeadline,
        List<String> missingFields,
        int turnCount,
        ErrorCode lastErrorCode,
        String lastError,
        String remediation,
        String deploymentId,
        Instant updatedAt) {

    public enum Readiness {
        READY,
        AWAITING_INPUT,
        AWAITING_CONFIRMATION,
        RUNNING,
        CLOSED,
        FAILED
    }
}
