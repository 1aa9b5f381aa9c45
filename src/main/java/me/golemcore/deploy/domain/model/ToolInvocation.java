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
import java.util.Map;

/**
 * Immutable record of one gateway call, written exactly once per call.
 * Parameters and output summary are stored redacted.
 */
@Builder
public record ToolInvocation(
        String id,
        String sessionId,
        String callerId,
        Stage stage,
        String action,
        Map<String, Object> params,
        boolean confirmed,
        boolean dryRun,
        InvocationOutcome outcome,
        ErrorCode errorCode,
        String outputSummary,
        Instant startedAt,
        long latencyMs) {
}
