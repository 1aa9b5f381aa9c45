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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted summary of a finished deployment. Holds a hash of the repository
 * reference, never the reference itself, and a sanitised configuration
 * snapshot. Records expire after the configured retention period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentRecord {

    private String id;
    private String sessionId;
    private DeploymentTarget target;
    private String region;
    private String repoReferenceHash;
    private Status status;
    private int planRevision;
    private String summary;

    @Builder.Default
    private Map<String, Object> configSnapshot = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public enum Status {
        SUCCEEDED, FAILED, ROLLED_BACK
    }
}
