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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.DeploymentIntent;
import me.golemcore.deploy.domain.model.DeploymentRecord;
import me.golemcore.deploy.domain.model.DeploymentSession;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.StoragePort;
import me.golemcore.deploy.security.SecretRedactor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists deployment summaries as {@code deployments/<id>.json}. The
 * repository reference is stored as a SHA-256 hash and the configuration
 * snapshot passes through the secret redactor.
 */
@Service
@Slf4j
public class DeploymentRecordService {

    private static final String DIRECTORY = "deployments";
    private static final String EXTENSION = ".json";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final SecretRedactor redactor;
    private final ObjectMapper objectMapper;
    private final DeployProperties properties;
    private final Clock clock;

    public DeploymentRecordService(StoragePort storagePort, SecretRedactor redactor, ObjectMapper objectMapper,
            DeployProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public DeploymentRecord record(DeploymentSession session, Plan plan, DeploymentRecord.Status status,
            String summary) {
        DeploymentIntent intent = session.getIntent();
        Instant now = clock.instant();
        DeploymentRecord deployment = DeploymentRecord.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .target(intent.getTarget())
                .region(intent.getRegion())
                .repoReferenceHash(repoReferenceHash(intent))
                .status(status)
                .planRevision(plan != null ? plan.getRevision() : 0)
                .summary(redactor.redact(summary))
                .configSnapshot(snapshot(intent, plan))
                .createdAt(now)
                .expiresAt(now.plus(properties.getDeployments().getRetention()))
                .build();
        try {
            storagePort.putTextAtomic(DIRECTORY, deployment.getId() + EXTENSION,
                    objectMapper.writeValueAsString(deployment)).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize deployment record", e);
        }
        session.setDeploymentId(deployment.getId());
        log.info("[Deployments] Recorded {} deployment {} for session {}", status, deployment.getId(),
                session.getId());
        return deployment;
    }

    public Optional<DeploymentRecord> find(String id) {
        if (id == null || !id.matches("[A-Za-z0-9-]+")) {
            return Optional.empty();
        }
        return load(id + EXTENSION);
    }

    public List<DeploymentRecord> list() {
        List<DeploymentRecord> records = new ArrayList<>();
        for (String file : storagePort.listObjects(DIRECTORY, "").join()) {
            if (file.endsWith(EXTENSION)) {
                load(file).ifPresent(records::add);
            }
        }
        records.sort(Comparator.comparing(DeploymentRecord::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return records;
    }

    /**
     * Delete records whose retention window has passed.
     *
     * @return number of deleted records
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (DeploymentRecord deployment : list()) {
            if (deployment.isExpired(now)) {
                storagePort.deleteObject(DIRECTORY, deployment.getId() + EXTENSION).join();
                purged++;
            }
        }
        if (purged > 0) {
            log.info("[Retention] Purged {} expired deployment records", purged);
        }
        return purged;
    }

    static String repoReferenceHash(DeploymentIntent intent) {
        if (intent.getRepoUrl() == null) {
            return HashSupport.sha256Hex(intent.getLocalPath());
        }
        String branch = intent.getBranch() != null ? intent.getBranch() : "";
        return HashSupport.sha256Hex(intent.getRepoUrl() + "#" + branch);
    }

    private Map<String, Object> snapshot(DeploymentIntent intent, Plan plan) {
        Map<String, Object> config = new LinkedHashMap<>(objectMapper.convertValue(intent, MAP_TYPE));
        config.remove("repoUrl");
        config.remove("branch");
        config.remove("localPath");
        config.values().removeIf(value -> value == null);
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("intent", config);
        if (plan != null) {
            List<Map<String, Object>> steps = new ArrayList<>();
            for (PlanStep step : plan.getSteps()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", step.getId());
                entry.put("action", step.getAction());
                entry.put("status", step.getStatus());
                steps.add(entry);
            }
            snapshot.put("steps", steps);
        }
        return redactor.redact(snapshot);
    }

    private Optional<DeploymentRecord> load(String file) {
        try {
            String json = storagePort.getText(DIRECTORY, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, DeploymentRecord.class));
        } catch (IOException e) {
            log.warn("[Deployments] Skipping unreadable record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
