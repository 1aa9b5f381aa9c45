package me.golemcore.deploy.adapter.outbound.audit;

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
import lombok.RequiredArgsConstructor;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.ToolInvocation;
import me.golemcore.deploy.port.outbound.AuditStorePort;
import me.golemcore.deploy.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends audit events to {@code audit/<session>.events.jsonl} and tool
 * invocations to {@code audit/<session>.invocations.jsonl}. Write failures
 * propagate so the audit sink can retry.
 */
@Component
@RequiredArgsConstructor
public class JsonlAuditStoreAdapter implements AuditStorePort {

    private static final String DIRECTORY = "audit";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public void appendEvents(List<AuditEvent> events) {
        Map<String, StringBuilder> bySession = new LinkedHashMap<>();
        for (AuditEvent event : events) {
            bySession.computeIfAbsent(event.sessionId(), key -> new StringBuilder())
                    .append(toJson(event)).append('\n');
        }
        for (Map.Entry<String, StringBuilder> entry : bySession.entrySet()) {
            storagePort.appendText(DIRECTORY, safeName(entry.getKey()) + ".events.jsonl", entry.getValue().toString())
                    .join();
        }
    }

    @Override
    public void appendInvocation(ToolInvocation invocation) {
        storagePort.appendText(DIRECTORY, safeName(invocation.sessionId()) + ".invocations.jsonl",
                toJson(invocation) + "\n").join();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit entry", e);
        }
    }

    static String safeName(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return "unscoped";
        }
        return sessionId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
