package me.golemcore.deploy.tools;

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

import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.gateway.ActionHandler;
import me.golemcore.deploy.domain.gateway.ActionProvider;
import me.golemcore.deploy.domain.gateway.ActionRequest;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.port.outbound.CloudProviderPort;

import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for action groups that talk to the cloud provider.
 */
abstract class CloudActionSupport implements ActionProvider {

    protected final CloudProviderPort cloud;

    protected CloudActionSupport(CloudProviderPort cloud) {
        this.cloud = cloud;
    }

    protected Map<String, Object> call(ActionRequest request, String service, String operation,
            Map<String, Object> params) {
        return cloud.call(new CloudProviderPort.CloudRequest(service, operation, request.region(), params,
                request.credentials(), request.dryRun()));
    }

    protected static ActionDefinition define(String name, ActionCategory category, StageCapability capability,
            String description, ActionHandler handler) {
        return ActionDefinition.builder()
                .name(name)
                .category(category)
                .capability(capability)
                .requiresCredentials(true)
                .description(description)
                .handler(handler)
                .build();
    }

    protected static ActionDefinition destructive(String name, ActionCategory category, boolean compensating,
            String description, ActionHandler handler) {
        return ActionDefinition.builder()
                .name(name)
                .category(category)
                .capability(StageCapability.MUTATE)
                .destructive(true)
                .compensating(compensating)
                .requiresCredentials(true)
                .description(description)
                .handler(handler)
                .build();
    }

    /**
     * Dry-run responses carry no resource data; handlers return them as a
     * preview instead of extracting fields.
     */
    protected static boolean isPreview(Map<String, Object> response) {
        return Boolean.TRUE.equals(response.get("DryRun"));
    }

    protected static Map<String, Object> preview(ActionRequest request, Map<String, Object> response) {
        return Map.of(
                "dry_run", true,
                "action", request.action(),
                "message", String.valueOf(response.getOrDefault("Message", "Request would have succeeded")));
    }

    @SuppressWarnings("unchecked")
    protected static List<Map<String, Object>> listOfMaps(Object value) {
        if (value instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> mapOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }
}
