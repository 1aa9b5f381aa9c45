package me.golemcore.deploy.domain.gateway;

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

import me.golemcore.deploy.domain.model.CredentialMaterial;

import java.util.Map;

/**
 * Everything a handler sees for one call. {@code credentials} is null for
 * actions that do not talk to the cloud.
 */
public record ActionRequest(
        String action,
        Map<String, Object> params,
        String region,
        boolean dryRun,
        CredentialMaterial credentials,
        String sessionId) {
}
