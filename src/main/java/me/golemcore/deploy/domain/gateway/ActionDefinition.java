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

import lombok.Builder;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.StageCapability;

/**
 * Catalog entry for one action.
 *
 * @param capability
 *            what a stage must permit to run the action live
 * @param destructive
 *            requires {@code confirm=true}
 * @param compensating
 *            may be issued while rolling back
 * @param shellClass
 *            local process execution, bounded by the shell timeout
 */
@Builder
public record ActionDefinition(
        String name,
        ActionCategory category,
        StageCapability capability,
        boolean destructive,
        boolean compensating,
        boolean shellClass,
        boolean requiresCredentials,
        String description,
        ActionHandler handler) {
}
