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

import java.util.Map;

/**
 * Executes one catalog action and returns its structured result. Validation
 * problems are reported as
 * {@link me.golemcore.deploy.domain.model.ParameterValidationException},
 * provider errors as
 * {@link me.golemcore.deploy.domain.model.CloudProviderException}.
 */
@FunctionalInterface
public interface ActionHandler {

    Map<String, Object> handle(ActionRequest request);
}
