package me.golemcore.deploy.port.outbound;

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
 * Port to the cloud control plane. Each call names a service and operation in
 * the provider's own vocabulary and returns the raw response as a map.
 * Provider-side errors surface as
 * {@link me.golemcore.deploy.domain.model.CloudProviderException}.
 */
public interface CloudProviderPort {

    String getProviderId();

    boolean isConfigured();

    Map<String, Object> call(CloudRequest request);

    /**
     * @param dryRun
     *            validate permissions and parameters without changing state
     */
    record CloudRequest(
            String service,
            String operation,
            String region,
            Map<String, Object> params,
            CredentialMaterial credentials,
            boolean dryRun) {
    }
}
