package me.golemcore.deploy.adapter.outbound.cloud;

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

import me.golemcore.deploy.domain.model.CloudProviderException;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Placeholder provider used when {@code deploy.cloud.provider=none}: every
 * call fails with an explanation instead of reaching a real account.
 */
@Component
@ConditionalOnProperty(prefix = "deploy.cloud", name = "provider", havingValue = "none")
public class UnconfiguredCloudProviderAdapter implements CloudProviderPort {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public boolean isConfigured() {
        return false;
    }

    @Override
    public Map<String, Object> call(CloudRequest request) {
        throw new CloudProviderException("ProviderNotConfigured", request.operation(),
                "No cloud provider is configured; set deploy.cloud.provider to enable " + request.service()
                        + " calls");
    }
}
