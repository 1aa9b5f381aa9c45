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

import me.golemcore.deploy.domain.model.CloudProviderException;

import java.util.Locale;

/**
 * Maps provider error codes to an actionable hint for the user.
 */
public final class RemediationAdvisor {

    private RemediationAdvisor() {
    }

    public static String forProviderError(CloudProviderException error) {
        String code = error.getProviderCode() != null ? error.getProviderCode() : "";
        String lower = code.toLowerCase(Locale.ROOT);
        String operation = error.getOperation() != null ? error.getOperation() : "the failing operation";
        if (lower.contains("accessdenied") || lower.contains("unauthorized") || lower.contains("forbidden")) {
            return "Grant the deployment principal IAM permission for " + operation + " and retry";
        }
        if (lower.contains("limitexceeded") || lower.contains("quota") || lower.contains("insufficient")) {
            return "Request a service quota increase or reduce the requested capacity for " + operation;
        }
        if (lower.contains("throttl") || lower.contains("requestlimit")) {
            return "The provider throttled the request; wait a moment and retry";
        }
        if (lower.contains("notfound") || lower.contains("nosuch")) {
            return "Check that the referenced resource exists in the selected region";
        }
        if (lower.contains("alreadyexists") || lower.contains("alreadyowned") || lower.contains("inuse")) {
            return "Choose a different name or reuse the existing resource";
        }
        if (lower.contains("invalid") || lower.contains("validation") || lower.contains("malformed")) {
            return "Correct the parameters reported by the provider and retry";
        }
        return "Inspect the provider error and retry once the cause is fixed";
    }
}
