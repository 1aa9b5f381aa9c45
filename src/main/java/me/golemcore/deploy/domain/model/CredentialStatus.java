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

import lombok.Builder;

import java.time.Instant;

/**
 * Non-secret view of whether credentials are stored for a principal.
 */
@Builder
public record CredentialStatus(String status, Instant updatedAt, String accessKeyLastFour, String source) {

    public static final String PRESENT = "present";
    public static final String MISSING = "missing";

    public boolean isPresent() {
        return PRESENT.equals(status);
    }

    public static CredentialStatus missing() {
        return new CredentialStatus(MISSING, null, null, null);
    }
}
