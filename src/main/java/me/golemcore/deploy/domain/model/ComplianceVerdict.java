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

import java.util.List;

/**
 * Deterministic result of evaluating one plan revision against policy.
 */
public record ComplianceVerdict(boolean approved, int revision, List<String> violations) {

    public static ComplianceVerdict approve(int revision) {
        return new ComplianceVerdict(true, revision, List.of());
    }

    public static ComplianceVerdict veto(int revision, List<String> violations) {
        return new ComplianceVerdict(false, revision, List.copyOf(violations));
    }

    public String reason() {
        return approved ? "approved" : String.join("; ", violations);
    }
}
