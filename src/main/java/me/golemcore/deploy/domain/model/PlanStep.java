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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ordered step of a deployment plan, bound to a catalog action.
 *
 * <p>
 * {@code bindings} maps a parameter name to {@code "<stepId>.<resultKey>"}; the
 * value is filled from an earlier step's result when the step runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlanStep {

    private String id;
    private StepKind kind;
    private String action;
    private String description;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> bindings = new LinkedHashMap<>();

    private boolean destructive;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    @Builder.Default
    private Map<String, Object> result = new LinkedHashMap<>();

    private String error;

    public enum StepStatus {
        PENDING, COMPLETED, FAILED, COMPENSATED
    }
}
