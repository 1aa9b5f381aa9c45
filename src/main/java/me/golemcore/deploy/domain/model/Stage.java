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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Workflow stages of a deployment session. Each stage carries the fixed set of
 * capabilities the tool gateway admits while a session sits in it.
 */
public enum Stage {

    INTAKE(EnumSet.of(StageCapability.CONVERSE)),
    CONTEXT_SYNC(EnumSet.of(StageCapability.CONVERSE, StageCapability.READ_ONLY)),
    PREFLIGHT(EnumSet.of(StageCapability.READ_ONLY, StageCapability.BUILD_CHECK)),
    PLAN_DRAFT(EnumSet.of(StageCapability.CONVERSE, StageCapability.READ_ONLY)),
    COMPLIANCE_REVIEW(EnumSet.of(StageCapability.CONVERSE)),
    DRY_RUN(EnumSet.of(StageCapability.READ_ONLY, StageCapability.PREVIEW)),
    EXECUTION(EnumSet.of(StageCapability.READ_ONLY, StageCapability.MUTATE, StageCapability.INVOKE,
            StageCapability.BUILD_CHECK)),
    VALIDATION(EnumSet.of(StageCapability.READ_ONLY, StageCapability.INVOKE)),
    ROLLBACK(EnumSet.of(StageCapability.READ_ONLY, StageCapability.COMPENSATE)),
    CLOSURE(EnumSet.of(StageCapability.CONVERSE)),
    FAILED(EnumSet.of(StageCapability.CONVERSE));

    private final Set<StageCapability> capabilities;

    Stage(EnumSet<StageCapability> capabilities) {
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public Set<StageCapability> getCapabilities() {
        return capabilities;
    }

    public boolean permits(StageCapability capability) {
        return capabilities.contains(capability);
    }

    public boolean isTerminal() {
        return this == CLOSURE || this == FAILED;
    }

    /**
     * Stages whose gateway calls are charged against the per-session planning
     * budget.
     */
    public boolean isPlanning() {
        return this == CONTEXT_SYNC || this == PREFLIGHT || this == PLAN_DRAFT || this == COMPLIANCE_REVIEW;
    }
}
