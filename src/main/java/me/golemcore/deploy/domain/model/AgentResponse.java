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

import java.util.ArrayList;
import java.util.List;

/**
 * Reply produced for one user turn: the final answer plus the trail of stage
 * work done while producing it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private String sessionId;
    private String finalAnswer;
    private Stage stage;
    private ErrorCode errorCode;
    private String remediation;
    private boolean awaitingConfirmation;

    @Builder.Default
    private List<ThoughtStep> thoughtProcess = new ArrayList<>();

    @Builder
    public record ThoughtStep(Stage stage, String thought, String action, String observation) {
    }
}
