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

/**
 * Who is calling the tool gateway and from where. {@code stage} is null for
 * direct calls that bypass the workflow engine.
 */
@Builder
public record InvocationContext(String sessionId, String callerId, Stage stage, InvocationMode mode) {

    public InvocationContext {
        if (mode == null) {
            mode = InvocationMode.LIVE;
        }
    }

    public static InvocationContext direct(String sessionId, String callerId) {
        return new InvocationContext(sessionId, callerId, null, InvocationMode.LIVE);
    }

    public static InvocationContext of(DeploymentSession session, Stage stage, InvocationMode mode) {
        return new InvocationContext(session.getId(), session.getPrincipal(), stage, mode);
    }
}
