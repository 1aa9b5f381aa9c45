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
import lombok.Data;

import java.util.Map;

/**
 * Result of one tool gateway call. Output and data are already redacted and
 * summarised when a result leaves the gateway.
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    private String invocationId;
    private String action;
    private InvocationOutcome outcome;
    private String output;
    private Map<String, Object> data;
    private ErrorCode errorCode;
    private String error;
    private String remediation;
    private String providerCode;
    private long latencyMs;

    public boolean isSuccess() {
        return outcome == InvocationOutcome.SUCCESS;
    }

    public static ToolResult success(String action, String output, Map<String, Object> data) {
        return ToolResult.builder()
                .action(action)
                .outcome(InvocationOutcome.SUCCESS)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(String action, ErrorCode errorCode, String error, String remediation) {
        return ToolResult.builder()
                .action(action)
                .outcome(InvocationOutcome.FAILURE)
                .errorCode(errorCode)
                .error(error)
                .remediation(remediation)
                .build();
    }

    public static ToolResult denied(String action, ErrorCode errorCode, String error, String remediation) {
        return ToolResult.builder()
                .action(action)
                .outcome(InvocationOutcome.DENIED)
                .errorCode(errorCode)
                .error(error)
                .remediation(remediation)
                .build();
    }

    public static ToolResult timeout(String action, String error) {
        return ToolResult.builder()
                .action(action)
                .outcome(InvocationOutcome.TIMEOUT)
                .errorCode(ErrorCode.TIMEOUT)
                .error(error)
                .remediation("Retry the action; if it keeps timing out, check the target service health")
                .build();
    }
}
