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

/**
 * Base failure carrying a stable error code and a remediation hint for the
 * user.
 */
public class DeploymentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final String remediation;

    public DeploymentException(ErrorCode errorCode, String message, String remediation) {
        super(message);
        this.errorCode = errorCode;
        this.remediation = remediation;
    }

    public DeploymentException(ErrorCode errorCode, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.remediation = remediation;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getRemediation() {
        return remediation;
    }
}
