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
 * Action parameters failed validation before any cloud call was made.
 */
public class ParameterValidationException extends DeploymentException {

    private static final long serialVersionUID = 1L;

    public ParameterValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message, "Fix the parameter and retry");
    }

    public ParameterValidationException(String message, String remediation) {
        super(ErrorCode.VALIDATION_ERROR, message, remediation);
    }
}
