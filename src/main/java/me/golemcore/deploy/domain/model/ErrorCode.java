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
 * Stable error codes surfaced to callers, audit events and API responses.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    CONFIRMATION_REQUIRED,
    COMPLIANCE_VETO,
    CREDENTIALS_MISSING,
    TOOL_FAILURE,
    TIMEOUT,
    ROLLBACK_FAILURE,
    UNSUPPORTED_ACTION,
    RATE_LIMITED,
    CAPABILITY_DENIED,
    CANCELLED
}
