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

import java.time.Instant;

/**
 * Encrypted-at-rest credential record. Only the ciphertext of the material is
 * persisted; the last four characters of the access key id are kept in clear
 * for status display.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredCredential {

    private String principal;
    private String ciphertext;
    private String accessKeyLastFour;
    private String region;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
