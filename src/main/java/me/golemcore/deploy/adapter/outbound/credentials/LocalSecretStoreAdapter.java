package me.golemcore.deploy.adapter.outbound.credentials;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.StoredCredential;
import me.golemcore.deploy.domain.service.HashSupport;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.SecretStorePort;
import me.golemcore.deploy.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps one encrypted credential record per principal in
 * {@code credentials/<hash(principal)>.json}. Saving a new record replaces the
 * previous one, so an old secret never survives a rotation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalSecretStoreAdapter implements SecretStorePort {

    private static final String DIRECTORY = "credentials";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final DeployProperties properties;

    @Override
    public Optional<StoredCredential> findActive(String principal) {
        try {
            String json = storagePort.getText(DIRECTORY, fileName(principal)).get(timeoutMs(), TimeUnit.MILLISECONDS);
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            StoredCredential stored = objectMapper.readValue(json, StoredCredential.class);
            return stored.isActive() ? Optional.of(stored) : Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading credentials", e);
        } catch (ExecutionException | TimeoutException | IOException e) {
            throw new IllegalStateException("Failed to read credential record", e);
        }
    }

    @Override
    public void saveActive(StoredCredential credential) {
        try {
            String json = objectMapper.writeValueAsString(credential);
            storagePort.putTextAtomic(DIRECTORY, fileName(credential.getPrincipal()), json)
                    .get(timeoutMs(), TimeUnit.MILLISECONDS);
            log.debug("[Credentials] Active record replaced for {}", HashSupport.shortHash(credential.getPrincipal()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while saving credentials", e);
        } catch (ExecutionException | TimeoutException | IOException e) {
            throw new IllegalStateException("Failed to persist credential record", e);
        }
    }

    private long timeoutMs() {
        return properties.getCredentials().getStoreTimeout().toMillis();
    }

    private static String fileName(String principal) {
        return HashSupport.shortHash(principal) + ".json";
    }
}
