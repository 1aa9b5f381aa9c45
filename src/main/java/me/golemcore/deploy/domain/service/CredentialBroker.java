package me.golemcore.deploy.domain.service;

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

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.model.CredentialHandle;
import me.golemcore.deploy.domain.model.CredentialMaterial;
import me.golemcore.deploy.domain.model.CredentialStatus;
import me.golemcore.deploy.domain.model.CredentialsMissingException;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.StoredCredential;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.SecretStorePort;
import me.golemcore.deploy.security.CredentialCipher;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Just-in-time credential broker.
 *
 * <p>
 * Credentials are stored encrypted per principal. A caller first obtains a
 * short-lived single-use {@link CredentialHandle}, then redeems it through
 * {@link #withCredential(CredentialHandle, Function)}; the decrypted material
 * exists only for the duration of that callback and is wiped afterwards.
 * Nothing decrypted is cached between calls.
 *
 * <p>
 * When {@code deploy.credentials.override-json} is set, it takes precedence
 * over stored records for every principal.
 */
@Service
@Slf4j
public class CredentialBroker implements SessionScopedState {

    static final String OVERRIDE_PRINCIPAL = "override";

    private static final String FIELD_ACCESS_KEY = "aws_access_key_id";
    private static final String FIELD_SECRET_KEY = "aws_secret_access_key";
    private static final String FIELD_SESSION_TOKEN = "aws_session_token";
    private static final String FIELD_REGION = "region";

    private final SecretStorePort secretStore;
    private final CredentialCipher cipher;
    private final ObjectMapper objectMapper;
    private final DeployProperties properties;
    private final Clock clock;

    private final Map<String, String> sessionPrincipals = new ConcurrentHashMap<>();
    private final Map<String, CredentialHandle> openHandles = new ConcurrentHashMap<>();

    public CredentialBroker(SecretStorePort secretStore, CredentialCipher cipher, ObjectMapper objectMapper,
            DeployProperties properties, Clock clock) {
        this.secretStore = secretStore;
        this.cipher = cipher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public void bindSession(String sessionId, String principal) {
        if (sessionId == null || principal == null || principal.isBlank()) {
            return;
        }
        sessionPrincipals.put(sessionId, principal);
    }

    /**
     * Bind the session to {@code principal} unless another principal already
     * owns it. A blank principal only succeeds on an unbound session.
     *
     * @return false when the session belongs to a different principal
     */
    public boolean claimSession(String sessionId, String principal) {
        if (sessionId == null) {
            return false;
        }
        if (principal == null || principal.isBlank()) {
            return !sessionPrincipals.containsKey(sessionId);
        }
        String owner = sessionPrincipals.putIfAbsent(sessionId, principal);
        return owner == null || owner.equals(principal);
    }

    public Optional<String> boundPrincipal(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessionPrincipals::get);
    }

    @Override
    public void evictSession(String sessionId) {
        sessionPrincipals.remove(sessionId);
        openHandles.values().removeIf(handle -> sessionId.equals(handle.sessionId()));
    }

    public String principalOf(String sessionId) {
        return sessionPrincipals.getOrDefault(sessionId, properties.getSession().getDefaultPrincipal());
    }

    /**
     * Issue a single-use handle for the session's principal.
     *
     * @throws CredentialsMissingException
     *             when nothing is stored and no override is configured
     */
    public CredentialHandle resolve(String sessionId) {
        purgeExpiredHandles();
        String principal = hasOverride() ? OVERRIDE_PRINCIPAL : principalOf(sessionId);
        if (!hasOverride() && secretStore.findActive(principal).isEmpty()) {
            throw new CredentialsMissingException("No AWS credentials stored for principal '" + principal + "'");
        }
        Instant expiresAt = clock.instant().plus(properties.getCredentials().getHandleTtl());
        CredentialHandle handle = new CredentialHandle(UUID.randomUUID().toString(), sessionId, principal, expiresAt);
        openHandles.put(handle.id(), handle);
        return handle;
    }

    /**
     * Redeem a handle: decrypt, run {@code action}, wipe. The handle cannot be
     * used again.
     */
    public <T> T withCredential(CredentialHandle handle, Function<CredentialMaterial, T> action) {
        CredentialHandle open = openHandles.remove(handle.id());
        if (open == null) {
            throw new IllegalStateException("Credential handle already used or unknown: " + handle.id());
        }
        if (open.isExpired(clock.instant())) {
            throw new CredentialsMissingException("Credential handle expired before use");
        }
        CredentialMaterial material = loadMaterial(open.principal());
        try {
            return action.apply(material);
        } finally {
            material.wipe();
        }
    }

    public boolean hasCredentials(String sessionId) {
        return hasOverride() || secretStore.findActive(principalOf(sessionId)).isPresent();
    }

    public CredentialStatus status(String principal) {
        if (hasOverride()) {
            return CredentialStatus.builder()
                    .status(CredentialStatus.PRESENT)
                    .source(OVERRIDE_PRINCIPAL)
                    .build();
        }
        Optional<StoredCredential> stored = secretStore.findActive(principal);
        if (stored.isEmpty()) {
            return CredentialStatus.missing();
        }
        return CredentialStatus.builder()
                .status(CredentialStatus.PRESENT)
                .updatedAt(stored.get().getUpdatedAt())
                .accessKeyLastFour(stored.get().getAccessKeyLastFour())
                .source("stored")
                .build();
    }

    /**
     * Encrypt and store credentials as the principal's only active record. The
     * secret arrays are wiped before returning.
     */
    public CredentialStatus store(String principal, String accessKeyId, char[] secretAccessKey, char[] sessionToken,
            String region) {
        try {
            if (principal == null || principal.isBlank()) {
                throw new ParameterValidationException("principal is required");
            }
            if (accessKeyId == null || accessKeyId.isBlank()) {
                throw new ParameterValidationException("access_key_id is required");
            }
            if (secretAccessKey == null || secretAccessKey.length == 0) {
                throw new ParameterValidationException("secret_access_key is required");
            }
            String trimmedRegion = region != null && !region.isBlank() ? region.trim() : null;
            String ciphertext;
            WipeableBuffer plaintext = new WipeableBuffer();
            try {
                writePayload(plaintext, accessKeyId.trim(), secretAccessKey, sessionToken, trimmedRegion);
                byte[] bytes = plaintext.toByteArray();
                try {
                    ciphertext = cipher.encrypt(bytes);
                } finally {
                    Arrays.fill(bytes, (byte) 0);
                }
            } finally {
                plaintext.wipe();
            }

            Instant now = clock.instant();
            String trimmedKey = accessKeyId.trim();
            StoredCredential record = StoredCredential.builder()
                    .principal(principal)
                    .ciphertext(ciphertext)
                    .accessKeyLastFour(trimmedKey.length() >= 4 ? trimmedKey.substring(trimmedKey.length() - 4) : null)
                    .region(trimmedRegion)
                    .active(true)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            secretStore.saveActive(record);
            log.info("[Credentials] Stored credentials for principal {} (key ****{})", principal,
                    record.getAccessKeyLastFour());
            return status(principal);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize credential payload", e);
        } finally {
            if (secretAccessKey != null) {
                Arrays.fill(secretAccessKey, '\0');
            }
            if (sessionToken != null) {
                Arrays.fill(sessionToken, '\0');
            }
        }
    }

    public CredentialStatus storeForSession(String sessionId, String accessKeyId, char[] secretAccessKey,
            char[] sessionToken, String region) {
        return store(principalOf(sessionId), accessKeyId, secretAccessKey, sessionToken, region);
    }

    // Secrets go from the char arrays straight into a buffer that is zeroed
    // afterwards, never through an immutable String.
    private void writePayload(WipeableBuffer out, String accessKeyId, char[] secretAccessKey, char[] sessionToken,
            String region) throws IOException {
        try (JsonGenerator generator = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            generator.writeStartObject();
            generator.writeStringField(FIELD_ACCESS_KEY, accessKeyId);
            writeTrimmed(generator, FIELD_SECRET_KEY, secretAccessKey);
            if (sessionToken != null && sessionToken.length > 0) {
                writeTrimmed(generator, FIELD_SESSION_TOKEN, sessionToken);
            }
            if (region != null) {
                generator.writeStringField(FIELD_REGION, region);
            }
            generator.writeEndObject();
        }
    }

    private static void writeTrimmed(JsonGenerator generator, String field, char[] value) throws IOException {
        int start = 0;
        int end = value.length;
        while (start < end && value[start] <= ' ') {
            start++;
        }
        while (end > start && value[end - 1] <= ' ') {
            end--;
        }
        generator.writeFieldName(field);
        generator.writeString(value, start, end - start);
    }

    int openHandleCount() {
        return openHandles.size();
    }

    private CredentialMaterial loadMaterial(String principal) {
        Map<String, String> fields;
        if (OVERRIDE_PRINCIPAL.equals(principal)) {
            fields = parse(properties.getCredentials().getOverrideJson().getBytes(StandardCharsets.UTF_8));
        } else {
            StoredCredential stored = secretStore.findActive(principal)
                    .orElseThrow(() -> new CredentialsMissingException(
                            "Credentials for principal '" + principal + "' were removed"));
            byte[] plaintext = cipher.decrypt(stored.getCiphertext());
            try {
                fields = parse(plaintext);
            } finally {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
        String accessKey = fields.get(FIELD_ACCESS_KEY);
        String secret = fields.get(FIELD_SECRET_KEY);
        if (accessKey == null || secret == null) {
            throw new CredentialsMissingException("Stored credentials are incomplete");
        }
        String token = fields.get(FIELD_SESSION_TOKEN);
        return new CredentialMaterial(accessKey, secret.toCharArray(),
                token != null ? token.toCharArray() : null, fields.get(FIELD_REGION));
    }

    private Map<String, String> parse(byte[] json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {
            });
        } catch (IOException e) {
            throw new CredentialsMissingException("Credential payload is unreadable", e);
        }
    }

    private boolean hasOverride() {
        String override = properties.getCredentials().getOverrideJson();
        return override != null && !override.isBlank();
    }

    private void purgeExpiredHandles() {
        Instant now = clock.instant();
        openHandles.values().removeIf(handle -> handle.isExpired(now));
    }

    private static final class WipeableBuffer extends ByteArrayOutputStream {

        void wipe() {
            Arrays.fill(buf, (byte) 0);
            reset();
        }
    }
}
