package me.golemcore.deploy.security;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * AES-GCM encryption of credential material at rest.
 *
 * <p>
 * The 256-bit master key comes from {@code deploy.credentials.master-key}
 * (Base64) or, when unset, from a key file in the workspace that is generated
 * on first start. Ciphertext layout is {@code base64(iv || ciphertext+tag)}
 * with a fresh 12-byte IV per encryption.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 12;
    private static final int KEY_BYTES = 32;
    private static final int GCM_TAG_BITS = 128;

    private final DeployProperties properties;
    private final StoragePort storagePort;
    private final SecureRandom random = new SecureRandom();

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = loadOrCreateKey();
        if (keyBytes.length != KEY_BYTES) {
            throw new IllegalStateException("Credential master key must be 32 bytes, got " + keyBytes.length);
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    public String encrypt(byte[] plaintext) {
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv).put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential material", e);
        }
    }

    public byte[] decrypt(String encoded) {
        try {
            byte[] payload = Base64.getDecoder().decode(encoded);
            if (payload.length <= IV_BYTES) {
                throw new IllegalStateException("Ciphertext too short");
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, payload, 0, IV_BYTES));
            return cipher.doFinal(payload, IV_BYTES, payload.length - IV_BYTES);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt credential material", e);
        }
    }

    private byte[] loadOrCreateKey() {
        String configured = properties.getCredentials().getMasterKey();
        if (configured != null && !configured.isBlank()) {
            return Base64.getDecoder().decode(configured.trim());
        }

        String keyFile = properties.getCredentials().getMasterKeyFile();
        int slash = keyFile.lastIndexOf('/');
        String directory = slash > 0 ? keyFile.substring(0, slash) : "credentials";
        String path = slash > 0 ? keyFile.substring(slash + 1) : keyFile;
        long timeoutMs = properties.getCredentials().getStoreTimeout().toMillis();
        try {
            String existing = storagePort.getText(directory, path).get(timeoutMs, TimeUnit.MILLISECONDS);
            if (existing != null && !existing.isBlank()) {
                return Base64.getDecoder().decode(existing.trim());
            }
            byte[] generated = new byte[KEY_BYTES];
            random.nextBytes(generated);
            storagePort.putTextAtomic(directory, path, Base64.getEncoder().encodeToString(generated))
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("[Credentials] Generated new master key at {}/{}", directory, path);
            return generated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading credential master key", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to load credential master key", e);
        }
    }
}
