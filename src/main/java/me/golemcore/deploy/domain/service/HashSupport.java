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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers for storing references without storing the referenced
 * value.
 */
public final class HashSupport {

    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final int SHORT_HASH_LEN = 16;

    private HashSupport() {
    }

    public static String sha256Hex(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return sha256Hex(value.trim().getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value);
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                int v = b & 0xFF;
                builder.append(HEX[v >>> 4]).append(HEX[v & 0x0F]);
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String shortHash(String value) {
        String full = sha256Hex(value);
        if (full == null) {
            return "na";
        }
        return full.substring(0, SHORT_HASH_LEN);
    }
}
