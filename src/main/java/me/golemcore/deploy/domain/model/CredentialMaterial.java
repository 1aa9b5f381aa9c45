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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decrypted cloud credentials. Lives only for the duration of one gateway call
 * and is wiped afterwards.
 */
public final class CredentialMaterial {

    private final String accessKeyId;
    private final char[] secretAccessKey;
    private final char[] sessionToken;
    private final String region;
    private volatile boolean wiped;

    public CredentialMaterial(String accessKeyId, char[] secretAccessKey, char[] sessionToken, String region) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey != null ? secretAccessKey.clone() : new char[0];
        this.sessionToken = sessionToken != null ? sessionToken.clone() : null;
        this.region = region;
    }

    public String getAccessKeyId() {
        ensureUsable();
        return accessKeyId;
    }

    public char[] getSecretAccessKey() {
        ensureUsable();
        return secretAccessKey;
    }

    public char[] getSessionToken() {
        ensureUsable();
        return sessionToken;
    }

    public String getRegion() {
        return region;
    }

    public boolean isWiped() {
        return wiped;
    }

    /**
     * Literal secret values, used to scrub any echo of them from tool output.
     */
    public List<String> secretValues() {
        ensureUsable();
        List<String> values = new ArrayList<>();
        if (accessKeyId != null && !accessKeyId.isEmpty()) {
            values.add(accessKeyId);
        }
        if (secretAccessKey.length > 0) {
            values.add(new String(secretAccessKey));
        }
        if (sessionToken != null && sessionToken.length > 0) {
            values.add(new String(sessionToken));
        }
        return values;
    }

    public String accessKeyLastFour() {
        if (accessKeyId == null || accessKeyId.length() < 4) {
            return null;
        }
        return accessKeyId.substring(accessKeyId.length() - 4);
    }

    public void wipe() {
        Arrays.fill(secretAccessKey, '\0');
        if (sessionToken != null) {
            Arrays.fill(sessionToken, '\0');
        }
        wiped = true;
    }

    private void ensureUsable() {
        if (wiped) {
            throw new IllegalStateException("Credential material already discarded");
        }
    }

    @Override
    public String toString() {
        return "CredentialMaterial[accessKeyId=****" + (accessKeyLastFour() != null ? accessKeyLastFour() : "")
                + "]";
    }
}
