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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes credential material from text and structured data before it reaches
 * logs, audit records, conversation history or the user.
 *
 * <p>
 * Recognises cloud access key ids, 40-character secret keys, bearer tokens,
 * PEM private keys and {@code .env}-style assignments of sensitive variables,
 * including any variable whose name ends in {@code KEY}.
 * Known literal secret values can be passed in and are always scrubbed.
 */
@Component
public class SecretRedactor {

    public static final String MASK = "[REDACTED]";

    // Matched against the lowercased key with '_' and '-' removed.
    private static final Set<String> SENSITIVE_KEY_MARKERS = Set.of(
            "secret", "token", "password", "passwd", "credential", "accesskey", "privatekey", "apikey",
            "authorization");

    // Names ending in "key" that identify an object or a key pair rather than hold one.
    private static final Set<String> NON_SECRET_KEY_NAMES = Set.of(
            "key", "objectkey", "s3key", "keyname", "keynames", "keypairid", "keypairs", "keytype",
            "keyfingerprint", "partitionkey", "sortkey");

    private static final Pattern ACCESS_KEY_ID = Pattern.compile("\\b(?:AKIA|ASIA)[A-Z0-9]{16}\\b");
    private static final Pattern SECRET_KEY_CANDIDATE = Pattern
            .compile("(?<![A-Za-z0-9/+=])[A-Za-z0-9/+]{40}(?![A-Za-z0-9/+=])");
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/-]+=*");
    private static final Pattern PRIVATE_KEY_BLOCK = Pattern.compile(
            "-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?-----END [A-Z ]*PRIVATE KEY-----");
    private static final Pattern ENV_ASSIGNMENT = Pattern.compile(
            "(?im)^(\\s*(?:export\\s+)?[A-Z0-9_]*"
                    + "(?:(?:SECRET|TOKEN|PASSWORD|PASSWD|ACCESS_KEY|PRIVATE_KEY|CREDENTIAL)[A-Z0-9_]*|KEY)"
                    + "\\s*=\\s*)(\\S.*)$");

    public String redact(String text) {
        return redact(text, List.of());
    }

    /**
     * Redact patterns and every occurrence of the given literal values.
     */
    public String redact(String text, Collection<String> literals) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        if (literals != null) {
            for (String literal : literals) {
                if (literal != null && literal.length() >= 4) {
                    result = result.replace(literal, MASK);
                }
            }
        }
        result = PRIVATE_KEY_BLOCK.matcher(result).replaceAll(MASK);
        result = ENV_ASSIGNMENT.matcher(result).replaceAll("$1" + Matcher.quoteReplacement(MASK));
        result = BEARER.matcher(result).replaceAll("$1" + Matcher.quoteReplacement(MASK));
        result = ACCESS_KEY_ID.matcher(result).replaceAll(MASK);
        result = replaceSecretKeys(result);
        return result;
    }

    public Map<String, Object> redact(Map<String, Object> data) {
        return redact(data, List.of());
    }

    /**
     * Deep copy of {@code data} with sensitive keys masked and every string value
     * redacted.
     */
    public Map<String, Object> redact(Map<String, Object> data, Collection<String> literals) {
        if (data == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isSensitiveKey(key) && entry.getValue() != null) {
                copy.put(key, MASK);
            } else {
                copy.put(key, redactValue(entry.getValue(), literals));
            }
        }
        return copy;
    }

    public boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (String marker : SENSITIVE_KEY_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return normalized.endsWith("key") && !NON_SECRET_KEY_NAMES.contains(normalized);
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value, Collection<String> literals) {
        if (value instanceof String text) {
            return redact(text, literals);
        }
        if (value instanceof Map<?, ?> map) {
            return redact((Map<String, Object>) map, literals);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(redactValue(item, literals));
            }
            return copy;
        }
        return value;
    }

    private String replaceSecretKeys(String text) {
        Matcher matcher = SECRET_KEY_CANDIDATE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String candidate = matcher.group();
            String replacement = looksLikeSecretKey(candidate) ? MASK : candidate;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    // Commit SHAs and other hex digests are 40 chars too but single-case.
    private static boolean looksLikeSecretKey(String candidate) {
        boolean upper = false;
        boolean lower = false;
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            }
        }
        return upper && lower;
    }
}
