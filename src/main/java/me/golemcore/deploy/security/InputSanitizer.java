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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;

/**
 * Input sanitizer that normalizes Unicode and removes invisible/control
 * characters from user messages before intent extraction.
 *
 * <p>
 * Legitimate whitespace (newline, tab) is preserved. Messages longer than
 * {@link #MAX_MESSAGE_LENGTH} are cut.
 */
@Component
@Slf4j
public class InputSanitizer {

    static final int MAX_MESSAGE_LENGTH = 16_000;

    /**
     * Normalize Unicode to prevent homograph tricks. Converts to NFC form and
     * removes invisible characters.
     */
    public String normalizeUnicode(String input) {
        if (input == null) {
            return "";
        }

        String normalized = Normalizer.normalize(input, Normalizer.Form.NFC);

        // zero-width and BiDi controls
        normalized = normalized.replaceAll(
                "[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]", "");

        // control characters except newline/tab
        normalized = normalized.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        return normalized;
    }

    public String sanitize(String input) {
        if (input == null) {
            return "";
        }

        int originalLength = input.length();
        String sanitized = normalizeUnicode(input);
        if (sanitized.length() > MAX_MESSAGE_LENGTH) {
            sanitized = sanitized.substring(0, MAX_MESSAGE_LENGTH);
        }
        if (sanitized.length() != originalLength) {
            log.debug("[Security] Input sanitized: {} -> {} chars", originalLength, sanitized.length());
        }
        return sanitized;
    }
}
