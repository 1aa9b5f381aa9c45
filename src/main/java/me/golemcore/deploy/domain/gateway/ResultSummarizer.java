package me.golemcore.deploy.domain.gateway;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caps large results so that observations stay small: strings are truncated,
 * lists keep their first items and the parent map gets a
 * {@code <key>_summary} entry with {@code shown} and {@code total}.
 */
public final class ResultSummarizer {

    private ResultSummarizer() {
    }

    @SuppressWarnings("unchecked")
    public static Object summarize(Object value, int maxItems, int maxString) {
        if (value instanceof String text) {
            return truncate(text, maxString);
        }
        if (value instanceof List<?> list) {
            List<Object> trimmed = new ArrayList<>();
            for (int i = 0; i < Math.min(maxItems, list.size()); i++) {
                trimmed.add(summarize(list.get(i), maxItems, maxString));
            }
            return trimmed;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> summarized = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) map).entrySet()) {
                Object item = entry.getValue();
                summarized.put(entry.getKey(), summarize(item, maxItems, maxString));
                if (item instanceof List<?> list && list.size() > maxItems) {
                    Map<String, Object> summary = new LinkedHashMap<>();
                    summary.put("shown", maxItems);
                    summary.put("total", list.size());
                    summarized.put(entry.getKey() + "_summary", summary);
                }
            }
            return summarized;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> summarizeMap(Map<String, Object> value, int maxItems, int maxString) {
        if (value == null) {
            return null;
        }
        return (Map<String, Object>) summarize(value, maxItems, maxString);
    }

    public static String truncate(String value, int limit) {
        if (value == null || value.length() <= limit) {
            return value;
        }
        if (limit <= 3) {
            return value.substring(0, limit);
        }
        return value.substring(0, limit - 3) + "...";
    }
}
