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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.deploy.domain.model.ParameterValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coercion and validation helpers for loosely typed action parameters.
 *
 * <p>
 * Parameters arrive from JSON requests or from plan steps. List parameters
 * accept a JSON array, a JSON array string or a comma-separated string; map
 * parameters accept a JSON object or a JSON object string.
 */
public final class ParameterSupport {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private static final Pattern BUCKET_PATTERN = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{1,61})[a-z0-9]$");
    private static final Pattern REGION_PATTERN = Pattern.compile("^[a-z]{2}(-gov)?-[a-z]+-\\d$");

    private static final Set<String> EC2_FILTER_PREFIXES = Set.of(
            "architecture", "block-device-mapping", "description", "image-id", "image-type", "is-public",
            "name", "owner-alias", "owner-id", "platform", "root-device-type", "state", "tag",
            "virtualization-type");

    private ParameterSupport() {
    }

    /**
     * Accept a map or a JSON object string; anything else is a validation error.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> coerceParams(Object raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        if (raw instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty()) {
                return new LinkedHashMap<>();
            }
            try {
                return new LinkedHashMap<>(JSON.readValue(stripped, MAP_TYPE));
            } catch (JsonProcessingException e) {
                throw new ParameterValidationException("Action params must be a JSON object");
            }
        }
        throw new ParameterValidationException("Action params must be mapping-compatible");
    }

    public static String requireString(Map<String, Object> params, String key, String action) {
        String value = optionalString(params, key);
        if (value == null) {
            throw new ParameterValidationException("'" + key + "' parameter is required for " + action);
        }
        return value;
    }

    public static String optionalString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).strip();
        return text.isEmpty() ? null : text;
    }

    public static List<Object> ensureList(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty()) {
                return null;
            }
            if (stripped.startsWith("[")) {
                try {
                    return JSON.readValue(stripped, LIST_TYPE);
                } catch (JsonProcessingException e) {
                    throw new ParameterValidationException("Expected a JSON array: " + e.getOriginalMessage());
                }
            }
            List<Object> items = new ArrayList<>();
            for (String item : stripped.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.strip());
                }
            }
            return items;
        }
        List<Object> single = new ArrayList<>();
        single.add(value);
        return single;
    }

    public static List<String> ensureStringList(Object value) {
        List<Object> items = ensureList(value);
        if (items == null) {
            return List.of();
        }
        return items.stream().map(String::valueOf).toList();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> ensureMap(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        if (value instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty()) {
                return null;
            }
            if (stripped.startsWith("{")) {
                try {
                    return JSON.readValue(stripped, MAP_TYPE);
                } catch (JsonProcessingException e) {
                    throw new ParameterValidationException("Expected a JSON object: " + e.getOriginalMessage());
                }
            }
        }
        throw new ParameterValidationException("Expected dictionary-compatible value");
    }

    public static int toInt(Object value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).strip());
        } catch (NumberFormatException e) {
            throw new ParameterValidationException("Expected an integer but got '" + value + "'");
        }
    }

    public static boolean toBoolean(Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).strip().toLowerCase(Locale.ROOT);
        return "true".equals(text) || "yes".equals(text) || "1".equals(text);
    }

    public static String validateBucketName(String name) {
        if (name == null || name.isEmpty()) {
            throw new ParameterValidationException("S3 bucket name is required");
        }
        if (name.length() < 3 || name.length() > 63) {
            throw new ParameterValidationException("S3 bucket name must be between 3 and 63 characters");
        }
        if (!name.equals(name.toLowerCase(Locale.ROOT))) {
            throw new ParameterValidationException("S3 bucket names must use lowercase letters only");
        }
        if (name.contains(".")) {
            throw new ParameterValidationException(
                    "S3 bucket names should not contain periods when using virtual-hosted style URLs");
        }
        if (name.contains("_")) {
            throw new ParameterValidationException(
                    "S3 bucket names cannot include underscores; use hyphens instead");
        }
        if (!BUCKET_PATTERN.matcher(name).matches()) {
            throw new ParameterValidationException("S3 bucket names may contain only lowercase letters, numbers, "
                    + "and hyphens, and must start and end with a letter or number");
        }
        return name;
    }

    public static String validateRegion(String region) {
        if (region == null || !REGION_PATTERN.matcher(region).matches()) {
            throw new ParameterValidationException("Invalid region '" + region + "'",
                    "Use a region code such as us-east-1");
        }
        return region;
    }

    /**
     * Normalise EC2 filters given as maps ({@code Name/Values}) or
     * {@code name=v1,v2} strings, validating each filter name.
     */
    public static List<Map<String, Object>> normalizeFilters(Object value) {
        List<Map<String, Object>> filters = new ArrayList<>();
        if (value == null) {
            return filters;
        }
        List<Object> entries = value instanceof List<?> ? ensureList(value) : List.of(value);
        for (Object entry : entries) {
            String name = null;
            List<String> values = List.of();
            if (entry instanceof Map<?, ?> map) {
                Object rawName = map.get("Name") != null ? map.get("Name") : map.get("name");
                Object rawValues = map.get("Values") != null ? map.get("Values") : map.get("values");
                name = rawName != null ? String.valueOf(rawName).strip() : null;
                values = ensureStringList(rawValues);
            } else if (entry instanceof String text) {
                String[] parts = text.split("=", 2);
                if (parts.length == 2) {
                    name = parts[0].strip();
                    values = ensureStringList(parts[1]);
                }
            } else {
                throw new ParameterValidationException("Filters must be provided as list, dict, or string format");
            }
            if (name != null && !name.isEmpty() && !values.isEmpty()) {
                validateEc2Filter(name);
                Map<String, Object> filter = new LinkedHashMap<>();
                filter.put("Name", name);
                filter.put("Values", values);
                filters.add(filter);
            }
        }
        return filters;
    }

    static void validateEc2Filter(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("tag:")) {
            return;
        }
        for (String prefix : EC2_FILTER_PREFIXES) {
            if (lower.equals(prefix) || lower.startsWith(prefix + ".")) {
                return;
            }
        }
        throw new ParameterValidationException("Unsupported filter name '" + name + "' for describe_images",
                "Use a documented DescribeImages filter such as name, state, owner-id or tag:<key>");
    }
}
