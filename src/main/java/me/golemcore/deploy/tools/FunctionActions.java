package me.golemcore.deploy.tools;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.gateway.ActionRequest;
import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.domain.service.HashSupport;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serverless function actions: create, replace code and invoke.
 */
@Component
public class FunctionActions extends CloudActionSupport {

    private static final String LAMBDA = "lambda";
    private static final String FUNCTION_NAME = "function_name";
    private static final String FUNCTION_ARN = "function_arn";
    private static final String LAST_MODIFIED = "last_modified";

    private final ObjectMapper objectMapper;

    public FunctionActions(CloudProviderPort cloud, ObjectMapper objectMapper) {
        super(cloud);
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ActionDefinition> getActions() {
        return List.of(
                define("deploy_lambda", ActionCategory.FUNCTION, StageCapability.MUTATE,
                        "Create a Lambda function from a zip archive", this::deploy),
                destructive("update_lambda_code", ActionCategory.FUNCTION, false,
                        "Replace the code of an existing Lambda function", this::updateCode),
                define("invoke_lambda", ActionCategory.FUNCTION, StageCapability.INVOKE,
                        "Invoke a Lambda function and return its payload", this::invoke));
    }

    private Map<String, Object> deploy(ActionRequest request) {
        Map<String, Object> params = request.params();
        String functionName = ParameterSupport.requireString(params, FUNCTION_NAME, "deploy_lambda");
        String runtime = ParameterSupport.requireString(params, "runtime", "deploy_lambda");
        String role = ParameterSupport.requireString(params, "role_arn", "deploy_lambda");
        String handler = ParameterSupport.requireString(params, "handler", "deploy_lambda");
        byte[] zip = loadArchive(ParameterSupport.requireString(params, "zip_file", "deploy_lambda"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("FunctionName", functionName);
        payload.put("Runtime", runtime);
        payload.put("Role", role);
        payload.put("Handler", handler);
        payload.put("Code", Map.of("ZipFileSize", zip.length, "CodeSha256", HashSupport.sha256Hex(zip)));
        String description = ParameterSupport.optionalString(params, "description");
        if (description != null) {
            payload.put("Description", description);
        }
        Map<String, Object> environment = ParameterSupport.ensureMap(params.get("environment"));
        if (environment != null && !environment.isEmpty()) {
            Map<String, String> variables = new LinkedHashMap<>();
            environment.forEach((key, value) -> variables.put(key, String.valueOf(value)));
            payload.put("Environment", Map.of("Variables", variables));
        }
        if (params.get("timeout") != null) {
            payload.put("Timeout", ParameterSupport.toInt(params.get("timeout"), 3));
        }
        if (params.get("memory_size") != null) {
            payload.put("MemorySize", ParameterSupport.toInt(params.get("memory_size"), 128));
        }
        payload.put("Publish", ParameterSupport.toBoolean(params.get("publish"), true));

        Map<String, Object> response = call(request, LAMBDA, "CreateFunction", payload);
        if (isPreview(response)) {
            return preview(request, response);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(FUNCTION_ARN, response.get("FunctionArn"));
        result.put("state", response.get("State"));
        result.put(LAST_MODIFIED, response.get("LastModified"));
        return result;
    }

    private Map<String, Object> updateCode(ActionRequest request) {
        Map<String, Object> params = request.params();
        String functionName = ParameterSupport.requireString(params, FUNCTION_NAME, "update_lambda_code");
        byte[] zip = loadArchive(ParameterSupport.requireString(params, "zip_file", "update_lambda_code"));
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("FunctionName", functionName);
        args.put("ZipFileSize", zip.length);
        args.put("CodeSha256", HashSupport.sha256Hex(zip));
        args.put("Publish", ParameterSupport.toBoolean(params.get("publish"), false));
        Map<String, Object> response = call(request, LAMBDA, "UpdateFunctionCode", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(FUNCTION_ARN, response.get("FunctionArn"));
        result.put(LAST_MODIFIED, response.get("LastModified"));
        return result;
    }

    private Map<String, Object> invoke(ActionRequest request) {
        Map<String, Object> params = request.params();
        String functionName = ParameterSupport.requireString(params, FUNCTION_NAME, "invoke_lambda");
        Object payload = params.getOrDefault("payload", Map.of());
        String payloadText;
        try {
            payloadText = payload instanceof String text ? text : objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ParameterValidationException("'payload' must be JSON-serialisable");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("FunctionName", functionName);
        args.put("Payload", payloadText);
        args.put("InvocationType", ParameterSupport.optionalString(params, "invocation_type") != null
                ? ParameterSupport.optionalString(params, "invocation_type")
                : "RequestResponse");
        Map<String, Object> response = call(request, LAMBDA, "Invoke", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status_code", response.get("StatusCode"));
        result.put("executed_version", response.get("ExecutedVersion"));
        result.put("payload", parsePayload(response.get("Payload")));
        return result;
    }

    private Object parsePayload(Object raw) {
        if (!(raw instanceof String text)) {
            return raw;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    private static byte[] loadArchive(String location) {
        Path path = Paths.get(location);
        if (!Files.isRegularFile(path)) {
            throw new ParameterValidationException("File not found: " + path,
                    "Point 'zip_file' at an existing deployment archive");
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
