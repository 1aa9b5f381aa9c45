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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.gateway.ActionRequest;
import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.port.outbound.ArtifactPackagerPort;
import me.golemcore.deploy.port.outbound.ArtifactPackagerPort.PackagedArtifact;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repository-to-deployment composites. Each fetches a repository, packages it
 * as a zip and delegates to the storage, function or compute actions with the
 * same credentials, so the whole sequence is one gateway call.
 */
@Component
@Slf4j
public class RepositoryActions extends CloudActionSupport {

    private static final String REPO_URL = "repo_url";
    private static final String BRANCH = "branch";
    private static final String BUCKET_NAME = "bucket_name";
    private static final String SUMMARY = "summary";
    private static final String REPOSITORY = "repository";

    private static final Set<String> NON_LAUNCH_PARAMS = Set.of(
            REPO_URL, BUCKET_NAME, "object_name", "artifact_subdir", "launch_instance", BRANCH,
            "artifact_install_path");

    private final ArtifactPackagerPort packager;
    private final Map<String, ActionDefinition> delegates = new HashMap<>();

    public RepositoryActions(CloudProviderPort cloud, ArtifactPackagerPort packager, StorageActions storageActions,
            FunctionActions functionActions, ComputeActions computeActions) {
        super(cloud);
        this.packager = packager;
        for (ActionDefinition definition : storageActions.getActions()) {
            delegates.put(definition.name(), definition);
        }
        for (ActionDefinition definition : functionActions.getActions()) {
            delegates.put(definition.name(), definition);
        }
        for (ActionDefinition definition : computeActions.getActions()) {
            delegates.put(definition.name(), definition);
        }
    }

    @Override
    public List<ActionDefinition> getActions() {
        return List.of(
                define("package_and_deploy_function", ActionCategory.REPOSITORY, StageCapability.MUTATE,
                        "Clone a repository, zip it and create a Lambda function from it", this::deployFunction),
                define("package_and_deploy_instance", ActionCategory.REPOSITORY, StageCapability.MUTATE,
                        "Clone a repository, stage the artifact in S3 and optionally launch an instance",
                        this::deployInstance));
    }

    /**
     * Startup script that downloads the staged artifact and unpacks it.
     */
    static String defaultUserData(String bucket, String objectName, String installPath) {
        String destination = installPath != null && !installPath.isBlank() ? installPath : "/opt/app";
        return "#!/bin/bash\n"
                + "set -e\n"
                + "sudo yum update -y\n"
                + "sudo yum install -y unzip awscli\n"
                + "mkdir -p " + destination + "\n"
                + "aws s3 cp s3://" + bucket + "/" + objectName + " /tmp/deployment.zip\n"
                + "unzip -o /tmp/deployment.zip -d " + destination + "\n";
    }

    private Map<String, Object> deployFunction(ActionRequest request) {
        Map<String, Object> params = request.params();
        String repoUrl = ParameterSupport.requireString(params, REPO_URL, request.action());
        String functionName = ParameterSupport.optionalString(params, "function_name");
        String handler = ParameterSupport.optionalString(params, "handler");
        String runtime = ParameterSupport.optionalString(params, "runtime");
        String roleArn = ParameterSupport.optionalString(params, "role_arn");
        if (functionName == null || handler == null || runtime == null || roleArn == null) {
            throw new ParameterValidationException(
                    "'function_name', 'handler', 'runtime', and 'role_arn' are required for Lambda deployments");
        }
        String branch = ParameterSupport.optionalString(params, BRANCH);
        if (request.dryRun()) {
            return previewComposite(request, List.of("fetch " + repoUrl, "package zip", "deploy_lambda"));
        }

        PackagedArtifact artifact = packager.cloneAndPackage(repoUrl, branch,
                ParameterSupport.optionalString(params, "lambda_subdir"), null);
        try {
            Map<String, Object> deployParams = new LinkedHashMap<>();
            deployParams.put("function_name", functionName);
            deployParams.put("handler", handler);
            deployParams.put("runtime", runtime);
            deployParams.put("role_arn", roleArn);
            deployParams.put("zip_file", artifact.archive().toString());
            copyIfPresent(params, deployParams, "description", "environment", "timeout", "memory_size");
            Map<String, Object> response = delegate(request, "deploy_lambda", deployParams);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("function_name", functionName);
            result.put("runtime", runtime);
            result.put(REPOSITORY, repoUrl);
            result.put(BRANCH, branch);
            result.put("artifact_size", artifact.sizeBytes());
            result.put("aws_response", response);
            result.put(SUMMARY, "Deployed Lambda function '" + functionName + "' in " + request.region()
                    + " using repository " + repoUrl + ".");
            return result;
        } finally {
            packager.cleanup(artifact);
        }
    }

    private Map<String, Object> deployInstance(ActionRequest request) {
        Map<String, Object> params = request.params();
        String repoUrl = ParameterSupport.requireString(params, REPO_URL, request.action());
        String bucket = ParameterSupport.optionalString(params, BUCKET_NAME);
        if (bucket == null) {
            throw new ParameterValidationException("'bucket_name' is required to stage artifacts in S3");
        }
        boolean launch = ParameterSupport.toBoolean(params.get("launch_instance"), false);
        if (launch && (params.get("ami_id") == null || params.get("instance_type") == null
                || params.get("key_name") == null)) {
            throw new ParameterValidationException(
                    "'ami_id', 'instance_type', and 'key_name' are required when launch_instance is true");
        }
        String branch = ParameterSupport.optionalString(params, BRANCH);
        if (request.dryRun()) {
            return previewComposite(request, launch
                    ? List.of("fetch " + repoUrl, "package zip", "upload_s3", "launch_ec2")
                    : List.of("fetch " + repoUrl, "package zip", "upload_s3"));
        }

        PackagedArtifact artifact = packager.cloneAndPackage(repoUrl, branch,
                ParameterSupport.optionalString(params, "artifact_subdir"), null);
        try {
            String objectName = ParameterSupport.optionalString(params, "object_name");
            if (objectName == null) {
                objectName = artifact.objectName();
            }
            Map<String, Object> uploadParams = new LinkedHashMap<>();
            uploadParams.put(BUCKET_NAME, bucket);
            uploadParams.put("file_path", artifact.archive().toString());
            uploadParams.put("object_name", objectName);
            delegate(request, "upload_s3", uploadParams);
            StringBuilder summary = new StringBuilder("Uploaded artifact to s3://" + bucket + "/" + objectName
                    + " (" + artifact.sizeBytes() + " bytes).");

            String userData = ParameterSupport.optionalString(params, "user_data");
            if (userData == null) {
                userData = defaultUserData(bucket, objectName,
                        ParameterSupport.optionalString(params, "artifact_install_path"));
            }

            Map<String, Object> launchResult = null;
            if (launch) {
                Map<String, Object> launchParams = new LinkedHashMap<>();
                params.forEach((key, value) -> {
                    if (!NON_LAUNCH_PARAMS.contains(key)) {
                        launchParams.put(key, value);
                    }
                });
                launchParams.put("user_data", userData);
                launchResult = delegate(request, "launch_ec2", launchParams);
                Object ids = launchResult.get("instance_ids");
                if (ids instanceof List<?> list && !list.isEmpty()) {
                    summary.append(" Launched EC2 instance(s) ").append(String.join(", ",
                            list.stream().map(String::valueOf).toList())).append(" in ").append(request.region())
                            .append('.');
                }
            }

            Map<String, Object> artifactInfo = new LinkedHashMap<>();
            artifactInfo.put("bucket", bucket);
            artifactInfo.put("object", objectName);
            artifactInfo.put("size_bytes", artifact.sizeBytes());

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("artifact", artifactInfo);
            result.put(REPOSITORY, repoUrl);
            result.put(BRANCH, branch);
            result.put("ec2_launch", launchResult);
            if (launchResult != null) {
                result.put("instance_ids", launchResult.get("instance_ids"));
            }
            result.put("user_data_hint", userData);
            result.put(SUMMARY, summary.toString());
            return result;
        } finally {
            packager.cleanup(artifact);
        }
    }

    private Map<String, Object> delegate(ActionRequest parent, String action, Map<String, Object> params) {
        ActionDefinition definition = delegates.get(action);
        if (definition == null) {
            throw new IllegalStateException("Delegate action not registered: " + action);
        }
        params.putIfAbsent("region", parent.region());
        log.debug("[Repository] {} delegating to {}", parent.action(), action);
        return definition.handler().handle(new ActionRequest(action, params, parent.region(), false,
                parent.credentials(), parent.sessionId()));
    }

    private static Map<String, Object> previewComposite(ActionRequest request, List<String> steps) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("dry_run", true);
        result.put("action", request.action());
        result.put("steps", steps);
        result.put("message", "Parameters are complete; the repository will be fetched at execution time.");
        return result;
    }

    private static void copyIfPresent(Map<String, Object> source, Map<String, Object> target, String... keys) {
        for (String key : keys) {
            if (source.get(key) != null) {
                target.put(key, source.get(key));
            }
        }
    }
}
