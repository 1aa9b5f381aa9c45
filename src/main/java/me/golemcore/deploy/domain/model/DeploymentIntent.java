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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the user wants deployed, accumulated across conversation turns.
 *
 * <p>
 * Every field is optional while the session is in Intake; {@link #missingFields()}
 * reports what still blocks planning.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentIntent {

    private DeploymentTarget target;
    private String region;

    private String repoUrl;
    private String branch;
    private String localPath;

    private String imageId;
    private String instanceType;
    private String keyName;
    private Integer instanceCount;

    private String functionName;
    private String runtime;
    private String handler;
    private String roleArn;

    private String bucketName;
    private String objectKey;

    private String clusterName;
    private String serviceName;
    private String containerImage;
    private Integer desiredCount;

    @Builder.Default
    private List<String> subnetIds = new ArrayList<>();
    @Builder.Default
    private List<String> securityGroupIds = new ArrayList<>();

    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();

    public boolean hasSource() {
        return notBlank(repoUrl) || notBlank(localPath);
    }

    /**
     * Field names that must still be supplied before a plan can be drafted.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (target == null) {
            missing.add("target");
        }
        if (!notBlank(region)) {
            missing.add("region");
        }
        if (target == null) {
            if (!hasSource()) {
                missing.add("repository or path");
            }
            return missing;
        }
        switch (target) {
        case INSTANCE -> {
            require(missing, "image id", imageId);
            require(missing, "instance type", instanceType);
            require(missing, "key name", keyName);
            if (notBlank(repoUrl)) {
                require(missing, "bucket name", bucketName);
            }
        }
        case FUNCTION -> {
            if (!hasSource()) {
                missing.add("repository or path");
            }
            require(missing, "function name", functionName);
            require(missing, "runtime", runtime);
            require(missing, "handler", handler);
            require(missing, "role arn", roleArn);
        }
        case CONTAINER -> {
            require(missing, "container image", containerImage);
            require(missing, "cluster name", clusterName);
            require(missing, "service name", serviceName);
        }
        case STORAGE -> {
            require(missing, "path", localPath);
            require(missing, "bucket name", bucketName);
        }
        default -> {
            // all targets handled above
        }
        }
        return missing;
    }

    /**
     * Copy non-empty fields of {@code update} over this intent.
     *
     * @return true when any field changed
     */
    public boolean mergeFrom(DeploymentIntent update) {
        if (update == null) {
            return false;
        }
        DeploymentIntent before = toBuilder()
                .subnetIds(new ArrayList<>(subnetIds))
                .securityGroupIds(new ArrayList<>(securityGroupIds))
                .tags(new LinkedHashMap<>(tags))
                .build();

        if (update.target != null) {
            target = update.target;
        }
        region = pick(update.region, region);
        repoUrl = pick(update.repoUrl, repoUrl);
        branch = pick(update.branch, branch);
        localPath = pick(update.localPath, localPath);
        imageId = pick(update.imageId, imageId);
        instanceType = pick(update.instanceType, instanceType);
        keyName = pick(update.keyName, keyName);
        functionName = pick(update.functionName, functionName);
        runtime = pick(update.runtime, runtime);
        handler = pick(update.handler, handler);
        roleArn = pick(update.roleArn, roleArn);
        bucketName = pick(update.bucketName, bucketName);
        objectKey = pick(update.objectKey, objectKey);
        clusterName = pick(update.clusterName, clusterName);
        serviceName = pick(update.serviceName, serviceName);
        containerImage = pick(update.containerImage, containerImage);
        if (update.instanceCount != null) {
            instanceCount = update.instanceCount;
        }
        if (update.desiredCount != null) {
            desiredCount = update.desiredCount;
        }
        if (update.subnetIds != null && !update.subnetIds.isEmpty()) {
            subnetIds = new ArrayList<>(update.subnetIds);
        }
        if (update.securityGroupIds != null && !update.securityGroupIds.isEmpty()) {
            securityGroupIds = new ArrayList<>(update.securityGroupIds);
        }
        if (update.tags != null) {
            tags.putAll(update.tags);
        }
        return !equals(before);
    }

    private static String pick(String incoming, String current) {
        return notBlank(incoming) ? incoming.trim() : current;
    }

    private static void require(List<String> missing, String label, String value) {
        if (!notBlank(value)) {
            missing.add(label);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
