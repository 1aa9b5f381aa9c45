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
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compute lifecycle actions: launch, stop, terminate, list and the two lookups
 * used while drafting a plan (images and key pairs).
 */
@Component
@Slf4j
public class ComputeActions extends CloudActionSupport {

    private static final String EC2 = "ec2";
    private static final String INSTANCE_ID = "instance_id";
    private static final String INSTANCES = "instances";
    private static final String FILTERS = "filters";

    public ComputeActions(CloudProviderPort cloud) {
        super(cloud);
    }

    @Override
    public List<ActionDefinition> getActions() {
        return List.of(
                define("launch_ec2", ActionCategory.COMPUTE, StageCapability.MUTATE,
                        "Launch EC2 instances from an AMI", this::launch),
                destructive("stop_ec2", ActionCategory.COMPUTE, true,
                        "Stop a running EC2 instance", request -> changeState(request, "StopInstances")),
                destructive("terminate_ec2", ActionCategory.COMPUTE, true,
                        "Terminate an EC2 instance", request -> changeState(request, "TerminateInstances")),
                define("list_ec2_instances", ActionCategory.COMPUTE, StageCapability.READ_ONLY,
                        "List EC2 instances in the region", this::listInstances),
                define("describe_images", ActionCategory.COMPUTE, StageCapability.READ_ONLY,
                        "Look up AMIs by owner, filter or id", this::describeImages),
                define("describe_key_pairs", ActionCategory.COMPUTE, StageCapability.READ_ONLY,
                        "Look up EC2 key pairs", this::describeKeyPairs));
    }

    private Map<String, Object> launch(ActionRequest request) {
        Map<String, Object> params = request.params();
        String amiId = ParameterSupport.requireString(params, "ami_id", "launch_ec2");
        String instanceType = ParameterSupport.requireString(params, "instance_type", "launch_ec2");
        int minCount = ParameterSupport.toInt(params.get("min_count"), 1);
        int maxCount = ParameterSupport.toInt(params.get("max_count"), minCount);
        if (minCount < 1 || maxCount < minCount) {
            throw new ParameterValidationException("'min_count' must be at least 1 and not exceed 'max_count'");
        }

        Map<String, Object> runArgs = new LinkedHashMap<>();
        runArgs.put("ImageId", amiId);
        runArgs.put("InstanceType", instanceType);
        runArgs.put("MinCount", minCount);
        runArgs.put("MaxCount", maxCount);
        putIfPresent(runArgs, "KeyName", ParameterSupport.optionalString(params, "key_name"));
        putIfPresent(runArgs, "SubnetId", ParameterSupport.optionalString(params, "subnet_id"));
        List<String> securityGroups = ParameterSupport.ensureStringList(params.get("security_group_ids"));
        if (!securityGroups.isEmpty()) {
            runArgs.put("SecurityGroupIds", securityGroups);
        }
        putIfPresent(runArgs, "UserData", ParameterSupport.optionalString(params, "user_data"));
        String profile = ParameterSupport.optionalString(params, "iam_instance_profile");
        if (profile != null) {
            runArgs.put("IamInstanceProfile", Map.of("Name", profile));
        }
        Map<String, Object> tags = ParameterSupport.ensureMap(params.get("tags"));
        if (tags != null && !tags.isEmpty()) {
            List<Map<String, Object>> tagList = new ArrayList<>();
            tags.forEach((key, value) -> tagList.add(Map.of("Key", key, "Value", String.valueOf(value))));
            runArgs.put("TagSpecifications", List.of(Map.of("ResourceType", "instance", "Tags", tagList)));
            runArgs.put("Tags", tagList);
        }

        Map<String, Object> response = call(request, EC2, "RunInstances", runArgs);
        if (isPreview(response)) {
            return preview(request, response);
        }
        List<String> instanceIds = listOfMaps(response.get("Instances")).stream()
                .map(instance -> String.valueOf(instance.get("InstanceId")))
                .toList();
        log.info("[Compute] Launched {} in {}", instanceIds, request.region());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("instance_ids", instanceIds);
        result.put("reservation_id", response.get("ReservationId"));
        return result;
    }

    private Map<String, Object> changeState(ActionRequest request, String operation) {
        List<String> ids = ParameterSupport.ensureStringList(request.params().get("instance_ids"));
        if (ids.isEmpty()) {
            ids = List.of(ParameterSupport.requireString(request.params(), INSTANCE_ID, request.action()));
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("InstanceIds", ids);
        if ("StopInstances".equals(operation)) {
            args.put("Force", ParameterSupport.toBoolean(request.params().get("force"), false));
        }
        Map<String, Object> response = call(request, EC2, operation, args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        List<Map<String, Object>> changes = new ArrayList<>(listOfMaps(response.get("StoppingInstances")));
        changes.addAll(listOfMaps(response.get("TerminatingInstances")));
        for (Map<String, Object> item : changes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(INSTANCE_ID, item.get("InstanceId"));
            entry.put("previous_state", mapOf(item.get("PreviousState")).get("Name"));
            entry.put("current_state", mapOf(item.get("CurrentState")).get("Name"));
            entries.add(entry);
        }
        return Map.of(INSTANCES, entries);
    }

    private Map<String, Object> listInstances(ActionRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        List<String> ids = ParameterSupport.ensureStringList(request.params().get("instance_ids"));
        if (!ids.isEmpty()) {
            args.put("InstanceIds", ids);
        }
        Map<String, Object> response = call(request, EC2, "DescribeInstances", args);
        List<Map<String, Object>> items = new ArrayList<>();
        for (Map<String, Object> reservation : listOfMaps(response.get("Reservations"))) {
            for (Map<String, Object> instance : listOfMaps(reservation.get("Instances"))) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put(INSTANCE_ID, instance.get("InstanceId"));
                item.put("state", mapOf(instance.get("State")).get("Name"));
                item.put("type", instance.get("InstanceType"));
                item.put("public_ip", instance.get("PublicIpAddress"));
                item.put("private_ip", instance.get("PrivateIpAddress"));
                Map<String, Object> tags = new LinkedHashMap<>();
                for (Map<String, Object> tag : listOfMaps(instance.get("Tags"))) {
                    tags.put(String.valueOf(tag.get("Key")), tag.get("Value"));
                }
                item.put("tags", tags);
                items.add(item);
            }
        }
        return Map.of(INSTANCES, items);
    }

    private Map<String, Object> describeImages(ActionRequest request) {
        Map<String, Object> params = request.params();
        Map<String, Object> args = new LinkedHashMap<>();
        List<String> owners = ParameterSupport.ensureStringList(params.get("owners"));
        if (!owners.isEmpty()) {
            args.put("Owners", owners);
        }
        if (params.get(FILTERS) != null) {
            args.put("Filters", ParameterSupport.normalizeFilters(params.get(FILTERS)));
        }
        List<String> imageIds = ParameterSupport.ensureStringList(params.get("image_ids"));
        if (!imageIds.isEmpty()) {
            args.put("ImageIds", imageIds);
        }
        Map<String, Object> response = call(request, EC2, "DescribeImages", args);
        List<Map<String, Object>> images = new ArrayList<>();
        for (Map<String, Object> image : listOfMaps(response.get("Images"))) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("image_id", image.get("ImageId"));
            item.put("name", image.get("Name"));
            item.put("description", image.get("Description"));
            item.put("state", image.get("State"));
            item.put("creation_date", image.get("CreationDate"));
            item.put("root_device_type", image.get("RootDeviceType"));
            item.put("virtualization_type", image.get("VirtualizationType"));
            images.add(item);
        }
        return Map.of("images", images);
    }

    private Map<String, Object> describeKeyPairs(ActionRequest request) {
        Map<String, Object> params = request.params();
        Map<String, Object> args = new LinkedHashMap<>();
        List<String> keyNames = ParameterSupport.ensureStringList(params.get("key_names"));
        if (!keyNames.isEmpty()) {
            args.put("KeyNames", keyNames);
        }
        if (params.get(FILTERS) != null) {
            args.put("Filters", ParameterSupport.normalizeFilters(params.get(FILTERS)));
        }
        Map<String, Object> response = call(request, EC2, "DescribeKeyPairs", args);
        List<Map<String, Object>> pairs = new ArrayList<>();
        for (Map<String, Object> pair : listOfMaps(response.get("KeyPairs"))) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("key_name", pair.get("KeyName"));
            item.put("key_pair_id", pair.get("KeyPairId"));
            item.put("fingerprint", pair.get("KeyFingerprint"));
            item.put("type", pair.get("KeyType"));
            pairs.add(item);
        }
        return Map.of("key_pairs", pairs);
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
