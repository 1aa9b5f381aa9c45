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
 * Container orchestration actions on ECS.
 */
@Component
public class ContainerActions extends CloudActionSupport {

    private static final String ECS = "ecs";
    private static final String CLUSTER = "cluster";
    private static final String SERVICE_NAME = "service_name";
    private static final String SERVICE_ARN = "service_arn";
    private static final String STATUS = "status";

    public ContainerActions(CloudProviderPort cloud) {
        super(cloud);
    }

    @Override
    public List<ActionDefinition> getActions() {
        return List.of(
                define("create_cluster", ActionCategory.CONTAINER, StageCapability.MUTATE,
                        "Create an ECS cluster", this::createCluster),
                define("register_task_definition", ActionCategory.CONTAINER, StageCapability.MUTATE,
                        "Register a task definition revision", this::registerTaskDefinition),
                define("create_service", ActionCategory.CONTAINER, StageCapability.MUTATE,
                        "Create an ECS service", this::createService),
                destructive("update_service", ActionCategory.CONTAINER, true,
                        "Update desired count or task definition of a running service", this::updateService),
                define("describe_services", ActionCategory.CONTAINER, StageCapability.READ_ONLY,
                        "Describe ECS services in a cluster", this::describeServices));
    }

    private Map<String, Object> createCluster(ActionRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("clusterName", ParameterSupport.requireString(request.params(), "cluster_name", "create_cluster"));
        List<Map<String, Object>> tags = formatTags(request.params().get("tags"));
        if (!tags.isEmpty()) {
            args.put("tags", tags);
        }
        Map<String, Object> response = call(request, ECS, "CreateCluster", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        Map<String, Object> cluster = mapOf(response.get(CLUSTER));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("cluster_arn", cluster.get("clusterArn"));
        result.put(STATUS, cluster.get(STATUS));
        return result;
    }

    private Map<String, Object> registerTaskDefinition(ActionRequest request) {
        Map<String, Object> params = request.params();
        String family = ParameterSupport.requireString(params, "family", "register_task_definition");
        List<Object> rawDefinitions = ParameterSupport.ensureList(params.get("container_definitions"));
        if (rawDefinitions == null || rawDefinitions.isEmpty()) {
            throw new ParameterValidationException("'container_definitions' is required and must be a list");
        }
        List<Map<String, Object>> definitions = new ArrayList<>();
        for (Object definition : rawDefinitions) {
            definitions.add(ParameterSupport.ensureMap(definition));
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("family", family);
        args.put("containerDefinitions", definitions);
        args.put("networkMode", params.getOrDefault("network_mode", "awsvpc"));
        List<String> compatibilities = ParameterSupport.ensureStringList(params.get("requires_compatibilities"));
        if (!compatibilities.isEmpty()) {
            args.put("requiresCompatibilities", compatibilities);
        }
        putString(args, "cpu", params.get("cpu"));
        putString(args, "memory", params.get("memory"));
        putString(args, "executionRoleArn", params.get("execution_role_arn"));
        putString(args, "taskRoleArn", params.get("task_role_arn"));

        Map<String, Object> response = call(request, ECS, "RegisterTaskDefinition", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        Map<String, Object> taskDefinition = mapOf(response.get("taskDefinition"));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_definition_arn", taskDefinition.get("taskDefinitionArn"));
        result.put("revision", taskDefinition.get("revision"));
        return result;
    }

    private Map<String, Object> createService(ActionRequest request) {
        Map<String, Object> params = request.params();
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(CLUSTER, ParameterSupport.requireString(params, CLUSTER, "create_service"));
        args.put("serviceName", ParameterSupport.requireString(params, SERVICE_NAME, "create_service"));
        args.put("taskDefinition", ParameterSupport.requireString(params, "task_definition", "create_service"));
        args.put("desiredCount", ParameterSupport.toInt(params.get("desired_count"), 1));
        args.put("launchType", params.getOrDefault("launch_type", "FARGATE"));
        putString(args, "platformVersion", params.get("platform_version"));
        putString(args, "role", params.get("role"));
        Map<String, Object> network = networkConfiguration(params);
        if (network != null) {
            args.put("networkConfiguration", network);
        }
        Map<String, Object> response = call(request, ECS, "CreateService", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        return serviceResult(response);
    }

    private Map<String, Object> updateService(ActionRequest request) {
        Map<String, Object> params = request.params();
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(CLUSTER, ParameterSupport.requireString(params, CLUSTER, "update_service"));
        args.put("service", ParameterSupport.requireString(params, SERVICE_NAME, "update_service"));
        if (params.containsKey("desired_count")) {
            args.put("desiredCount", ParameterSupport.toInt(params.get("desired_count"), 0));
        }
        putString(args, "taskDefinition", params.get("task_definition"));
        if (params.get("force_new_deployment") != null) {
            args.put("forceNewDeployment", ParameterSupport.toBoolean(params.get("force_new_deployment"), false));
        }
        Map<String, Object> response = call(request, ECS, "UpdateService", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        return serviceResult(response);
    }

    private Map<String, Object> describeServices(ActionRequest request) {
        Map<String, Object> params = request.params();
        List<String> names = ParameterSupport.ensureStringList(params.get("services"));
        if (names.isEmpty()) {
            names = List.of(ParameterSupport.requireString(params, SERVICE_NAME, "describe_services"));
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(CLUSTER, ParameterSupport.requireString(params, CLUSTER, "describe_services"));
        args.put("services", names);
        Map<String, Object> response = call(request, ECS, "DescribeServices", args);
        List<Map<String, Object>> services = new ArrayList<>();
        for (Map<String, Object> service : listOfMaps(response.get("services"))) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put(SERVICE_NAME, service.get("serviceName"));
            item.put(SERVICE_ARN, service.get("serviceArn"));
            item.put(STATUS, service.get(STATUS));
            item.put("desired_count", service.get("desiredCount"));
            item.put("running_count", service.get("runningCount"));
            services.add(item);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("services", services);
        result.put("failures", listOfMaps(response.get("failures")));
        return result;
    }

    private static Map<String, Object> serviceResult(Map<String, Object> response) {
        Map<String, Object> service = mapOf(response.get("service"));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(SERVICE_ARN, service.get("serviceArn"));
        result.put(STATUS, service.get(STATUS));
        return result;
    }

    private static Map<String, Object> networkConfiguration(Map<String, Object> params) {
        List<String> subnets = ParameterSupport.ensureStringList(params.get("subnets"));
        List<String> securityGroups = ParameterSupport.ensureStringList(params.get("security_groups"));
        Object assignPublicIp = params.get("assign_public_ip");
        if (subnets.isEmpty() && securityGroups.isEmpty() && assignPublicIp == null) {
            return null;
        }
        Map<String, Object> awsvpc = new LinkedHashMap<>();
        if (!subnets.isEmpty()) {
            awsvpc.put("subnets", subnets);
        }
        if (!securityGroups.isEmpty()) {
            awsvpc.put("securityGroups", securityGroups);
        }
        if (assignPublicIp != null) {
            awsvpc.put("assignPublicIp", ParameterSupport.toBoolean(assignPublicIp, false) ? "ENABLED" : "DISABLED");
        }
        return Map.of("awsvpcConfiguration", awsvpc);
    }

    private static List<Map<String, Object>> formatTags(Object raw) {
        Map<String, Object> parsed = ParameterSupport.ensureMap(raw);
        List<Map<String, Object>> tags = new ArrayList<>();
        if (parsed != null) {
            parsed.forEach((key, value) -> tags.add(Map.of("key", key, "value", String.valueOf(value))));
        }
        return tags;
    }

    private static void putString(Map<String, Object> target, String key, Object value) {
        if (value != null && !String.valueOf(value).isBlank()) {
            target.put(key, String.valueOf(value));
        }
    }
}
