package me.golemcore.deploy.domain.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.domain.gateway.ActionCatalog;
import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.model.DeploymentIntent;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.domain.model.StepKind;
import me.golemcore.deploy.domain.service.HashSupport;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a complete {@link DeploymentIntent} into ordered plan steps. Every
 * step names a catalog action; destructive tagging is copied from the
 * catalog so that the plan and the gateway always agree.
 */
@Component
@Slf4j
public class PlanComposer {

    private static final String REGION = "region";
    private static final String BUCKET_NAME = "bucket_name";
    private static final String FUNCTION_NAME = "function_name";
    private static final String CLUSTER = "cluster";
    private static final String SERVICE_NAME = "service_name";
    private static final String INSTANCE_IDS = "instance_ids";

    private final ActionCatalog catalog;
    private final ObjectMapper canonicalMapper;

    public PlanComposer(ActionCatalog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public List<PlanStep> compose(DeploymentIntent intent) {
        List<PlanStep> steps = switch (intent.getTarget()) {
        case INSTANCE -> instanceSteps(intent);
        case FUNCTION -> functionSteps(intent);
        case CONTAINER -> containerSteps(intent);
        case STORAGE -> storageSteps(intent);
        };
        log.debug("[Plan] Composed {} steps for {} target", steps.size(), intent.getTarget());
        return steps;
    }

    /**
     * Content hash over action, kind and parameters of every step. Equal
     * fingerprints mean the plan revision does not change.
     */
    public String fingerprint(List<PlanStep> steps) {
        List<Map<String, Object>> canonical = new ArrayList<>();
        for (PlanStep step : steps) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", step.getId());
            entry.put("kind", step.getKind());
            entry.put("action", step.getAction());
            entry.put("params", step.getParams());
            entry.put("bindings", step.getBindings());
            canonical.add(entry);
        }
        try {
            return HashSupport.sha256Hex(canonicalMapper.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to fingerprint plan steps", e);
        }
    }

    private List<PlanStep> instanceSteps(DeploymentIntent intent) {
        List<PlanStep> steps = new ArrayList<>();
        Map<String, Object> launch = new LinkedHashMap<>();
        launch.put(REGION, intent.getRegion());
        launch.put("ami_id", intent.getImageId());
        launch.put("instance_type", intent.getInstanceType());
        launch.put("key_name", intent.getKeyName());
        int count = intent.getInstanceCount() != null ? intent.getInstanceCount() : 1;
        launch.put("min_count", count);
        launch.put("max_count", count);
        putIfNotEmpty(launch, "security_group_ids", intent.getSecurityGroupIds());
        if (!intent.getSubnetIds().isEmpty()) {
            launch.put("subnet_id", intent.getSubnetIds().get(0));
        }
        putIfNotEmpty(launch, "tags", intent.getTags());

        String launchStep;
        if (notBlank(intent.getRepoUrl())) {
            Map<String, Object> params = new LinkedHashMap<>(launch);
            params.put("repo_url", intent.getRepoUrl());
            putIfPresent(params, "branch", intent.getBranch());
            params.put(BUCKET_NAME, intent.getBucketName());
            putIfPresent(params, "object_name", intent.getObjectKey());
            params.put("launch_instance", true);
            steps.add(step("package", StepKind.PACKAGE, "package_and_deploy_instance",
                    "Package " + intent.getRepoUrl() + ", stage it in s3://" + intent.getBucketName()
                            + " and launch " + count + " x " + intent.getInstanceType(),
                    params, Map.of()));
            launchStep = "package";
        } else {
            steps.add(step("launch", StepKind.PROVISION, "launch_ec2",
                    "Launch " + count + " x " + intent.getInstanceType() + " from " + intent.getImageId(),
                    launch, Map.of()));
            launchStep = "launch";
        }

        steps.add(step("verify", StepKind.VALIDATE, "list_ec2_instances",
                "Check the launched instances are running",
                Map.of(REGION, intent.getRegion()), Map.of(INSTANCE_IDS, launchStep + "." + INSTANCE_IDS)));
        return steps;
    }

    private List<PlanStep> functionSteps(DeploymentIntent intent) {
        List<PlanStep> steps = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(REGION, intent.getRegion());
        params.put(FUNCTION_NAME, intent.getFunctionName());
        params.put("runtime", intent.getRuntime());
        params.put("handler", intent.getHandler());
        params.put("role_arn", intent.getRoleArn());
        if (notBlank(intent.getRepoUrl())) {
            params.put("repo_url", intent.getRepoUrl());
            putIfPresent(params, "branch", intent.getBranch());
            steps.add(step("package", StepKind.PACKAGE, "package_and_deploy_function",
                    "Package " + intent.getRepoUrl() + " and create function " + intent.getFunctionName(),
                    params, Map.of()));
        } else {
            params.put("zip_file", intent.getLocalPath());
            steps.add(step("deploy", StepKind.DEPLOY, "deploy_lambda",
                    "Create function " + intent.getFunctionName() + " from "
                            + Paths.get(intent.getLocalPath()).getFileName(),
                    params, Map.of()));
        }
        steps.add(step("verify", StepKind.VALIDATE, "invoke_lambda",
                "Invoke " + intent.getFunctionName() + " and expect status 200",
                Map.of(REGION, intent.getRegion(), FUNCTION_NAME, intent.getFunctionName()), Map.of()));
        return steps;
    }

    private List<PlanStep> containerSteps(DeploymentIntent intent) {
        List<PlanStep> steps = new ArrayList<>();
        String region = intent.getRegion();
        steps.add(step("cluster", StepKind.PROVISION, "create_cluster",
                "Create cluster " + intent.getClusterName(),
                Map.of(REGION, region, "cluster_name", intent.getClusterName()), Map.of()));

        Map<String, Object> container = new LinkedHashMap<>();
        container.put("name", intent.getServiceName());
        container.put("image", intent.getContainerImage());
        container.put("essential", true);
        Map<String, Object> taskDefinition = new LinkedHashMap<>();
        taskDefinition.put(REGION, region);
        taskDefinition.put("family", intent.getServiceName());
        taskDefinition.put("container_definitions", List.of(container));
        taskDefinition.put("requires_compatibilities", List.of("FARGATE"));
        taskDefinition.put("cpu", "256");
        taskDefinition.put("memory", "512");
        steps.add(step("task", StepKind.PROVISION, "register_task_definition",
                "Register task definition " + intent.getServiceName() + " for " + intent.getContainerImage(),
                taskDefinition, Map.of()));

        int desired = intent.getDesiredCount() != null ? intent.getDesiredCount() : 1;
        Map<String, Object> service = new LinkedHashMap<>();
        service.put(REGION, region);
        service.put(CLUSTER, intent.getClusterName());
        service.put(SERVICE_NAME, intent.getServiceName());
        service.put("desired_count", desired);
        service.put("launch_type", "FARGATE");
        putIfNotEmpty(service, "subnets", intent.getSubnetIds());
        putIfNotEmpty(service, "security_groups", intent.getSecurityGroupIds());
        if (!intent.getSubnetIds().isEmpty()) {
            service.put("assign_public_ip", true);
        }
        steps.add(step("service", StepKind.DEPLOY, "create_service",
                "Create service " + intent.getServiceName() + " with " + desired + " task(s)",
                service, Map.of("task_definition", "task.task_definition_arn")));

        steps.add(step("verify", StepKind.VALIDATE, "describe_services",
                "Check service " + intent.getServiceName() + " is active with running tasks",
                Map.of(REGION, region, CLUSTER, intent.getClusterName(), SERVICE_NAME, intent.getServiceName()),
                Map.of()));
        return steps;
    }

    private List<PlanStep> storageSteps(DeploymentIntent intent) {
        List<PlanStep> steps = new ArrayList<>();
        String region = intent.getRegion();
        steps.add(step("bucket", StepKind.PROVISION, "create_bucket",
                "Create bucket " + intent.getBucketName(),
                Map.of(REGION, region, BUCKET_NAME, intent.getBucketName()), Map.of()));
        String objectName = notBlank(intent.getObjectKey())
                ? intent.getObjectKey()
                : Paths.get(intent.getLocalPath()).getFileName().toString();
        steps.add(step("upload", StepKind.DEPLOY, "upload_s3",
                "Upload " + intent.getLocalPath() + " to s3://" + intent.getBucketName() + "/" + objectName,
                Map.of(REGION, region, BUCKET_NAME, intent.getBucketName(), "file_path", intent.getLocalPath(),
                        "object_name", objectName),
                Map.of()));
        steps.add(step("verify", StepKind.VALIDATE, "list_s3_objects",
                "Check " + objectName + " is listed in the bucket",
                Map.of(REGION, region, BUCKET_NAME, intent.getBucketName(), "prefix", objectName), Map.of()));
        return steps;
    }

    private PlanStep step(String id, StepKind kind, String action, String description, Map<String, Object> params,
            Map<String, String> bindings) {
        ActionDefinition definition = catalog.find(action)
                .orElseThrow(() -> new IllegalStateException("Plan references unknown action " + action));
        return PlanStep.builder()
                .id(id)
                .kind(kind)
                .action(action)
                .description(description)
                .params(new LinkedHashMap<>(params))
                .bindings(new LinkedHashMap<>(bindings))
                .destructive(definition.destructive())
                .build();
    }

    private static void putIfPresent(Map<String, Object> params, String key, String value) {
        if (notBlank(value)) {
            params.put(key, value);
        }
    }

    private static void putIfNotEmpty(Map<String, Object> params, String key, Object value) {
        if (value instanceof List<?> list && !list.isEmpty()) {
            params.put(key, new ArrayList<>(list));
        } else if (value instanceof Map<?, ?> map && !map.isEmpty()) {
            params.put(key, new LinkedHashMap<>(map));
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
