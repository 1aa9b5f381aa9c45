package me.golemcore.deploy.adapter.outbound.cloud;

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
import me.golemcore.deploy.domain.model.CloudProviderException;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cloud that understands the EC2, S3, Lambda and ECS operations the
 * action catalog issues. State is kept per region and lost on restart.
 *
 * <p>
 * Dry-run calls check credentials and the operation's required parameters
 * and answer {@code DryRunOperation} without changing state, mirroring the
 * provider's own dry-run semantics. {@link #failNext(String, String, String)}
 * queues a provider error for the next live call of an operation.
 */
@Component
@ConditionalOnProperty(prefix = "deploy.cloud", name = "provider", havingValue = "sandbox", matchIfMissing = true)
@Slf4j
public class SandboxCloudProviderAdapter implements CloudProviderPort {

    private static final String ACCOUNT_ID = "000000000000";
    private static final String INSTANCE_ID = "InstanceId";
    private static final String CLUSTER = "cluster";
    private static final String STATUS = "status";

    private final Clock clock;
    private final AtomicLong idSequence = new AtomicLong(0x1000);

    private final Map<String, Map<String, Object>> instances = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> buckets = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> functions = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> clusters = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> taskDefinitions = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> services = new ConcurrentHashMap<>();
    private final Map<String, Queue<CloudProviderException>> injectedFailures = new ConcurrentHashMap<>();
    private final List<String> liveCalls = new ArrayList<>();

    public SandboxCloudProviderAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getProviderId() {
        return "sandbox";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    /**
     * Make the next live call of {@code operation} fail with the given provider
     * error code.
     */
    public void failNext(String operation, String providerCode, String message) {
        injectedFailures.computeIfAbsent(operation, key -> new ConcurrentLinkedQueue<>())
                .add(new CloudProviderException(providerCode, operation, message));
    }

    public List<String> getLiveCalls() {
        synchronized (liveCalls) {
            return List.copyOf(liveCalls);
        }
    }

    public Collection<Map<String, Object>> getInstances() {
        return instances.values();
    }

    @Override
    public Map<String, Object> call(CloudRequest request) {
        if (request.credentials() == null) {
            throw new CloudProviderException("AuthFailure", request.operation(),
                    "AWS was not able to validate the provided access credentials");
        }
        Map<String, Object> params = request.params() != null ? request.params() : Map.of();
        if (request.dryRun()) {
            return dryRun(request, params);
        }
        Queue<CloudProviderException> failures = injectedFailures.get(request.operation());
        CloudProviderException injected = failures != null ? failures.poll() : null;
        if (injected != null) {
            log.debug("[Sandbox] Injected failure for {}: {}", request.operation(), injected.getProviderCode());
            throw injected;
        }
        synchronized (liveCalls) {
            liveCalls.add(request.operation());
        }
        String region = request.region();
        return switch (request.service() + ":" + request.operation()) {
        case "ec2:RunInstances" -> runInstances(region, params);
        case "ec2:StopInstances" -> changeInstanceState(region, params, "stopped", "StoppingInstances");
        case "ec2:TerminateInstances" -> changeInstanceState(region, params, "terminated", "TerminatingInstances");
        case "ec2:DescribeInstances" -> describeInstances(region, params);
        case "ec2:DescribeImages" -> describeImages(params);
        case "ec2:DescribeKeyPairs" -> describeKeyPairs(params);
        case "s3:CreateBucket" -> createBucket(region, params);
        case "s3:HeadBucket" -> headBucket(params);
        case "s3:PutObject" -> putObject(params);
        case "s3:GetObject" -> getObject(params);
        case "s3:ListObjectsV2" -> listObjects(params);
        case "lambda:CreateFunction" -> createFunction(region, params);
        case "lambda:UpdateFunctionCode" -> updateFunctionCode(region, params);
        case "lambda:GetFunction" -> getFunction(region, params);
        case "lambda:Invoke" -> invoke(region, params);
        case "ecs:CreateCluster" -> createCluster(region, params);
        case "ecs:RegisterTaskDefinition" -> registerTaskDefinition(region, params);
        case "ecs:CreateService" -> createService(region, params);
        case "ecs:UpdateService" -> updateService(region, params);
        case "ecs:DescribeServices" -> describeServices(region, params);
        default -> throw new CloudProviderException("InvalidAction", request.operation(),
                "The action " + request.service() + ":" + request.operation() + " is not valid for this endpoint");
        };
    }

    private Map<String, Object> dryRun(CloudRequest request, Map<String, Object> params) {
        if ("ecs:CreateService".equals(request.service() + ":" + request.operation())) {
            requireParam(params, CLUSTER, request.operation());
            requireParam(params, "serviceName", request.operation());
        }
        if ("ec2:RunInstances".equals(request.service() + ":" + request.operation())) {
            requireParam(params, "ImageId", request.operation());
            requireParam(params, "InstanceType", request.operation());
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("DryRun", true);
        response.put("Operation", request.operation());
        response.put("Message", "Request would have succeeded, but DryRun flag is set.");
        return response;
    }

    private Map<String, Object> runInstances(String region, Map<String, Object> params) {
        requireParam(params, "ImageId", "RunInstances");
        requireParam(params, "InstanceType", "RunInstances");
        int count = params.get("MaxCount") instanceof Number number ? number.intValue() : 1;
        List<Map<String, Object>> launched = new ArrayList<>();
        for (int i = 0; i < Math.max(1, count); i++) {
            String id = "i-" + Long.toHexString(idSequence.incrementAndGet()) + "sandbox";
            Map<String, Object> instance = new LinkedHashMap<>();
            instance.put(INSTANCE_ID, id);
            instance.put("ImageId", params.get("ImageId"));
            instance.put("InstanceType", params.get("InstanceType"));
            instance.put("KeyName", params.get("KeyName"));
            instance.put("State", Map.of("Name", "running"));
            instance.put("PrivateIpAddress", "10.0.0." + (idSequence.get() % 250 + 2));
            instance.put("Region", region);
            instance.put("LaunchTime", clock.instant().toString());
            instance.put("Tags", params.getOrDefault("Tags", List.of()));
            instances.put(id, instance);
            launched.add(instance);
        }
        return Map.of("Instances", launched, "ReservationId", "r-" + Long.toHexString(idSequence.incrementAndGet()));
    }

    private Map<String, Object> changeInstanceState(String region, Map<String, Object> params, String newState,
            String responseKey) {
        List<Map<String, Object>> changes = new ArrayList<>();
        for (Object rawId : listParam(params, "InstanceIds")) {
            String id = String.valueOf(rawId);
            Map<String, Object> instance = instances.get(id);
            if (instance == null || !region.equals(instance.get("Region"))) {
                throw new CloudProviderException("InvalidInstanceID.NotFound", responseKey,
                        "The instance ID '" + id + "' does not exist");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> previous = (Map<String, Object>) instance.get("State");
            instance.put("State", Map.of("Name", newState));
            changes.add(Map.of(INSTANCE_ID, id, "PreviousState", previous, "CurrentState", Map.of("Name", newState)));
        }
        return Map.of(responseKey, changes);
    }

    private Map<String, Object> describeInstances(String region, Map<String, Object> params) {
        List<Object> requested = listParam(params, "InstanceIds");
        List<Map<String, Object>> matching = instances.values().stream()
                .filter(instance -> region.equals(instance.get("Region")))
                .filter(instance -> requested.isEmpty() || requested.contains(instance.get(INSTANCE_ID)))
                .toList();
        return Map.of("Reservations", List.of(Map.of("Instances", matching)));
    }

    private Map<String, Object> describeImages(Map<String, Object> params) {
        List<Map<String, Object>> images = List.of(
                image("ami-0sandboxal2023", "al2023-ami-2023.5-kernel-6.1-x86_64", "Amazon Linux 2023"),
                image("ami-0sandboxubuntu", "ubuntu-jammy-22.04-amd64-server", "Canonical Ubuntu 22.04 LTS"));
        List<Object> ids = listParam(params, "ImageIds");
        if (!ids.isEmpty()) {
            images = images.stream().filter(image -> ids.contains(image.get("ImageId"))).toList();
        }
        return Map.of("Images", images);
    }

    private Map<String, Object> image(String id, String name, String description) {
        Map<String, Object> image = new LinkedHashMap<>();
        image.put("ImageId", id);
        image.put("Name", name);
        image.put("Description", description);
        image.put("State", "available");
        image.put("CreationDate", "2024-06-01T00:00:00.000Z");
        image.put("RootDeviceType", "ebs");
        image.put("VirtualizationType", "hvm");
        return image;
    }

    private Map<String, Object> describeKeyPairs(Map<String, Object> params) {
        List<Map<String, Object>> pairs = List.of(Map.of(
                "KeyName", "sandbox-key",
                "KeyPairId", "key-0sandbox",
                "KeyFingerprint", "1f:51:ae:28:bf:89:e9:d8:1f:25:5d:37:2d:7d:b8:ca:9f:f5:f1:6f",
                "KeyType", "rsa",
                "Tags", List.of()));
        List<Object> names = listParam(params, "KeyNames");
        if (!names.isEmpty()) {
            pairs = pairs.stream().filter(pair -> names.contains(pair.get("KeyName"))).toList();
            if (pairs.isEmpty()) {
                throw new CloudProviderException("InvalidKeyPair.NotFound", "DescribeKeyPairs",
                        "The key pair '" + names.get(0) + "' does not exist");
            }
        }
        return Map.of("KeyPairs", pairs);
    }

    private Map<String, Object> createBucket(String region, Map<String, Object> params) {
        String bucket = requireParam(params, "Bucket", "CreateBucket");
        Map<String, Object> existing = buckets.putIfAbsent(bucket, newBucket(region));
        if (existing != null) {
            throw new CloudProviderException("BucketAlreadyOwnedByYou", "CreateBucket",
                    "Your previous request to create the named bucket succeeded and you already own it.");
        }
        return Map.of("Location", "/" + bucket);
    }

    private Map<String, Object> newBucket(String region) {
        Map<String, Object> bucket = new ConcurrentHashMap<>();
        bucket.put("Region", region);
        bucket.put("Objects", new ConcurrentHashMap<String, Map<String, Object>>());
        return bucket;
    }

    private Map<String, Object> headBucket(Map<String, Object> params) {
        bucket(requireParam(params, "Bucket", "HeadBucket"), "HeadBucket");
        return Map.of("BucketExists", true);
    }

    private Map<String, Object> putObject(Map<String, Object> params) {
        String key = requireParam(params, "Key", "PutObject");
        Map<String, Map<String, Object>> objects = objects(requireParam(params, "Bucket", "PutObject"), "PutObject");
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("Key", key);
        object.put("Size", params.getOrDefault("ContentLength", 0L));
        object.put("LastModified", clock.instant().toString());
        object.put("StorageClass", "STANDARD");
        objects.put(key, object);
        return Map.of("ETag", "\"" + Integer.toHexString(key.hashCode()) + "\"");
    }

    private Map<String, Object> getObject(Map<String, Object> params) {
        String key = requireParam(params, "Key", "GetObject");
        Map<String, Object> object = objects(requireParam(params, "Bucket", "GetObject"), "GetObject").get(key);
        if (object == null) {
            throw new CloudProviderException("NoSuchKey", "GetObject", "The specified key does not exist.");
        }
        return Map.of("ContentLength", object.get("Size"), "Body", "");
    }

    private Map<String, Object> listObjects(Map<String, Object> params) {
        Map<String, Map<String, Object>> objects = objects(requireParam(params, "Bucket", "ListObjectsV2"),
                "ListObjectsV2");
        Object prefix = params.get("Prefix");
        List<Map<String, Object>> contents = objects.values().stream()
                .filter(object -> prefix == null || String.valueOf(object.get("Key")).startsWith(prefix.toString()))
                .toList();
        return Map.of("Contents", contents);
    }

    private Map<String, Object> createFunction(String region, Map<String, Object> params) {
        String name = requireParam(params, "FunctionName", "CreateFunction");
        requireParam(params, "Role", "CreateFunction");
        String arn = "arn:aws:lambda:" + region + ":" + ACCOUNT_ID + ":function:" + name;
        Map<String, Object> function = new ConcurrentHashMap<>();
        function.put("FunctionArn", arn);
        function.put("Runtime", params.getOrDefault("Runtime", "unknown"));
        function.put("State", "Active");
        function.put("LastModified", clock.instant().toString());
        if (functions.putIfAbsent(region + ":" + name, function) != null) {
            throw new CloudProviderException("ResourceConflictException", "CreateFunction",
                    "Function already exist: " + name);
        }
        return Map.copyOf(function);
    }

    private Map<String, Object> updateFunctionCode(String region, Map<String, Object> params) {
        Map<String, Object> function = function(region, requireParam(params, "FunctionName", "UpdateFunctionCode"),
                "UpdateFunctionCode");
        function.put("LastModified", clock.instant().toString());
        return Map.copyOf(function);
    }

    private Map<String, Object> getFunction(String region, Map<String, Object> params) {
        Map<String, Object> function = function(region, requireParam(params, "FunctionName", "GetFunction"),
                "GetFunction");
        return Map.of("Configuration", Map.copyOf(function));
    }

    private Map<String, Object> invoke(String region, Map<String, Object> params) {
        function(region, requireParam(params, "FunctionName", "Invoke"), "Invoke");
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("StatusCode", "Event".equals(params.get("InvocationType")) ? 202 : 200);
        response.put("ExecutedVersion", "$LATEST");
        response.put("Payload", "{\"ok\": true}");
        return response;
    }

    private Map<String, Object> createCluster(String region, Map<String, Object> params) {
        String name = requireParam(params, "clusterName", "CreateCluster");
        Map<String, Object> cluster = Map.of(
                "clusterArn", "arn:aws:ecs:" + region + ":" + ACCOUNT_ID + ":cluster/" + name,
                STATUS, "ACTIVE");
        clusters.put(region + ":" + name, cluster);
        return Map.of(CLUSTER, cluster);
    }

    private Map<String, Object> registerTaskDefinition(String region, Map<String, Object> params) {
        String family = requireParam(params, "family", "RegisterTaskDefinition");
        if (listParam(params, "containerDefinitions").isEmpty()) {
            throw new CloudProviderException("ClientException", "RegisterTaskDefinition",
                    "Container definitions must not be empty");
        }
        long revision = taskDefinitions.keySet().stream().filter(key -> key.startsWith(region + ":" + family + ":"))
                .count() + 1;
        String arn = "arn:aws:ecs:" + region + ":" + ACCOUNT_ID + ":task-definition/" + family + ":" + revision;
        Map<String, Object> definition = Map.of("taskDefinitionArn", arn, "revision", revision, "family", family);
        taskDefinitions.put(region + ":" + family + ":" + revision, definition);
        return Map.of("taskDefinition", definition);
    }

    private Map<String, Object> createService(String region, Map<String, Object> params) {
        String clusterName = requireParam(params, CLUSTER, "CreateService");
        String serviceName = requireParam(params, "serviceName", "CreateService");
        if (!clusters.containsKey(region + ":" + clusterName)) {
            throw new CloudProviderException("ClusterNotFoundException", "CreateService", "Cluster not found.");
        }
        int desired = params.get("desiredCount") instanceof Number number ? number.intValue() : 1;
        Map<String, Object> service = new ConcurrentHashMap<>();
        service.put("serviceArn", "arn:aws:ecs:" + region + ":" + ACCOUNT_ID + ":service/" + clusterName + "/"
                + serviceName);
        service.put("serviceName", serviceName);
        service.put(STATUS, "ACTIVE");
        service.put("desiredCount", desired);
        service.put("runningCount", desired);
        service.put("taskDefinition", params.getOrDefault("taskDefinition", ""));
        if (services.putIfAbsent(region + ":" + clusterName + ":" + serviceName, service) != null) {
            throw new CloudProviderException("InvalidParameterException", "CreateService",
                    "Creation of service was not idempotent.");
        }
        return Map.of("service", Map.copyOf(service));
    }

    private Map<String, Object> updateService(String region, Map<String, Object> params) {
        String clusterName = requireParam(params, CLUSTER, "UpdateService");
        String serviceName = requireParam(params, "service", "UpdateService");
        Map<String, Object> service = services.get(region + ":" + clusterName + ":" + serviceName);
        if (service == null) {
            throw new CloudProviderException("ServiceNotFoundException", "UpdateService", "Service not found.");
        }
        if (params.get("desiredCount") instanceof Number number) {
            service.put("desiredCount", number.intValue());
            service.put("runningCount", number.intValue());
        }
        if (params.get("taskDefinition") != null) {
            service.put("taskDefinition", params.get("taskDefinition"));
        }
        return Map.of("service", Map.copyOf(service));
    }

    private Map<String, Object> describeServices(String region, Map<String, Object> params) {
        String clusterName = requireParam(params, CLUSTER, "DescribeServices");
        List<Map<String, Object>> found = new ArrayList<>();
        List<Map<String, Object>> failures = new ArrayList<>();
        for (Object name : listParam(params, "services")) {
            Map<String, Object> service = services.get(region + ":" + clusterName + ":" + name);
            if (service != null) {
                found.add(Map.copyOf(service));
            } else {
                failures.add(Map.of("arn", String.valueOf(name), "reason", "MISSING"));
            }
        }
        return Map.of("services", found, "failures", failures);
    }

    private Map<String, Object> bucket(String name, String operation) {
        Map<String, Object> bucket = buckets.get(name);
        if (bucket == null) {
            throw new CloudProviderException("NoSuchBucket", operation, "The specified bucket does not exist");
        }
        return bucket;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Map<String, Object>> objects(String bucketName, String operation) {
        return (Map<String, Map<String, Object>>) bucket(bucketName, operation).get("Objects");
    }

    private Map<String, Object> function(String region, String name, String operation) {
        Map<String, Object> function = functions.get(region + ":" + name);
        if (function == null) {
            throw new CloudProviderException("ResourceNotFoundException", operation,
                    "Function not found: arn:aws:lambda:" + region + ":" + ACCOUNT_ID + ":function:" + name);
        }
        return function;
    }

    private static String requireParam(Map<String, Object> params, String key, String operation) {
        Object value = params.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new CloudProviderException("MissingParameter", operation,
                    "The request must contain the parameter " + key);
        }
        return String.valueOf(value);
    }

    private static List<Object> listParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return value != null ? List.of(value) : List.of();
    }
}
