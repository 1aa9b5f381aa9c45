package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.PlanStep;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Judges the result of a validation step. Returns null when the deployment
 * looks healthy, otherwise a short reason.
 */
@Component
public class HealthEvaluator {

    public String evaluate(PlanStep step, Map<String, Object> data) {
        Map<String, Object> result = data != null ? data : Map.of();
        return switch (step.getAction()) {
        case "list_ec2_instances" -> instancesRunning(result);
        case "invoke_lambda" -> functionResponded(result);
        case "describe_services" -> serviceRunning(result);
        case "list_s3_objects" -> objectListed(result);
        default -> null;
        };
    }

    private static String instancesRunning(Map<String, Object> result) {
        List<Map<String, Object>> instances = maps(result.get("instances"));
        if (instances.isEmpty()) {
            return "No launched instances were found";
        }
        for (Map<String, Object> instance : instances) {
            if (!"running".equals(instance.get("state"))) {
                return "Instance " + instance.get("instance_id") + " is " + instance.get("state");
            }
        }
        return null;
    }

    private static String functionResponded(Map<String, Object> result) {
        int status = ParameterSupport.toInt(result.get("status_code"), 0);
        return status == 200 ? null : "Function returned status " + status;
    }

    private static String serviceRunning(Map<String, Object> result) {
        List<Map<String, Object>> services = maps(result.get("services"));
        if (services.isEmpty()) {
            return "Service not found: " + maps(result.get("failures"));
        }
        Map<String, Object> service = services.get(0);
        if (!"ACTIVE".equals(service.get("status"))) {
            return "Service " + service.get("service_name") + " is " + service.get("status");
        }
        int running = ParameterSupport.toInt(service.get("running_count"), 0);
        if (running < 1) {
            return "Service " + service.get("service_name") + " has no running tasks";
        }
        return null;
    }

    private static String objectListed(Map<String, Object> result) {
        return maps(result.get("objects")).isEmpty() ? "Uploaded object is not listed in the bucket" : null;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> maps(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Map.class::isInstance)
                .map(item -> (Map<String, Object>) item)
                .toList();
    }
}
