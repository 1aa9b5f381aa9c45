package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.domain.model.PlanStep.StepStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the compensating actions for a partially executed plan, newest step
 * first. Resources the catalog cannot remove are reported as residue for the
 * operator instead.
 */
@Component
public class CompensationPlanner {

    private static final String REGION = "region";

    public CompensationPlan plan(Plan plan) {
        List<Compensation> actions = new ArrayList<>();
        List<String> residue = new ArrayList<>();
        List<PlanStep> steps = new ArrayList<>(plan.mutatingSteps());
        for (int i = steps.size() - 1; i >= 0; i--) {
            PlanStep step = steps.get(i);
            if (step.getStatus() != StepStatus.COMPLETED && step.getStatus() != StepStatus.FAILED) {
                continue;
            }
            boolean failed = step.getStatus() == StepStatus.FAILED;
            switch (step.getAction()) {
            case "launch_ec2", "package_and_deploy_instance" -> {
                List<String> ids = ParameterSupport.ensureStringList(step.getResult().get("instance_ids"));
                if (!ids.isEmpty()) {
                    Map<String, Object> params = new LinkedHashMap<>();
                    params.put(REGION, step.getParams().get(REGION));
                    params.put("instance_ids", ids);
                    actions.add(new Compensation(step, "terminate_ec2", params,
                            "Terminate instance(s) " + String.join(", ", ids), false));
                } else if ("package_and_deploy_instance".equals(step.getAction()) && !failed) {
                    residue.add("Artifact staged in s3://" + step.getParams().get("bucket_name"));
                }
            }
            case "create_service" -> {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put(REGION, step.getParams().get(REGION));
                params.put("cluster", step.getParams().get("cluster"));
                params.put("service_name", step.getParams().get("service_name"));
                params.put("desired_count", 0);
                actions.add(new Compensation(step, "update_service", params,
                        "Scale service " + step.getParams().get("service_name") + " to zero tasks", failed));
            }
            case "deploy_lambda", "package_and_deploy_function" -> {
                if (!failed) {
                    residue.add("Function " + step.getParams().get("function_name") + " was created");
                }
            }
            case "create_cluster" -> {
                if (!failed) {
                    residue.add("Cluster " + step.getParams().get("cluster_name") + " was created");
                }
            }
            case "register_task_definition" -> {
                if (!failed) {
                    residue.add("Task definition " + step.getParams().get("family") + " was registered");
                }
            }
            case "create_bucket" -> {
                if (!failed) {
                    residue.add("Bucket " + step.getParams().get("bucket_name") + " was created");
                }
            }
            case "upload_s3" -> {
                if (!failed) {
                    residue.add("Object " + step.getParams().get("object_name") + " was uploaded");
                }
            }
            default -> {
                if (!failed) {
                    residue.add("Step " + step.getId() + " (" + step.getAction() + ") has no compensating action");
                }
            }
            }
        }
        return new CompensationPlan(actions, residue);
    }

    /**
     * One compensating gateway call. {@code tolerateMissing} is set when the
     * step being undone failed, so the resource may never have been created.
     */
    public record Compensation(PlanStep source, String action, Map<String, Object> params, String description,
            boolean tolerateMissing) {
    }

    public record CompensationPlan(List<Compensation> actions, List<String> residue) {

        public boolean isEmpty() {
            return actions.isEmpty();
        }
    }
}
