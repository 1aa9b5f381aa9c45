package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.domain.model.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthEvaluatorTest {

    private final HealthEvaluator evaluator = new HealthEvaluator();

    @Test
    void shouldAcceptRunningInstances() {
        Map<String, Object> data = Map.of("instances", List.of(
                Map.of("instance_id", "i-1", "state", "running"),
                Map.of("instance_id", "i-2", "state", "running")));

        assertNull(evaluator.evaluate(step("list_ec2_instances"), data));
    }

    @Test
    void shouldNameInstanceThatIsNotRunning() {
        Map<String, Object> data = Map.of("instances", List.of(
                Map.of("instance_id", "i-1", "state", "running"),
                Map.of("instance_id", "i-2", "state", "pending")));

        assertEquals("Instance i-2 is pending", evaluator.evaluate(step("list_ec2_instances"), data));
        assertEquals("No launched instances were found",
                evaluator.evaluate(step("list_ec2_instances"), Map.of("instances", List.of())));
    }

    @Test
    void shouldExpectStatus200FromFunction() {
        assertNull(evaluator.evaluate(step("invoke_lambda"), Map.of("status_code", 200)));
        assertEquals("Function returned status 202",
                evaluator.evaluate(step("invoke_lambda"), Map.of("status_code", 202)));
        assertEquals("Function returned status 0", evaluator.evaluate(step("invoke_lambda"), null));
    }

    @Test
    void shouldRequireActiveServiceWithRunningTasks() {
        Map<String, Object> healthy = Map.of("services", List.of(
                Map.of("service_name", "web", "status", "ACTIVE", "running_count", 1)));
        Map<String, Object> idle = Map.of("services", List.of(
                Map.of("service_name", "web", "status", "ACTIVE", "running_count", 0)));
        Map<String, Object> draining = Map.of("services", List.of(
                Map.of("service_name", "web", "status", "DRAINING", "running_count", 1)));

        assertNull(evaluator.evaluate(step("describe_services"), healthy));
        assertEquals("Service web has no running tasks", evaluator.evaluate(step("describe_services"), idle));
        assertEquals("Service web is DRAINING", evaluator.evaluate(step("describe_services"), draining));
        assertTrue(evaluator.evaluate(step("describe_services"), Map.of("services", List.of()))
                .startsWith("Service not found"));
    }

    @Test
    void shouldRequireListedObject() {
        assertNull(evaluator.evaluate(step("list_s3_objects"), Map.of("objects", List.of(Map.of("key", "a")))));
        assertNotNull(evaluator.evaluate(step("list_s3_objects"), Map.of("objects", List.of())));
    }

    @Test
    void shouldTreatUnknownChecksAsHealthy() {
        assertNull(evaluator.evaluate(step("describe_images"), Map.of()));
    }

    private static PlanStep step(String action) {
        return PlanStep.builder().id("verify").kind(StepKind.VALIDATE).action(action).build();
    }
}
