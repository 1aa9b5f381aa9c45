package me.golemcore.deploy.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.ComplianceVerdict;
import me.golemcore.deploy.domain.model.Plan;
import me.golemcore.deploy.domain.model.PlanStep;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.infrastructure.config.DeployProperties.ComplianceProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Policy built from {@code deploy.compliance.*}: allowed regions and instance
 * types, fleet and task count ceilings, reserved bucket prefixes and optional
 * mandatory tagging.
 */
@Component
@RequiredArgsConstructor
public class RuleBasedCompliancePolicy implements CompliancePolicy {

    private static final Set<String> INSTANCE_ACTIONS = Set.of("launch_ec2", "package_and_deploy_instance");

    private final DeployProperties properties;

    @Override
    public ComplianceVerdict evaluate(Plan plan) {
        ComplianceProperties rules = properties.getCompliance();
        List<String> violations = new ArrayList<>();
        for (PlanStep step : plan.getSteps()) {
            Map<String, Object> params = step.getParams();
            String region = ParameterSupport.optionalString(params, "region");
            if (region != null && !rules.getAllowedRegions().contains(region)) {
                addOnce(violations, "Region " + region + " is not approved for deployments (allowed: "
                        + rules.getAllowedRegions() + ")");
            }
            if (INSTANCE_ACTIONS.contains(step.getAction())) {
                checkInstances(step, rules, violations);
            }
            if ("create_service".equals(step.getAction()) || "update_service".equals(step.getAction())) {
                int desired = ParameterSupport.toInt(params.get("desired_count"), 1);
                if (desired > rules.getMaxDesiredCount()) {
                    violations.add("Step " + step.getId() + " requests " + desired
                            + " tasks, above the limit of " + rules.getMaxDesiredCount());
                }
            }
            String bucket = ParameterSupport.optionalString(params, "bucket_name");
            if (bucket != null) {
                for (String prefix : rules.getDeniedBucketPrefixes()) {
                    if (bucket.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                        addOnce(violations, "Bucket " + bucket + " uses reserved prefix '" + prefix + "'");
                    }
                }
            }
        }
        return violations.isEmpty()
                ? ComplianceVerdict.approve(plan.getRevision())
                : ComplianceVerdict.veto(plan.getRevision(), violations);
    }

    private static void checkInstances(PlanStep step, ComplianceProperties rules, List<String> violations) {
        Map<String, Object> params = step.getParams();
        String instanceType = ParameterSupport.optionalString(params, "instance_type");
        if (instanceType != null && !rules.getAllowedInstanceTypes().contains(instanceType)) {
            violations.add("Instance type " + instanceType + " is not approved (allowed: "
                    + rules.getAllowedInstanceTypes() + ")");
        }
        int count = ParameterSupport.toInt(params.get("max_count"), 1);
        if (count > rules.getMaxInstanceCount()) {
            violations.add("Step " + step.getId() + " launches " + count + " instances, above the limit of "
                    + rules.getMaxInstanceCount());
        }
        if (rules.isRequireTags()) {
            Map<String, Object> tags = ParameterSupport.ensureMap(params.get("tags"));
            if (tags == null || tags.isEmpty()) {
                violations.add("Step " + step.getId() + " launches untagged instances");
            }
        }
    }

    private static void addOnce(List<String> violations, String violation) {
        if (!violations.contains(violation)) {
            violations.add(violation);
        }
    }
}
