package me.golemcore.deploy.domain.gateway;

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
import me.golemcore.deploy.domain.model.InvocationMode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides which gateway calls need an explicit {@code confirm=true} and builds
 * the human-readable description shown in the confirmation prompt.
 *
 * <p>
 * Destructive catalog actions always need confirmation when run live or as a
 * compensation. Dry-run previews change nothing and are exempt.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    private static final String UNKNOWN = "unknown";

    public boolean requiresConfirmation(ActionDefinition definition, InvocationMode mode) {
        if (definition == null || mode == InvocationMode.PREVIEW) {
            return false;
        }
        return definition.destructive();
    }

    public String confirmationMessage(String action) {
        return "Confirmation required for destructive operation '" + action + "'. Set 'confirm' to true.";
    }

    /**
     * Build a human-readable description of the action for the confirmation
     * prompt.
     */
    public String describeAction(String action, Map<String, Object> params) {
        Map<String, Object> args = params != null ? params : Map.of();
        return switch (action) {
        case "terminate_ec2" -> "Terminate instance " + instanceTarget(args);
        case "stop_ec2" -> "Stop instance " + instanceTarget(args);
        case "update_service" -> "Update service " + valueOf(args, "service_name") + " in cluster "
                + valueOf(args, "cluster")
                + (args.containsKey("desired_count") ? " (desired count " + args.get("desired_count") + ")" : "");
        case "update_lambda_code" -> "Replace code of function " + valueOf(args, "function_name");
        default -> action + ": " + args.keySet();
        };
    }

    private static String instanceTarget(Map<String, Object> args) {
        Object ids = args.get("instance_ids");
        if (ids != null) {
            return String.valueOf(ids);
        }
        return valueOf(args, "instance_id");
    }

    private static String valueOf(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? String.valueOf(value) : UNKNOWN;
    }
}
