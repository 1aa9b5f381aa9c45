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
import me.golemcore.deploy.domain.gateway.ActionHandler;
import me.golemcore.deploy.domain.gateway.ActionProvider;
import me.golemcore.deploy.domain.gateway.ActionRequest;
import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.CommandRunnerPort;
import me.golemcore.deploy.port.outbound.CommandRunnerPort.CommandResult;
import me.golemcore.deploy.security.CommandGuard;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Local build and dependency actions. Commands run without a shell, inside
 * the gateway workspace, and are bounded by the gateway's shell timeout.
 *
 * <p>
 * Parameters:
 * <ul>
 * <li>{@code command} - build check command line (defaults to
 * {@code deploy.workflow.build-check-command})
 * <li>{@code workdir} - directory relative to the workspace
 * <li>{@code manager} - {@code npm}, {@code pip}, {@code maven} or
 * {@code gradle} for {@code install_dependencies}
 * </ul>
 */
@Component
@Slf4j
public class ShellActions implements ActionProvider {

    private static final Map<String, List<String>> INSTALL_COMMANDS = Map.of(
            "npm", List.of("npm", "install", "--no-audit", "--no-fund"),
            "pip", List.of("pip", "install", "-r", "requirements.txt"),
            "maven", List.of("mvn", "-B", "-q", "dependency:go-offline"),
            "gradle", List.of("gradle", "--no-daemon", "dependencies"));

    private final CommandRunnerPort commandRunner;
    private final CommandGuard commandGuard;
    private final DeployProperties properties;
    private final Path workspaceRoot;

    public ShellActions(CommandRunnerPort commandRunner, CommandGuard commandGuard, DeployProperties properties) {
        this.commandRunner = commandRunner;
        this.commandGuard = commandGuard;
        this.properties = properties;
        this.workspaceRoot = Paths.get(properties.getGateway().getWorkspaceRoot()
                .replace("${user.home}", System.getProperty("user.home"))).toAbsolutePath().normalize();
    }

    @Override
    public List<ActionDefinition> getActions() {
        return List.of(
                shell("run_build_check", "Run the project's build or test command", this::buildCheck),
                shell("install_dependencies", "Install project dependencies with a known package manager",
                        this::installDependencies));
    }

    private static ActionDefinition shell(String name, String description,
            ActionHandler handler) {
        return ActionDefinition.builder()
                .name(name)
                .category(ActionCategory.SHELL)
                .capability(StageCapability.BUILD_CHECK)
                .shellClass(true)
                .description(description)
                .handler(handler)
                .build();
    }

    private Map<String, Object> buildCheck(ActionRequest request) {
        String command = ParameterSupport.optionalString(request.params(), "command");
        if (command == null) {
            command = properties.getWorkflow().getBuildCheckCommand();
        }
        if (command == null || command.isBlank()) {
            Map<String, Object> skipped = new LinkedHashMap<>();
            skipped.put("skipped", true);
            skipped.put("reason", "No build check command configured");
            return skipped;
        }
        String blocked = commandGuard.check(command);
        if (blocked != null) {
            throw new ParameterValidationException(blocked, "Use a plain build or test command");
        }
        List<String> argv = Arrays.asList(command.trim().split("\\s+"));
        return run(request, argv);
    }

    private Map<String, Object> installDependencies(ActionRequest request) {
        String manager = ParameterSupport.requireString(request.params(), "manager", "install_dependencies")
                .toLowerCase(Locale.ROOT);
        List<String> argv = INSTALL_COMMANDS.get(manager);
        if (argv == null) {
            throw new ParameterValidationException("Unsupported package manager '" + manager + "'",
                    "Use one of " + INSTALL_COMMANDS.keySet());
        }
        return run(request, argv);
    }

    private Map<String, Object> run(ActionRequest request, List<String> argv) {
        Path workDir = resolveWorkDir(ParameterSupport.optionalString(request.params(), "workdir"));
        if (request.dryRun()) {
            Map<String, Object> preview = new LinkedHashMap<>();
            preview.put("dry_run", true);
            preview.put("command", String.join(" ", argv));
            preview.put("workdir", workDir.toString());
            return preview;
        }
        log.info("[Shell] Running '{}' in {}", argv.get(0), workDir);
        CommandResult result = commandRunner.run(argv, workDir, properties.getGateway().getShellTimeout());
        if (result.timedOut()) {
            throw new DeploymentException(ErrorCode.TIMEOUT, "Command '" + argv.get(0) + "' timed out",
                    "Shorten the build or raise deploy.gateway.shell-timeout");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exit_code", result.exitCode());
        data.put("duration_ms", result.durationMs());
        data.put("command", String.join(" ", argv));
        data.put("output", result.output());
        if (!result.isSuccess()) {
            throw new DeploymentException(ErrorCode.TOOL_FAILURE,
                    "Command failed with exit code " + result.exitCode() + ": " + tail(result.output()),
                    "Fix the build errors reported above and retry");
        }
        return data;
    }

    private Path resolveWorkDir(String relative) {
        try {
            Files.createDirectories(workspaceRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace " + workspaceRoot, e);
        }
        if (relative == null) {
            return workspaceRoot;
        }
        Path workDir = workspaceRoot.resolve(relative).normalize();
        if (!workDir.startsWith(workspaceRoot)) {
            throw new ParameterValidationException("Working directory must be within workspace");
        }
        if (!Files.isDirectory(workDir)) {
            throw new ParameterValidationException("Working directory does not exist: " + relative);
        }
        return workDir;
    }

    private static String tail(String output) {
        if (output == null) {
            return "";
        }
        String trimmed = output.strip();
        return trimmed.length() > 500 ? trimmed.substring(trimmed.length() - 500) : trimmed;
    }
}
