package me.golemcore.deploy.adapter.outbound.process;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deploy.port.outbound.CommandRunnerPort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs local processes from an argument vector (no shell interpretation) with
 * a sanitized environment, an output cap and a hard kill on timeout.
 */
@Component
@Slf4j
public class ProcessCommandRunner implements CommandRunnerPort {

    private static final int MAX_OUTPUT_LENGTH = 100_000;

    private static final Set<String> ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "USER", "LOGNAME", "HOME", "JAVA_HOME", "GIT_TERMINAL_PROMPT");

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "process-output");
        thread.setDaemon(true);
        return thread;
    });

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public CommandResult run(List<String> command, Path workDir, Duration timeout) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.redirectErrorStream(true);

        Map<String, String> env = pb.environment();
        env.keySet().retainAll(ALLOWED_ENV_VARS);
        env.put("GIT_TERMINAL_PROMPT", "0");

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start " + command.get(0), e);
        }

        Future<String> outputFuture = executor.submit(() -> readOutput(process));
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long duration = System.currentTimeMillis() - startTime;
            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                log.warn("[Process] '{}' killed after {}s", command.get(0), timeout.toSeconds());
                return new CommandResult(-1, "Command timed out after " + timeout.toSeconds() + " seconds",
                        duration, true);
            }
            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }
            return new CommandResult(process.exitValue(), output, duration, false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new CommandResult(-1, "Command execution interrupted", System.currentTimeMillis() - startTime,
                    true);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Error reading process output: " + e.getMessage(), e);
        }
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        if (output.length() >= MAX_OUTPUT_LENGTH) {
            output.append("[Output truncated...]");
        }
        return output.toString();
    }
}
