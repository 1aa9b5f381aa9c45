package me.golemcore.deploy.adapter.outbound.packaging;

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
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.ArtifactPackagerPort;
import me.golemcore.deploy.port.outbound.CommandRunnerPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Shallow-clones a git repository into a temporary directory and zips its
 * working tree (without {@code .git}) as a deployable artifact.
 */
@Component
@Slf4j
public class GitArtifactPackagerAdapter implements ArtifactPackagerPort {

    private static final DateTimeFormatter ARTIFACT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private final CommandRunnerPort commandRunner;
    private final DeployProperties properties;
    private final Clock clock;

    public GitArtifactPackagerAdapter(CommandRunnerPort commandRunner, DeployProperties properties, Clock clock) {
        this.commandRunner = commandRunner;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public PackagedArtifact cloneAndPackage(String repoUrl, String branch, String subdirectory,
            String artifactBaseName) {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("deploy_repo_");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create checkout directory", e);
        }
        Path checkout = workDir.resolve("repo");

        List<String> command = new ArrayList<>(List.of("git", "clone", "--depth", "1"));
        if (branch != null && !branch.isBlank()) {
            command.add("--branch");
            command.add(branch);
        }
        command.add(repoUrl);
        command.add(checkout.toString());

        log.info("[Packager] Cloning {} (branch: {})", repoUrl, branch != null ? branch : "default");
        CommandRunnerPort.CommandResult result = commandRunner.run(command, workDir,
                properties.getGateway().getShellTimeout());
        if (!result.isSuccess()) {
            deleteRecursively(workDir);
            throw new DeploymentException(result.timedOut() ? ErrorCode.TIMEOUT : ErrorCode.TOOL_FAILURE,
                    "Failed to clone repository: " + result.output().strip(),
                    "Check that the repository URL and branch exist and are reachable");
        }

        Path source = checkout;
        if (subdirectory != null && !subdirectory.isBlank()) {
            source = checkout.resolve(subdirectory).normalize();
            if (!source.startsWith(checkout) || !Files.isDirectory(source)) {
                deleteRecursively(workDir);
                throw new ParameterValidationException(
                        "Directory '" + subdirectory + "' not found in repository",
                        "Use a directory path relative to the repository root");
            }
        }

        String base = artifactBaseName != null && !artifactBaseName.isBlank() ? artifactBaseName
                : source.getFileName().toString();
        String objectName = base + "-" + ARTIFACT_TIMESTAMP.format(clock.instant()) + ".zip";
        Path archive = workDir.resolve(objectName);
        try {
            zipDirectory(source, archive);
            return new PackagedArtifact(archive, workDir, objectName, Files.size(archive));
        } catch (IOException e) {
            deleteRecursively(workDir);
            throw new UncheckedIOException("Failed to package repository", e);
        }
    }

    @Override
    public void cleanup(PackagedArtifact artifact) {
        if (artifact != null && artifact.workDir() != null) {
            deleteRecursively(artifact.workDir());
        }
    }

    static void zipDirectory(Path source, Path archive) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(source)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> !source.relativize(path).startsWith(".git"))
                    .sorted()
                    .toList();
        }
        try (OutputStream out = Files.newOutputStream(archive);
                ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path file : files) {
                String entryName = source.relativize(file).toString().replace('\\', '/');
                zip.putNextEntry(new ZipEntry(entryName));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    private static void deleteRecursively(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("[Packager] Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("[Packager] Failed to clean up {}: {}", root, e.getMessage());
        }
    }
}
