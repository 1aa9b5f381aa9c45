package me.golemcore.deploy.adapter.outbound.process;

import me.golemcore.deploy.port.outbound.CommandRunnerPort.CommandResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class ProcessCommandRunnerTest {

    @TempDir
    Path tempDir;

    private ProcessCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ProcessCommandRunner();
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void shouldCaptureMergedOutputAndExitCode() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), tempDir,
                Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertFalse(result.isSuccess());
        assertTrue(result.output().contains("out"));
        assertTrue(result.output().contains("err"));
    }

    @Test
    void shouldRunInWorkingDirectory() {
        CommandResult result = runner.run(List.of("pwd"), tempDir, Duration.ofSeconds(10));

        assertTrue(result.isSuccess());
        assertTrue(result.output().strip().endsWith(tempDir.getFileName().toString()));
    }

    @Test
    void shouldNotLeakUnlistedEnvironment() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo \"[$AWS_SECRET_ACCESS_KEY]\""), tempDir,
                Duration.ofSeconds(10));

        assertEquals("[]", result.output().strip());
    }

    @Test
    void shouldKillCommandAfterTimeout() {
        CommandResult result = runner.run(List.of("sleep", "5"), tempDir, Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
    }

    @Test
    void shouldFailForUnknownExecutable() {
        assertThrows(UncheckedIOException.class,
                () -> runner.run(List.of("definitely-not-a-command-xyz"), tempDir, Duration.ofSeconds(5)));
    }
}
