package me.golemcore.deploy.adapter.outbound.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.deploy.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.deploy.domain.model.AuditEvent;
import me.golemcore.deploy.domain.model.AuditStatus;
import me.golemcore.deploy.domain.model.InvocationOutcome;
import me.golemcore.deploy.domain.model.Stage;
import me.golemcore.deploy.domain.model.ToolInvocation;
import me.golemcore.deploy.infrastructure.config.AutoConfiguration;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonlAuditStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private JsonlAuditStoreAdapter store;

    @BeforeEach
    void setUp() {
        DeployProperties properties = new DeployProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        store = new JsonlAuditStoreAdapter(storage, objectMapper);
    }

    @Test
    void shouldAppendEventsGroupedBySession() throws Exception {
        store.appendEvents(List.of(event("s1", 1), event("s2", 1), event("s1", 2)));
        store.appendEvents(List.of(event("s1", 3)));

        String[] lines = storage.getText("audit", "s1.events.jsonl").join().strip().split("\n");
        assertEquals(3, lines.length);
        assertEquals(3, objectMapper.readValue(lines[2], AuditEvent.class).sequence());
        assertNotNull(storage.getText("audit", "s2.events.jsonl").join());
    }

    @Test
    void shouldAppendInvocationUnderSafeName() throws Exception {
        store.appendInvocation(ToolInvocation.builder()
                .id("inv-1")
                .sessionId("../escape")
                .stage(Stage.EXECUTION)
                .action("launch_ec2")
                .params(Map.of("instance_type", "t3.micro"))
                .outcome(InvocationOutcome.SUCCESS)
                .startedAt(NOW)
                .build());

        String json = storage.getText("audit", ".._escape.invocations.jsonl").join();
        assertEquals("launch_ec2", objectMapper.readTree(json).get("action").asText());
    }

    @Test
    void shouldMapBlankSessionToUnscoped() {
        assertEquals("unscoped", JsonlAuditStoreAdapter.safeName(" "));
        assertEquals("team_a", JsonlAuditStoreAdapter.safeName("team/a"));
    }

    @Test
    void shouldPropagateWriteFailures() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        JsonlAuditStoreAdapter failingStore = new JsonlAuditStoreAdapter(failing, objectMapper);

        assertThrows(CompletionException.class, () -> failingStore.appendEvents(List.of(event("s1", 1))));
    }

    private static AuditEvent event(String sessionId, long sequence) {
        return AuditEvent.builder()
                .sessionId(sessionId)
                .sequence(sequence)
                .timestamp(NOW)
                .kind(AuditEvent.Kind.STAGE_TRANSITION)
                .stage(Stage.INTAKE)
                .status(AuditStatus.SUCCESS)
                .detail("INTAKE -> CONTEXT_SYNC")
                .build();
    }
}
