package me.golemcore.deploy.adapter.outbound.storage;

import me.golemcore.deploy.infrastructure.config.DeployProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String DEPLOYMENTS = "deployments";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        DeployProperties properties = new DeployProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateWorkspaceDirectoriesOnInit() {
        for (String dir : LocalStorageAdapter.DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)), dir);
        }
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(DEPLOYMENTS, "d1.json", "{\"id\":\"d1\"}").get();

        assertEquals("{\"id\":\"d1\"}", storageAdapter.getText(DEPLOYMENTS, "d1.json").get());
    }

    @Test
    void getTextReturnsNullWhenMissing() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(DEPLOYMENTS, "missing.json").get());
    }

    @Test
    void appendTextAccumulatesLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("audit", "s1.jsonl", "{\"seq\":1}\n").get();
        storageAdapter.appendText("audit", "s1.jsonl", "{\"seq\":2}\n").get();

        assertEquals("{\"seq\":1}\n{\"seq\":2}\n", storageAdapter.getText("audit", "s1.jsonl").get());
    }

    @Test
    void putTextAtomicReplacesContentAndLeavesNoTempFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("credentials", "p.json", "old").get();
        storageAdapter.putTextAtomic("credentials", "p.json", "new").get();

        assertEquals("new", storageAdapter.getText("credentials", "p.json").get());
        assertFalse(Files.exists(tempDir.resolve("credentials").resolve("p.json.tmp")));
    }

    @Test
    void listObjectsFiltersByPrefixAndSorts() throws ExecutionException, InterruptedException {
        storageAdapter.putText(DEPLOYMENTS, "b.json", "b").get();
        storageAdapter.putText(DEPLOYMENTS, "a.json", "a").get();
        storageAdapter.putText(DEPLOYMENTS, "other.txt", "x").get();

        assertEquals(List.of("a.json", "b.json", "other.txt"), storageAdapter.listObjects(DEPLOYMENTS, "").get());
        assertEquals(List.of("a.json"), storageAdapter.listObjects(DEPLOYMENTS, "a").get());
    }

    @Test
    void deleteObjectRemovesFile() throws ExecutionException, InterruptedException {
        storageAdapter.putText(DEPLOYMENTS, "gone.json", "x").get();
        storageAdapter.deleteObject(DEPLOYMENTS, "gone.json").get();

        assertFalse(storageAdapter.exists(DEPLOYMENTS, "gone.json").get());
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(DEPLOYMENTS, "../../etc/passwd").get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
