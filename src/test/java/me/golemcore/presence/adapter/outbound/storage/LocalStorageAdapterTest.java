package me.golemcore.presence.adapter.outbound.storage;

import me.golemcore.presence.infrastructure.config.PresenceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "presence";
    private static final String FILE_1 = "events-2026-03-10.jsonl";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        PresenceProperties properties = new PresenceProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsTelemetryDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("presence")));
        assertTrue(Files.isDirectory(tempDir.resolve("sleep")));
    }

    @Test
    void appendText_accumulatesLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, FILE_1, "{\"a\":1}\n").get();
        storageAdapter.appendText(TEST_DIR, FILE_1, "{\"a\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storageAdapter.getText(TEST_DIR, FILE_1).get());
    }

    @Test
    void appendText_createsMissingDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("archive", "old.jsonl", "x\n").get();

        assertTrue(Files.exists(tempDir.resolve("archive").resolve("old.jsonl")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.jsonl").get());
    }

    @Test
    void listObjects_filtersByPrefixAndSorts() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "events-2026-03-11.jsonl", "x\n").get();
        storageAdapter.appendText(TEST_DIR, FILE_1, "x\n").get();
        storageAdapter.appendText(TEST_DIR, "notes.txt", "x\n").get();

        List<String> files = storageAdapter.listObjects(TEST_DIR, "events-").get();

        assertEquals(List.of(FILE_1, "events-2026-03-11.jsonl"), files);
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
    }

    @Test
    void deleteObject_removesFile() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, FILE_1, "x\n").get();

        storageAdapter.deleteObject(TEST_DIR, FILE_1).get();

        assertNull(storageAdapter.getText(TEST_DIR, FILE_1).get());
    }

    @Test
    void pathTraversal_isBlocked() {
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").get());

        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
    }
}
