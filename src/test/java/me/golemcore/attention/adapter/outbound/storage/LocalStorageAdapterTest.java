package me.golemcore.attention.adapter.outbound.storage;

import me.golemcore.attention.infrastructure.config.AttentionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        AttentionProperties properties = new AttentionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsSessionsDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve(LocalStorageAdapter.SESSIONS_DIR)));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "{\"a\":1}", false).get();

        assertEquals("{\"a\":1}", storageAdapter.getText(TEST_DIR, "state.json").get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("state.json.tmp")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void putTextAtomic_overwritesAndKeepsBackup() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, "state.json").get());
        Path backup = tempDir.resolve(TEST_DIR).resolve("state.json.bak");
        assertEquals("v1", Files.readString(backup, StandardCharsets.UTF_8));
    }

    @Test
    void putTextAtomic_withoutBackupLeavesNoBakFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("state.json.bak")));
    }

    @Test
    void pathTraversalIsBlocked() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText("..", "escape.txt").join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
