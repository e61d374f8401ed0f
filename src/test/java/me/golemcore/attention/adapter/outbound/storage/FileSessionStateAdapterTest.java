package me.golemcore.attention.adapter.outbound.storage;

import me.golemcore.attention.domain.model.PersistedSessionState;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import me.golemcore.attention.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSessionStateAdapterTest {

    @TempDir
    Path tempDir;

    private FileSessionStateAdapter adapter;

    @BeforeEach
    void setUp() {
        AttentionProperties properties = new AttentionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new FileSessionStateAdapter(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(adapter.load("nobody").join().isEmpty());
    }

    @Test
    void shouldSaveAndLoadSessionState() {
        PersistedSessionState state = PersistedSessionState.builder()
                .sessionId("telegram:group/1")
                .energy(0.42)
                .mood(-0.3)
                .lastReplyTime(Instant.parse("2026-03-01T12:00:00Z"))
                .lastDailyResetDate(LocalDate.of(2026, 3, 1))
                .lastMoodChangeTime(Instant.parse("2026-03-01T11:00:00Z"))
                .totalReplies(12)
                .updatedAt(Instant.parse("2026-03-01T12:05:00Z"))
                .build();

        adapter.save(state).join();
        Optional<PersistedSessionState> loaded = adapter.load("telegram:group/1").join();

        assertEquals(Optional.of(state), loaded);
        Path file = tempDir.resolve(LocalStorageAdapter.SESSIONS_DIR)
                .resolve(FileSessionStateAdapter.fileName("telegram:group/1"));
        assertTrue(Files.exists(file));
    }

    @Test
    void shouldEncodeSessionIdIntoSafeFileName() {
        assertEquals("a%2F..%2Fb.json", FileSessionStateAdapter.fileName("a/../b"));
    }

    @Test
    void shouldFailOnCorruptedDocument() throws Exception {
        Path file = tempDir.resolve(LocalStorageAdapter.SESSIONS_DIR).resolve("broken.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        CompletionException error = assertThrows(CompletionException.class, () -> adapter.load("broken").join());
        assertInstanceOf(StorageException.class, error.getCause());
    }
}
