package me.fablestack.mechanics.adapter.outbound.storage;

import me.fablestack.mechanics.infrastructure.config.MechanicsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SESSIONS = "sessions";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        MechanicsProperties properties = new MechanicsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesSessionsDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve(SESSIONS)));
    }

    @Test
    void putTextAtomicThenGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "abc.json", "{\"id\":\"abc\"}", false).get();

        assertEquals("{\"id\":\"abc\"}", storageAdapter.getText(SESSIONS, "abc.json").get());
        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve("abc.json.tmp")));
    }

    @Test
    void putTextAtomicOverwritesAndKeepsBackup() throws Exception {
        storageAdapter.putTextAtomic(SESSIONS, "abc.json", "v1", false).get();
        storageAdapter.putTextAtomic(SESSIONS, "abc.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(SESSIONS, "abc.json").get());
        assertEquals("v1", Files.readString(tempDir.resolve(SESSIONS).resolve("abc.json.bak")));
    }

    @Test
    void getTextReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SESSIONS, "missing.json").get());
    }

    @Test
    void deleteObject_removesFileAndIgnoresMissing() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "a.json", "{}", false).get();

        storageAdapter.deleteObject(SESSIONS, "a.json").get();
        storageAdapter.deleteObject(SESSIONS, "a.json").get();

        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve("a.json")));
    }

    @Test
    void listObjects_returnsRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "a.json", "{}", false).get();
        storageAdapter.putTextAtomic(SESSIONS, "b.json", "{}", false).get();

        List<String> files = storageAdapter.listObjects(SESSIONS, "").get();

        assertEquals(2, files.size());
        assertTrue(files.containsAll(List.of("a.json", "b.json")));
    }

    @Test
    void listObjects_returnsEmptyForUnknownDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
    }

    @Test
    void pathTraversalIsBlocked() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.putTextAtomic(SESSIONS, "../../escape.json", "{}", false).join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
