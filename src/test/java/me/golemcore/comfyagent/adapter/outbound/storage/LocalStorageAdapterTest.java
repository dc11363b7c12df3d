package me.golemcore.comfyagent.adapter.outbound.storage;

import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SESSIONS = "sessions";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateWorkspaceDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(SESSIONS)));
        assertTrue(Files.isDirectory(tempDir.resolve("experiences")));
    }

    @Test
    void shouldWriteSessionFileAtomically() throws Exception {
        storageAdapter.putTextAtomic(SESSIONS, "s1.json", "{\"id\":\"s1\"}", false).join();

        assertEquals("{\"id\":\"s1\"}", Files.readString(tempDir.resolve(SESSIONS).resolve("s1.json")));
        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve("s1.json.tmp")));
    }

    @Test
    void shouldKeepBackupWhenRequested() throws Exception {
        storageAdapter.putTextAtomic(SESSIONS, "s1.json", "v1", false).join();
        storageAdapter.putTextAtomic(SESSIONS, "s1.json", "v2", true).join();

        assertEquals("v2", storageAdapter.getText(SESSIONS, "s1.json").join());
        assertEquals("v1", Files.readString(tempDir.resolve(SESSIONS).resolve("s1.json.bak")));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(storageAdapter.getText(SESSIONS, "missing.json").join());
        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve("missing.json")));
    }

    @Test
    void shouldListFilesSorted() {
        storageAdapter.putText(SESSIONS, "b.json", "{}").join();
        storageAdapter.putText(SESSIONS, "a.json", "{}").join();

        assertEquals(List.of("a.json", "b.json"), storageAdapter.listObjects(SESSIONS, "").join());
        assertEquals(List.of(), storageAdapter.listObjects("nowhere", "").join());
    }

    @Test
    void shouldDeleteFile() {
        storageAdapter.putText(SESSIONS, "s1.json", "{}").join();

        storageAdapter.deleteObject(SESSIONS, "s1.json").join();

        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve("s1.json")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.putText(SESSIONS, "../../escape.txt", "x").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
