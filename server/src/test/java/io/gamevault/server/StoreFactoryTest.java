package io.gamevault.server;

import io.gamevault.storage.StoreKind;
import io.gamevault.storage.document.DocumentStore;
import io.gamevault.storage.log.LogStructuredStore;
import io.gamevault.storage.memory.InMemoryStore;
import io.gamevault.storage.sql.JdbcStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoreFactoryTest {

    @TempDir Path dir;

    private StorageConfig config(StoreKind kind, String url) {
        return new StorageConfig(kind, url, null, null, dir, 8, 5, false);
    }

    @Test
    void builds_the_configured_backend() {
        assertInstanceOf(InMemoryStore.class, StoreFactory.create(config(StoreKind.MEMORY, null)));
        assertInstanceOf(LogStructuredStore.class, StoreFactory.create(config(StoreKind.LOG, null)));
        assertInstanceOf(DocumentStore.class, StoreFactory.create(config(StoreKind.DOCUMENT, null)));
        assertInstanceOf(JdbcStore.class,
                StoreFactory.create(config(StoreKind.SQL, "jdbc:sqlite:" + dir.resolve("f.db"))));
    }

    @Test
    void open_wires_cache_size_and_policy() {
        var lenient = new StorageConfig(StoreKind.MEMORY, null, null, null, dir, 8, 5, true);

        try (CachingGameStorage storage = StoreFactory.open(lenient)) {
            assertEquals(8, storage.cache().capacity());
            storage.connect();
            assertFalse(storage.has("g1"));
        }
    }

    @Test
    void file_backends_live_under_the_data_dir() {
        try (CachingGameStorage storage = StoreFactory.open(config(StoreKind.LOG, null))) {
            storage.connect();
        }
        assertTrue(dir.resolve("log").resolve("wal").toFile().isDirectory());
    }
}
