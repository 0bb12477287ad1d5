package io.gamevault.server;

import io.gamevault.core.GameState;
import io.gamevault.storage.StoreKind;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The same game lifecycle driven through the caching facade on every backend.
 */
class BackendScenarioTest {

    @TempDir Path dir;

    private StorageConfig config(StoreKind kind) {
        String url = kind == StoreKind.SQL ? "jdbc:sqlite:" + dir.resolve("games.db") : null;
        return new StorageConfig(kind, url, null, null, dir, 1000, 5, false);
    }

    @ParameterizedTest
    @EnumSource(StoreKind.class)
    void game_lifecycle(StoreKind kind) {
        try (CachingGameStorage storage = StoreFactory.open(config(kind))) {
            storage.connect();

            assertFalse(storage.has("game"));
            assertNull(storage.get("game"));

            storage.set("game", GameState.parse("{\"_stateID\":0,\"cells\":[null,null,null]}"));
            assertTrue(storage.has("game"));
            assertEquals(0L, storage.get("game").stateId());

            storage.set("game", GameState.parse("{\"_stateID\":1,\"cells\":[\"0\",null,null]}"));
            storage.set("game", GameState.parse("{\"_stateID\":0,\"cells\":[null,null,null]}"));

            GameState cached = storage.get("game");
            assertEquals(1L, cached.stateId());
            assertNull(cached.storeId());

            storage.resetCache();
            GameState stored = storage.get("game");
            assertEquals(1L, stored.stateId());
            assertEquals("[\"0\",null,null]", stored.field("cells").toString());
            assertNotNull(stored.storeId(), kind + " stamps identity on reads");
        }
    }

    @ParameterizedTest
    @EnumSource(value = StoreKind.class, names = {"LOG", "DOCUMENT", "SQL"})
    void state_survives_reopening(StoreKind kind) {
        try (CachingGameStorage storage = StoreFactory.open(config(kind))) {
            storage.connect();
            storage.set("game", GameState.withStateId(9));
        }
        try (CachingGameStorage storage = StoreFactory.open(config(kind))) {
            storage.connect();
            assertTrue(storage.has("game"));
            assertEquals(9L, storage.get("game").stateId());
        }
    }
}
