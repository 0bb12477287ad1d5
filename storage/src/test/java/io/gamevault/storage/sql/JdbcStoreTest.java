package io.gamevault.storage.sql;

import io.gamevault.core.GameState;
import io.gamevault.storage.StoreConnectionException;
import io.gamevault.storage.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStoreTest {

    @TempDir Path dir;

    private JdbcSettings settings;
    private JdbcStore store;

    @BeforeEach
    void setUp() {
        settings = JdbcSettings.of("jdbc:sqlite:" + dir.resolve("games.db"));
        store = new JdbcStore(settings);
        store.connect();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void upsert_bumps_revision_and_stamps_identity() {
        store.upsert("g1", GameState.parse("{\"_stateID\":0,\"cells\":[null,null]}"));
        store.upsert("g1", GameState.parse("{\"_stateID\":1,\"cells\":[\"0\",null]}"));

        GameState found = store.findOne("g1");
        assertEquals(1L, found.stateId());
        assertEquals("g1@2", found.storeId());
        assertEquals("[\"0\",null]", found.field("cells").toString());
    }

    @Test
    void out_of_order_upsert_does_not_move_row_backwards() {
        store.upsert("g1", GameState.parse("{\"_stateID\":5,\"turn\":\"x\"}"));
        store.upsert("g1", GameState.parse("{\"_stateID\":3,\"turn\":\"o\"}"));

        GameState found = store.findOne("g1");
        assertEquals(5L, found.stateId());
        assertEquals("\"x\"", found.field("turn").toString());
        assertEquals("g1@1", found.storeId());

        store.upsert("g1", GameState.withStateId(5));
        assertEquals("g1@2", store.findOne("g1").storeId());
    }

    @Test
    void unversioned_upserts_always_apply() {
        store.upsert("g1", GameState.withStateId(9));
        store.upsert("g1", GameState.parse("{\"note\":\"reset\"}"));

        GameState found = store.findOne("g1");
        assertFalse(found.hasStateId());
        assertEquals("g1@2", found.storeId());

        store.upsert("g1", GameState.withStateId(1));
        assertEquals(1L, store.findOne("g1").stateId());
    }

    @Test
    void stored_row_does_not_keep_caller_identity() {
        store.upsert("g1", GameState.parse("{\"_stateID\":3,\"_id\":\"bogus\"}"));

        assertEquals("g1@1", store.findOne("g1").storeId());
    }

    @Test
    void exists_reflects_rows() {
        assertFalse(store.exists("g1"));
        assertNull(store.findOne("g1"));
        store.upsert("g1", GameState.withStateId(0));
        assertTrue(store.exists("g1"));
    }

    @Test
    void rows_survive_reconnect() {
        store.upsert("g1", GameState.withStateId(7));
        store.close();

        store = new JdbcStore(settings);
        store.connect();
        assertEquals(7L, store.findOne("g1").stateId());
    }

    @Test
    void unknown_driver_fails_connect() {
        var bad = new JdbcStore(JdbcSettings.of("jdbc:nosuchdb:somewhere"));
        assertThrows(StoreConnectionException.class, bad::connect);
        assertFalse(bad.isConnected());
    }

    @Test
    void operations_before_connect_fail() {
        var fresh = new JdbcStore(settings);
        assertThrows(StoreException.class, () -> fresh.findOne("g1"));
    }
}
