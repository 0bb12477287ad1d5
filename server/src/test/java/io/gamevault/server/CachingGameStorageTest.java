package io.gamevault.server;

import io.gamevault.core.GameState;
import io.gamevault.core.LruCache;
import io.gamevault.storage.StoreConnectionException;
import io.gamevault.storage.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CachingGameStorageTest {

    private ScriptedStore store;
    private CachingGameStorage storage;

    @BeforeEach
    void setUp() {
        store = new ScriptedStore();
        storage = new CachingGameStorage(store);
        storage.connect();
    }

    private static GameState state(long stateId) {
        return GameState.parse("{\"_stateID\":" + stateId + ",\"turn\":" + stateId + "}");
    }

    @Test
    void set_then_get_serves_from_cache() {
        storage.set("g1", state(1));

        assertEquals(state(1), storage.get("g1"));
        assertEquals(0, store.finds.get());
        assertEquals(1, store.upserts.get());
    }

    @Test
    void older_or_equal_write_is_discarded_without_touching_the_store() {
        storage.set("g1", state(0));
        storage.set("g1", state(1));
        storage.set("g1", state(0));
        storage.set("g1", state(1));

        assertEquals(1L, storage.get("g1").stateId());
        assertEquals(2, store.upserts.get());
        assertEquals(1L, store.delegate.findOne("g1").stateId());
    }

    @Test
    void unversioned_writes_always_go_through() {
        storage.set("g1", GameState.parse("{\"a\":1}"));
        storage.set("g1", GameState.parse("{\"a\":2}"));

        assertEquals(2, storage.get("g1").field("a").asInt());
        assertEquals(2, store.upserts.get());
    }

    @Test
    void cold_get_fetches_from_store_and_populates_cache() {
        store.seed("g1", state(4));

        GameState first = storage.get("g1");
        assertEquals(4L, first.stateId());
        assertNotNull(first.storeId(), "store-fetched document carries its identity");
        assertEquals(first, storage.cache().get("g1"));

        storage.get("g1");
        assertEquals(1, store.finds.get());
    }

    @Test
    void missing_game_is_null_and_leaves_cache_empty() {
        assertNull(storage.get("nope"));
        assertEquals(0, storage.cache().size());
    }

    @Test
    void has_checks_cache_then_store() {
        assertFalse(storage.has("g1"));
        assertEquals(1, store.existsCalls.get());

        storage.set("g1", state(0));
        assertTrue(storage.has("g1"));
        assertEquals(1, store.existsCalls.get(), "cache hit answers without the store");

        store.seed("g2", state(0));
        assertTrue(storage.has("g2"));
        assertEquals(1, storage.cache().size(), "has() does not populate the cache");
    }

    @Test
    void caller_identity_is_stripped_before_caching_and_storing() {
        storage.set("g1", GameState.parse("{\"_stateID\":1,\"_id\":\"forged\"}"));

        assertNull(storage.get("g1").storeId());
        assertEquals("mem-1", store.delegate.findOne("g1").storeId());
    }

    @Test
    void evicted_game_is_refetched_with_store_identity() {
        var small = new CachingGameStorage(store, new LruCache<>(1), ConnectPolicy.STRICT);
        small.connect();

        small.set("g1", state(1));
        small.set("g2", state(1));
        assertNull(small.cache().get("g1"));

        GameState refetched = small.get("g1");
        assertEquals(1L, refetched.stateId());
        assertNotNull(refetched.storeId());
        assertEquals(1, store.finds.get());
    }

    @Test
    void duplicate_write_after_progress_keeps_latest_state() {
        storage.set("g1", state(0));
        storage.set("g1", state(1));
        storage.set("g1", state(0));

        assertEquals(1L, storage.get("g1").stateId());

        storage.resetCache();
        GameState fromStore = storage.get("g1");
        assertEquals(1L, fromStore.stateId());
        assertNotNull(fromStore.storeId());
    }

    @Test
    void reset_cache_forces_store_reads() {
        storage.set("g1", state(2));
        storage.resetCache();

        assertEquals(0, storage.cache().size());
        assertEquals(2L, storage.get("g1").stateId());
        assertEquals(1, store.finds.get());
    }

    @Test
    void operations_before_connect_are_rejected() {
        var fresh = new CachingGameStorage(new ScriptedStore());
        assertThrows(IllegalStateException.class, () -> fresh.get("g1"));
        assertThrows(IllegalStateException.class, () -> fresh.set("g1", state(1)));
        assertThrows(IllegalStateException.class, () -> fresh.has("g1"));
    }

    @Test
    void second_connect_is_rejected() {
        assertThrows(IllegalStateException.class, storage::connect);
    }

    @Test
    void strict_connect_rethrows() {
        var failing = new ScriptedStore();
        failing.failConnect = true;
        var strict = new CachingGameStorage(failing, new LruCache<>(10), ConnectPolicy.STRICT);

        assertThrows(StoreConnectionException.class, strict::connect);
    }

    @Test
    void lenient_connect_returns_and_later_calls_surface_store_errors() {
        var failing = new ScriptedStore();
        failing.failConnect = true;
        var lenient = new CachingGameStorage(failing, new LruCache<>(10), ConnectPolicy.LENIENT);

        assertDoesNotThrow(lenient::connect);
        assertThrows(StoreException.class, () -> lenient.get("g1"));
    }

    @Test
    void store_failure_on_set_propagates_and_cache_keeps_value() {
        store.close();

        assertThrows(StoreException.class, () -> storage.set("g1", state(3)));
        assertEquals(3L, storage.cache().get("g1").stateId());
    }

    @Test
    void blank_game_id_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> storage.get(""));
        assertThrows(NullPointerException.class, () -> storage.set("g1", null));
    }

    @Test
    void non_positive_cache_size_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new CachingGameStorage(store, 0));
    }
}
