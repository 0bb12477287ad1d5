package io.gamevault.server;

import io.gamevault.core.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Interleavings between a slow store read in get() and writes that land while
 * the read is in flight.
 */
class CachingGameStorageRaceTest {

    private ScriptedStore store;
    private CachingGameStorage storage;

    @BeforeEach
    void setUp() {
        store = new ScriptedStore();
        storage = new CachingGameStorage(store);
        storage.connect();
    }

    @Test
    void stale_store_read_does_not_downgrade_newer_write() throws Exception {
        store.seed("g1", GameState.withStateId(3));
        store.parkNextFind();

        CompletableFuture<GameState> read = CompletableFuture.supplyAsync(() -> storage.get("g1"));
        store.awaitFindEntered();
        storage.set("g1", GameState.withStateId(5));
        store.release();

        GameState returned = read.get(5, TimeUnit.SECONDS);
        assertEquals(3L, returned.stateId(), "get() still returns what it fetched");
        assertEquals(5L, storage.cache().get("g1").stateId());
    }

    @Test
    void fresher_store_read_replaces_older_cached_write() throws Exception {
        store.seed("g1", GameState.withStateId(7));
        store.parkNextFind();

        CompletableFuture<GameState> read = CompletableFuture.supplyAsync(() -> storage.get("g1"));
        store.awaitFindEntered();
        storage.set("g1", GameState.withStateId(2));
        store.release();

        assertEquals(7L, read.get(5, TimeUnit.SECONDS).stateId());
        assertEquals(7L, storage.cache().get("g1").stateId());
    }

    @Test
    void missing_document_read_returns_null_and_keeps_concurrent_write() throws Exception {
        store.parkNextFind();

        CompletableFuture<GameState> read = CompletableFuture.supplyAsync(() -> storage.get("g1"));
        store.awaitFindEntered();
        storage.set("g1", GameState.withStateId(1));
        store.release();

        assertNull(read.get(5, TimeUnit.SECONDS));
        assertEquals(1L, storage.cache().get("g1").stateId());
    }

    @Test
    void racing_writers_leave_the_highest_state_cached() throws Exception {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            ids.add(i);
        }
        Collections.shuffle(ids, new Random(42));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int id : ids) {
                futures.add(pool.submit(() -> {
                    start.await();
                    storage.set("g1", GameState.withStateId(id));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(199L, storage.cache().get("g1").stateId());
        assertTrue(store.upserts.get() <= ids.size());
    }
}
