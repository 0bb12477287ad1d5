package io.gamevault.server;

import io.gamevault.core.Freshness;
import io.gamevault.core.GameState;
import io.gamevault.core.LruCache;
import io.gamevault.storage.DurableStore;
import io.gamevault.storage.StoreConnectionException;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Write-through LRU cache in front of a {@link DurableStore}.
 * <p>
 * set(id, state):
 *  1) Drop the caller's {@code _id}; identity belongs to the store.
 *  2) In one atomic step against the cache: if the cached state is as new or
 *     newer, discard the write; otherwise cache the incoming state.
 *  3) Upsert into the store. Failures propagate; the cache keeps the value.
 * <p>
 * get(id):
 *  1) Cache hit: return it.
 *  2) Miss: fetch from the store (no lock held).
 *  3) Re-check the cache atomically and only install the fetched document if
 *     it is at least as new as whatever the cache holds by then.
 *  4) Return the fetched document, or null when the store has none.
 * <p>
 * has(id): cache hit, else ask the store. Never mutates the cache.
 * <p>
 * The stateID of a game's cached entry therefore never decreases, even when
 * writers race each other or a slow store read races a newer write.
 * <p>
 * Upserts of racing set() calls reach the store in no guaranteed order. The
 * sql backend drops a versioned upsert that is behind the stored row; the
 * other backends keep the last upsert, which may be the older state. The
 * cache still holds the newest one until it is evicted.
 */
public final class CachingGameStorage implements GameStorage {
    private static final Logger log = Logger.getLogger(CachingGameStorage.class.getName());

    public static final int DEFAULT_CACHE_SIZE = 1000;

    private final DurableStore store;
    private final LruCache<String, GameState> cache;
    private final ConnectPolicy policy;
    private final AtomicBoolean connectCalled = new AtomicBoolean();

    public CachingGameStorage(DurableStore store, LruCache<String, GameState> cache, ConnectPolicy policy) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public CachingGameStorage(DurableStore store, int cacheSize) {
        this(store, new LruCache<>(cacheSize), ConnectPolicy.STRICT);
    }

    public CachingGameStorage(DurableStore store) {
        this(store, DEFAULT_CACHE_SIZE);
    }

    @Override
    public void connect() {
        if (!connectCalled.compareAndSet(false, true)) {
            throw new IllegalStateException("connect() already called");
        }
        try {
            store.connect();
            log.info(() -> store.kind() + " store connected, cache capacity " + cache.capacity());
        } catch (StoreConnectionException e) {
            if (policy == ConnectPolicy.LENIENT) {
                log.log(Level.WARNING, store.kind() + " store connection failed; continuing", e);
                return;
            }
            log.log(Level.SEVERE, store.kind() + " store connection failed", e);
            throw e;
        }
    }

    @Override
    public GameState get(String gameId) {
        requireConnectCalled();
        requireGameId(gameId);

        GameState cached = cache.get(gameId);
        if (cached != null) {
            return cached;
        }

        GameState fetched = store.findOne(gameId);
        if (fetched != null) {
            boolean installed = cache.putIf(gameId, fetched, Freshness::shouldRefresh);
            if (!installed) {
                log.fine(() -> "cache for " + gameId + " moved ahead during fetch; kept cached state");
            }
        }
        return fetched;
    }

    @Override
    public void set(String gameId, GameState state) {
        requireConnectCalled();
        requireGameId(gameId);
        Objects.requireNonNull(state, "state");

        GameState doc = state.withoutStoreId();
        boolean accepted = cache.putIf(gameId, doc, (cached, incoming) -> !Freshness.isStale(cached, incoming));
        if (!accepted) {
            log.fine(() -> "discarded stale write for " + gameId + " (stateID " + doc.stateId() + ")");
            return;
        }
        store.upsert(gameId, doc);
    }

    @Override
    public boolean has(String gameId) {
        requireConnectCalled();
        requireGameId(gameId);
        if (cache.containsKey(gameId)) {
            return true;
        }
        return store.exists(gameId);
    }

    /** The cache instance, for operators and tests. */
    public LruCache<String, GameState> cache() {
        return cache;
    }

    public void resetCache() {
        cache.reset();
        log.info("cache reset");
    }

    @Override
    public void close() {
        store.close();
    }

    private void requireConnectCalled() {
        if (!connectCalled.get()) {
            throw new IllegalStateException("connect() has not been called");
        }
    }

    private static void requireGameId(String gameId) {
        Objects.requireNonNull(gameId, "gameId");
        if (gameId.isBlank()) {
            throw new IllegalArgumentException("gameId must not be blank");
        }
    }
}
