package io.gamevault.storage.memory;

import io.gamevault.core.GameState;
import io.gamevault.storage.AbstractDurableStore;
import io.gamevault.storage.StoreKind;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store: one document per game in a ConcurrentHashMap.
 * <p>
 * Identity is a per-store counter ("mem-1", "mem-2", ...) assigned on every
 * upsert. Nothing survives a restart; used as the default backend and in tests.
 */
public final class InMemoryStore extends AbstractDurableStore {

    private final Map<String, GameState> games = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public void connect() {
        markConnected();
    }

    @Override
    public GameState findOne(String gameId) {
        ensureConnected();
        return games.get(requireGameId(gameId));
    }

    @Override
    public void upsert(String gameId, GameState state) {
        ensureConnected();
        Objects.requireNonNull(state, "state");
        games.put(requireGameId(gameId), state.withStoreId("mem-" + ids.incrementAndGet()));
    }

    @Override
    public boolean exists(String gameId) {
        ensureConnected();
        return games.containsKey(requireGameId(gameId));
    }

    @Override
    public StoreKind kind() {
        return StoreKind.MEMORY;
    }

    @Override
    public void close() {
        markClosed();
    }
}
