package io.gamevault.storage;

import io.gamevault.core.GameState;

/**
 * Minimal capability interface over an authoritative backing store.
 * <p>
 * Semantics:
 *  - connect() must succeed before any other call; otherwise calls throw
 *    {@link StoreException}.
 *  - findOne() returns the latest document for the game, stamped with the
 *    store's own identity in {@link GameState#STORE_ID}, or null if the game
 *    was never written. Backends that keep a history pick the most recent
 *    entry by identity order.
 *  - upsert() is idempotent create-or-replace keyed by game id (an append for
 *    history backends) and is durable once it returns.
 *  - exists() answers without fetching the document where the backend allows it.
 * <p>
 * Implementations are safe to call from multiple threads.
 */
public interface DurableStore extends AutoCloseable {

    /**
     * Open files / connections and recover state if needed.
     *
     * @throws StoreConnectionException if the backend cannot be reached or opened
     */
    void connect();

    /** Latest document for {@code gameId}, or null if none exists. */
    GameState findOne(String gameId);

    /** Persist {@code state} as the current document for {@code gameId}. */
    void upsert(String gameId, GameState state);

    /** True if at least one document exists for {@code gameId}. */
    boolean exists(String gameId);

    StoreKind kind();

    /** Release resources. Failures are logged, not thrown. */
    @Override
    void close();
}
