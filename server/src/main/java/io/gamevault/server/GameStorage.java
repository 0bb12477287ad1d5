package io.gamevault.server;

import io.gamevault.core.GameState;

/**
 * Persistence contract used by the game server.
 * <p>
 *  - connect() once before anything else.
 *  - get() returns the latest known state or null if the game does not exist.
 *  - set() records a new state; a state not newer than the cached one is dropped.
 *  - has() tells whether the game exists.
 */
public interface GameStorage extends AutoCloseable {

    void connect();

    GameState get(String gameId);

    void set(String gameId, GameState state);

    boolean has(String gameId);

    @Override
    void close();
}
