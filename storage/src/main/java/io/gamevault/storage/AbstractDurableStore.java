package io.gamevault.storage;

import java.util.Objects;

/**
 * Shared plumbing for {@link DurableStore} implementations: connection state
 * and argument checks.
 */
public abstract class AbstractDurableStore implements DurableStore {

    private volatile boolean connected;

    protected final void markConnected() {
        connected = true;
    }

    protected final void markClosed() {
        connected = false;
    }

    public final boolean isConnected() {
        return connected;
    }

    /** Guard called at the top of every data operation. */
    protected final void ensureConnected() {
        if (!connected) {
            throw new StoreException(kind() + " store not connected");
        }
    }

    protected static String requireGameId(String gameId) {
        Objects.requireNonNull(gameId, "gameId");
        if (gameId.isBlank()) {
            throw new IllegalArgumentException("gameId must not be blank");
        }
        return gameId;
    }
}
