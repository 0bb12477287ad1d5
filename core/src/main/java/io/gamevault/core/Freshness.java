package io.gamevault.core;

/**
 * Comparison rules that keep a game's cached state from moving backwards.
 * <p>
 * Two decisions are needed:
 *  - On write: is the incoming state older than (or as old as) what the cache
 *    already holds? Then the write is stale and must be dropped.
 *  - On read-refresh: is the document just fetched from the store at least as
 *    new as what the cache holds now? Only then may it replace the cache entry.
 * <p>
 * Refresh formula:
 * <pre>
 *   oldStateID = cached  == null ? 0  : cached.stateId()
 *   newStateID = fetched == null ? -1 : fetched.stateId()
 *   refresh iff newStateID >= oldStateID
 * </pre>
 * An empty cache counts as 0, so any stored document wins. A missing store
 * document counts as -1, so it never displaces a cached entry. Swapping
 * these two defaults silently breaks monotonicity.
 */
public final class Freshness {

    private Freshness() {
        // utility
    }

    /**
     * True if {@code incoming} must be discarded because the cache already
     * holds the same or a newer stateID.
     * <p>
     * Unversioned states (no stateID on either side) are never stale.
     */
    public static boolean isStale(GameState cached, GameState incoming) {
        if (cached == null || incoming == null) {
            return false;
        }
        if (!cached.hasStateId() || !incoming.hasStateId()) {
            return false;
        }
        return cached.stateId() >= incoming.stateId();
    }

    /** True if {@code fetched} may overwrite {@code cached}. */
    public static boolean shouldRefresh(GameState cached, GameState fetched) {
        long oldStateId = cached == null ? 0L : cached.stateId();
        long newStateId = fetched == null ? -1L : fetched.stateId();
        return newStateId >= oldStateId;
    }
}
