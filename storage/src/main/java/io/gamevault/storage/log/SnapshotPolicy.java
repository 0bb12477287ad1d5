package io.gamevault.storage.log;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Triggers a full snapshot after every N applied writes.
 * Bounds recovery time by limiting how much WAL has to be replayed.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each durable write. Returns true when a snapshot is due (and resets the count). */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
