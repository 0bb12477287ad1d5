package io.gamevault.storage.log;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the in-memory map plus the highest log
 * position it covers and the WAL segment that follows it. On restart we load
 * the latest readable snapshot, then replay only the WAL from that segment on.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current map.
     *
     * @param current    immutable copy of gameId -> latest entry
     * @param lastSeq    highest log position reflected in {@code current}
     * @param walSegment first WAL segment holding records after {@code lastSeq}
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(Map<String, LogEntry> current, long lastSeq, long walSegment);

    /**
     * Load the newest snapshot that reads back cleanly, skipping damaged ones,
     * or null if there is none.
     */
    LoadedSnapshot loadLatest();

    /**
     * Keep the newest {@code keep} readable snapshots and delete the rest,
     * damaged ones included.
     *
     * @return the WAL segment the oldest kept snapshot replays from; WAL
     *         segments below it are no longer needed. 0 if nothing is kept.
     */
    long prune(int keep);

    record LoadedSnapshot(String id, long lastSeq, long walSegment, Map<String, LogEntry> data) {}
}
