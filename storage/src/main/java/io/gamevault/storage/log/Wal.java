package io.gamevault.storage.log;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() must fsync the record to disk before returning.
 *  - A partial write is treated as absent during recovery: a corrupt or
 *    truncated record ends its segment for the reader.
 *  - Segments are numbered from 1 upwards; compaction removes a prefix of them.
 */
public interface Wal extends AutoCloseable {

    /** Append a single serialized record (header+payload) and fsync it. */
    void append(byte[] serializedRecord);

    /** Start a new segment if the current one passed its size threshold. */
    void rotateIfNeeded();

    /** Start a new segment unless the current one is still empty. */
    void rotate();

    /** Number of the segment appends currently go to. */
    long currentSegment();

    /** Number of the oldest segment still on disk. */
    long oldestSegment();

    /** Delete every segment numbered below {@code segment}; returns how many were removed. */
    int deleteSegmentsBefore(long segment);

    /**
     * Open a sequential reader over the segments numbered {@code fromSegment}
     * and above, oldest first.
     */
    WalReader openReader(long fromSegment);

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /** @return next valid payload (without header), or null once every segment is read. */
        byte[] next();

        /** True if some segment ended in a torn or corrupt record. */
        boolean sawTornTail();

        @Override
        void close();
    }
}
