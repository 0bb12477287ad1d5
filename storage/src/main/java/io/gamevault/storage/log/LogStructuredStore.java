package io.gamevault.storage.log;

import io.gamevault.core.GameState;
import io.gamevault.storage.AbstractDurableStore;
import io.gamevault.storage.StoreConnectionException;
import io.gamevault.storage.StoreException;
import io.gamevault.storage.StoreKind;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Key-value store made durable by a write-ahead log plus periodic snapshots.
 * <p>
 * Layout under {@code dataDir}:
 *  - wal/   segment files written by {@link FileWal}
 *  - snap/  snapshot files written by {@link FileSnapshotter}
 * <p>
 * On upsert:
 *  1) Assign the next log position (seq).
 *  2) Frame the record and append+fsync it to the WAL.
 *  3) Apply it to the in-memory map.
 *  4) Rotate the WAL segment if needed; snapshot if the policy says so.
 * A failed append still consumes its seq and abandons the segment, so a
 * half-written record never has acknowledged writes behind it.
 * <p>
 * On snapshot: start a new WAL segment, write the snapshot, keep the newest
 * {@value #SNAPSHOTS_KEPT} snapshots and drop WAL segments that all of them cover.
 * <p>
 * On connect (recovery):
 *  1) Seed memory from the newest readable snapshot, if any.
 *  2) Replay WAL segments from the one that snapshot names, applying each
 *     record whose seq is above the highest applied so far.
 *     A torn tail is skipped and writing resumes in a fresh segment.
 * <p>
 * Document identity is the seq of the write that produced the current value.
 */
public class LogStructuredStore extends AbstractDurableStore {
    private static final Logger log = Logger.getLogger(LogStructuredStore.class.getName());

    public static final long DEFAULT_ROTATE_BYTES = 64L * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY = 50_000;
    static final int SNAPSHOTS_KEPT = 2;

    private final Map<String, LogEntry> mem = new ConcurrentHashMap<>();
    private final Path dataDir;
    private final long rotateBytes;
    private final SnapshotPolicy snapPolicy;

    private Wal wal;
    private Snapshotter snaps;
    private long lastSeq;

    public LogStructuredStore(Path dataDir) {
        this(dataDir, DEFAULT_ROTATE_BYTES, DEFAULT_SNAPSHOT_EVERY);
    }

    public LogStructuredStore(Path dataDir, long rotateBytes, int snapshotEveryOps) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        this.rotateBytes = rotateBytes;
        this.snapPolicy = new SnapshotPolicy(snapshotEveryOps);
    }

    @Override
    public synchronized void connect() {
        try {
            wal = new FileWal(dataDir.resolve("wal"), rotateBytes);
            snaps = new FileSnapshotter(dataDir.resolve("snap"));
            recover();
        } catch (StoreException | IllegalArgumentException e) {
            closeQuietly();
            throw new StoreConnectionException("cannot open log store at " + dataDir, e);
        }
        markConnected();
        log.info(() -> String.format("log store at %s recovered %d games (lastSeq=%d)", dataDir, mem.size(), lastSeq));
    }

    @Override
    public GameState findOne(String gameId) {
        ensureConnected();
        LogEntry entry = mem.get(requireGameId(gameId));
        return entry == null ? null : entry.state().withStoreId(entry.identity());
    }

    @Override
    public synchronized void upsert(String gameId, GameState state) {
        ensureConnected();
        requireGameId(gameId);
        Objects.requireNonNull(state, "state");

        long seq = ++lastSeq;
        GameState doc = state.withoutStoreId();

        // Durable before visible: a crash after append() still replays this write.
        try {
            wal.append(RecordCodec.encode(seq, gameId, doc));
        } catch (StoreException e) {
            abandonSegment(e);
            throw e;
        }
        mem.put(gameId, new LogEntry(seq, doc));

        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            snapshot();
        }
    }

    @Override
    public boolean exists(String gameId) {
        ensureConnected();
        return mem.containsKey(requireGameId(gameId));
    }

    @Override
    public StoreKind kind() {
        return StoreKind.LOG;
    }

    @Override
    public synchronized void close() {
        markClosed();
        closeQuietly();
    }

    /** Highest log position applied so far. */
    public synchronized long lastSeq() {
        return lastSeq;
    }

    private void snapshot() {
        // The write itself is durable already; a failed snapshot only costs replay time.
        try {
            wal.rotate();
            String id = snaps.writeSnapshot(Map.copyOf(mem), lastSeq, wal.currentSegment());
            long replayFrom = snaps.prune(SNAPSHOTS_KEPT);
            int removed = replayFrom > 0 ? wal.deleteSegmentsBefore(replayFrom) : 0;
            log.fine(() -> "wrote snapshot " + id + " at seq " + lastSeq + ", removed " + removed + " WAL segments");
        } catch (StoreException e) {
            log.log(Level.WARNING, "snapshot in " + dataDir + " failed; WAL kept", e);
        }
    }

    private void abandonSegment(StoreException cause) {
        try {
            wal.rotate();
        } catch (StoreException e) {
            cause.addSuppressed(e);
        }
    }

    private void recover() {
        mem.clear();
        lastSeq = 0;
        long fromSegment = 1;

        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            mem.putAll(loaded.data());
            lastSeq = loaded.lastSeq();
            fromSegment = loaded.walSegment();
            log.fine(() -> "loaded snapshot " + loaded.id());
        }
        if (wal.oldestSegment() > fromSegment) {
            throw new StoreException("WAL segments from " + fromSegment + " are gone; cannot recover "
                    + (loaded == null ? "without a readable snapshot" : "from " + loaded.id()));
        }

        try (Wal.WalReader r = wal.openReader(fromSegment)) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.seq() <= lastSeq) {
                    continue; // covered by the snapshot or a replayed duplicate
                }
                mem.put(rec.gameId(), new LogEntry(rec.seq(), rec.state()));
                lastSeq = rec.seq();
            }
            if (r.sawTornTail()) {
                // New writes must not land behind the garbage.
                log.warning(() -> "WAL in " + dataDir + " had a torn tail; starting a new segment");
                wal.rotate();
            }
        }
    }

    private void closeQuietly() {
        if (wal == null) return;
        try {
            wal.close();
        } catch (StoreException e) {
            log.log(Level.WARNING, "failed to close WAL in " + dataDir, e);
        }
        wal = null;
    }
}
