package io.gamevault.storage.log;

import io.gamevault.core.GameState;
import io.gamevault.storage.StoreException;

import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 lastSeq
 *   int64 walSegment
 *   int32 count
 *   repeated 'count' times:
 *     - gameId: int32 len + UTF-8 bytes
 *     - seq:    int64
 *     - doc:    int32 len + JSON bytes
 * <p>
 * Atomicity: written to "snapshot-&lt;n&gt;.bin.tmp", fsynced, then moved into
 * place with ATOMIC_MOVE. Names sort by creation order.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());

    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;
    private final AtomicLong counter;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("cannot create snapshot directory " + dir, e);
        }
        // Never reuse or sort below an existing name, even if the clock moved back.
        long highest = snapshots().stream()
                .mapToLong(FileSnapshotter::numberOf)
                .max()
                .orElse(0L);
        this.counter = new AtomicLong(Math.max(highest, System.currentTimeMillis()));
    }

    @Override
    public String writeSnapshot(Map<String, LogEntry> current, long lastSeq, long walSegment) {
        String name = String.format(PREFIX + "%020d" + SUFFIX, counter.incrementAndGet());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            var out = new DataOutputStream(new BufferedOutputStream(Channels.newOutputStream(ch)));
            out.writeLong(lastSeq);
            out.writeLong(walSegment);
            out.writeInt(current.size());
            for (Map.Entry<String, LogEntry> e : current.entrySet()) {
                LogEntry entry = e.getValue();
                writeString(out, e.getKey());
                out.writeLong(entry.seq());
                writeBytes(out, entry.state().toBytes());
            }
            out.flush();
            ch.force(true);
        } catch (IOException ex) {
            throw new StoreException("snapshot write failed", ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("snapshot publish failed", e);
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        for (Path snap : newestFirst()) {
            LoadedSnapshot loaded = tryRead(snap);
            if (loaded != null) {
                return loaded;
            }
        }
        return null;
    }

    @Override
    public long prune(int keep) {
        if (keep <= 0) throw new IllegalArgumentException("keep must be > 0");
        List<Path> kept = new ArrayList<>();
        long replayFrom = 0L;
        for (Path snap : newestFirst()) {
            if (kept.size() < keep) {
                LoadedSnapshot loaded = tryRead(snap);
                if (loaded != null) {
                    kept.add(snap);
                    replayFrom = loaded.walSegment();
                    continue;
                }
            }
            delete(snap);
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path leftover : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX + ".tmp"))
                    .collect(Collectors.toList())) {
                delete(leftover);
            }
        } catch (IOException e) {
            throw new StoreException("cannot list snapshots in " + dir, e);
        }
        return replayFrom;
    }

    private List<Path> newestFirst() {
        List<Path> snaps = snapshots();
        Collections.reverse(snaps);
        return snaps;
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("cannot list snapshots in " + dir, e);
        }
    }

    private static long numberOf(Path snap) {
        String n = snap.getFileName().toString();
        try {
            return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /** Reads a whole snapshot; null (and a warning) if it is damaged. */
    private static LoadedSnapshot tryRead(Path snap) {
        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            long lastSeq = in.readLong();
            long walSegment = in.readLong();
            int count = in.readInt();
            if (count < 0) throw new IOException("negative entry count " + count);
            Map<String, LogEntry> map = new HashMap<>();
            for (int i = 0; i < count; i++) {
                String gameId = readString(in);
                long seq = in.readLong();
                GameState state = GameState.fromBytes(readBytes(in));
                map.put(gameId, new LogEntry(seq, state));
            }
            if (in.read() != -1) throw new IOException("trailing bytes");
            return new LoadedSnapshot(snap.getFileName().toString(), lastSeq, walSegment, map);
        } catch (IOException | IllegalArgumentException e) {
            log.log(Level.WARNING, "skipping unreadable snapshot " + snap, e);
            return null;
        }
    }

    private static void delete(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StoreException("cannot delete snapshot " + p, e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        writeBytes(out, s.getBytes(StandardCharsets.UTF_8));
    }

    private static String readString(DataInputStream in) throws IOException {
        return new String(readBytes(in), StandardCharsets.UTF_8);
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative field length " + len);
        byte[] bytes = in.readNBytes(len);
        if (bytes.length < len) throw new EOFException("field cut short");
        return bytes;
    }
}
