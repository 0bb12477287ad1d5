package io.gamevault.storage.log;

import io.gamevault.storage.StoreException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed WAL that appends header+payload records to segment files
 * named "00000001.log", "00000002.log", ...
 * <p>
 *  - On construction it creates the directory if needed and opens the newest
 *    segment for append.
 *  - append() writes the bytes and calls force(true).
 *  - rotateIfNeeded() opens the next segment once the current one holds at
 *    least rotateBytes.
 *  - The reader walks segments in number order. A truncated header/payload,
 *    a length running past the end of the file or a bad CRC ends that segment
 *    (it can only be the tail left by a crash); reading continues with the
 *    next segment.
 */
public class FileWal implements Wal {
    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private long current;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StoreException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public synchronized void rotate() {
        try {
            // size() and not writtenInSegment: a failed append may have left bytes behind
            if (ch.size() == 0) return;
            ch.close();
            current++;
            ch = FileChannel.open(segmentPath(current), CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StoreException("WAL rotation failed", e);
        }
    }

    @Override
    public synchronized long currentSegment() {
        return current;
    }

    @Override
    public synchronized long oldestSegment() {
        List<Path> segs = segments(dir);
        return segs.isEmpty() ? current : indexOf(segs.get(0));
    }

    @Override
    public synchronized int deleteSegmentsBefore(long segment) {
        int removed = 0;
        for (Path p : segments(dir)) {
            long index = indexOf(p);
            if (index >= segment || index >= current) break;
            try {
                Files.delete(p);
                removed++;
            } catch (IOException e) {
                throw new StoreException("cannot delete WAL segment " + p, e);
            }
        }
        return removed;
    }

    @Override
    public WalReader openReader(long fromSegment) {
        List<Path> segs = segments(dir).stream()
                .filter(p -> indexOf(p) >= fromSegment)
                .collect(Collectors.toList());
        return new Reader(segs);
    }

    @Override
    public synchronized void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new StoreException("WAL close failed", e);
        }
    }

    int segmentCount() {
        return segments(dir).size();
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? 1 : indexOf(segs.get(segs.size() - 1));
        Path path = segmentPath(current);
        try {
            ch = FileChannel.open(path, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StoreException("cannot open WAL segment " + path, e);
        }
    }

    private Path segmentPath(long index) {
        return dir.resolve(String.format("%08d.log", index));
    }

    private static long indexOf(Path segment) {
        return Long.parseLong(segment.getFileName().toString().replace(".log", ""));
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().matches("\\d+\\.log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("cannot list WAL segments in " + dir, e);
        }
    }

    /** Sequential reader across segments, used during recovery. */
    private static final class Reader implements WalReader {
        private final Deque<Path> pending;
        private FileChannel ch;
        private long pos;
        private boolean torn;

        Reader(List<Path> segments) {
            this.pending = new ArrayDeque<>(segments);
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null) {
                        Path nextSeg = pending.pollFirst();
                        if (nextSeg == null) return null;
                        ch = FileChannel.open(nextSeg, READ);
                        pos = 0;
                    }
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment, move on
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) { skipRestOfSegment(); continue; } // torn header
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) { skipRestOfSegment(); continue; }
                    long available = ch.size() - pos - RecordCodec.HEADER_BYTES;
                    if (len > available) { skipRestOfSegment(); continue; } // torn or corrupt length
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) { skipRestOfSegment(); continue; }
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) { skipRestOfSegment(); continue; }
                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                }
            } catch (IOException e) {
                throw new StoreException("WAL read failed", e);
            }
        }

        private void skipRestOfSegment() throws IOException {
            torn = true;
            ch.close();
            ch = null;
        }

        @Override
        public boolean sawTornTail() {
            return torn;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new StoreException("WAL reader close failed", e);
            }
        }
    }
}
