package io.gamevault.storage.document;

import io.gamevault.core.GameState;
import io.gamevault.storage.AbstractDurableStore;
import io.gamevault.storage.StoreConnectionException;
import io.gamevault.storage.StoreException;
import io.gamevault.storage.StoreKind;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Document store keeping an append-only history per game.
 * <p>
 * Each game is a collection: one JSON-lines file
 * {@code <dir>/<base64url(gameId)>.jsonl}. Every upsert appends a new document
 * stamped with {@code _id}, a per-game counter that only grows, and fsyncs it.
 * Reads return the document with the highest {@code _id}.
 * <p>
 * Lines that fail to parse (a torn last line after a crash) are skipped.
 */
public final class DocumentStore extends AbstractDurableStore {
    private static final Logger log = Logger.getLogger(DocumentStore.class.getName());

    private final Path dir;
    // gameId -> highest _id appended so far; loaded lazily from disk
    private final Map<String, Long> lastIds = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public DocumentStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    @Override
    public void connect() {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreConnectionException("cannot create document directory " + dir, e);
        }
        if (!Files.isWritable(dir)) {
            throw new StoreConnectionException("document directory is not writable: " + dir);
        }
        markConnected();
        log.info(() -> "document store ready at " + dir);
    }

    @Override
    public GameState findOne(String gameId) {
        ensureConnected();
        Path file = collection(requireGameId(gameId));
        if (!Files.exists(file)) {
            return null;
        }
        GameState latest = null;
        long latestId = -1;
        for (GameState doc : readAll(file)) {
            long id = identityOf(doc);
            if (id > latestId) {
                latestId = id;
                latest = doc;
            }
        }
        return latest;
    }

    @Override
    public void upsert(String gameId, GameState state) {
        ensureConnected();
        requireGameId(gameId);
        Objects.requireNonNull(state, "state");
        Path file = collection(gameId);

        // One writer per collection at a time; the counter and the append move together.
        synchronized (lockFor(gameId)) {
            long next = lastIds.computeIfAbsent(gameId, id -> highestId(file)) + 1;
            GameState doc = state.withStoreId(Long.toString(next));
            try (FileChannel ch = FileChannel.open(file, CREATE, READ, WRITE)) {
                // Start on a fresh line if a previous append was torn mid-line.
                String prefix = endsWithNewline(ch) ? "" : "\n";
                byte[] line = (prefix + doc.toJson() + "\n").getBytes(StandardCharsets.UTF_8);
                ByteBuffer buf = ByteBuffer.wrap(line);
                ch.position(ch.size());
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            } catch (IOException e) {
                throw new StoreException("append to " + file + " failed", e);
            }
            lastIds.put(gameId, next);
        }
    }

    @Override
    public boolean exists(String gameId) {
        ensureConnected();
        Path file = collection(requireGameId(gameId));
        try {
            return Files.exists(file) && Files.size(file) > 0;
        } catch (IOException e) {
            throw new StoreException("cannot stat " + file, e);
        }
    }

    /** Full history of a game, oldest first. */
    public List<GameState> history(String gameId) {
        ensureConnected();
        Path file = collection(requireGameId(gameId));
        return Files.exists(file) ? readAll(file) : List.of();
    }

    @Override
    public StoreKind kind() {
        return StoreKind.DOCUMENT;
    }

    @Override
    public void close() {
        markClosed();
    }

    // ---------- helpers ----------

    private Path collection(String gameId) {
        String name = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(gameId.getBytes(StandardCharsets.UTF_8));
        return dir.resolve(name + ".jsonl");
    }

    private Object lockFor(String gameId) {
        return locks.computeIfAbsent(gameId, k -> new Object());
    }

    private static boolean endsWithNewline(FileChannel ch) throws IOException {
        long size = ch.size();
        if (size == 0) {
            return true;
        }
        ByteBuffer last = ByteBuffer.allocate(1);
        ch.read(last, size - 1);
        return last.get(0) == '\n';
    }

    private long highestId(Path file) {
        if (!Files.exists(file)) {
            return 0L;
        }
        long max = 0L;
        for (GameState doc : readAll(file)) {
            max = Math.max(max, identityOf(doc));
        }
        return max;
    }

    private static List<GameState> readAll(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("cannot read " + file, e);
        }
        return lines.stream()
                .filter(l -> !l.isBlank())
                .map(l -> parseLine(file, l))
                .filter(Objects::nonNull)
                .toList();
    }

    private static GameState parseLine(Path file, String line) {
        try {
            GameState doc = GameState.parse(line);
            return doc.storeId() == null ? null : doc;
        } catch (IllegalArgumentException e) {
            log.warning(() -> "skipping unreadable document in " + file + ": " + e.getMessage());
            return null;
        }
    }

    private static long identityOf(GameState doc) {
        try {
            return Long.parseLong(doc.storeId());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
