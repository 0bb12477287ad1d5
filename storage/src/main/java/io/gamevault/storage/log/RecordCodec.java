package io.gamevault.storage.log;

import io.gamevault.core.GameState;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x6A4E
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - seq:     int64 log position
 *     - gameId:  int32 len + UTF-8 bytes
 *     - doc:     int32 len + UTF-8 JSON bytes of the game state
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x6A4E;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    /** Immutable view of a decoded record. */
    record LogRecord(long seq, String gameId, GameState state) {}

    private RecordCodec() {
    }

    /** Encode a log record into header+payload bytes ready for append. */
    static byte[] encode(long seq, String gameId, GameState state) {
        byte[] payload = encodePayload(seq, gameId, state);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long seq = b.getLong();
        String gameId = readString(b);
        GameState state = GameState.fromBytes(readBytes(b));
        return new LogRecord(seq, gameId, state);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(long seq, String gameId, GameState state) {
        byte[] sGame = gameId.getBytes(StandardCharsets.UTF_8);
        byte[] doc = state.toBytes();

        int size = 8 + 4 + sGame.length + 4 + doc.length;
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(seq);
        writeBytes(b, sGame);
        writeBytes(b, doc);
        return b.array();
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("corrupt record: field length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        return new String(readBytes(b), StandardCharsets.UTF_8);
    }
}
