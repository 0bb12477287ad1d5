package io.gamevault.storage.log;

import io.gamevault.core.GameState;

import java.util.Objects;

/**
 * Latest applied write for one game in the log-structured store.
 *
 * @param seq   position of the write in the log; later writes have larger values
 * @param state document as written (without identity)
 */
public record LogEntry(long seq, GameState state) {
    public LogEntry {
        Objects.requireNonNull(state, "state");
    }

    /** Document identity: the log position that produced this value. */
    public String identity() {
        return Long.toString(seq);
    }
}
