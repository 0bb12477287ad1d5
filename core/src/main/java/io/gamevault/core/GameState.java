package io.gamevault.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Immutable envelope for one game's state document.
 * <p>
 * The document itself is opaque JSON. Only two fields are interpreted:
 *  - {@value #STATE_ID}: caller-assigned sequence number, bumped each time the
 *    game advances. A document without it is "unversioned".
 *  - {@value #STORE_ID}: identity stamped by a durable store on documents it
 *    returns. Callers never control it.
 * <p>
 * Invariants:
 *  - The wrapped node is never exposed; {@link #json()} hands out a deep copy.
 *  - equals/hashCode are JSON equality.
 *  - An integral {@value #STATE_ID} always fits in a long; larger values are rejected.
 */
public final class GameState {

    public static final String STATE_ID = "_stateID";
    public static final String STORE_ID = "_id";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode doc;

    private GameState(ObjectNode doc) {
        this.doc = doc;
    }

    private static GameState checked(ObjectNode doc) {
        JsonNode id = doc.get(STATE_ID);
        if (id != null && id.isIntegralNumber() && !id.canConvertToLong()) {
            throw new IllegalArgumentException(STATE_ID + " out of range: " + id.asText());
        }
        return new GameState(doc);
    }

    /** Wrap a copy of the given JSON object. */
    public static GameState of(ObjectNode doc) {
        Objects.requireNonNull(doc, "doc");
        return checked(doc.deepCopy());
    }

    /** Parse a JSON object literal. */
    public static GameState parse(String json) {
        Objects.requireNonNull(json, "json");
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("game state must be a JSON object");
            }
            return checked((ObjectNode) node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("game state is not valid JSON", e);
        }
    }

    /** Empty document carrying only a stateID. */
    public static GameState withStateId(long stateId) {
        ObjectNode node = MAPPER.createObjectNode();
        // Int-sized ids stay IntNodes so they compare equal to parsed JSON.
        if (stateId >= Integer.MIN_VALUE && stateId <= Integer.MAX_VALUE) {
            node.put(STATE_ID, (int) stateId);
        } else {
            node.put(STATE_ID, stateId);
        }
        return new GameState(node);
    }

    /** Shared mapper for codecs that serialize game states. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public boolean hasStateId() {
        JsonNode n = doc.get(STATE_ID);
        return n != null && n.isIntegralNumber();
    }

    /** The stateID, or 0 when the document is unversioned. */
    public long stateId() {
        return hasStateId() ? doc.get(STATE_ID).asLong() : 0L;
    }

    /** Store-assigned identity, or null for documents that never came from a store. */
    public String storeId() {
        JsonNode n = doc.get(STORE_ID);
        return (n == null || n.isNull()) ? null : n.asText();
    }

    public GameState withoutStoreId() {
        if (!doc.has(STORE_ID)) {
            return this;
        }
        ObjectNode copy = doc.deepCopy();
        copy.remove(STORE_ID);
        return new GameState(copy);
    }

    public GameState withStoreId(String storeId) {
        Objects.requireNonNull(storeId, "storeId");
        ObjectNode copy = doc.deepCopy();
        copy.put(STORE_ID, storeId);
        return new GameState(copy);
    }

    /** Read-only access to a single top-level field; null if absent. */
    public JsonNode field(String name) {
        JsonNode n = doc.get(name);
        return n == null ? null : n.deepCopy();
    }

    /** Deep copy of the underlying document. */
    public ObjectNode json() {
        return doc.deepCopy();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize game state", e);
        }
    }

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize game state", e);
        }
    }

    public static GameState fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        try {
            JsonNode node = MAPPER.readTree(bytes);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("game state must be a JSON object");
            }
            return checked((ObjectNode) node);
        } catch (java.io.IOException e) {
            throw new IllegalArgumentException("game state is not valid JSON", e);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState gs)) return false;
        return doc.equals(gs.doc);
    }

    @Override public int hashCode() { return doc.hashCode(); }

    @Override public String toString() { return toJson(); }
}
