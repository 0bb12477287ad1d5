package io.gamevault.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GameStateTest {

    @Test
    void parses_state_id_and_treats_missing_as_unversioned() {
        var versioned = GameState.parse("{\"_stateID\":4,\"board\":[1,2,3]}");
        var unversioned = GameState.parse("{\"board\":[]}");

        assertTrue(versioned.hasStateId());
        assertEquals(4L, versioned.stateId());
        assertFalse(unversioned.hasStateId());
        assertEquals(0L, unversioned.stateId());
    }

    @Test
    void state_id_beyond_long_range_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> GameState.parse("{\"_stateID\":99999999999999999999}"));
        assertThrows(IllegalArgumentException.class,
                () -> GameState.fromBytes("{\"_stateID\":-18446744073709551617}".getBytes()));

        var max = GameState.parse("{\"_stateID\":" + Long.MAX_VALUE + "}");
        assertEquals(Long.MAX_VALUE, max.stateId());
    }

    @Test
    void store_id_is_added_and_stripped_on_copies() {
        var base = GameState.parse("{\"_stateID\":1}");
        var stamped = base.withStoreId("mem-1");

        assertNull(base.storeId(), "original must stay untouched");
        assertEquals("mem-1", stamped.storeId());
        assertEquals(base, stamped.withoutStoreId());
        assertSame(base, base.withoutStoreId());
    }

    @Test
    void with_state_id_equals_parsed_document() {
        assertEquals(GameState.parse("{\"_stateID\":2}"), GameState.withStateId(2));
    }

    @Test
    void bytes_round_trip_preserves_document() {
        var state = GameState.parse("{\"_stateID\":3,\"players\":{\"0\":\"ann\"}}");

        assertEquals(state, GameState.fromBytes(state.toBytes()));
    }

    @Test
    void json_copy_cannot_mutate_state() {
        var state = GameState.parse("{\"_stateID\":1}");
        state.json().put("_stateID", 99);

        assertEquals(1L, state.stateId());
    }

    @Test
    void rejects_non_object_json() {
        assertThrows(IllegalArgumentException.class, () -> GameState.parse("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> GameState.parse("{not json"));
    }
}
