package io.promptfeed.interaction;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InteractionKindTest {

    @Test
    void shouldParseKnownKindsCaseInsensitively() {
        assertEquals(Optional.of(InteractionKind.VIEW), InteractionKind.fromString("view"));
        assertEquals(Optional.of(InteractionKind.USE), InteractionKind.fromString("USE"));
        assertEquals(Optional.of(InteractionKind.REMIX), InteractionKind.fromString(" Remix "));
        assertEquals(Optional.of(InteractionKind.SHARE), InteractionKind.fromString("share"));
        assertEquals(Optional.of(InteractionKind.SKIP), InteractionKind.fromString("skip"));
    }

    @Test
    void shouldReturnEmptyForUnknownKinds() {
        assertTrue(InteractionKind.fromString("like").isEmpty());
        assertTrue(InteractionKind.fromString("").isEmpty());
        assertTrue(InteractionKind.fromString(null).isEmpty());
    }

    @Test
    void shouldCarryTrendWeights() {
        assertEquals(0.1, InteractionKind.VIEW.trendWeight());
        assertEquals(0.5, InteractionKind.USE.trendWeight());
        assertEquals(2.0, InteractionKind.REMIX.trendWeight());
        assertEquals(1.5, InteractionKind.SHARE.trendWeight());
        assertEquals(-0.3, InteractionKind.SKIP.trendWeight());
    }

    @Test
    void shouldCarryAffinityWeights() {
        assertEquals(0.0, InteractionKind.VIEW.affinityWeight());
        assertEquals(1.0, InteractionKind.USE.affinityWeight());
        assertEquals(2.0, InteractionKind.REMIX.affinityWeight());
        assertEquals(-0.5, InteractionKind.SKIP.affinityWeight());
    }
}
