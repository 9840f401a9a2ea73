package com.gt.lift.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MultitextTests {

    @Test
    public void testPut_LastWins() {
        Multitext multitext = Multitext.builder()
                .put("en", "first")
                .put("fr", "premier")
                .put("en", "second")
                .build();

        assertEquals("second", multitext.get("en"));
        assertEquals(2, multitext.size());
        assertEquals(List.of("en", "fr"), List.copyOf(multitext.languages()));
    }

    @Test
    public void testEquals_IgnoresInsertionOrder() {
        Multitext enFirst = Multitext.of("en", "cat", "fr", "chat");
        Multitext frFirst = Multitext.of("fr", "chat", "en", "cat");

        assertEquals(enFirst, frFirst);
        assertEquals(enFirst.hashCode(), frFirst.hashCode());
        assertEquals("cat", enFirst.first());
        assertEquals("chat", frFirst.first());
    }

    @Test
    public void testEmpty() {
        assertTrue(Multitext.EMPTY.isEmpty());
        assertSame(Multitext.EMPTY, Multitext.builder().build());
        assertSame(Multitext.EMPTY, Multitext.of(Map.of()));
        assertSame(Multitext.EMPTY, Multitext.of("en", "cat").without("en"));
        assertEquals("", Multitext.EMPTY.first());
    }

    @Test
    public void testInvalidForms() {
        assertThrows(IllegalArgumentException.class, () -> Multitext.of("", "cat"));
        assertThrows(IllegalArgumentException.class, () -> Multitext.of(null, "cat"));
        assertThrows(IllegalArgumentException.class, () -> Multitext.of("en", null));
    }

    @Test
    public void testBlankTextIgnored() {
        assertSame(Multitext.EMPTY, Multitext.of("en", "  "));
        assertEquals(Multitext.of("en", "cat"), Multitext.of("en", "cat", "fr", ""));
        assertEquals("cat", Multitext.of("en", "cat").with("en", " ").get("en"));
        assertNull(Multitext.of("en", "cat", "fr", "").get("fr"));
    }

    @Test
    public void testWith() {
        Multitext original = Multitext.of("en", "cat");
        Multitext updated = original.with("fr", "chat");

        assertEquals(1, original.size());
        assertEquals(Multitext.of("en", "cat", "fr", "chat"), updated);
        assertEquals("chat", updated.find("fr").orElseThrow());
        assertTrue(updated.find("de").isEmpty());
    }

    @Test
    public void testAsMap_Unmodifiable() {
        Multitext multitext = Multitext.of("en", "cat");

        assertThrows(UnsupportedOperationException.class, () -> multitext.asMap().put("fr", "chat"));
    }
}
