package com.shellguard.security;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LongOptionsTest {

    private static final Set<String> KNOWN = Set.of("file", "field-separator", "source", "sandbox", "lint", "lint-old");

    @Test
    void exactNameWins() {
        assertEquals(Optional.of("lint"), LongOptions.resolve("--lint", KNOWN));
        assertEquals(Optional.of("file"), LongOptions.resolve("--file=prog.awk", KNOWN));
    }

    @Test
    void uniquePrefixResolves() {
        assertEquals(Optional.of("source"), LongOptions.resolve("--so=BEGIN{}", KNOWN));
        assertEquals(Optional.of("field-separator"), LongOptions.resolve("--field", KNOWN));
        assertEquals(Optional.of("lint-old"), LongOptions.resolve("--lint-", KNOWN));
    }

    @Test
    void ambiguousOrUnknownIsEmpty() {
        assertTrue(LongOptions.resolve("--fi", KNOWN).isEmpty());
        assertTrue(LongOptions.resolve("--s", KNOWN).isEmpty());
        assertTrue(LongOptions.resolve("--exec", KNOWN).isEmpty());
        assertTrue(LongOptions.resolve("--", KNOWN).isEmpty());
        assertTrue(LongOptions.resolve("--=x", KNOWN).isEmpty());
    }

    @Test
    void splitsAttachedValue() {
        assertEquals("source", LongOptions.name("--source=a=b"));
        assertTrue(LongOptions.hasAttachedValue("--source=a=b"));
        assertFalse(LongOptions.hasAttachedValue("--source"));
    }

    @Test
    void shortClusters() {
        assertEquals(1, LongOptions.shortCluster("-iv", "i0v", "uC"));
        assertEquals(2, LongOptions.shortCluster("-iu", "i0v", "uC"));
        assertEquals(1, LongOptions.shortCluster("-uHOME", "i0v", "uC"));
        assertEquals(-1, LongOptions.shortCluster("-iP", "i0v", "uC"));
        assertEquals(-1, LongOptions.shortCluster("-S", "i0v", "uC"));
    }
}
