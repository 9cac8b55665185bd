package com.repo.timeline.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AliasTableTest {

    @Test
    void testAliasReplacesAuthor() {
        AliasTable table = AliasTable.parse(List.of("jdoe::Jane Doe"));

        assertEquals("Jane Doe", table.resolve("jdoe"));
    }

    @Test
    void testUnknownAuthorPassesThroughEscaped() {
        AliasTable table = AliasTable.parse(List.of("jdoe::Jane Doe"));

        assertEquals("someone", table.resolve("someone"));
        assertEquals("Some#User", table.resolve("Some|User"));
    }

    @Test
    void testAliasKeyMatchesEscapedName() {
        AliasTable escapedKey = AliasTable.parse(List.of("Some#User::SomeUser"));
        AliasTable rawKey = AliasTable.of(Map.of("Some|User", "SomeUser"));

        assertEquals("SomeUser", escapedKey.resolve("Some|User"));
        assertEquals("SomeUser", rawKey.resolve("Some|User"));
    }

    @Test
    void testAliasValueIsUsedVerbatim() {
        AliasTable table = AliasTable.parse(List.of("bot::CI|Bot"));

        assertEquals("CI|Bot", table.resolve("bot"));
    }

    @Test
    void testResolveIsDeterministic() {
        AliasTable table = AliasTable.parse(List.of("a::Alpha", "b::Beta"));

        for (int i = 0; i < 3; i++) {
            assertEquals("Alpha", table.resolve("a"));
            assertEquals("Beta", table.resolve("b"));
        }
    }

    @Test
    void testLastAliasForSameNameWins() {
        AliasTable table = AliasTable.parse(List.of("a::First", "a::Second"));

        assertEquals("Second", table.resolve("a"));
        assertEquals(1, table.size());
    }

    @Test
    void testMalformedAliasesAreRejected() {
        assertThrows(ConfigurationException.class, () -> AliasTable.parseAlias("no-separator"));
        assertThrows(ConfigurationException.class, () -> AliasTable.parseAlias("a::b::c"));
        assertThrows(ConfigurationException.class, () -> AliasTable.parseAlias("::Display"));
        assertThrows(ConfigurationException.class, () -> AliasTable.parseAlias("raw::"));
    }

    @Test
    void testEmptyTable() {
        assertTrue(AliasTable.empty().isEmpty());
        assertEquals("x#y", AliasTable.empty().resolve("x|y"));
    }
}
