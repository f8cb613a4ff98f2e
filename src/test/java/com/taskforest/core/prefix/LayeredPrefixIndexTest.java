package com.taskforest.core.prefix;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LayeredPrefixIndex}.
 */
class LayeredPrefixIndexTest {

    @Test
    @DisplayName("lengths are de-duplicated, positive and longest first")
    void lengthOrder() {
        var index = new LayeredPrefixIndex(List.of(9, 13, 9, 0, -4));
        assertEquals(List.of(13, 9), index.lengths());
        assertThrows(IllegalArgumentException.class, () -> index.layer(0));
    }

    @Nested
    @DisplayName("key spaces")
    class KeySpaces {

        @Test
        @DisplayName("a declaration truncated for a short layer never answers a long lookup")
        void layersAreSeparate() {
            var index = new LayeredPrefixIndex(List.of(192, 19));
            index.insert("write the changelog and tag it", "P_LONGER");
            index.insert("write the changelog", "P_EXACT");

            var matches = index.matchesDecreasing("Write the changelog");
            assertEquals(192, matches.get(0).prefixLength());
            assertEquals(List.of(new IndexEntry("P_EXACT", "write the changelog")), matches.get(0).entries());

            assertEquals(19, matches.get(1).prefixLength());
            assertEquals(List.of("P_LONGER", "P_EXACT"),
                    matches.get(1).entries().stream().map(IndexEntry::ownerTaskId).toList());
        }

        @Test
        @DisplayName("every layer holds the declaration at its own length")
        void insertsIntoEveryLayer() {
            var index = new LayeredPrefixIndex(List.of(192, 9));
            index.insert("build the api gateway", "T1");

            assertEquals(List.of("T1"), index.layer(192).lookup("build the api gateway"));
            assertEquals(List.of("T1"), index.layer(9).lookup("build the"));
            assertTrue(index.layer(192).lookup("build the").isEmpty());
            assertEquals(2, index.size());
        }

        @Test
        @DisplayName("clear empties every layer")
        void clear() {
            var index = new LayeredPrefixIndex(List.of(192, 9));
            index.insert("build the api gateway", "T1");
            index.clear();
            assertEquals(0, index.size());
            assertTrue(index.matchesDecreasing("build the api gateway").isEmpty());
        }
    }

    @Nested
    @DisplayName("lookupDecreasing")
    class LookupDecreasing {

        @Test
        @DisplayName("returns the hit at the longest length")
        void longestFirst() {
            var index = new LayeredPrefixIndex(List.of(9, 13));
            index.insert("build the", "SHORT");
            index.insert("build the api", "LONG");

            var match = index.lookupDecreasing("Build the API");
            assertTrue(match.isPresent());
            assertEquals(13, match.get().prefixLength());
            assertEquals("build the api", match.get().key());
            assertEquals("LONG", match.get().entries().get(0).ownerTaskId());
        }

        @Test
        @DisplayName("falls back to a shorter length when the longer misses")
        void fallsBack() {
            var index = new LayeredPrefixIndex(List.of(9, 13));
            index.insert("build the", "SHORT");

            var match = index.lookupDecreasing("Build the API");
            assertTrue(match.isPresent());
            assertEquals(9, match.get().prefixLength());
            assertEquals("SHORT", match.get().entries().get(0).ownerTaskId());
        }

        @Test
        @DisplayName("empty when nothing matches at any length")
        void noMatch() {
            var index = new LayeredPrefixIndex(List.of(192, 64));
            index.insert("something else", "T1");
            assertTrue(index.lookupDecreasing("Build the API").isEmpty());
        }
    }
}
