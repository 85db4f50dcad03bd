package com.dcruver.themerank.cache;

import com.dcruver.themerank.domain.EmbeddingVector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the bounded semantic index.
 */
class SemanticIndexTest {

    private static EmbeddingVector vector(int i) {
        return EmbeddingVector.of(new float[]{1.0f, i, (float) Math.sqrt(i)});
    }

    @Test
    void testNeverExceedsCapacity() {
        SemanticIndex index = new SemanticIndex(10);

        for (int i = 0; i < 25; i++) {
            assertTrue(index.add("h" + i, vector(i), "text " + i));
            assertTrue(index.size() <= 10, "size must stay within capacity");
        }

        assertEquals(10, index.capacity());
        assertEquals(15, index.evictedTotal());
    }

    @Test
    void testEvictsOldestTenthInOneBatch() {
        SemanticIndex index = new SemanticIndex(100);
        for (int i = 0; i < 100; i++) {
            index.add("h" + i, vector(i), null);
        }
        assertEquals(100, index.size());

        index.add("h100", vector(100), null);

        assertEquals(91, index.size());
        assertEquals(10, index.evictedTotal());
        for (int i = 0; i < 10; i++) {
            assertFalse(index.contains("h" + i), "oldest entries should be evicted first");
        }
        assertTrue(index.contains("h10"));
        assertTrue(index.contains("h100"));
    }

    @Test
    void testRejectsDuplicatesAndZeroVectors() {
        SemanticIndex index = new SemanticIndex(5);

        assertTrue(index.add("a", vector(1), null));
        assertFalse(index.add("a", vector(2), null));
        assertFalse(index.add("zero", EmbeddingVector.of(new float[]{0f, 0f, 0f}), null));

        assertEquals(1, index.size());
    }

    @Test
    void testFindBestReturnsMostSimilarEntry() {
        SemanticIndex index = new SemanticIndex(5);
        index.add("x", EmbeddingVector.of(new float[]{1f, 0f, 0f}), "x axis");
        index.add("y", EmbeddingVector.of(new float[]{0f, 1f, 0f}), "y axis");

        Optional<SemanticIndex.Match> match = index.findBest(EmbeddingVector.of(new float[]{0.1f, 0.9f, 0f}));

        assertTrue(match.isPresent());
        assertEquals("y", match.get().hash());
        assertEquals("y axis", match.get().excerpt());
        assertTrue(match.get().similarity() > 0.99);
    }

    @Test
    void testFindBestOnEmptyIndexOrZeroProbe() {
        SemanticIndex index = new SemanticIndex(5);
        assertTrue(index.findBest(vector(1)).isEmpty());

        index.add("a", vector(1), null);
        assertTrue(index.findBest(EmbeddingVector.of(new float[]{0f, 0f, 0f})).isEmpty());
    }

    @Test
    void testClearFreesAllSlots() {
        SemanticIndex index = new SemanticIndex(3);
        index.add("a", vector(1), null);
        index.add("b", vector(2), null);

        index.clear();

        assertEquals(0, index.size());
        for (int i = 0; i < 3; i++) {
            assertTrue(index.add("n" + i, vector(i + 1), null));
        }
        assertEquals(0, index.evictedTotal());
    }

    @Test
    void testEntriesAreOldestFirst() {
        SemanticIndex index = new SemanticIndex(3);
        index.add("a", vector(1), "first");
        index.add("b", vector(2), "second");

        List<SemanticIndex.Entry> entries = index.entries();

        assertEquals(2, entries.size());
        assertEquals("a", entries.get(0).hash());
        assertEquals("second", entries.get(1).excerpt());
        assertTrue(entries.get(0).generation() < entries.get(1).generation());
    }
}
