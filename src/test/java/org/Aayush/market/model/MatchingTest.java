package org.Aayush.market.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Matching Tests")
class MatchingTest {

    @Test
    @DisplayName("Recorded pairs are visible from both sides in commit order")
    void testRecordAndQuery() {
        Matching matching = new Matching(new int[]{1, 1, 1}, new int[]{2, 1});
        matching.record(2, 0);
        matching.record(0, 0);
        matching.record(1, 1);

        assertEquals(3, matching.pairCount());
        assertEquals(2, matching.agentsOf(0).size());
        assertEquals(2, matching.agentsOf(0).getInt(0));
        assertEquals(OptionalInt.of(2), matching.agentOf(0));
        assertEquals(OptionalInt.of(1), matching.objectOf(1));
        assertTrue(matching.isMatched(0, 0));
        assertFalse(matching.isMatched(0, 1));
    }

    @Test
    @DisplayName("Unmatched parties report empty")
    void testUnmatched() {
        Matching matching = new Matching(new int[]{1}, new int[]{1});

        assertEquals(OptionalInt.empty(), matching.objectOf(0));
        assertEquals(OptionalInt.empty(), matching.agentOf(0));
        assertTrue(matching.objectsOf(0).isEmpty());
    }

    @Test
    @DisplayName("Capacity and duplicate violations are rejected")
    void testCapacityGuards() {
        Matching matching = new Matching(new int[]{2, 1}, new int[]{1, 1});
        matching.record(0, 0);

        assertThrows(IllegalStateException.class, () -> matching.record(0, 0));
        assertThrows(IllegalStateException.class, () -> matching.record(1, 0));
        matching.record(0, 1);
        assertThrows(IllegalStateException.class, () -> matching.record(1, 1));
        assertEquals(2, matching.pairCount());
    }

    @Test
    @DisplayName("Zero-capacity parties can never be matched")
    void testZeroCapacity() {
        Matching matching = new Matching(new int[]{0}, new int[]{1});

        assertThrows(IllegalStateException.class, () -> matching.record(0, 0));
    }

    @Test
    @DisplayName("Query views are read-only")
    void testUnmodifiableViews() {
        Matching matching = new Matching(new int[]{1}, new int[]{1});
        matching.record(0, 0);

        assertThrows(UnsupportedOperationException.class, () -> matching.objectsOf(0).add(0));
    }

    @Test
    @DisplayName("Transpose swaps roles and capacities")
    void testTranspose() {
        Matching matching = new Matching(new int[]{1, 1}, new int[]{2});
        matching.record(0, 0);
        matching.record(1, 0);

        Matching transposed = matching.transpose();

        assertEquals(1, transposed.agentCount());
        assertEquals(2, transposed.objectCount());
        assertEquals(2, transposed.agentCapacity(0));
        assertEquals(2, transposed.objectsOf(0).size());
        assertEquals(matching, transposed.transpose());
    }

    @Test
    @DisplayName("Matrix export and value equality ignore commit order")
    void testMatrixAndEquality() {
        Matching first = new Matching(new int[]{1, 1}, new int[]{1, 1});
        first.record(0, 1);
        first.record(1, 0);
        Matching second = new Matching(new int[]{1, 1}, new int[]{1, 1});
        second.record(1, 0);
        second.record(0, 1);

        assertArrayEquals(new boolean[]{false, true}, first.toObjectAgentMatrix()[0]);
        assertArrayEquals(new boolean[]{true, false}, first.toObjectAgentMatrix()[1]);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        Matching other = new Matching(new int[]{1, 1}, new int[]{1, 1});
        other.record(0, 0);
        assertNotEquals(first, other);
    }
}
