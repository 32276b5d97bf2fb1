package com.questrail.waveform.mapping;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SlotIndexTests
{
    @Test
    void arraySlotIndexProvidesBidirectionalLookup() {
        ArraySlotIndex<String> index = new ArraySlotIndex<>(List.of("d[2]", "d[1]", "d[0]"));

        assertEquals(0, index.indexOf("d[2]"));
        assertEquals(1, index.indexOf("d[1]"));
        assertEquals(2, index.indexOf("d[0]"));

        assertEquals("d[2]", index.keyAt(0));
        assertEquals("d[0]", index.keyAt(2));

        assertEquals(3, index.size());
        assertTrue(index.contains("d[1]"));
        assertFalse(index.contains("d[7]"));
    }

    @Test
    void sortedFactoryAppliesOrder() {
        ArraySlotIndex<Integer> index = ArraySlotIndex.sorted(
                List.of(0, 3, 1, 2), Comparator.<Integer>reverseOrder());

        assertEquals(List.of(3, 2, 1, 0), List.copyOf(index.allKeys()));
        assertEquals(3, index.indexOf(0));
    }

    @Test
    void unknownMemberAndOutOfRangeSlotThrow() {
        ArraySlotIndex<String> index = new ArraySlotIndex<>(List.of("a", "b"));

        assertThrows(IllegalArgumentException.class, () -> index.indexOf("z"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.keyAt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> index.keyAt(-1));
    }

    @Test
    void emptyOrDuplicateMembersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ArraySlotIndex<String>(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ArraySlotIndex<>(List.of("a", "a")));
    }
}
