package com.questrail.waveform.mapping;

import java.util.Objects;
import java.util.Set;

/**
 * SlotIndex
 * -----------------------------------------------------------------------------
 * {@code SlotIndex} defines the mapping between the members of a channel
 * (typically its sibling declarations) and dense, 0-based positions in the
 * channel's working value buffer.
 *
 * <h2>Why this exists</h2>
 * A bit-index as written in a dump is a label: it may start anywhere, skip
 * values, or be absent entirely for a scalar. The reconstruction buffer, on
 * the other hand, needs positions {@code 0..size-1}. This interface isolates
 * that translation so that:
 * <ul>
 *   <li>Merge code never computes offsets from bit-indices directly</li>
 *   <li>The ordering convention lives in exactly one place</li>
 *   <li>Sparse or irregular bit-indices do not leak into buffer addressing</li>
 * </ul>
 *
 * <h2>Index Semantics</h2>
 * The slot returned by {@link #indexOf(Object)} is always:
 * <ul>
 *   <li>0-based</li>
 *   <li>Dense, in {@code [0, size())}</li>
 *   <li>Stable within a given {@code SlotIndex} instance</li>
 * </ul>
 */
public interface SlotIndex<K>
{
    /**
     * Returns the number of slots.
     */
    int size();

    /**
     * Returns the 0-based slot of the given member.
     *
     * @throws IllegalArgumentException if the member is unknown to this index
     */
    int indexOf(K key);

    /**
     * Reverse-lookup: returns the member at the given slot.
     *
     * @throws IndexOutOfBoundsException if slot is out of range
     */
    K keyAt(int slot);

    /**
     * Returns all members, in slot order.
     */
    Set<K> allKeys();

    /**
     * Returns true if this index contains the given member.
     */
    default boolean contains(K key) {
        Objects.requireNonNull(key, "key");
        return allKeys().contains(key);
    }
}
