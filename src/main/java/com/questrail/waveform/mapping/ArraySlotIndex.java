package com.questrail.waveform.mapping;

import java.util.*;

/**
 * ArraySlotIndex
 * -----------------------------------------------------------------------------
 * A straightforward {@link SlotIndex} implementation backed by:
 *
 * <ul>
 *   <li>a list for slot -> member</li>
 *   <li>a map for member -> slot</li>
 * </ul>
 */
public final class ArraySlotIndex<K> implements SlotIndex<K>
{
    private final List<K> keyBySlot;
    private final Map<K, Integer> slotByKey;
    private final Set<K> all;

    /**
     * Creates an index from members already in slot order.
     */
    public ArraySlotIndex(List<? extends K> keysInSlotOrder) {
        Objects.requireNonNull(keysInSlotOrder, "keysInSlotOrder");
        if (keysInSlotOrder.isEmpty()) {
            throw new IllegalArgumentException("At least one member is required");
        }

        this.keyBySlot = List.copyOf(keysInSlotOrder);

        Map<K, Integer> tmp = new HashMap<>(keyBySlot.size() * 2);
        for (int i = 0; i < keyBySlot.size(); i++) {
            Integer prev = tmp.put(keyBySlot.get(i), i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate member in index: " + keyBySlot.get(i));
            }
        }
        this.slotByKey = Collections.unmodifiableMap(tmp);
        this.all = Collections.unmodifiableSet(new LinkedHashSet<>(keyBySlot));
    }

    /**
     * Creates an index whose slot order is {@code members} sorted by
     * {@code order}.
     */
    public static <K> ArraySlotIndex<K> sorted(Collection<? extends K> members,
                                               Comparator<? super K> order) {
        Objects.requireNonNull(members, "members");
        Objects.requireNonNull(order, "order");
        List<K> sorted = new ArrayList<>(members);
        sorted.sort(order);
        return new ArraySlotIndex<>(sorted);
    }

    @Override
    public int size() {
        return keyBySlot.size();
    }

    @Override
    public int indexOf(K key) {
        Objects.requireNonNull(key, "key");
        Integer slot = slotByKey.get(key);
        if (slot == null) {
            throw new IllegalArgumentException("Unknown member: " + key);
        }
        return slot;
    }

    @Override
    public K keyAt(int slot) {
        if (slot < 0 || slot >= keyBySlot.size()) {
            throw new IndexOutOfBoundsException("slot=" + slot + ", size=" + keyBySlot.size());
        }
        return keyBySlot.get(slot);
    }

    @Override
    public Set<K> allKeys() {
        return all;
    }
}
