package com.questrail.waveform.timeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TimedChangeSet
 * -----------------------------------------------------------------------------
 * Immutable mapping from timestamp to the value changes recorded at that
 * timestamp.
 *
 * <h2>Ordering</h2>
 * Iteration follows insertion order, which {@link TimelineBuilder} guarantees
 * to be strictly increasing in time. Within a timestamp, changes keep their
 * source order. A timestamp that was opened but saw no changes is present
 * with an empty list.
 */
public final class TimedChangeSet
{
    private final Map<Long, List<TimedChange>> byTime;

    TimedChangeSet(Map<Long, List<TimedChange>> byTime) {
        Map<Long, List<TimedChange>> copy = new LinkedHashMap<>();
        byTime.forEach((t, changes) -> copy.put(t, List.copyOf(changes)));
        this.byTime = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the timestamp to change-list mapping, in chronological order.
     */
    public Map<Long, List<TimedChange>> asMap() {
        return byTime;
    }

    public Set<Long> timestamps() {
        return byTime.keySet();
    }

    /**
     * Returns the changes recorded at {@code time}; empty if none.
     */
    public List<TimedChange> changesAt(long time) {
        return byTime.getOrDefault(time, List.of());
    }

    public boolean isEmpty() {
        return byTime.isEmpty();
    }

    /**
     * Returns the total number of recorded changes across all timestamps.
     */
    public int changeCount() {
        int n = 0;
        for (List<TimedChange> changes : byTime.values()) {
            n += changes.size();
        }
        return n;
    }
}
