package com.questrail.waveform.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Channel
 * -----------------------------------------------------------------------------
 * The full, reconstructed value history of one logical signal.
 *
 * <h2>Composition</h2>
 * A channel may be backed by a single declaration, or by several bit-indexed
 * declarations sharing a reference name inside one scope. Either way it is
 * exposed as a single sequence of {@link ChannelEvent}s whose values span the
 * whole channel width.
 *
 * <h2>Event ordering</h2>
 * Events are ordered by time and contain only timestamps at which the channel
 * was touched. Construction rejects an out-of-order sequence.
 *
 * <h2>Missing data</h2>
 * Before its first event a channel holds {@link #UNKNOWN}. A channel with no
 * events at all is unknown for all time. Neither case is an error.
 */
public final class Channel
{
    /** Value reported before a channel's first recorded change. */
    public static final String UNKNOWN = "X";

    private final int width;
    private final String scope;
    private final String name;
    private final List<ChannelEvent> events;

    public Channel(int width, String scope, String name, List<ChannelEvent> events) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be >= 1: " + width);
        }
        this.width = width;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.name = Objects.requireNonNull(name, "name");
        this.events = List.copyOf(Objects.requireNonNull(events, "events"));

        for (int i = 1; i < this.events.size(); i++) {
            if (this.events.get(i).time() <= this.events.get(i - 1).time()) {
                throw new IllegalArgumentException(
                        "Events of channel " + name + " are not strictly increasing at position " + i);
            }
        }
    }

    public int width() {
        return width;
    }

    public String scope() {
        return scope;
    }

    public String name() {
        return name;
    }

    public List<ChannelEvent> events() {
        return events;
    }

    /**
     * Returns the value of the latest event at or before {@code time}, or
     * {@link #UNKNOWN} if the channel has not changed yet.
     */
    public String valueAt(long time) {
        int i = countAtOrBefore(time);
        return i == 0 ? UNKNOWN : events.get(i - 1).value();
    }

    /**
     * Returns the first event strictly after {@code time}, if any.
     */
    public Optional<ChannelEvent> nextEvent(long time) {
        int i = countAtOrBefore(time);
        return i < events.size() ? Optional.of(events.get(i)) : Optional.empty();
    }

    // Number of events with time <= t.
    private int countAtOrBefore(long t) {
        int lo = 0;
        int hi = events.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (events.get(mid).time() <= t) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Channel other)) return false;
        return width == other.width
                && scope.equals(other.scope)
                && name.equals(other.name)
                && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, scope, name, events);
    }

    @Override
    public String toString() {
        return "Channel{" + scope + "." + name + ", width=" + width + ", events=" + events.size() + "}";
    }
}
