package com.questrail.waveform.reconstruct;

import com.questrail.waveform.api.Channel;
import com.questrail.waveform.api.ChannelEvent;
import com.questrail.waveform.api.StructuralFault;
import com.questrail.waveform.api.WaveformStructureException;
import com.questrail.waveform.index.Declaration;
import com.questrail.waveform.mapping.ArraySlotIndex;
import com.questrail.waveform.mapping.SlotIndex;
import com.questrail.waveform.timeline.TimedChange;
import com.questrail.waveform.timeline.TimedChangeSet;

import java.util.*;

/**
 * ChannelReconstructor
 * -----------------------------------------------------------------------------
 * Replays a {@link TimedChangeSet} against one group of sibling declarations
 * and produces the composite channel's change-only event sequence.
 *
 * <h2>Slot order</h2>
 * Siblings are placed into buffer slots by <b>descending</b> bit-index, so the
 * highest bit-index occupies slot 0 and bit-index 0 occupies the last slot.
 * The joined buffer therefore reads most-significant slice first, independent
 * of the order the slices were declared in. A sibling without a bit-index
 * sorts as bit-index 0.
 *
 * <h2>Dirty timestamps</h2>
 * A timestamp produces exactly one event iff at least one change at that
 * timestamp addresses a sibling's id-code. All other timestamps are skipped.
 *
 * <h2>Value normalization</h2>
 * Each slot holds {@link Declaration#size()} characters. Bit values shorter
 * than that are left-extended: with {@code 0} when the leading character is
 * {@code 0} or {@code 1}, otherwise by repeating the leading {@code x}/{@code z}.
 * A longer value is a {@link StructuralFault#VALUE_WIDER_THAN_DECLARATION}
 * fault. Real and string values are stored verbatim.
 */
public final class ChannelReconstructor
{
    /** Orders siblings so that the highest bit-index takes slot 0. */
    public static final Comparator<Declaration> DESCENDING_BIT_INDEX =
            Comparator.comparingInt((Declaration d) -> d.bitIndex().orElse(0)).reversed();

    /**
     * Reconstructs the full channel for one (scope, reference) group.
     */
    public Channel toChannel(String scope,
                             String reference,
                             Collection<Declaration> siblings,
                             TimedChangeSet timeline) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(reference, "reference");

        List<ChannelEvent> events = reconstruct(siblings, timeline);
        return new Channel(widthOf(siblings), scope, reference, events);
    }

    /**
     * Produces the change-only event sequence for a sibling group.
     *
     * @param siblings one or more declarations sharing (scope, reference)
     * @param timeline the full, chronologically ordered change set
     * @return events in timestamp order, one per dirty timestamp
     * @throws WaveformStructureException if a bit value is wider than its
     *         declaration
     */
    public List<ChannelEvent> reconstruct(Collection<Declaration> siblings,
                                          TimedChangeSet timeline) {
        Objects.requireNonNull(siblings, "siblings");
        Objects.requireNonNull(timeline, "timeline");

        SlotIndex<Declaration> slots = ArraySlotIndex.sorted(siblings, DESCENDING_BIT_INDEX);

        // An id-code may be shared by more than one sibling.
        Map<String, List<Declaration>> byIdCode = new HashMap<>();
        for (Declaration d : slots.allKeys()) {
            byIdCode.computeIfAbsent(d.idCode(), k -> new ArrayList<>()).add(d);
        }

        String[] buffer = new String[slots.size()];
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = Channel.UNKNOWN.repeat(slots.keyAt(i).size());
        }

        List<ChannelEvent> events = new ArrayList<>();
        for (Map.Entry<Long, List<TimedChange>> entry : timeline.asMap().entrySet()) {
            boolean dirty = false;
            for (TimedChange change : entry.getValue()) {
                List<Declaration> targets = byIdCode.get(change.idCode());
                if (targets == null) {
                    continue;
                }
                for (Declaration d : targets) {
                    buffer[slots.indexOf(d)] = normalize(d, change);
                    dirty = true;
                }
            }
            if (dirty) {
                events.add(new ChannelEvent(entry.getKey(), String.join("", buffer)));
            }
        }
        return events;
    }

    /**
     * Returns the channel width: the sum of the siblings' declared sizes, which
     * for 1-bit slices equals the number of siblings.
     */
    public static int widthOf(Collection<Declaration> siblings) {
        int width = 0;
        for (Declaration d : siblings) {
            width += d.size();
        }
        return width;
    }

    static String normalize(Declaration decl, TimedChange change) {
        String value = change.value();
        if (decl.isTextual()) {
            return value;
        }
        int size = decl.size();
        if (value.isEmpty()) {
            return Channel.UNKNOWN.repeat(size);
        }
        if (value.length() == size) {
            return value;
        }
        if (value.length() > size) {
            throw new WaveformStructureException(
                    StructuralFault.VALUE_WIDER_THAN_DECLARATION,
                    change.tokenIndex(),
                    change.kind(),
                    "value '" + value + "' of '" + decl.reference() + "' is wider than its "
                            + size + "-bit declaration");
        }
        char lead = value.charAt(0);
        char pad = (lead == '0' || lead == '1') ? '0' : lead;
        return String.valueOf(pad).repeat(size - value.length()) + value;
    }
}
