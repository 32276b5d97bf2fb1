package com.questrail.waveform.timeline;

import com.questrail.waveform.api.StructuralFault;
import com.questrail.waveform.api.WaveformStructureException;
import com.questrail.waveform.token.VcdToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TimelineBuilder
 * -----------------------------------------------------------------------------
 * Pure fold that turns a token sequence into a {@link TimedChangeSet}.
 *
 * <h2>Role in the architecture</h2>
 * This is the second pass over a token sequence. It looks only at timestamp
 * markers and value changes; declarations are the concern of
 * {@code DeclarationIndexer}.
 *
 * <h2>Timestamp cursor</h2>
 * The cursor starts undefined and is local to the fold.
 * <ul>
 *   <li>A timestamp marker opens an entry and advances the cursor</li>
 *   <li>A repeated, equal timestamp appends to the entry already open</li>
 *   <li>Any of the four change kinds appends to the current entry</li>
 * </ul>
 *
 * The builder never re-sorts. A change before the first marker, or a marker
 * lower than its predecessor, aborts the fold.
 */
public final class TimelineBuilder
{
    /**
     * Folds the whole token sequence into a timeline.
     *
     * @param tokens the token sequence, in source order
     * @return the finished, immutable timeline
     * @throws WaveformStructureException on a change before any timestamp, or
     *         a timestamp regression
     */
    public TimedChangeSet build(List<? extends VcdToken> tokens) {
        Objects.requireNonNull(tokens, "tokens");

        Map<Long, List<TimedChange>> acc = new LinkedHashMap<>();
        List<TimedChange> current = null;
        long currentTime = Long.MIN_VALUE;

        for (VcdToken token : tokens) {
            if (token instanceof VcdToken.ChangeTime t) {
                if (current != null && t.time() < currentTime) {
                    throw new WaveformStructureException(
                            StructuralFault.TIMESTAMP_REGRESSION, t.index(), t.kind(),
                            "#" + t.time() + " follows #" + currentTime);
                }
                currentTime = t.time();
                current = acc.computeIfAbsent(currentTime, k -> new ArrayList<>());
            }
            else if (token instanceof VcdToken.ChangeToken c) {
                if (current == null) {
                    throw new WaveformStructureException(
                            StructuralFault.CHANGE_BEFORE_TIMESTAMP, c.index(), c.kind(),
                            "change of '" + c.idCode() + "' before any timestamp");
                }
                current.add(new TimedChange(c.idCode(), c.value(), c.index(), c.kind()));
            }
        }
        return new TimedChangeSet(acc);
    }
}
