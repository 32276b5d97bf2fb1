package com.questrail.waveform.render;

import com.questrail.waveform.api.Channel;
import com.questrail.waveform.api.ChannelEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SegmentEncoder
 * ============================================================================
 * Converts a {@link Channel}'s event history into the run-length
 * {@link Segment}s covering a half-open window {@code [start, end)}.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Start at {@code start} holding {@code valueAt(start)}</li>
 *   <li>The current segment ends at the next event, clamped to {@code end}</li>
 *   <li>Stop once there is no next event or it lies at or past {@code end}</li>
 * </ol>
 *
 * Segment durations always sum to {@code end - start}. Adjacent segments that
 * hold the same value are merged, so the output is minimal even when the
 * history repeats a value.
 *
 * <h2>Degenerate windows</h2>
 * {@code start == end} yields an empty list. {@code start > end} is rejected.
 */
public final class SegmentEncoder
{
    /**
     * Encodes {@code channel} over {@code [start, end)}.
     *
     * @throws IllegalArgumentException if {@code start > end}
     */
    public List<Segment> encode(Channel channel, long start, long end) {
        Objects.requireNonNull(channel, "channel");
        if (start > end) {
            throw new IllegalArgumentException("window start " + start + " is after end " + end);
        }

        List<Segment> segments = new ArrayList<>();
        long currentTime = start;
        String currentValue = channel.valueAt(start);

        while (currentTime < end) {
            Optional<ChannelEvent> next = channel.nextEvent(currentTime);
            long segmentEnd = next.map(e -> Math.min(e.time(), end)).orElse(end);

            append(segments, new Segment(segmentEnd - currentTime, currentValue));

            if (next.isEmpty() || next.get().time() >= end) {
                break;
            }
            currentValue = next.get().value();
            currentTime = next.get().time();
        }
        return segments;
    }

    private static void append(List<Segment> segments, Segment segment) {
        int last = segments.size() - 1;
        if (last >= 0 && segments.get(last).value().equals(segment.value())) {
            Segment prev = segments.get(last);
            segments.set(last, new Segment(prev.duration() + segment.duration(), prev.value()));
        } else {
            segments.add(segment);
        }
    }
}
