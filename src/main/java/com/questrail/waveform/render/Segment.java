package com.questrail.waveform.render;

import java.util.Objects;

/**
 * A run-length segment: {@code value} held for {@code duration} time units.
 */
public record Segment(long duration, String value)
{
    public Segment {
        Objects.requireNonNull(value, "value");
        if (duration < 0) {
            throw new IllegalArgumentException("duration must be >= 0: " + duration);
        }
    }
}
