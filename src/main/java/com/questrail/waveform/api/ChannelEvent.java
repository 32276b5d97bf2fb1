package com.questrail.waveform.api;

import java.util.Objects;

/**
 * A channel's composite value from {@code time} onward.
 * <p>
 * The value is positional: one character per bit slot for bit-level
 * channels, verbatim text for real and string channels. It must not be read
 * as a number.
 */
public record ChannelEvent(long time, String value)
{
    public ChannelEvent {
        Objects.requireNonNull(value, "value");
    }
}
