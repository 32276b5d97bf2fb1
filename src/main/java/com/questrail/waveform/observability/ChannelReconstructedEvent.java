package com.questrail.waveform.observability;

import java.time.Instant;

/**
 * Record describing one channel produced by a reconstruction pass.
 */
public record ChannelReconstructedEvent(
    Instant timestamp,
    String scope,
    String name,
    int width,
    int eventCount
) {
    /**
     * Checks if the channel never changed within the dump.
     */
    public boolean isSilent() {
        return eventCount == 0;
    }
}
