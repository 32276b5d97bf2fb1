package com.questrail.waveform.observability;

import java.time.Instant;

/**
 * Record summarizing a completed reconstruction pass.
 */
public record ReconstructionPassEvent(
    Instant timestamp,
    int tokenCount,
    int scopeCount,
    int channelCount,
    int timestampCount,
    int changeCount
) {
}
