package com.questrail.waveform.observability;

import com.questrail.waveform.api.WaveformStructureException;

import java.time.Instant;

/**
 * Record representing a structural fault that aborted a reconstruction pass.
 */
public record ReconstructionErrorEvent(
    Instant timestamp,
    String message,
    WaveformStructureException cause
) {
}
