package com.questrail.waveform.observability;

/**
 * Main interface for receiving reconstruction observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ReconstructionObservabilitySink {
    /**
     * Called once the declaration index and timeline of a pass are built.
     * @param event the pass summary
     */
    void onPassCompleted(ReconstructionPassEvent event);

    /**
     * Called for every channel reconstructed during a pass.
     * @param event the channel details
     */
    void onChannelReconstructed(ChannelReconstructedEvent event);

    /**
     * Called when a structural fault aborts a pass, before it is rethrown.
     * @param event the error event
     */
    void onFault(ReconstructionErrorEvent event);
}
