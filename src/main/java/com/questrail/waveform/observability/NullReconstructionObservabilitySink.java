package com.questrail.waveform.observability;

/**
 * No-op implementation of ReconstructionObservabilitySink.
 */
public final class NullReconstructionObservabilitySink implements ReconstructionObservabilitySink {
    public static final NullReconstructionObservabilitySink INSTANCE = new NullReconstructionObservabilitySink();

    private NullReconstructionObservabilitySink() {}

    @Override
    public void onPassCompleted(ReconstructionPassEvent event) {}

    @Override
    public void onChannelReconstructed(ChannelReconstructedEvent event) {}

    @Override
    public void onFault(ReconstructionErrorEvent event) {}
}
