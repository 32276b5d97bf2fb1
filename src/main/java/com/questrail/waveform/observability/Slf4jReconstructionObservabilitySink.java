package com.questrail.waveform.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ReconstructionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jReconstructionObservabilitySink implements ReconstructionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jReconstructionObservabilitySink.class);

    @Override
    public void onPassCompleted(ReconstructionPassEvent event) {
        log.info("Waveform pass: {} tokens, {} scopes, {} channels, {} timestamps, {} changes",
            event.tokenCount(),
            event.scopeCount(),
            event.channelCount(),
            event.timestampCount(),
            event.changeCount());
    }

    @Override
    public void onChannelReconstructed(ChannelReconstructedEvent event) {
        if (event.isSilent()) {
            log.debug("Channel {}.{} (width {}) never changes", event.scope(), event.name(), event.width());
            return;
        }
        log.debug("Channel {}.{} (width {}): {} events",
            event.scope(),
            event.name(),
            event.width(),
            event.eventCount());
    }

    @Override
    public void onFault(ReconstructionErrorEvent event) {
        log.error("Waveform reconstruction aborted: {}", event.message(), event.cause());
    }
}
