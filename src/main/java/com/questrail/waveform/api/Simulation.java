package com.questrail.waveform.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, read-only collection of reconstructed channels; the final output of
 * a reconstruction pass and the input of the diagram renderer.
 */
public record Simulation(List<Channel> channels)
{
    public Simulation {
        channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
    }

    /**
     * Returns the first channel with the given name, in simulation order.
     */
    public Optional<Channel> channel(String name) {
        Objects.requireNonNull(name, "name");
        for (Channel c : channels) {
            if (c.name().equals(name)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
