package com.questrail.waveform.reconstruct;

import com.questrail.waveform.api.Channel;
import com.questrail.waveform.api.Simulation;
import com.questrail.waveform.api.StructuralFault;
import com.questrail.waveform.api.WaveformStructureException;
import com.questrail.waveform.index.Declaration;
import com.questrail.waveform.index.DeclarationIndex;
import com.questrail.waveform.index.DeclarationIndexer;
import com.questrail.waveform.observability.ChannelReconstructedEvent;
import com.questrail.waveform.observability.NullReconstructionObservabilitySink;
import com.questrail.waveform.observability.ReconstructionErrorEvent;
import com.questrail.waveform.observability.ReconstructionObservabilitySink;
import com.questrail.waveform.observability.ReconstructionPassEvent;
import com.questrail.waveform.timeline.TimedChange;
import com.questrail.waveform.timeline.TimedChangeSet;
import com.questrail.waveform.timeline.TimelineBuilder;
import com.questrail.waveform.token.TokenSource;
import com.questrail.waveform.token.VcdToken;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SimulationBuilder
 * =============================================================================
 * One reconstruction pass over a materialized token sequence.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   TokenSource
 *     -> DeclarationIndexer  -> DeclarationIndex
 *     -> TimelineBuilder     -> TimedChangeSet
 *         -> id-code validation
 *             -> ChannelReconstructor (one per scope/reference group)
 *                 -> Simulation
 * </pre>
 *
 * <h2>Caching</h2>
 * The token sequence is snapshotted at construction. The declaration index,
 * timeline and reconstructed {@link Simulation} are built on first use and
 * cached for the lifetime of the builder; every later query reuses them.
 *
 * <h2>Faults</h2>
 * Any {@link WaveformStructureException} raised while building, validating or
 * reconstructing is reported to the {@link ReconstructionObservabilitySink} and rethrown.
 * Nothing is cached from a failed pass, so a retry fails the same way.
 *
 * <h2>Thread Safety</h2>
 * Instances are not thread-safe. Confine a builder to one thread.
 */
public final class SimulationBuilder
{
    private final List<VcdToken> tokens;
    private final ReconstructionObservabilitySink sink;
    private final Clock clock;

    private final DeclarationIndexer indexer = new DeclarationIndexer();
    private final TimelineBuilder timelineBuilder = new TimelineBuilder();
    private final ChannelReconstructor reconstructor = new ChannelReconstructor();

    private DeclarationIndex declarations;
    private TimedChangeSet timeline;
    private Simulation simulation;

    public SimulationBuilder(TokenSource source) {
        this(source, NullReconstructionObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    public SimulationBuilder(TokenSource source,
                             ReconstructionObservabilitySink sink,
                             Clock clock) {
        Objects.requireNonNull(source, "source");
        this.tokens = List.copyOf(Objects.requireNonNull(source.tokens(), "source.tokens()"));
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the raw payload of the first {@code $date} token, if any.
     */
    public Optional<String> date() {
        for (VcdToken token : tokens) {
            if (token instanceof VcdToken.Date d) {
                return Optional.of(d.raw().strip());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the raw payload of the first {@code $timescale} token, if any.
     */
    public Optional<String> timescale() {
        for (VcdToken token : tokens) {
            if (token instanceof VcdToken.Timescale t) {
                return Optional.of(t.raw().strip());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the validated declaration index.
     *
     * @throws WaveformStructureException if the token sequence is corrupt
     */
    public DeclarationIndex declarations() {
        ensureBuilt();
        return declarations;
    }

    /**
     * Returns the validated timeline.
     *
     * @throws WaveformStructureException if the token sequence is corrupt
     */
    public TimedChangeSet timeline() {
        ensureBuilt();
        return timeline;
    }

    /**
     * Reconstructs one channel per (scope, reference) group, in declaration
     * order.
     *
     * @throws WaveformStructureException if the token sequence is corrupt
     */
    public List<Channel> toChannels() {
        return toSimulation().channels();
    }

    /**
     * Reconstructs the whole simulation. The result is cached, so repeated
     * calls return the same instance and report each channel once.
     *
     * @throws WaveformStructureException if the token sequence is corrupt
     */
    public Simulation toSimulation() {
        if (simulation != null) {
            return simulation;
        }
        ensureBuilt();

        List<Channel> channels = new ArrayList<>(declarations.groupCount());
        try {
            for (Map.Entry<String, Map<String, Map<Integer, Declaration>>> scope
                    : declarations.asMap().entrySet()) {
                for (Map.Entry<String, Map<Integer, Declaration>> group : scope.getValue().entrySet()) {
                    channels.add(reconstructor.toChannel(
                            scope.getKey(), group.getKey(), group.getValue().values(), timeline));
                }
            }
        } catch (WaveformStructureException e) {
            sink.onFault(new ReconstructionErrorEvent(clock.instant(), e.getMessage(), e));
            throw e;
        }

        this.simulation = new Simulation(channels);
        for (Channel channel : simulation.channels()) {
            sink.onChannelReconstructed(new ChannelReconstructedEvent(
                    clock.instant(),
                    channel.scope(),
                    channel.name(),
                    channel.width(),
                    channel.events().size()));
        }
        return simulation;
    }

    // ---------------------------------------------------------------------
    // Pass
    // ---------------------------------------------------------------------

    private void ensureBuilt() {
        if (declarations != null) {
            return;
        }
        try {
            DeclarationIndex builtIndex = indexer.index(tokens);
            TimedChangeSet builtTimeline = timelineBuilder.build(tokens);
            validateIdCodes(builtIndex, builtTimeline);

            this.declarations = builtIndex;
            this.timeline = builtTimeline;
        } catch (WaveformStructureException e) {
            sink.onFault(new ReconstructionErrorEvent(clock.instant(), e.getMessage(), e));
            throw e;
        }

        sink.onPassCompleted(new ReconstructionPassEvent(
                clock.instant(),
                tokens.size(),
                declarations.scopes().size(),
                declarations.groupCount(),
                timeline.timestamps().size(),
                timeline.changeCount()));
    }

    private static void validateIdCodes(DeclarationIndex index, TimedChangeSet timeline) {
        for (Map.Entry<Long, List<TimedChange>> entry : timeline.asMap().entrySet()) {
            for (TimedChange change : entry.getValue()) {
                if (!index.isDeclared(change.idCode())) {
                    throw new WaveformStructureException(
                            StructuralFault.UNDECLARED_ID_CODE,
                            change.tokenIndex(),
                            change.kind(),
                            "id-code '" + change.idCode() + "' at #" + entry.getKey()
                                    + " matches no declaration");
                }
            }
        }
    }
}
