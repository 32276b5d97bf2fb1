package com.questrail.waveform.reconstruct;

import com.questrail.waveform.api.Channel;
import com.questrail.waveform.api.ChannelEvent;
import com.questrail.waveform.api.Simulation;
import com.questrail.waveform.api.StructuralFault;
import com.questrail.waveform.api.WaveformStructureException;
import com.questrail.waveform.observability.ChannelReconstructedEvent;
import com.questrail.waveform.observability.RecordingReconstructionObservabilitySink;
import com.questrail.waveform.observability.ReconstructionErrorEvent;
import com.questrail.waveform.observability.ReconstructionPassEvent;
import com.questrail.waveform.token.TokenKind;
import com.questrail.waveform.token.TokenSequenceBuilder;
import com.questrail.waveform.token.TokenSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SimulationBuilderTest
 * -----------------------------------------------------------------------------
 * End-to-end reconstruction from a token fixture shaped like a small
 * testbench dump: one clock, one 2-bit bus declared as per-bit slices, and a
 * 4-bit vector in a nested scope.
 */
final class SimulationBuilderTest
{
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private RecordingReconstructionObservabilitySink sink;
    private Clock clock;

    static TokenSource counterDump() {
        return new TokenSequenceBuilder()
                .date("  Mon Jan 01 00:00:00 2024  ")
                .timescale(" 1ns ")
                .scope("top")
                .wire("!", "clk")
                .wireBit("#", "data", 0)
                .wireBit("\"", "data", 1)
                .scope("sub")
                .vector("$", "bus", 4)
                .upscope()
                .upscope()
                .time(0).scalar("!", "0").scalar("#", "0").scalar("\"", "0").vectorChange("$", "1")
                .time(10).scalar("!", "1")
                .time(20).scalar("!", "0").scalar("#", "1")
                .time(30).scalar("!", "1").vectorChange("$", "x")
                .toSource();
    }

    @BeforeEach
    void setUp() {
        sink = new RecordingReconstructionObservabilitySink();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void reconstructsOneChannelPerScopeAndReference()
    {
        Simulation sim = new SimulationBuilder(counterDump(), sink, clock).toSimulation();

        assertEquals(3, sim.channels().size());

        Channel clk = sim.channels().get(0);
        assertEquals("top", clk.scope());
        assertEquals("clk", clk.name());
        assertEquals(1, clk.width());
        assertEquals(List.of(
                new ChannelEvent(0, "0"),
                new ChannelEvent(10, "1"),
                new ChannelEvent(20, "0"),
                new ChannelEvent(30, "1")), clk.events());

        Channel data = sim.channels().get(1);
        assertEquals("data", data.name());
        assertEquals(2, data.width());
        assertEquals(List.of(new ChannelEvent(0, "00"), new ChannelEvent(20, "01")), data.events());

        Channel bus = sim.channels().get(2);
        assertEquals("top.sub", bus.scope());
        assertEquals(4, bus.width());
        assertEquals(List.of(new ChannelEvent(0, "0001"), new ChannelEvent(30, "xxxx")), bus.events());
    }

    @Test
    void headerMetadataIsExposedRaw()
    {
        SimulationBuilder builder = new SimulationBuilder(counterDump());

        assertEquals("Mon Jan 01 00:00:00 2024", builder.date().orElseThrow());
        assertEquals("1ns", builder.timescale().orElseThrow());

        SimulationBuilder bare = new SimulationBuilder(new TokenSequenceBuilder().toSource());
        assertTrue(bare.date().isEmpty());
        assertTrue(bare.timescale().isEmpty());
    }

    @Test
    void passIsBuiltOnceAndReported()
    {
        SimulationBuilder builder = new SimulationBuilder(counterDump(), sink, clock);

        assertSame(builder.declarations(), builder.declarations());
        assertSame(builder.timeline(), builder.timeline());
        builder.toSimulation();

        List<ReconstructionPassEvent> passes = sink.eventsOfType(ReconstructionPassEvent.class);
        assertEquals(1, passes.size());

        ReconstructionPassEvent pass = passes.get(0);
        assertEquals(NOW, pass.timestamp());
        assertEquals(23, pass.tokenCount());
        assertEquals(2, pass.scopeCount());
        assertEquals(3, pass.channelCount());
        assertEquals(4, pass.timestampCount());
        assertEquals(9, pass.changeCount());

        List<ChannelReconstructedEvent> channels = sink.eventsOfType(ChannelReconstructedEvent.class);
        assertEquals(List.of("clk", "data", "bus"),
                channels.stream().map(ChannelReconstructedEvent::name).toList());
        assertEquals(4, channels.get(0).eventCount());
    }

    @Test
    void undeclaredIdCodeAbortsWithTokenPosition()
    {
        TokenSource source = new TokenSequenceBuilder()
                .scope("top")
                .wire("!", "clk")
                .time(0)
                .scalar("!", "0")
                .scalar("?", "1")
                .toSource();

        SimulationBuilder builder = new SimulationBuilder(source, sink, clock);

        WaveformStructureException e = assertThrows(WaveformStructureException.class, builder::toSimulation);
        assertEquals(StructuralFault.UNDECLARED_ID_CODE, e.fault());
        assertEquals(4, e.tokenIndex());
        assertEquals(TokenKind.CHANGE_SCALAR, e.tokenKind());

        List<ReconstructionErrorEvent> faults = sink.eventsOfType(ReconstructionErrorEvent.class);
        assertEquals(1, faults.size());
        assertSame(e, faults.get(0).cause());
        assertFalse(sink.hasEventOfType(ReconstructionPassEvent.class));
        assertFalse(sink.hasEventOfType(ChannelReconstructedEvent.class));

        // Nothing is cached from a failed pass.
        assertThrows(WaveformStructureException.class, builder::declarations);
    }

    @Test
    void simulationIsCachedAndChannelsReportedOnce()
    {
        SimulationBuilder builder = new SimulationBuilder(counterDump(), sink, clock);

        Simulation first = builder.toSimulation();
        assertSame(first, builder.toSimulation());
        assertSame(first.channels(), builder.toChannels());

        assertEquals(3, sink.eventsOfType(ChannelReconstructedEvent.class).size());
        assertEquals(4, sink.getAllEvents().size());
        assertInstanceOf(ReconstructionPassEvent.class, sink.getAllEvents().get(0));
    }

    @Test
    void wideValueFaultIsReportedAndRethrown()
    {
        TokenSource source = new TokenSequenceBuilder()
                .scope("top")
                .vector("$", "acc", 4)
                .time(0)
                .vectorChange("$", "10101")
                .toSource();

        SimulationBuilder builder = new SimulationBuilder(source, sink, clock);

        WaveformStructureException e = assertThrows(WaveformStructureException.class, builder::toSimulation);
        assertEquals(StructuralFault.VALUE_WIDER_THAN_DECLARATION, e.fault());
        assertEquals(3, e.tokenIndex());
        assertEquals(TokenKind.CHANGE_VECTOR, e.tokenKind());

        List<Object> events = sink.getAllEvents();
        assertEquals(2, events.size());
        assertInstanceOf(ReconstructionPassEvent.class, events.get(0));
        assertSame(e, ((ReconstructionErrorEvent) events.get(1)).cause());
        assertFalse(sink.hasEventOfType(ChannelReconstructedEvent.class));

        assertThrows(WaveformStructureException.class, builder::toChannels);
    }

    @Test
    void versionAndCommentTokensAreIgnored()
    {
        TokenSource annotated = new TokenSequenceBuilder()
                .version("Icarus Verilog")
                .comment("generated")
                .scope("top")
                .comment("inside scope")
                .wire("!", "clk")
                .upscope()
                .time(0).scalar("!", "0")
                .comment("between changes")
                .time(10).version("again").scalar("!", "1")
                .toSource();
        TokenSource plain = new TokenSequenceBuilder()
                .scope("top")
                .wire("!", "clk")
                .upscope()
                .time(0).scalar("!", "0")
                .time(10).scalar("!", "1")
                .toSource();

        SimulationBuilder builder = new SimulationBuilder(annotated, sink, clock);

        assertEquals(new SimulationBuilder(plain).toSimulation(), builder.toSimulation());
        assertEquals(2, builder.timeline().changeCount());
        assertTrue(builder.date().isEmpty());
    }

    @Test
    void foldFaultsSurfaceThroughThePass()
    {
        TokenSource noScope = new TokenSequenceBuilder().wire("!", "clk").toSource();
        TokenSource noTime = new TokenSequenceBuilder().scope("top").wire("!", "clk").scalar("!", "1").toSource();

        assertEquals(StructuralFault.VAR_OUTSIDE_SCOPE,
                assertThrows(WaveformStructureException.class,
                        () -> new SimulationBuilder(noScope).toSimulation()).fault());
        assertEquals(StructuralFault.CHANGE_BEFORE_TIMESTAMP,
                assertThrows(WaveformStructureException.class,
                        () -> new SimulationBuilder(noTime).toSimulation()).fault());
    }

    @Test
    void emptyDumpYieldsEmptySimulation()
    {
        Simulation sim = new SimulationBuilder(new TokenSequenceBuilder().toSource()).toSimulation();

        assertTrue(sim.channels().isEmpty());
    }
}
