package com.questrail.waveform.render;

import com.questrail.waveform.api.Channel;
import com.questrail.waveform.api.Simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * TimingDiagramRenderer
 * ============================================================================
 * Renders a {@link Simulation}, or a single {@link Channel}, as timing-diagram
 * markup.
 *
 * <h2>Output shape</h2>
 * <pre>
 *   \begin{tikztimingtable}
 *   	clock &amp; 10{0} 10{1} 10{0}
 *   	enable &amp; 30{0} 20{1}
 *   \end{tikztimingtable}
 * </pre>
 *
 * <ul>
 *   <li>One line per channel: the name, {@code " &"}, then each segment as
 *       {@code <duration>{<symbol>}}, separated by single spaces</li>
 *   <li>Durations are plain integers in the dump's time units</li>
 *   <li>No escaping is applied to names or symbols</li>
 * </ul>
 *
 * Markers, indentation and symbol spelling come from {@link DiagramConfig}.
 * Rendering is a pure function of its inputs.
 */
public final class TimingDiagramRenderer
{
    private final DiagramConfig config;
    private final SegmentEncoder encoder;

    public TimingDiagramRenderer() {
        this(DiagramConfig.defaults());
    }

    public TimingDiagramRenderer(DiagramConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = new SegmentEncoder();
    }

    public DiagramConfig config() {
        return config;
    }

    /**
     * Returns the run-length segments of {@code channel} over
     * {@code [start, end)}.
     */
    public List<Segment> segments(Channel channel, long start, long end) {
        return encoder.encode(channel, start, end);
    }

    /**
     * Formats one channel line, without indentation.
     */
    public String renderLine(Channel channel, long start, long end) {
        StringBuilder line = new StringBuilder(channel.name()).append(" &");
        for (Segment s : segments(channel, start, end)) {
            line.append(' ')
                .append(s.duration())
                .append('{')
                .append(config.symbolStyle().symbol(s.value()))
                .append('}');
        }
        return line.toString();
    }

    /**
     * Renders every channel of {@code simulation}, in simulation order.
     */
    public String render(Simulation simulation, long start, long end) {
        return render(simulation, start, end, null);
    }

    /**
     * Renders the channels of {@code simulation} whose name is in
     * {@code channelNames}, in simulation order. A {@code null} filter selects
     * every channel.
     */
    public String render(Simulation simulation, long start, long end, Set<String> channelNames) {
        Objects.requireNonNull(simulation, "simulation");

        List<String> lines = new ArrayList<>();
        lines.add(config.beginMarker());
        for (Channel channel : simulation.channels()) {
            if (channelNames != null && !channelNames.contains(channel.name())) {
                continue;
            }
            lines.add(config.indent() + renderLine(channel, start, end));
        }
        lines.add(config.endMarker());
        return String.join("\n", lines);
    }
}
