package com.questrail.waveform.timeline;

import com.questrail.waveform.api.StructuralFault;
import com.questrail.waveform.api.WaveformStructureException;
import com.questrail.waveform.token.TokenKind;
import com.questrail.waveform.token.TokenSequenceBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the timeline fold.
 */
final class TimelineBuilderTest
{
    private final TimelineBuilder builder = new TimelineBuilder();

    @Test
    void changesAreGroupedUnderTheirTimestampInSourceOrder()
    {
        TimedChangeSet timeline = builder.build(new TokenSequenceBuilder()
                .scope("top")
                .wire("!", "clk")
                .time(0)
                .scalar("!", "0")
                .vectorChange("#", "1010")
                .time(10)
                .real("$", "2.5")
                .string("%", "busy")
                .time(20)
                .build());

        assertEquals(List.of(0L, 10L, 20L), List.copyOf(timeline.timestamps()));

        List<TimedChange> at0 = timeline.changesAt(0);
        assertEquals(2, at0.size());
        assertEquals(new TimedChange("!", "0", 3, TokenKind.CHANGE_SCALAR), at0.get(0));
        assertEquals(new TimedChange("#", "1010", 4, TokenKind.CHANGE_VECTOR), at0.get(1));

        List<TimedChange> at10 = timeline.changesAt(10);
        assertEquals(TokenKind.CHANGE_REAL, at10.get(0).kind());
        assertEquals(TokenKind.CHANGE_STRING, at10.get(1).kind());

        assertTrue(timeline.changesAt(20).isEmpty());
        assertTrue(timeline.changesAt(99).isEmpty());
        assertEquals(4, timeline.changeCount());
    }

    @Test
    void repeatedTimestampAppendsToOpenEntry()
    {
        TimedChangeSet timeline = builder.build(new TokenSequenceBuilder()
                .time(5).scalar("!", "1")
                .time(5).scalar("#", "0")
                .build());

        assertEquals(1, timeline.timestamps().size());
        assertEquals(2, timeline.changesAt(5).size());
    }

    @Test
    void emptySequenceYieldsEmptyTimeline()
    {
        assertTrue(builder.build(List.of()).isEmpty());
    }

    @Test
    void changeBeforeAnyTimestampIsFatal()
    {
        WaveformStructureException e = assertThrows(WaveformStructureException.class,
                () -> builder.build(new TokenSequenceBuilder()
                        .scope("top")
                        .wire("!", "clk")
                        .scalar("!", "1")
                        .build()));

        assertEquals(StructuralFault.CHANGE_BEFORE_TIMESTAMP, e.fault());
        assertEquals(2, e.tokenIndex());
        assertEquals(TokenKind.CHANGE_SCALAR, e.tokenKind());
    }

    @Test
    void timestampRegressionIsFatal()
    {
        WaveformStructureException e = assertThrows(WaveformStructureException.class,
                () -> builder.build(new TokenSequenceBuilder()
                        .time(10)
                        .scalar("!", "1")
                        .time(5)
                        .build()));

        assertEquals(StructuralFault.TIMESTAMP_REGRESSION, e.fault());
        assertEquals(2, e.tokenIndex());
        assertEquals(TokenKind.CHANGE_TIME, e.tokenKind());
    }

    @Test
    void timelineIsImmutable()
    {
        TimedChangeSet timeline = builder.build(new TokenSequenceBuilder()
                .time(0).scalar("!", "1")
                .build());

        assertThrows(UnsupportedOperationException.class, () -> timeline.asMap().clear());
        assertThrows(UnsupportedOperationException.class, () -> timeline.changesAt(0).clear());
    }
}
