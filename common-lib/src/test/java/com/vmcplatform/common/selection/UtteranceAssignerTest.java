package com.vmcplatform.common.selection;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.SegmentCandidate;
import com.vmcplatform.common.model.VocalEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtteranceAssignerTest {

    private final List<SegmentCandidate> selected = List.of(
        SegmentSelectorTest.segment(1, 10, true),   // 0..300 s
        SegmentSelectorTest.segment(3, 8, true));   // 600..900 s

    @Test
    @DisplayName("events are placed by start time, segment start inclusive and end exclusive")
    void startTimeContainment() {
        List<AssignedUtterance> result = UtteranceAssigner.assign(selected, List.of(
            VocalEvent.of(0.0, 1.2),
            VocalEvent.of(299.5, 301.0),   // starts inside segment 1, runs past its end
            VocalEvent.of(300.0, 301.0),   // starts at segment 1 end → unselected segment 2
            VocalEvent.of(650.25, 651.0)));

        assertEquals(3, result.size());
        assertEquals(1L, result.get(0).segmentId());
        assertEquals(1L, result.get(1).segmentId());
        assertEquals(3L, result.get(2).segmentId());
        assertEquals(0.75, result.get(2).durationSeconds(), 1e-9);
    }

    @Test
    @DisplayName("pitch range is max minus min; missing pitch yields zeros")
    void pitchFeatures() {
        List<AssignedUtterance> result = UtteranceAssigner.assign(selected, List.of(
            new VocalEvent(10.0, 11.0, 180.0, 420.5, 260.0),
            VocalEvent.of(12.0, 13.0)));

        assertEquals(240.5, result.get(0).pitchRange(), 1e-9);
        assertEquals(260.0, result.get(0).averagePitch(), 1e-9);
        assertEquals(0.0, result.get(1).minimumPitch());
        assertEquals(0.0, result.get(1).pitchRange());
    }

    @Test
    @DisplayName("duration is rounded to four decimals")
    void durationRounding() {
        AssignedUtterance u = UtteranceAssigner.assign(selected, List.of(VocalEvent.of(1.00001, 2.123456))).get(0);
        assertEquals(1.1234, u.durationSeconds(), 1e-12);
    }

    @Test
    @DisplayName("inverted event is rejected")
    void invertedEvent() {
        assertThrows(InputGuardException.class,
            () -> UtteranceAssigner.assign(selected, List.of(VocalEvent.of(5.0, 4.0))));
    }
}
