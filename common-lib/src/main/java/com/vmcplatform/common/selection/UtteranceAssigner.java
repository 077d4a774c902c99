package com.vmcplatform.common.selection;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.SegmentCandidate;
import com.vmcplatform.common.model.VocalEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Places provider vocal events into selected segments.
 *
 * <p>An event belongs to a segment when its start falls in {@code [segment.start, segment.end)},
 * in seconds relative to the recording. Events starting outside every selected segment are dropped.
 * Events without pitch data get 0.0 for all pitch features.
 */
public final class UtteranceAssigner {

    private UtteranceAssigner() {}

    public static List<AssignedUtterance> assign(List<SegmentCandidate> selectedSegments,
                                                 List<VocalEvent> events) {
        for (VocalEvent event : events) {
            if (event.endSeconds() <= event.startSeconds()) {
                throw new InputGuardException("registerUtterances",
                    "event end " + event.endSeconds() + " must be after start " + event.startSeconds());
            }
        }

        List<AssignedUtterance> assigned = new ArrayList<>();
        for (SegmentCandidate segment : selectedSegments) {
            for (VocalEvent event : events) {
                if (segment.startSeconds() <= event.startSeconds()
                        && event.startSeconds() < segment.endSeconds()) {
                    assigned.add(toUtterance(segment.segmentId(), event));
                }
            }
        }
        return assigned;
    }

    private static AssignedUtterance toUtterance(long segmentId, VocalEvent event) {
        double duration = Math.round((event.endSeconds() - event.startSeconds()) * 10_000.0) / 10_000.0;
        double min = event.hasPitch() ? event.minPitch()     : 0.0;
        double max = event.hasPitch() ? event.maxPitch()     : 0.0;
        double avg = event.hasPitch() ? event.averagePitch() : 0.0;
        return new AssignedUtterance(segmentId, event.startSeconds(), event.endSeconds(),
                                     duration, min, max, avg, max - min);
    }
}
