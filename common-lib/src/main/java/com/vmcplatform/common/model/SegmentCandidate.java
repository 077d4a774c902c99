package com.vmcplatform.common.model;

import java.time.LocalDateTime;

/**
 * Read-only view of a stored segment as seen by the selection policy.
 *
 * @param activity child-vocalization count for the segment; the ranking metric
 */
public record SegmentCandidate(
    long segmentId,
    LocalDateTime start,
    LocalDateTime end,
    double startSeconds,
    double endSeconds,
    int activity,
    boolean selected
) {
    public TimeWindow window() {
        return new TimeWindow(start, end);
    }
}
