package com.vmcplatform.common.selection;

/**
 * A vocal event placed inside a selected segment, with derived acoustic features.
 */
public record AssignedUtterance(
    long segmentId,
    double startSeconds,
    double endSeconds,
    double durationSeconds,
    double minimumPitch,
    double maximumPitch,
    double averagePitch,
    double pitchRange
) {}
