package com.vmcplatform.common.model;

import java.time.LocalDate;

/**
 * Recording, participant, segment and acoustic context of one coded utterance.
 */
public record UtteranceMetadata(
    long utteranceId,
    String assessmentId,
    LocalDate recordingDate,
    String childId,
    String childSex,
    LocalDate childDateOfBirth,
    double ageAtRecordingInMonths,
    String childGroup,
    long segmentId,
    String selectionCriterion,
    double startTimeInSeconds,
    double endTimeInSeconds,
    double durationInSeconds,
    double minimumPitch,
    double maximumPitch,
    double averagePitch,
    double pitchRange
) {}
