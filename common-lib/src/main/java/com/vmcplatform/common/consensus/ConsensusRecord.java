package com.vmcplatform.common.consensus;

import com.vmcplatform.common.model.UtteranceMetadata;

import java.time.LocalDate;
import java.util.Map;

/**
 * One denormalized report row per coded utterance: recording and participant context,
 * segment and acoustic features, then consensus / agreement (/ Speech-scoped average) for each
 * of the seven coded fields. Absent consensus or average is {@code null}.
 */
public record ConsensusRecord(
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
    double pitchRange,

    Integer totalSyllablesConsensus,
    double  totalSyllablesAgreement,
    Double  totalSyllablesAverage,

    Integer canonicalSyllablesConsensus,
    double  canonicalSyllablesAgreement,
    Double  canonicalSyllablesAverage,

    Integer nonCanonicalSyllablesConsensus,
    double  nonCanonicalSyllablesAgreement,
    Double  nonCanonicalSyllablesAverage,

    Integer wordSyllablesConsensus,
    double  wordSyllablesAgreement,
    Double  wordSyllablesAverage,

    Integer wordsConsensus,
    double  wordsAgreement,
    Double  wordsAverage,

    String  utteranceTypeConsensus,
    double  utteranceTypeAgreement,

    String  annotationConsensus,
    double  annotationAgreement
) {

    static ConsensusRecord of(UtteranceMetadata u,
                              Map<CodedField, FieldConsensus<Object>> fields,
                              Map<CodedField, Double> averages) {
        return new ConsensusRecord(
            u.utteranceId(),
            u.assessmentId(),
            u.recordingDate(),
            u.childId(),
            u.childSex(),
            u.childDateOfBirth(),
            round(u.ageAtRecordingInMonths(), 100.0),
            u.childGroup(),
            u.segmentId(),
            u.selectionCriterion(),
            u.startTimeInSeconds(),
            u.endTimeInSeconds(),
            round(u.durationInSeconds(), 1000.0),
            u.minimumPitch(),
            u.maximumPitch(),
            u.averagePitch(),
            u.pitchRange(),

            (Integer) fields.get(CodedField.TOTAL_SYLLABLES).consensus(),
            fields.get(CodedField.TOTAL_SYLLABLES).agreement(),
            averages.get(CodedField.TOTAL_SYLLABLES),

            (Integer) fields.get(CodedField.CANONICAL_SYLLABLES).consensus(),
            fields.get(CodedField.CANONICAL_SYLLABLES).agreement(),
            averages.get(CodedField.CANONICAL_SYLLABLES),

            (Integer) fields.get(CodedField.NON_CANONICAL_SYLLABLES).consensus(),
            fields.get(CodedField.NON_CANONICAL_SYLLABLES).agreement(),
            averages.get(CodedField.NON_CANONICAL_SYLLABLES),

            (Integer) fields.get(CodedField.WORD_SYLLABLES).consensus(),
            fields.get(CodedField.WORD_SYLLABLES).agreement(),
            averages.get(CodedField.WORD_SYLLABLES),

            (Integer) fields.get(CodedField.WORDS).consensus(),
            fields.get(CodedField.WORDS).agreement(),
            averages.get(CodedField.WORDS),

            (String) fields.get(CodedField.UTTERANCE_TYPE).consensus(),
            fields.get(CodedField.UTTERANCE_TYPE).agreement(),

            (String) fields.get(CodedField.ANNOTATION).consensus(),
            fields.get(CodedField.ANNOTATION).agreement()
        );
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}
