package com.vmcplatform.common.model;

/**
 * One rater's accepted code for one utterance, flattened for aggregation.
 *
 * @param utteranceType parent category of the annotation, e.g. "Speech"
 * @param annotation    annotation description, e.g. "Canonical"
 */
public record CoderCode(
    long utteranceId,
    String coder,
    int totalSyllables,
    int canonicalSyllables,
    int nonCanonicalSyllables,
    int wordSyllables,
    int words,
    String utteranceType,
    String annotation
) {}
