package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/pool/entries/{id}/submit.
 *
 * @param codingId   set when revising a code already saved in this session
 * @param annotation annotation description, resolved against reference data
 */
public record CodingSubmission(
    @JsonProperty("coderId")            long coderId,
    @JsonProperty("codingId")           Long codingId,
    @JsonProperty("annotation")         String annotation,
    @JsonProperty("totalSyllables")     int totalSyllables,
    @JsonProperty("canonicalSyllables") int canonicalSyllables,
    @JsonProperty("wordSyllables")      int wordSyllables,
    @JsonProperty("words")              int words,
    @JsonProperty("comments")           String comments
) {
    @JsonIgnore
    public boolean isRevision() {
        return codingId != null;
    }
}
