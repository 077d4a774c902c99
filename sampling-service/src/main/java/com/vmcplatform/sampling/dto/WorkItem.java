package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a rater receives from a successful claim.
 */
public record WorkItem(
    @JsonProperty("poolEntryId")     long poolEntryId,
    @JsonProperty("utteranceId")     long utteranceId,
    @JsonProperty("durationSeconds") double durationSeconds,
    @JsonProperty("batchGroup")      int batchGroup
) {}
