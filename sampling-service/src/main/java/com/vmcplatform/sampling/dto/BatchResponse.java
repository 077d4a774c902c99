package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BatchResponse(
    @JsonProperty("batchGroup")     int batchGroup,
    @JsonProperty("recordingCount") int recordingCount
) {}
