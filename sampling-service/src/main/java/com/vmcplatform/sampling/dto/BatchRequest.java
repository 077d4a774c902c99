package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /api/v1/batches.
 */
public record BatchRequest(
    @JsonProperty("recordingIds") List<Long> recordingIds
) {}
