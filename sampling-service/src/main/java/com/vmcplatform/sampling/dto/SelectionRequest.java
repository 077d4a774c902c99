package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/recordings/{id}/selection. Absent counts fall back to
 * the configured defaults.
 */
public record SelectionRequest(
    @JsonProperty("highVolubilityCount") Integer highVolubilityCount,
    @JsonProperty("randomCount")         Integer randomCount
) {}
