package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/recordings/{id}/exclusions.
 *
 * @param category NAP or SCRUB
 * @param windows  lab-entered clock ranges, e.g. {@code "1:30 PM - 3:00 PM, 9:00 PM - 11:45 PM"}
 */
public record ExclusionRequest(
    @JsonProperty("category") String category,
    @JsonProperty("windows")  String windows
) {}
