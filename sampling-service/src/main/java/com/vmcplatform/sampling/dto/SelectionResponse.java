package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SelectionResponse(
    @JsonProperty("recordingId") long recordingId,
    @JsonProperty("selected")    boolean selected
) {}
