package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubmitResponse(
    @JsonProperty("poolEntryId") long poolEntryId,
    @JsonProperty("accepted")    boolean accepted
) {}
