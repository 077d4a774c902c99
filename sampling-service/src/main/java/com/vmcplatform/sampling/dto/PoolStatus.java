package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress of one sampling round.
 *
 * @param orphaned claimed entries whose lease has run out; a subset of {@code inProcess}
 */
public record PoolStatus(
    @JsonProperty("batchGroup") int batchGroup,
    @JsonProperty("total")      long total,
    @JsonProperty("remaining")  long remaining,
    @JsonProperty("inProcess")  long inProcess,
    @JsonProperty("orphaned")   long orphaned,
    @JsonProperty("completed")  long completed
) {}
