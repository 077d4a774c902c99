package com.vmcplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A run of codes by one coder with no pause longer than the configured maximum.
 * {@code duration} is first-to-last code; a single-code session has zero duration.
 */
public record CodingSession(
    @JsonProperty("coder")     String coder,
    @JsonProperty("startedAt") LocalDateTime startedAt,
    @JsonProperty("duration")  Duration duration,
    @JsonProperty("codeCount") int codeCount
) {}
