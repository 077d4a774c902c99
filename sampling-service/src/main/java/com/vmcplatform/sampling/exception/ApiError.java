package com.vmcplatform.sampling.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Error body returned by every failing endpoint.
 *
 * @param operation the domain operation that failed, when known
 */
public record ApiError(
    @JsonProperty("errorCode") String errorCode,
    @JsonProperty("operation") String operation,
    @JsonProperty("message")   String message,
    @JsonProperty("timestamp") Instant timestamp
) {}
