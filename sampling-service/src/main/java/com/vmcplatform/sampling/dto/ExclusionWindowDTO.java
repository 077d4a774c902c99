package com.vmcplatform.sampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ExclusionWindowDTO(
    @JsonProperty("id")        Long id,
    @JsonProperty("category")  String category,
    @JsonProperty("startTime") LocalDateTime startTime,
    @JsonProperty("endTime")   LocalDateTime endTime
) {}
