package com.vmcplatform.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ConsensusReportRequest(
    @JsonProperty("utteranceIds") List<Long> utteranceIds
) {}
