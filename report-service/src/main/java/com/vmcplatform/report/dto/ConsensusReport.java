package com.vmcplatform.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vmcplatform.common.consensus.ConsensusRecord;

import java.time.Instant;
import java.util.List;

public record ConsensusReport(
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("raterCount")  int raterCount,
    @JsonProperty("records")     List<ConsensusRecord> records
) {}
