package com.vmcplatform.report.controller;

import com.vmcplatform.common.consensus.ConsensusEngine;
import com.vmcplatform.common.model.CodingSession;
import com.vmcplatform.report.dto.ConsensusReport;
import com.vmcplatform.report.dto.ConsensusReportRequest;
import com.vmcplatform.report.service.CodingRateService;
import com.vmcplatform.report.service.ConsensusReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    private final ConsensusReportService consensusReportService;
    private final CodingRateService codingRateService;
    private final ConsensusEngine consensusEngine;

    public ReportController(ConsensusReportService consensusReportService,
                            CodingRateService codingRateService,
                            ConsensusEngine consensusEngine) {
        this.consensusReportService = consensusReportService;
        this.codingRateService      = codingRateService;
        this.consensusEngine        = consensusEngine;
    }

    @GetMapping("/consensus")
    public Mono<ResponseEntity<ConsensusReport>> consensusReport() {
        log.info("Consensus report requested");
        return consensusReportService.generateReport()
            .map(records -> ResponseEntity.ok(
                new ConsensusReport(Instant.now(), consensusEngine.raterCount(), records)));
    }

    @PostMapping("/consensus")
    public Mono<ResponseEntity<ConsensusReport>> consensusFor(@RequestBody ConsensusReportRequest request) {
        log.info("Consensus requested for utterances. count={}",
                 request.utteranceIds() == null ? 0 : request.utteranceIds().size());
        return consensusReportService.aggregate(request.utteranceIds())
            .map(records -> ResponseEntity.ok(
                new ConsensusReport(Instant.now(), consensusEngine.raterCount(), records)));
    }

    @GetMapping("/coding-rate")
    public Mono<ResponseEntity<Map<String, List<CodingSession>>>> codingRate(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        log.info("Coding rate requested. from={} to={}", from, to);
        return codingRateService.codingRate(from, to)
            .map(ResponseEntity::ok);
    }

    /** Recordings held back from the full report because pool work is outstanding. */
    @GetMapping("/recordings/in-process")
    public Mono<ResponseEntity<List<Long>>> recordingsInProcess() {
        return consensusReportService.recordingsInProcess()
            .collectList()
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("report-service UP"));
    }
}
