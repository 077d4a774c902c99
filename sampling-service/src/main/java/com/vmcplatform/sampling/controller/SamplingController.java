package com.vmcplatform.sampling.controller;

import com.vmcplatform.common.model.VocalEvent;
import com.vmcplatform.sampling.dto.BatchRequest;
import com.vmcplatform.sampling.dto.BatchResponse;
import com.vmcplatform.sampling.dto.ExclusionRequest;
import com.vmcplatform.sampling.dto.ExclusionWindowDTO;
import com.vmcplatform.sampling.dto.SelectionRequest;
import com.vmcplatform.sampling.dto.SelectionResponse;
import com.vmcplatform.sampling.service.CodingBatchService;
import com.vmcplatform.sampling.service.ExclusionService;
import com.vmcplatform.sampling.service.SegmentSelectionService;
import com.vmcplatform.sampling.service.UtteranceRegistrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Lab-staff API: batching recordings, exclusion windows, segment selection and
 * utterance registration.
 */
@RestController
@RequestMapping("/api/v1")
public class SamplingController {

    private static final Logger log = LoggerFactory.getLogger(SamplingController.class);

    private final CodingBatchService batchService;
    private final ExclusionService exclusionService;
    private final SegmentSelectionService selectionService;
    private final UtteranceRegistrationService registrationService;

    public SamplingController(CodingBatchService batchService,
                              ExclusionService exclusionService,
                              SegmentSelectionService selectionService,
                              UtteranceRegistrationService registrationService) {
        this.batchService        = batchService;
        this.exclusionService    = exclusionService;
        this.selectionService    = selectionService;
        this.registrationService = registrationService;
    }

    @PostMapping("/batches")
    public Mono<ResponseEntity<BatchResponse>> createBatch(@RequestBody BatchRequest request) {
        log.info("Batch requested. recordingIds={}", request.recordingIds());
        int size = request.recordingIds() == null ? 0 : request.recordingIds().size();
        return batchService.createBatch(request.recordingIds())
            .map(group -> ResponseEntity.status(HttpStatus.CREATED).body(new BatchResponse(group, size)))
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    @PostMapping("/recordings/{id}/exclusions")
    public Flux<ExclusionWindowDTO> addExclusions(@PathVariable long id, @RequestBody ExclusionRequest request) {
        log.info("Exclusions submitted. recordingId={} category={}", id, request.category());
        return exclusionService.addExclusions(id, request);
    }

    @GetMapping("/recordings/{id}/exclusions")
    public Flux<ExclusionWindowDTO> exclusions(@PathVariable long id) {
        return exclusionService.findExclusions(id);
    }

    @PostMapping("/recordings/{id}/selection")
    public Mono<ResponseEntity<SelectionResponse>> select(@PathVariable long id,
                                                          @RequestBody(required = false) SelectionRequest request) {
        log.info("Segment selection requested. recordingId={}", id);
        int highVolubility = request == null
            ? selectionService.defaultHighVolubilityCount()
            : orDefault(request.highVolubilityCount(), selectionService.defaultHighVolubilityCount());
        int random = request == null
            ? selectionService.defaultRandomCount()
            : orDefault(request.randomCount(), selectionService.defaultRandomCount());
        return selectionService.select(id, highVolubility, random)
            .map(selected -> ResponseEntity.ok(new SelectionResponse(id, selected)));
    }

    @PostMapping("/recordings/{id}/utterances")
    public Mono<ResponseEntity<Map<String, Integer>>> registerUtterances(@PathVariable long id,
                                                                         @RequestBody List<VocalEvent> events) {
        log.info("Utterance registration requested. recordingId={} events={}", id, events.size());
        return registrationService.registerUtterances(id, events)
            .map(created -> ResponseEntity.ok(Map.of("created", created)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
