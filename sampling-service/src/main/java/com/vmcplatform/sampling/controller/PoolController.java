package com.vmcplatform.sampling.controller;

import com.vmcplatform.sampling.dto.CodingSubmission;
import com.vmcplatform.sampling.dto.PoolStatus;
import com.vmcplatform.sampling.dto.SubmitResponse;
import com.vmcplatform.sampling.dto.WorkItem;
import com.vmcplatform.sampling.service.SamplePoolService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Rater-facing API over the sample pool.
 */
@RestController
@RequestMapping("/api/v1/pool")
public class PoolController {

    private static final Logger log = LoggerFactory.getLogger(PoolController.class);

    private final SamplePoolService poolService;

    @Value("${vmc.pool.coder-count:3}")
    private int defaultCoderCount = 3;

    public PoolController(SamplePoolService poolService) {
        this.poolService = poolService;
    }

    @PostMapping("/{batchGroup}/expand")
    public Mono<ResponseEntity<Map<String, Integer>>> expand(@PathVariable int batchGroup,
                                                             @RequestParam(required = false) Integer coderCount) {
        int coders = coderCount == null ? defaultCoderCount : coderCount;
        log.info("Pool expansion requested. batchGroup={} coderCount={}", batchGroup, coders);
        return poolService.expand(batchGroup, coders)
            .map(created -> ResponseEntity.ok(Map.of("created", created)));
    }

    @PostMapping("/claim")
    public Mono<ResponseEntity<WorkItem>> claim(@RequestParam long coderId) {
        return poolService.claimNext(coderId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @PostMapping("/entries/{id}/submit")
    public Mono<ResponseEntity<SubmitResponse>> submit(@PathVariable long id,
                                                       @RequestBody CodingSubmission submission) {
        log.info("Code submitted. poolEntryId={} coderId={} revision={}",
                 id, submission.coderId(), submission.isRevision());
        return poolService.submit(id, submission)
            .map(accepted -> ResponseEntity
                .status(accepted ? HttpStatus.OK : HttpStatus.CONFLICT)
                .body(new SubmitResponse(id, accepted)));
    }

    @GetMapping("/{batchGroup}/status")
    public Mono<PoolStatus> status(@PathVariable int batchGroup) {
        return poolService.status(batchGroup);
    }

    @GetMapping("/in-process")
    public Flux<Integer> inProcess() {
        return poolService.batchGroupsInProcess();
    }
}
