package com.vmcplatform.sampling.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.SelectionCriterion;
import com.vmcplatform.common.selection.SegmentSelector;
import com.vmcplatform.common.selection.SelectionPlan;
import com.vmcplatform.sampling.model.Segment;
import com.vmcplatform.sampling.repository.RecordingRepository;
import com.vmcplatform.sampling.repository.SegmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Runs the two-tier selection policy over a recording and persists the chosen segments.
 *
 * <p>The whole call is one transaction holding a row lock on the recording, so selection
 * happens at most once per recording even under concurrent calls.
 */
@Service
public class SegmentSelectionService {

    private static final Logger log = LoggerFactory.getLogger(SegmentSelectionService.class);

    private final SegmentRepository segmentRepository;
    private final RecordingRepository recordingRepository;
    private final ExclusionService exclusionService;
    private final SegmentSelector selector;
    private final Clock clock;

    @Value("${vmc.selection.high-volubility-count:10}")
    private int defaultHighVolubilityCount = 10;

    @Value("${vmc.selection.random-count:20}")
    private int defaultRandomCount = 20;

    public SegmentSelectionService(SegmentRepository segmentRepository,
                                   RecordingRepository recordingRepository,
                                   ExclusionService exclusionService,
                                   SegmentSelector selector,
                                   Clock clock) {
        this.segmentRepository   = segmentRepository;
        this.recordingRepository = recordingRepository;
        this.exclusionService    = exclusionService;
        this.selector            = selector;
        this.clock               = clock;
    }

    @Transactional
    public Mono<Boolean> select(long recordingId) {
        return select(recordingId, defaultHighVolubilityCount, defaultRandomCount);
    }

    public int defaultHighVolubilityCount() {
        return defaultHighVolubilityCount;
    }

    public int defaultRandomCount() {
        return defaultRandomCount;
    }

    /**
     * @return {@code true} when the recording ends up selected (now or earlier),
     *         {@code false} when it has too few eligible segments or does not exist
     */
    @Transactional
    public Mono<Boolean> select(long recordingId, int highVolubilityCount, int randomCount) {
        if (highVolubilityCount < 0 || randomCount < 0) {
            return Mono.error(new InputGuardException("selectSegments",
                "counts must be non-negative. highVolubility=" + highVolubilityCount + " random=" + randomCount));
        }

        return recordingRepository.lockById(recordingId)
            .flatMap(recording -> Mono.zip(
                segmentRepository.findRankedByRecordingId(recordingId).map(Segment::toCandidate).collectList(),
                exclusionService.windowsFor(recordingId)))
            .map(t -> selector.plan(t.getT1(), t.getT2(), highVolubilityCount, randomCount))
            .flatMap(plan -> persist(recordingId, plan))
            .defaultIfEmpty(Boolean.FALSE)
            .doOnError(e -> log.error("Segment selection failed. recordingId={}", recordingId, e));
    }

    private Mono<Boolean> persist(long recordingId, SelectionPlan plan) {
        switch (plan.outcome()) {
            case ALREADY_SELECTED -> {
                log.info("Recording already selected. recordingId={}", recordingId);
                return Mono.just(Boolean.TRUE);
            }
            case INSUFFICIENT_CANDIDATES -> {
                log.warn("Not enough eligible segments. recordingId={} candidates={}",
                         recordingId, plan.candidateCount());
                return Mono.just(Boolean.FALSE);
            }
            default -> {
                LocalDateTime now = LocalDateTime.now(clock);
                Map<Long, SelectionCriterion> assignments = plan.assignments();
                return Flux.fromIterable(assignments.entrySet())
                    .concatMap(e -> segmentRepository.markSelected(e.getKey(), e.getValue().name(), now))
                    .reduce(0, Integer::sum)
                    .map(updated -> {
                        log.info("Segments selected. recordingId={} highVolubility={} random={} updated={}",
                                 recordingId, plan.highVolubility().size(), plan.randomSample().size(), updated);
                        return Boolean.TRUE;
                    });
            }
        }
    }
}
