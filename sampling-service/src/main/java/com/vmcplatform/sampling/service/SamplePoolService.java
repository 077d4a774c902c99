package com.vmcplatform.sampling.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.pool.PoolExpansion;
import com.vmcplatform.sampling.claim.PoolClaimStrategy;
import com.vmcplatform.sampling.dto.CodingSubmission;
import com.vmcplatform.sampling.dto.PoolStatus;
import com.vmcplatform.sampling.dto.WorkItem;
import com.vmcplatform.sampling.model.SamplePoolEntry;
import com.vmcplatform.sampling.model.UtteranceAnnotation;
import com.vmcplatform.sampling.model.UtteranceCoding;
import com.vmcplatform.sampling.repository.SamplePoolEntryRepository;
import com.vmcplatform.sampling.repository.UtteranceAnnotationRepository;
import com.vmcplatform.sampling.repository.UtteranceCodingRepository;
import com.vmcplatform.sampling.repository.UtteranceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;

/**
 * The rater work pool: expansion of a sampling round into rater slots, claiming the next slot,
 * and recording the rater's code against it.
 *
 * <p>All coordination between rater sessions goes through conditional updates on
 * {@code sample_pool_entry}; nothing here holds in-memory state.
 */
@Service
public class SamplePoolService {

    private static final Logger log = LoggerFactory.getLogger(SamplePoolService.class);

    private final SamplePoolEntryRepository poolRepository;
    private final UtteranceRepository utteranceRepository;
    private final UtteranceCodingRepository codingRepository;
    private final UtteranceAnnotationRepository annotationRepository;
    private final PoolClaimStrategy claimStrategy;
    private final Random random;
    private final Clock clock;

    @Value("${vmc.pool.claim-lease:PT1H}")
    private Duration claimLease = Duration.ofHours(1);

    public SamplePoolService(SamplePoolEntryRepository poolRepository,
                             UtteranceRepository utteranceRepository,
                             UtteranceCodingRepository codingRepository,
                             UtteranceAnnotationRepository annotationRepository,
                             PoolClaimStrategy claimStrategy,
                             Random samplingRandom,
                             Clock clock) {
        this.poolRepository       = poolRepository;
        this.utteranceRepository  = utteranceRepository;
        this.codingRepository     = codingRepository;
        this.annotationRepository = annotationRepository;
        this.claimStrategy        = claimStrategy;
        this.random               = samplingRandom;
        this.clock                = clock;
    }

    // ── expand ───────────────────────────────────────────────────────────────

    /**
     * Creates {@code coderCount} unassigned entries per utterance in the batch group, in
     * shuffled order. A group that already has entries is left untouched.
     *
     * @return number of entries created
     */
    @Transactional
    public Mono<Integer> expand(int batchGroup, int coderCount) {
        if (coderCount < 1) {
            return Mono.error(new InputGuardException("expandPool",
                "coderCount must be at least 1 but was " + coderCount));
        }
        return poolRepository.countByBatchGroup(batchGroup)
            .flatMap(existing -> {
                if (existing > 0) {
                    log.info("Pool already expanded. batchGroup={} entries={}", batchGroup, existing);
                    return Mono.just(0);
                }
                return utteranceRepository.findIdsByBatchGroup(batchGroup)
                    .collectList()
                    .flatMap(ids -> insertSlots(batchGroup, PoolExpansion.shuffled(ids, coderCount, random)));
            })
            .doOnSuccess(n -> log.info("Pool expanded. batchGroup={} coderCount={} entries={}",
                                       batchGroup, coderCount, n))
            .doOnError(e -> log.error("Pool expansion failed. batchGroup={}", batchGroup, e));
    }

    private Mono<Integer> insertSlots(int batchGroup, List<Long> slots) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Flux.fromIterable(slots)
            .map(utteranceId -> {
                SamplePoolEntry entry = new SamplePoolEntry();
                entry.setUtteranceId(utteranceId);
                entry.setBatchGroup(batchGroup);
                entry.setIsProcessing(Boolean.FALSE);
                entry.setAddedOn(now);
                entry.setModifiedOn(now);
                return entry;
            })
            .concatMap(poolRepository::save)
            .count()
            .map(Long::intValue);
    }

    // ── claim ────────────────────────────────────────────────────────────────

    /**
     * @return the claimed work item, or empty when nothing is available for this coder
     */
    public Mono<WorkItem> claimNext(long coderId) {
        return claimStrategy.claim(coderId)
            .flatMap(entry -> utteranceRepository.findById(entry.getUtteranceId())
                .map(u -> new WorkItem(entry.getId(), entry.getUtteranceId(),
                                       u.getDurationInSeconds() == null ? 0.0 : u.getDurationInSeconds(),
                                       entry.getBatchGroup())))
            .doOnNext(w -> log.info("Pool entry claimed. coderId={} poolEntryId={} utteranceId={}",
                                    coderId, w.poolEntryId(), w.utteranceId()))
            .doOnError(e -> log.error("Claim failed. coderId={}", coderId, e));
    }

    // ── submit ───────────────────────────────────────────────────────────────

    /**
     * Records a code for a claimed entry, or revises the coder's earlier code for it.
     *
     * @return {@code false} when the entry is no longer claimed by (or assigned to) this coder;
     *         nothing is written in that case
     */
    @Transactional
    public Mono<Boolean> submit(long poolEntryId, CodingSubmission submission) {
        return Mono.fromRunnable(() -> validateCounts(submission))
            .then(Mono.defer(() -> resolveAnnotation(submission.annotation())))
            .flatMap(annotation -> submission.isRevision()
                ? revise(poolEntryId, submission, annotation)
                : record(poolEntryId, submission, annotation))
            .doOnSuccess(accepted -> {
                if (Boolean.TRUE.equals(accepted)) {
                    log.info("Code accepted. poolEntryId={} coderId={} revision={}",
                             poolEntryId, submission.coderId(), submission.isRevision());
                } else {
                    log.warn("Code rejected, entry not held by coder. poolEntryId={} coderId={} revision={}",
                             poolEntryId, submission.coderId(), submission.isRevision());
                }
            })
            .doOnError(e -> log.error("Submit failed. poolEntryId={} coderId={}",
                                      poolEntryId, submission.coderId(), e));
    }

    private Mono<Boolean> record(long poolEntryId, CodingSubmission submission, UtteranceAnnotation annotation) {
        LocalDateTime now = LocalDateTime.now(clock);
        return poolRepository.findById(poolEntryId)
            .flatMap(entry -> poolRepository.completeClaim(poolEntryId, submission.coderId(), now)
                .flatMap(rows -> {
                    if (rows == 0) {
                        return Mono.just(Boolean.FALSE);
                    }
                    UtteranceCoding coding = new UtteranceCoding();
                    coding.setUtteranceId(entry.getUtteranceId());
                    coding.setCoderId(submission.coderId());
                    coding.setIsAcceptable(Boolean.TRUE);
                    coding.setAddedOn(now);
                    applyCode(coding, submission, annotation, now);
                    return codingRepository.save(coding).thenReturn(Boolean.TRUE);
                }))
            .defaultIfEmpty(Boolean.FALSE);
    }

    private Mono<Boolean> revise(long poolEntryId, CodingSubmission submission, UtteranceAnnotation annotation) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Mono.zip(poolRepository.findById(poolEntryId), codingRepository.findById(submission.codingId()))
            .flatMap(t -> {
                SamplePoolEntry entry = t.getT1();
                UtteranceCoding coding = t.getT2();
                boolean held = Long.valueOf(submission.coderId()).equals(entry.getCoderId())
                    && Long.valueOf(submission.coderId()).equals(coding.getCoderId())
                    && entry.getUtteranceId().equals(coding.getUtteranceId());
                if (!held) {
                    return Mono.just(Boolean.FALSE);
                }
                applyCode(coding, submission, annotation, now);
                return codingRepository.save(coding).thenReturn(Boolean.TRUE);
            })
            .defaultIfEmpty(Boolean.FALSE);
    }

    private static void applyCode(UtteranceCoding coding, CodingSubmission s,
                                  UtteranceAnnotation annotation, LocalDateTime now) {
        coding.setAnnotationId(annotation.getId());
        coding.setTotalSyllableCount(s.totalSyllables());
        coding.setCanonicalSyllableCount(s.canonicalSyllables());
        coding.setNonCanonicalSyllableCount(s.totalSyllables() - s.canonicalSyllables());
        coding.setWordSyllableCount(s.wordSyllables());
        coding.setWordCount(s.words());
        coding.setComments(s.comments() == null || s.comments().isBlank() ? null : s.comments());
        coding.setModifiedOn(now);
    }

    private Mono<UtteranceAnnotation> resolveAnnotation(String description) {
        if (description == null || description.isBlank()) {
            return Mono.error(new InputGuardException("submit", "annotation is required"));
        }
        return annotationRepository.findByDescription(description)
            .switchIfEmpty(Mono.error(() ->
                new InputGuardException("submit", "unknown annotation '" + description + "'")));
    }

    static void validateCounts(CodingSubmission s) {
        if (s.totalSyllables() < 0 || s.canonicalSyllables() < 0 || s.wordSyllables() < 0 || s.words() < 0) {
            throw new InputGuardException("submit", "syllable and word counts must be non-negative");
        }
        if (s.canonicalSyllables() > s.totalSyllables()) {
            throw new InputGuardException("submit",
                "canonical syllables " + s.canonicalSyllables() + " exceed total " + s.totalSyllables());
        }
    }

    // ── status ───────────────────────────────────────────────────────────────

    public Mono<PoolStatus> status(int batchGroup) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(claimLease);
        return Mono.zip(
                poolRepository.countByBatchGroup(batchGroup),
                poolRepository.countUnassigned(batchGroup),
                poolRepository.countClaimed(batchGroup),
                poolRepository.countClaimedBefore(batchGroup, cutoff),
                poolRepository.countAssigned(batchGroup))
            .map(t -> new PoolStatus(batchGroup, t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5()));
    }

    public Flux<Integer> batchGroupsInProcess() {
        return poolRepository.findBatchGroupsInProcess();
    }
}
