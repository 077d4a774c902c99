package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.SamplePoolEntry;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Claim-state transitions are conditional updates: each returns the affected row count and
 * a zero means the entry was no longer in the expected state.
 */
@Repository
public interface SamplePoolEntryRepository extends ReactiveCrudRepository<SamplePoolEntry, Long> {

    // ── claim ───────────────────────────────────────────────────────────────

    /**
     * Lowest-id unassigned entries whose utterance the coder has neither coded, been assigned,
     * nor currently holds a claim on.
     */
    @Query("""
        SELECT p.id FROM sample_pool_entry p
        WHERE p.is_processing = FALSE
          AND p.coder_id IS NULL
          AND NOT EXISTS (
              SELECT 1 FROM utterance_coding c
              WHERE c.utterance_id = p.utterance_id AND c.coder_id = :coderId)
          AND NOT EXISTS (
              SELECT 1 FROM sample_pool_entry o
              WHERE o.utterance_id = p.utterance_id
                AND (o.coder_id = :coderId OR (o.is_processing = TRUE AND o.claimed_by = :coderId)))
        ORDER BY p.id
        LIMIT :limit
        """)
    Flux<Long> findClaimCandidateIds(Long coderId, int limit);

    /**
     * Compare-and-swap from unassigned to claimed. The self-exclusion is re-checked so a
     * candidate read earlier cannot hand the coder an utterance they picked up since.
     */
    @Modifying
    @Query("""
        UPDATE sample_pool_entry
        SET is_processing = TRUE,
            claimed_by = :coderId,
            claimed_at = :now,
            modified_on = :now
        WHERE id = :id
          AND is_processing = FALSE
          AND coder_id IS NULL
          AND NOT EXISTS (
              SELECT 1 FROM utterance_coding c
              WHERE c.utterance_id = sample_pool_entry.utterance_id AND c.coder_id = :coderId)
          AND NOT EXISTS (
              SELECT 1 FROM sample_pool_entry o
              WHERE o.utterance_id = sample_pool_entry.utterance_id
                AND o.id <> sample_pool_entry.id
                AND (o.coder_id = :coderId OR (o.is_processing = TRUE AND o.claimed_by = :coderId)))
        """)
    Mono<Integer> tryClaim(Long id, Long coderId, LocalDateTime now);

    // ── submit ──────────────────────────────────────────────────────────────

    /**
     * Claimed by this coder → assigned to this coder.
     */
    @Modifying
    @Query("""
        UPDATE sample_pool_entry
        SET coder_id = :coderId,
            is_processing = FALSE,
            modified_on = :now
        WHERE id = :id
          AND is_processing = TRUE
          AND coder_id IS NULL
          AND claimed_by = :coderId
        """)
    Mono<Integer> completeClaim(Long id, Long coderId, LocalDateTime now);

    // ── lease ───────────────────────────────────────────────────────────────

    @Modifying
    @Query("""
        UPDATE sample_pool_entry
        SET is_processing = FALSE,
            claimed_by = NULL,
            claimed_at = NULL,
            modified_on = :now
        WHERE is_processing = TRUE
          AND coder_id IS NULL
          AND claimed_at < :cutoff
        """)
    Mono<Integer> releaseClaimsOlderThan(LocalDateTime cutoff, LocalDateTime now);

    // ── status ──────────────────────────────────────────────────────────────

    Mono<Long> countByBatchGroup(Integer batchGroup);

    @Query("""
        SELECT COUNT(*) FROM sample_pool_entry
        WHERE batch_group = :batchGroup AND coder_id IS NULL AND is_processing = FALSE
        """)
    Mono<Long> countUnassigned(Integer batchGroup);

    @Query("""
        SELECT COUNT(*) FROM sample_pool_entry
        WHERE batch_group = :batchGroup AND coder_id IS NULL AND is_processing = TRUE
        """)
    Mono<Long> countClaimed(Integer batchGroup);

    @Query("""
        SELECT COUNT(*) FROM sample_pool_entry
        WHERE batch_group = :batchGroup AND coder_id IS NULL AND is_processing = TRUE
          AND claimed_at < :cutoff
        """)
    Mono<Long> countClaimedBefore(Integer batchGroup, LocalDateTime cutoff);

    @Query("""
        SELECT COUNT(*) FROM sample_pool_entry
        WHERE batch_group = :batchGroup AND coder_id IS NOT NULL
        """)
    Mono<Long> countAssigned(Integer batchGroup);

    /**
     * Batch groups that still have unassigned or claimed entries.
     */
    @Query("""
        SELECT DISTINCT batch_group FROM sample_pool_entry
        WHERE coder_id IS NULL OR is_processing = TRUE
        ORDER BY batch_group
        """)
    Flux<Integer> findBatchGroupsInProcess();
}
