package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.Utterance;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface UtteranceRepository extends ReactiveCrudRepository<Utterance, Long> {

    @Query("""
        SELECT COUNT(*) FROM utterance u
        JOIN segment s ON u.segment_id = s.id
        WHERE s.recording_id = :recordingId
        """)
    Mono<Long> countByRecordingId(Long recordingId);

    /**
     * Utterance → Segment → Recording → CodingBatch.
     */
    @Query("""
        SELECT u.id FROM utterance u
        JOIN segment s       ON u.segment_id = s.id
        JOIN coding_batch cb ON cb.recording_id = s.recording_id
        WHERE cb.batch_group = :batchGroup
        ORDER BY u.id
        """)
    Flux<Long> findIdsByBatchGroup(Integer batchGroup);
}
