package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.Segment;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface SegmentRepository extends ReactiveCrudRepository<Segment, Long> {

    @Query("""
        SELECT * FROM segment
        WHERE recording_id = :recordingId
        ORDER BY child_vocalization_count DESC, id ASC
        """)
    Flux<Segment> findRankedByRecordingId(Long recordingId);

    @Query("""
        SELECT * FROM segment
        WHERE recording_id = :recordingId
          AND is_selected = TRUE
        ORDER BY start_time_in_seconds
        """)
    Flux<Segment> findSelectedByRecordingId(Long recordingId);

    /**
     * Marks one segment selected. Zero rows when it was already selected.
     */
    @Modifying
    @Query("""
        UPDATE segment
        SET is_selected = TRUE,
            selection_criterion = :criterion,
            modified_on = :modifiedOn
        WHERE id = :id
          AND is_selected = FALSE
        """)
    Mono<Integer> markSelected(Long id, String criterion, LocalDateTime modifiedOn);
}
