package com.vmcplatform.report.repository;

import com.vmcplatform.report.model.UtteranceReportRow;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;

@Repository
public interface UtteranceReportRepository extends ReactiveCrudRepository<UtteranceReportRow, Long> {

    String SELECT_METADATA = """
        SELECT u.id                          AS utterance_id,
               r.assessment_id               AS assessment_id,
               r.recording_date              AS recording_date,
               p.child_id                    AS child_id,
               p.sex                         AS child_sex,
               p.date_of_birth               AS child_date_of_birth,
               r.age_at_recording_in_months  AS age_at_recording_in_months,
               p.genetic_risk                AS child_group,
               s.id                          AS segment_id,
               s.selection_criterion         AS selection_criterion,
               u.start_time_in_seconds       AS start_time_in_seconds,
               u.end_time_in_seconds         AS end_time_in_seconds,
               u.duration_in_seconds         AS duration_in_seconds,
               u.minimum_pitch               AS minimum_pitch,
               u.maximum_pitch               AS maximum_pitch,
               u.average_pitch               AS average_pitch,
               u.pitch_range                 AS pitch_range
        FROM utterance u
        JOIN segment s     ON s.id = u.segment_id
        JOIN recording r   ON r.id = s.recording_id
        JOIN participant p ON p.id = r.participant_id
        """;

    /**
     * Recordings that still have pool work outstanding: any entry not yet assigned, or
     * assigned but still flagged processing.
     */
    String RECORDINGS_IN_PROCESS = """
        SELECT DISTINCT s2.recording_id
        FROM sample_pool_entry pe
        JOIN utterance u2 ON u2.id = pe.utterance_id
        JOIN segment s2   ON s2.id = u2.segment_id
        WHERE pe.coder_id IS NULL OR pe.is_processing = TRUE
        """;

    /**
     * Utterances of valid, fully coded recordings that carry at least one accepted,
     * non-legacy code.
     */
    @Query(SELECT_METADATA + """
        WHERE r.is_valid = TRUE
          AND EXISTS (SELECT 1 FROM utterance_coding c
                      WHERE c.utterance_id = u.id
                        AND c.is_acceptable = TRUE
                        AND (c.comments IS NULL OR c.comments <> :legacyComment))
          AND r.id NOT IN (""" + RECORDINGS_IN_PROCESS + """
          )
        ORDER BY u.id
        """)
    Flux<UtteranceReportRow> findReportUtterances(String legacyComment);

    @Query(SELECT_METADATA + """
        WHERE u.id IN (:utteranceIds)
        ORDER BY u.id
        """)
    Flux<UtteranceReportRow> findByUtteranceIds(Collection<Long> utteranceIds);

    @Query(RECORDINGS_IN_PROCESS)
    Flux<Long> findRecordingsInProcess();
}
