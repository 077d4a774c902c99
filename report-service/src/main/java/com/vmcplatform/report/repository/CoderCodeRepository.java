package com.vmcplatform.report.repository;

import com.vmcplatform.report.model.CoderCodeRow;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Accepted codings only: {@code is_acceptable} set and the comment is not the legacy marker.
 * Coders missing from the {@code coder} table are reported as {@code coder-<id>}.
 */
@Repository
public interface CoderCodeRepository extends ReactiveCrudRepository<CoderCodeRow, Long> {

    String SELECT_CODES = """
        SELECT c.id                            AS coding_id,
               c.utterance_id                  AS utterance_id,
               COALESCE(cd.first_name || ' ' || cd.last_name,
                        'coder-' || CAST(c.coder_id AS VARCHAR(20))) AS coder,
               c.total_syllable_count          AS total_syllable_count,
               c.canonical_syllable_count      AS canonical_syllable_count,
               c.non_canonical_syllable_count  AS non_canonical_syllable_count,
               c.word_syllable_count           AS word_syllable_count,
               c.word_count                    AS word_count,
               a.utterance_type                AS utterance_type,
               a.description                   AS annotation,
               c.added_on                      AS coded_at
        FROM utterance_coding c
        JOIN utterance_annotation a ON a.id = c.annotation_id
        LEFT JOIN coder cd          ON cd.id = c.coder_id
        """;

    /** Appended after a WHERE clause; starts on its own line with its own AND. */
    String AND_ACCEPTED = """
          AND c.is_acceptable = TRUE
          AND (c.comments IS NULL OR c.comments <> :legacyComment)
        """;

    @Query(SELECT_CODES + """
        JOIN utterance u   ON u.id = c.utterance_id
        JOIN segment s     ON s.id = u.segment_id
        JOIN recording r   ON r.id = s.recording_id
        WHERE r.is_valid = TRUE
        """ + AND_ACCEPTED + """
          AND r.id NOT IN (""" + UtteranceReportRepository.RECORDINGS_IN_PROCESS + """
          )
        ORDER BY c.utterance_id, c.id
        """)
    Flux<CoderCodeRow> findReportCodes(String legacyComment);

    @Query(SELECT_CODES + """
        WHERE c.utterance_id IN (:utteranceIds)
        """ + AND_ACCEPTED + """
        ORDER BY c.utterance_id, c.id
        """)
    Flux<CoderCodeRow> findByUtteranceIds(Collection<Long> utteranceIds, String legacyComment);

    @Query(SELECT_CODES + """
        WHERE c.added_on >= :from
          AND c.added_on <  :to
        """ + AND_ACCEPTED + """
        ORDER BY c.added_on
        """)
    Flux<CoderCodeRow> findCodedBetween(LocalDateTime from, LocalDateTime to, String legacyComment);
}
