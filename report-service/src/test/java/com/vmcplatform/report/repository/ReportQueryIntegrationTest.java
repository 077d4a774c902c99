package com.vmcplatform.report.repository;

import com.vmcplatform.common.consensus.ConsensusAggregator;
import com.vmcplatform.common.consensus.ConsensusRecord;
import com.vmcplatform.common.consensus.PluralityConsensusStrategy;
import com.vmcplatform.common.exception.ConsistencyException;
import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.CodingSession;
import com.vmcplatform.report.model.CoderCodeRow;
import com.vmcplatform.report.service.CodingRateService;
import com.vmcplatform.report.service.ConsensusReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the report SQL against embedded H2 with the production schema.
 *
 * <pre>
 *   recording 1 (valid, finished)      utterances 1, 2   3 codes each, plus a legacy code on 2
 *   recording 2 (valid, one entry open) utterance 3       3 codes
 *   recording 3 (invalid)              utterance 4       2 codes
 * </pre>
 */
@DataR2dbcTest
class ReportQueryIntegrationTest {

    @Autowired private DatabaseClient db;
    @Autowired private UtteranceReportRepository utteranceRepository;
    @Autowired private CoderCodeRepository codeRepository;

    private ConsensusReportService reportService;
    private CodingRateService rateService;

    @BeforeEach
    void seed() {
        reportService = new ConsensusReportService(utteranceRepository, codeRepository,
            new ConsensusAggregator(new PluralityConsensusStrategy(3)));
        rateService = new CodingRateService(codeRepository);

        Flux.just("utterance_coding", "sample_pool_entry", "utterance", "coding_batch", "exclusion_duration",
                  "segment", "recording", "participant", "utterance_annotation", "coder")
            .concatMap(table -> db.sql("DELETE FROM " + table).then())
            .blockLast();

        List<String> sql = new ArrayList<>(List.of(
            "INSERT INTO participant (id, child_id, date_of_birth, sex, genetic_risk) "
                + "VALUES (1, 'C17', DATE '2020-11-02', 'F', 'TD')",
            recording(1, true), recording(2, true), recording(3, false),
            segment(1, 1, "HIGH_VOLUBILITY"), segment(2, 2, "RANDOM_SAMPLE"), segment(3, 3, "RANDOM_SAMPLE"),
            utterance(1, 1), utterance(2, 1), utterance(3, 2), utterance(4, 3),
            "INSERT INTO utterance_annotation (id, description, utterance_type) VALUES (1, 'Canonical', 'Speech')",
            "INSERT INTO utterance_annotation (id, description, utterance_type) VALUES (2, 'Non-canonical', 'Speech')",
            "INSERT INTO utterance_annotation (id, description, utterance_type) VALUES (3, 'Laugh', 'Laughing')",
            "INSERT INTO coder (id, first_name, last_name) VALUES (1, 'Ana', 'Ruiz')",
            "INSERT INTO coder (id, first_name, last_name) VALUES (2, 'Ben', 'Okafor')",
            "INSERT INTO coder (id, first_name, last_name) VALUES (3, 'Cleo', 'Marsh')",

            coding(1, 1, 1, 4, 1, null, "09:00"),
            coding(2, 1, 2, 4, 1, null, "09:02"),
            coding(3, 1, 3, 6, 2, null, "09:30"),
            coding(4, 2, 1, 2, 3, null, "09:05"),
            coding(5, 2, 2, 2, 3, null, "09:06"),
            coding(6, 2, 3, 3, 1, null, "09:31"),
            coding(7, 2, 9, 7, 1, "Legacy Code", "09:07"),
            coding(8, 3, 1, 1, 1, null, "10:00"),
            coding(9, 3, 2, 1, 1, null, "10:01"),
            coding(10, 3, 3, 1, 1, null, "10:02"),
            coding(11, 4, 1, 5, 1, null, "11:00"),
            coding(12, 4, 2, 5, 1, null, "11:01")));

        long entryId = 1;
        for (long utteranceId = 1; utteranceId <= 3; utteranceId++) {
            for (long coderId = 1; coderId <= 3; coderId++) {
                boolean open = utteranceId == 3 && coderId == 3;
                sql.add("INSERT INTO sample_pool_entry (id, utterance_id, batch_group, coder_id, is_processing, "
                    + "added_on, modified_on) VALUES (" + entryId++ + ", " + utteranceId + ", 100, "
                    + (open ? "NULL" : String.valueOf(coderId)) + ", FALSE, "
                    + "TIMESTAMP '2022-04-01 08:00:00', TIMESTAMP '2022-04-01 08:00:00')");
            }
        }

        Flux.fromIterable(sql).concatMap(s -> db.sql(s).then()).blockLast();
    }

    private static String recording(long id, boolean valid) {
        return "INSERT INTO recording (id, assessment_id, participant_id, recording_date, age_at_recording_in_months, "
            + "is_valid) VALUES (" + id + ", 'A-0" + id + "', 1, DATE '2022-03-14', 16.3870967, " + valid + ")";
    }

    private static String segment(long id, long recordingId, String criterion) {
        return "INSERT INTO segment (id, recording_id, start_time, end_time, start_time_in_seconds, "
            + "end_time_in_seconds, child_vocalization_count, is_selected, selection_criterion) VALUES ("
            + id + ", " + recordingId + ", TIMESTAMP '2022-03-14 07:00:00', TIMESTAMP '2022-03-14 07:05:00', "
            + "0, 300, 12, TRUE, '" + criterion + "')";
    }

    private static String utterance(long id, long segmentId) {
        return "INSERT INTO utterance (id, segment_id, start_time_in_seconds, end_time_in_seconds, "
            + "duration_in_seconds, minimum_pitch, maximum_pitch, average_pitch, pitch_range) VALUES ("
            + id + ", " + segmentId + ", " + (id * 10) + ", " + (id * 10 + 1.5) + ", 1.49949, 180, 420, 260, 240)";
    }

    private static String coding(long id, long utteranceId, long coderId, int total, long annotationId,
                                 String comments, String clock) {
        return "INSERT INTO utterance_coding (id, utterance_id, coder_id, annotation_id, total_syllable_count, "
            + "canonical_syllable_count, non_canonical_syllable_count, word_syllable_count, word_count, comments, "
            + "is_acceptable, added_on, modified_on) VALUES (" + id + ", " + utteranceId + ", " + coderId + ", "
            + annotationId + ", " + total + ", " + total + ", 0, 0, 0, "
            + (comments == null ? "NULL" : "'" + comments + "'") + ", TRUE, "
            + "TIMESTAMP '2022-04-02 " + clock + ":00', TIMESTAMP '2022-04-02 " + clock + ":00')";
    }

    @Test
    @DisplayName("recording with an unassigned pool entry is reported as in process")
    void recordingsInProcess() {
        assertEquals(List.of(2L), utteranceRepository.findRecordingsInProcess().collectList().block());
    }

    @Test
    @DisplayName("code lookup applies the accepted-code filter and names coders")
    void codeLookupByIds() {
        List<CoderCodeRow> accepted = codeRepository.findByUtteranceIds(List.of(2L), "Legacy Code")
            .collectList().block();
        assertThat(accepted).extracting(CoderCodeRow::getCoder)
            .containsExactly("Ana Ruiz", "Ben Okafor", "Cleo Marsh");
        assertThat(accepted).extracting(CoderCodeRow::getUtteranceType)
            .containsExactly("Laughing", "Laughing", "Speech");

        List<CoderCodeRow> withLegacy = codeRepository.findByUtteranceIds(List.of(2L), "Imported")
            .collectList().block();
        assertEquals(4, withLegacy.size());
        assertEquals("coder-9", withLegacy.get(3).getCoder());
    }

    @Test
    @DisplayName("report code query skips in-process and invalid recordings")
    void reportCodes() {
        assertThat(codeRepository.findReportCodes("Legacy Code").collectList().block())
            .extracting(CoderCodeRow::getUtteranceId)
            .containsExactly(1L, 1L, 1L, 2L, 2L, 2L);
    }

    @Test
    @DisplayName("full report covers only valid, finished recordings and ignores legacy codes")
    void generateReport() {
        List<ConsensusRecord> records = reportService.generateReport().block();

        assertThat(records).extracting(ConsensusRecord::utteranceId).containsExactly(1L, 2L);

        ConsensusRecord first = records.get(0);
        assertEquals("A-01", first.assessmentId());
        assertEquals("C17", first.childId());
        assertEquals("HV", first.selectionCriterion());
        assertEquals(16.39, first.ageAtRecordingInMonths());
        assertEquals(1.499, first.durationInSeconds());
        assertEquals(4, first.totalSyllablesConsensus());
        assertEquals(0.67, first.totalSyllablesAgreement());
        assertEquals("Speech", first.utteranceTypeConsensus());
        assertEquals(1.0, first.utteranceTypeAgreement());
        assertEquals(14.0 / 3, first.totalSyllablesAverage(), 1e-9);

        ConsensusRecord second = records.get(1);
        assertEquals(2, second.totalSyllablesConsensus());
        assertEquals("Laughing", second.utteranceTypeConsensus());
        assertEquals(3.0, second.totalSyllablesAverage());
    }

    @Test
    @DisplayName("explicit ids are aggregated even while their recording is in process")
    void aggregateByIds() {
        List<ConsensusRecord> records = reportService.aggregate(List.of(3L)).block();

        assertEquals(1, records.size());
        assertEquals("RS", records.get(0).selectionCriterion());
        assertEquals(1.0, records.get(0).annotationAgreement());
    }

    @Test
    @DisplayName("an utterance short of raters fails the whole run")
    void shortRaterSet() {
        assertThrows(ConsistencyException.class, () -> reportService.aggregate(List.of(1L, 4L)).block());
    }

    @Test
    @DisplayName("unknown utterance ids are rejected")
    void unknownIds() {
        InputGuardException e = assertThrows(InputGuardException.class,
            () -> reportService.aggregate(List.of(1L, 99L)).block());
        assertTrue(e.getMessage().contains("99"));
    }

    @Test
    @DisplayName("coding rate resolves coder names and splits on long pauses")
    void codingRate() {
        Map<String, List<CodingSession>> sessions = rateService
            .codingRate(LocalDateTime.of(2022, 4, 2, 0, 0), LocalDateTime.of(2022, 4, 2, 10, 30))
            .block();

        assertThat(sessions).containsOnlyKeys("Ana Ruiz", "Ben Okafor", "Cleo Marsh");
        // 09:00, 09:05 | 10:00
        assertEquals(2, sessions.get("Ana Ruiz").size());
        assertEquals(2, sessions.get("Ana Ruiz").get(0).codeCount());
        // 09:30, 09:31 | 10:02
        assertEquals(List.of(2, 1),
            sessions.get("Cleo Marsh").stream().map(CodingSession::codeCount).toList());
    }
}
