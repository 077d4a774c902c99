package com.vmcplatform.common.consensus;

import com.vmcplatform.common.exception.ConsistencyException;
import com.vmcplatform.common.model.CoderCode;
import com.vmcplatform.common.model.UtteranceMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusAggregatorTest {

    private final ConsensusAggregator aggregator = new ConsensusAggregator(new PluralityConsensusStrategy(3));

    private static UtteranceMetadata utterance(long id) {
        return new UtteranceMetadata(id, "A-0" + id, LocalDate.of(2022, 3, 14), "C17", "F",
            LocalDate.of(2020, 11, 2), 16.3870967, "TD", 40 + id, "HIGH_VOLUBILITY",
            12.0, 13.5, 1.49949, 180.0, 420.0, 260.0, 240.0);
    }

    private static CoderCode code(long utteranceId, String coder, int total, String type, String annotation) {
        return new CoderCode(utteranceId, coder, total, total, 0, 0, 0, type, annotation);
    }

    @Nested
    @DisplayName("per-utterance record")
    class Records {

        @Test
        @DisplayName("consensus, agreement and Speech-scoped average")
        void speechScopedAverage() {
            List<CoderCode> codes = List.of(
                code(1, "ana",  4,  "Speech",   "Canonical"),
                code(1, "ben",  6,  "Speech",   "Canonical"),
                code(1, "cleo", 10, "Laughing", "Laugh"));

            ConsensusRecord r = aggregator.aggregate(List.of(utterance(1)), codes).get(0);

            assertNull(r.totalSyllablesConsensus());
            assertEquals(0.0, r.totalSyllablesAgreement());
            assertEquals(5.0, r.totalSyllablesAverage());
            assertEquals("Speech", r.utteranceTypeConsensus());
            assertEquals(0.67, r.utteranceTypeAgreement());
            assertEquals("Canonical", r.annotationConsensus());
            assertEquals(0, r.nonCanonicalSyllablesConsensus());
            assertEquals(1.0, r.nonCanonicalSyllablesAgreement());
        }

        @Test
        @DisplayName("no Speech code → null average")
        void noReferenceCategory() {
            List<CoderCode> codes = List.of(
                code(1, "ana",  2, "Crying", "Cry"),
                code(1, "ben",  2, "Crying", "Cry"),
                code(1, "cleo", 2, "Crying", "Cry"));

            ConsensusRecord r = aggregator.aggregate(List.of(utterance(1)), codes).get(0);
            assertEquals(2, r.totalSyllablesConsensus());
            assertNull(r.totalSyllablesAverage());
        }

        @Test
        @DisplayName("metadata is carried with age and duration rounded")
        void metadataRounding() {
            List<CoderCode> codes = List.of(
                code(1, "ana", 1, "Speech", "Canonical"),
                code(1, "ben", 1, "Speech", "Canonical"),
                code(1, "cleo", 1, "Speech", "Canonical"));

            ConsensusRecord r = aggregator.aggregate(List.of(utterance(1)), codes).get(0);
            assertEquals(16.39, r.ageAtRecordingInMonths());
            assertEquals(1.499, r.durationInSeconds());
            assertEquals("A-01", r.assessmentId());
            assertEquals(41L, r.segmentId());
        }

        @Test
        @DisplayName("records are ordered by utterance id")
        void ordering() {
            List<CoderCode> codes = new ArrayList<>();
            for (long id : new long[] {7, 3}) {
                for (String coder : List.of("ana", "ben", "cleo")) {
                    codes.add(code(id, coder, 1, "Speech", "Canonical"));
                }
            }
            List<ConsensusRecord> records = aggregator.aggregate(List.of(utterance(7), utterance(3)), codes);
            assertEquals(List.of(3L, 7L), records.stream().map(ConsensusRecord::utteranceId).toList());
        }

        @Test
        @DisplayName("reference category is configurable")
        void customReferenceCategory() {
            ConsensusAggregator babble = new ConsensusAggregator(new PluralityConsensusStrategy(3), "Babble");
            List<CoderCode> codes = List.of(
                code(1, "ana",  3, "Babble", "Canonical"),
                code(1, "ben",  1, "Speech", "Canonical"),
                code(1, "cleo", 5, "Babble", "Canonical"));
            assertEquals(4.0, babble.aggregate(List.of(utterance(1)), codes).get(0).totalSyllablesAverage());
        }
    }

    @Nested
    @DisplayName("precondition")
    class Precondition {

        @Test
        @DisplayName("two codes for one utterance fails the whole run")
        void tooFewCodes() {
            List<CoderCode> codes = List.of(
                code(1, "ana", 1, "Speech", "Canonical"),
                code(1, "ben", 1, "Speech", "Canonical"),
                code(1, "cleo", 1, "Speech", "Canonical"),
                code(2, "ana", 1, "Speech", "Canonical"),
                code(2, "ben", 1, "Speech", "Canonical"));

            ConsistencyException e = assertThrows(ConsistencyException.class,
                () -> aggregator.aggregate(List.of(utterance(1), utterance(2)), codes));
            assertEquals("aggregate", e.getOperation());
            assertTrue(e.getMessage().contains("[2]"));
        }

        @Test
        @DisplayName("four codes for one utterance fails")
        void tooManyCodes() {
            List<CoderCode> codes = List.of(
                code(1, "ana", 1, "Speech", "Canonical"),
                code(1, "ben", 1, "Speech", "Canonical"),
                code(1, "cleo", 1, "Speech", "Canonical"),
                code(1, "dan", 1, "Speech", "Canonical"));
            assertThrows(ConsistencyException.class, () -> aggregator.aggregate(List.of(utterance(1)), codes));
        }

        @Test
        @DisplayName("codes for an unlisted utterance fail")
        void orphanCodes() {
            List<CoderCode> codes = List.of(code(9, "ana", 1, "Speech", "Canonical"));
            assertThrows(ConsistencyException.class, () -> aggregator.aggregate(List.of(), codes));
        }

        @Test
        @DisplayName("empty input aggregates to nothing")
        void empty() {
            assertTrue(aggregator.aggregate(List.of(), List.of()).isEmpty());
        }
    }

    @Test
    @DisplayName("categorical field has no average")
    void categoricalAverageRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> aggregator.scopedAverage(List.of(), CodedField.ANNOTATION));
    }
}
