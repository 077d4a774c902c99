package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.claim.ConditionalUpdateClaimStrategy;
import com.vmcplatform.sampling.model.SamplePoolEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the claim and lease SQL against embedded H2 with the production schema.
 * Pool: 4 utterances x 3 slots.
 */
@DataR2dbcTest
class PoolClaimIntegrationTest {

    private static final int UTTERANCES = 4;
    private static final int SLOTS = 3;

    @Autowired private DatabaseClient db;
    @Autowired private SamplePoolEntryRepository poolRepository;

    private ConditionalUpdateClaimStrategy strategy;
    private List<Long> utteranceIds;

    @BeforeEach
    void seed() {
        strategy = new ConditionalUpdateClaimStrategy(poolRepository, Clock.systemDefaultZone(), 4);

        Flux.just("utterance_coding", "sample_pool_entry", "utterance", "coding_batch",
                  "exclusion_duration", "segment", "recording", "participant", "utterance_annotation")
            .concatMap(table -> db.sql("DELETE FROM " + table).then())
            .blockLast();

        Flux.just(
                "INSERT INTO participant (id, child_id, sex, genetic_risk) VALUES (1, 'C01', 'F', 'TD')",
                "INSERT INTO recording (id, assessment_id, participant_id, recording_date, is_valid) "
                    + "VALUES (1, 'A-01', 1, DATE '2022-01-10', TRUE)",
                "INSERT INTO segment (id, recording_id, start_time, end_time, start_time_in_seconds, "
                    + "end_time_in_seconds, child_vocalization_count, is_selected, selection_criterion) "
                    + "VALUES (1, 1, TIMESTAMP '2022-01-10 07:00:00', TIMESTAMP '2022-01-10 07:05:00', "
                    + "0, 300, 12, TRUE, 'HIGH_VOLUBILITY')")
            .concatWith(Flux.range(1, UTTERANCES).map(i ->
                "INSERT INTO utterance (id, segment_id, start_time_in_seconds, end_time_in_seconds, duration_in_seconds) "
                    + "VALUES (" + i + ", 1, " + (i * 10) + ", " + (i * 10 + 1) + ", 1.0)"))
            .concatMap(sql -> db.sql(sql).then())
            .blockLast();
        utteranceIds = List.of(1L, 2L, 3L, 4L);

        LocalDateTime now = LocalDateTime.now();
        Flux.range(0, SLOTS)
            .concatMap(round -> Flux.fromIterable(utteranceIds))
            .map(utteranceId -> {
                SamplePoolEntry e = new SamplePoolEntry();
                e.setUtteranceId(utteranceId);
                e.setBatchGroup(100);
                e.setIsProcessing(false);
                e.setAddedOn(now);
                e.setModifiedOn(now);
                return e;
            })
            .concatMap(poolRepository::save)
            .blockLast();
    }

    private List<SamplePoolEntry> drain(long coderId) {
        return Flux.range(0, UTTERANCES + 1)
            .concatMap(i -> strategy.claim(coderId))
            .collectList()
            .block();
    }

    @Test
    @DisplayName("concurrent coders never receive the same entry")
    void concurrentClaimsAreDistinct() {
        List<SamplePoolEntry> claimed = Flux.range(1, 6)
            .flatMap(coder -> strategy.claim(coder).subscribeOn(Schedulers.parallel()))
            .collectList()
            .block();

        assertEquals(6, claimed.size());
        assertThat(claimed).extracting(SamplePoolEntry::getId).doesNotHaveDuplicates();
        assertEquals(6L, poolRepository.countClaimed(100).block());
    }

    @Test
    @DisplayName("a coder holding a claim is not handed the same utterance again")
    void noSelfDuplication() {
        List<SamplePoolEntry> claimed = drain(1L);

        assertEquals(UTTERANCES, claimed.size());
        assertThat(claimed).extracting(SamplePoolEntry::getUtteranceId).doesNotHaveDuplicates();
        assertNull(strategy.claim(1L).block());
    }

    @Test
    @DisplayName("a coder who already coded an utterance is never offered it again")
    void alreadyCodedUtteranceSkipped() {
        Flux.just(
                "INSERT INTO utterance_annotation (id, description, utterance_type) VALUES (1, 'Canonical', 'Speech')",
                "INSERT INTO utterance_coding (utterance_id, coder_id, annotation_id, total_syllable_count, "
                    + "canonical_syllable_count, non_canonical_syllable_count, word_syllable_count, word_count, "
                    + "is_acceptable, added_on, modified_on) VALUES (1, 7, 1, 2, 2, 0, 0, 0, TRUE, "
                    + "TIMESTAMP '2022-01-11 09:00:00', TIMESTAMP '2022-01-11 09:00:00')")
            .concatMap(sql -> db.sql(sql).then())
            .blockLast();

        assertEquals(2L, strategy.claim(7L).block().getUtteranceId());

        List<SamplePoolEntry> rest = drain(7L);
        assertThat(rest).extracting(SamplePoolEntry::getUtteranceId).containsExactlyInAnyOrder(3L, 4L);
        assertNull(strategy.claim(7L).block());
    }

    @Test
    @DisplayName("three coders draining in parallel each get every utterance once")
    void threeCodersDrainPool() {
        Map<Long, List<SamplePoolEntry>> byCoder = Flux.range(1, SLOTS)
            .flatMap(coder -> Mono.fromCallable(() -> Map.entry((long) coder, drain(coder)))
                .subscribeOn(Schedulers.boundedElastic()))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .block();

        Set<Long> allEntries = byCoder.values().stream().flatMap(List::stream)
            .map(SamplePoolEntry::getId).collect(Collectors.toSet());
        assertEquals(UTTERANCES * SLOTS, allEntries.size());
        byCoder.values().forEach(entries ->
            assertThat(entries).extracting(SamplePoolEntry::getUtteranceId)
                .containsExactlyInAnyOrderElementsOf(utteranceIds));
        assertEquals(0L, poolRepository.countUnassigned(100).block());
    }

    @Test
    @DisplayName("only the claiming coder can complete a claim, and only once")
    void completeClaim() {
        SamplePoolEntry entry = strategy.claim(1L).block();
        LocalDateTime now = LocalDateTime.now();

        assertEquals(0, poolRepository.completeClaim(entry.getId(), 2L, now).block());
        assertEquals(1, poolRepository.completeClaim(entry.getId(), 1L, now).block());
        assertEquals(0, poolRepository.completeClaim(entry.getId(), 1L, now).block());

        SamplePoolEntry stored = poolRepository.findById(entry.getId()).block();
        assertEquals(1L, stored.getCoderId());
        assertFalse(stored.getIsProcessing());
        assertEquals(1L, poolRepository.countAssigned(100).block());
    }

    @Test
    @DisplayName("lease release frees stale claims only")
    void leaseRelease() {
        SamplePoolEntry stale = strategy.claim(1L).block();
        SamplePoolEntry fresh = strategy.claim(2L).block();
        db.sql("UPDATE sample_pool_entry SET claimed_at = :at WHERE id = :id")
            .bind("at", LocalDateTime.now().minusHours(2))
            .bind("id", stale.getId())
            .then()
            .block();

        LocalDateTime now = LocalDateTime.now();
        assertEquals(1, poolRepository.releaseClaimsOlderThan(now.minusHours(1), now).block());

        SamplePoolEntry released = poolRepository.findById(stale.getId()).block();
        assertFalse(released.getIsProcessing());
        assertNull(released.getClaimedBy());
        assertTrue(poolRepository.findById(fresh.getId()).block().getIsProcessing());
        // a late submit for the released claim is a conflict
        assertEquals(0, poolRepository.completeClaim(stale.getId(), 1L, now).block());
    }

    @Test
    @DisplayName("batch groups with open entries are reported in process")
    void inProcess() {
        assertEquals(List.of(100), poolRepository.findBatchGroupsInProcess().collectList().block());
    }
}
