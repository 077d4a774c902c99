package com.vmcplatform.common.consensus;

import com.vmcplatform.common.exception.ConsistencyException;
import com.vmcplatform.common.model.CoderCode;
import com.vmcplatform.common.model.UtteranceMetadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns the full rater set of each utterance into one {@link ConsensusRecord}.
 *
 * <p>The precondition is checked over the whole input before any record is built: every
 * utterance must carry exactly {@link ConsensusEngine#raterCount()} codes and every code must
 * belong to a listed utterance. Any violation fails the run with {@link ConsistencyException};
 * partial rater sets are never aggregated.
 *
 * <p>Numeric fields additionally get an average over the codes whose utterance type equals the
 * reference category ("Speech" by default). That average ignores the consensus outcome.
 *
 * <p>Stateless and thread-safe. Never mutates its inputs.
 */
public class ConsensusAggregator {

    public static final String DEFAULT_REFERENCE_CATEGORY = "Speech";

    private static final int MAX_REPORTED_IDS = 10;

    private final ConsensusEngine engine;
    private final String referenceCategory;

    public ConsensusAggregator(ConsensusEngine engine) {
        this(engine, DEFAULT_REFERENCE_CATEGORY);
    }

    public ConsensusAggregator(ConsensusEngine engine, String referenceCategory) {
        this.engine            = Objects.requireNonNull(engine, "engine");
        this.referenceCategory = Objects.requireNonNull(referenceCategory, "referenceCategory");
    }

    public List<ConsensusRecord> aggregate(List<UtteranceMetadata> utterances, List<CoderCode> codes) {
        Map<Long, List<CoderCode>> codesByUtterance = groupAndVerify(utterances, codes);

        List<UtteranceMetadata> ordered = new ArrayList<>(utterances);
        ordered.sort(Comparator.comparingLong(UtteranceMetadata::utteranceId));

        List<ConsensusRecord> records = new ArrayList<>(ordered.size());
        for (UtteranceMetadata utterance : ordered) {
            List<CoderCode> rows = codesByUtterance.get(utterance.utteranceId());

            Map<CodedField, FieldConsensus<Object>> fields = new EnumMap<>(CodedField.class);
            Map<CodedField, Double> averages = new EnumMap<>(CodedField.class);
            for (CodedField field : CodedField.values()) {
                fields.put(field, consensus(rows, field));
                if (field.numeric()) {
                    averages.put(field, scopedAverage(rows, field));
                }
            }
            records.add(ConsensusRecord.of(utterance, fields, averages));
        }
        return records;
    }

    public FieldConsensus<Object> consensus(List<CoderCode> rows, CodedField field) {
        List<Object> values = new ArrayList<>(rows.size());
        for (CoderCode row : rows) {
            values.add(field.valueOf(row));
        }
        return engine.compute(values);
    }

    /**
     * Mean of {@code field} over rows whose utterance type is the reference category;
     * {@code null} when no row qualifies.
     */
    public Double scopedAverage(List<CoderCode> rows, CodedField field) {
        if (!field.numeric()) {
            throw new IllegalArgumentException(field + " has no numeric average");
        }
        double sum = 0.0;
        int count = 0;
        for (CoderCode row : rows) {
            if (referenceCategory.equals(row.utteranceType())) {
                sum += ((Number) field.valueOf(row)).doubleValue();
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    // ── precondition ────────────────────────────────────────────────────────

    private Map<Long, List<CoderCode>> groupAndVerify(List<UtteranceMetadata> utterances,
                                                      List<CoderCode> codes) {
        Map<Long, List<CoderCode>> byUtterance = new HashMap<>();
        for (UtteranceMetadata u : utterances) {
            if (byUtterance.put(u.utteranceId(), new ArrayList<>()) != null) {
                throw new ConsistencyException("aggregate", "utterance " + u.utteranceId() + " listed twice");
            }
        }

        Set<Long> orphaned = new LinkedHashSet<>();
        for (CoderCode code : codes) {
            List<CoderCode> bucket = byUtterance.get(code.utteranceId());
            if (bucket == null) {
                orphaned.add(code.utteranceId());
            } else {
                bucket.add(code);
            }
        }
        if (!orphaned.isEmpty()) {
            throw new ConsistencyException("aggregate",
                "codes reference unlisted utterances " + sample(orphaned));
        }

        Set<Long> wrongCount = new LinkedHashSet<>();
        byUtterance.forEach((id, rows) -> {
            if (rows.size() != engine.raterCount()) {
                wrongCount.add(id);
            }
        });
        if (!wrongCount.isEmpty()) {
            throw new ConsistencyException("aggregate",
                wrongCount.size() + " utterance(s) without exactly " + engine.raterCount()
                    + " codes, e.g. " + sample(wrongCount));
        }
        return byUtterance;
    }

    private static List<Long> sample(Set<Long> ids) {
        return ids.stream().sorted().limit(MAX_REPORTED_IDS).toList();
    }
}
