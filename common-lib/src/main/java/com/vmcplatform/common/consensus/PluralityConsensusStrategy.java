package com.vmcplatform.common.consensus;

import com.vmcplatform.common.exception.ConsistencyException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Majority vote over a fixed rater count.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Group equal values and find the largest group, size {@code g}.</li>
 *   <li>{@code g > N/2} → consensus is that value, agreement {@code round(g / N, 2)}.</li>
 *   <li>Otherwise no consensus, agreement 0.0.</li>
 * </ol>
 *
 * <p>For three raters this yields exactly:
 * <pre>
 *   [5,5,5] → 5,    1.0
 *   [2,2,3] → 2,    0.67
 *   [1,2,3] → none, 0.0
 * </pre>
 *
 * <p>A list whose size differs from the rater count is a data inconsistency, not a vote.
 */
public class PluralityConsensusStrategy implements ConsensusEngine {

    private final int raterCount;

    public PluralityConsensusStrategy(int raterCount) {
        if (raterCount < 1) {
            throw new IllegalArgumentException("raterCount must be at least 1 but was " + raterCount);
        }
        this.raterCount = raterCount;
    }

    @Override
    public int raterCount() {
        return raterCount;
    }

    @Override
    public <T> FieldConsensus<T> compute(List<T> values) {
        if (values.size() != raterCount) {
            throw new ConsistencyException("consensus",
                "expected " + raterCount + " codes but got " + values.size());
        }

        // Insertion order keeps the result deterministic for equal group sizes
        Map<T, Integer> votes = new LinkedHashMap<>();
        for (T value : values) {
            votes.merge(value, 1, Integer::sum);
        }

        T leader = null;
        int leaderVotes = 0;
        for (Map.Entry<T, Integer> entry : votes.entrySet()) {
            if (entry.getValue() > leaderVotes) {
                leader      = entry.getKey();
                leaderVotes = entry.getValue();
            }
        }

        if (leaderVotes * 2 <= raterCount) {
            return FieldConsensus.none();
        }
        double agreement = Math.round(leaderVotes * 100.0 / raterCount) / 100.0;
        return new FieldConsensus<>(leader, agreement);
    }
}
