package com.vmcplatform.common.selection;

import com.vmcplatform.common.model.SegmentCandidate;
import com.vmcplatform.common.model.SelectionCriterion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running the two-tier selection policy over one recording.
 *
 * <p>Only {@link Outcome#SELECTED} carries segments to persist. {@code ALREADY_SELECTED} is a
 * successful no-op; {@code INSUFFICIENT_CANDIDATES} is a failure with nothing selected.
 */
public record SelectionPlan(
    Outcome outcome,
    List<SegmentCandidate> highVolubility,
    List<SegmentCandidate> randomSample,
    int candidateCount
) {
    public enum Outcome {
        SELECTED,
        ALREADY_SELECTED,
        INSUFFICIENT_CANDIDATES
    }

    static SelectionPlan alreadySelected(int candidateCount) {
        return new SelectionPlan(Outcome.ALREADY_SELECTED, List.of(), List.of(), candidateCount);
    }

    static SelectionPlan insufficient(int candidateCount) {
        return new SelectionPlan(Outcome.INSUFFICIENT_CANDIDATES, List.of(), List.of(), candidateCount);
    }

    public boolean successful() {
        return outcome != Outcome.INSUFFICIENT_CANDIDATES;
    }

    public boolean hasWork() {
        return outcome == Outcome.SELECTED;
    }

    /** segmentId → criterion, high-volubility first in ranking order, then the random draw. */
    public Map<Long, SelectionCriterion> assignments() {
        Map<Long, SelectionCriterion> result = new LinkedHashMap<>();
        highVolubility.forEach(s -> result.put(s.segmentId(), SelectionCriterion.HIGH_VOLUBILITY));
        randomSample.forEach(s -> result.put(s.segmentId(), SelectionCriterion.RANDOM_SAMPLE));
        return result;
    }
}
