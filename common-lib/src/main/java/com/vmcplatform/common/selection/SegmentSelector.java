package com.vmcplatform.common.selection;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.exclusion.ExclusionFilter;
import com.vmcplatform.common.model.SegmentCandidate;
import com.vmcplatform.common.model.TimeWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Two-tier segment selection policy for one recording.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>If any segment of the recording is already selected → {@code ALREADY_SELECTED}
 *       (selection happens at most once per recording).</li>
 *   <li>Rank segments by activity descending, ties by segment id ascending.</li>
 *   <li>Drop segments disqualified by an exclusion window.</li>
 *   <li>Fewer than {@code highVolubilityCount + randomCount} left → {@code INSUFFICIENT_CANDIDATES},
 *       nothing is selected.</li>
 *   <li>The first {@code highVolubilityCount} ranked candidates are high-volubility; the random
 *       tier is a uniform draw without replacement from the rest.</li>
 * </ol>
 *
 * <p>Pure: persistence is the caller's job. The {@link Random} is injected so tests can pin the draw.
 */
public class SegmentSelector {

    static final Comparator<SegmentCandidate> RANKING =
        Comparator.comparingInt(SegmentCandidate::activity).reversed()
                  .thenComparingLong(SegmentCandidate::segmentId);

    private final ExclusionFilter exclusionFilter;
    private final Random random;

    public SegmentSelector(ExclusionFilter exclusionFilter, Random random) {
        this.exclusionFilter = Objects.requireNonNull(exclusionFilter, "exclusionFilter");
        this.random          = Objects.requireNonNull(random, "random");
    }

    public SelectionPlan plan(List<SegmentCandidate> segments, List<TimeWindow> exclusions,
                              int highVolubilityCount, int randomCount) {
        if (highVolubilityCount < 0 || randomCount < 0) {
            throw new InputGuardException("selectSegments",
                "counts must be non-negative. highVolubility=" + highVolubilityCount + " random=" + randomCount);
        }

        if (segments.stream().anyMatch(SegmentCandidate::selected)) {
            return SelectionPlan.alreadySelected(segments.size());
        }

        List<SegmentCandidate> ranked = new ArrayList<>(segments);
        ranked.sort(RANKING);
        List<SegmentCandidate> candidates =
            exclusionFilter.retain(ranked, SegmentCandidate::window, exclusions);

        if (candidates.size() < highVolubilityCount + randomCount) {
            return SelectionPlan.insufficient(candidates.size());
        }

        List<SegmentCandidate> top = List.copyOf(candidates.subList(0, highVolubilityCount));

        List<SegmentCandidate> remainder = new ArrayList<>(candidates.subList(highVolubilityCount, candidates.size()));
        Collections.shuffle(remainder, random);
        List<SegmentCandidate> drawn = List.copyOf(remainder.subList(0, randomCount));

        return new SelectionPlan(SelectionPlan.Outcome.SELECTED, top, drawn, candidates.size());
    }
}
