package com.vmcplatform.common.exclusion;

import com.vmcplatform.common.model.TimeWindow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Removes candidates whose time range is disqualified by any exclusion window
 * (nap, scrub) under the configured {@link OverlapPolicy}.
 *
 * <p>Stateless and thread-safe. Input order is preserved.
 */
public final class ExclusionFilter {

    private final OverlapPolicy policy;

    public ExclusionFilter(OverlapPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public OverlapPolicy policy() {
        return policy;
    }

    public boolean isExcluded(TimeWindow candidate, List<TimeWindow> exclusions) {
        for (TimeWindow exclusion : exclusions) {
            if (policy.disqualifies(candidate, exclusion)) {
                return true;
            }
        }
        return false;
    }

    public <T> List<T> retain(List<T> candidates, Function<T, TimeWindow> windowOf,
                              List<TimeWindow> exclusions) {
        if (exclusions == null || exclusions.isEmpty()) {
            return new ArrayList<>(candidates);
        }
        List<T> kept = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            if (!isExcluded(windowOf.apply(candidate), exclusions)) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
