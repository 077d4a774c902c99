package com.vmcplatform.common.exclusion;

import com.vmcplatform.common.model.TimeWindow;

/**
 * Decides when an exclusion window disqualifies a candidate segment.
 */
public enum OverlapPolicy {

    /** Any shared instant disqualifies. Default. */
    ANY_INTERSECTION {
        @Override
        public boolean disqualifies(TimeWindow candidate, TimeWindow exclusion) {
            return candidate.intersects(exclusion);
        }
    },

    /**
     * Only segments lying completely inside the window are disqualified. Partially
     * overlapping segments stay eligible. Kept for reproducing legacy selections.
     */
    FULL_CONTAINMENT {
        @Override
        public boolean disqualifies(TimeWindow candidate, TimeWindow exclusion) {
            return exclusion.contains(candidate);
        }
    };

    public abstract boolean disqualifies(TimeWindow candidate, TimeWindow exclusion);
}
