package com.vmcplatform.common.pool;

import com.vmcplatform.common.exception.InputGuardException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds the rater-slot multiset for a sampling round: each utterance id repeated
 * {@code coderCount} times, globally shuffled so that claim order (lowest pool id first)
 * interleaves utterances and recordings instead of serving one utterance's slots back to back.
 */
public final class PoolExpansion {

    private PoolExpansion() {}

    public static List<Long> shuffled(Collection<Long> utteranceIds, int coderCount, Random random) {
        if (coderCount < 1) {
            throw new InputGuardException("expandPool", "coderCount must be at least 1 but was " + coderCount);
        }
        List<Long> slots = new ArrayList<>(utteranceIds.size() * coderCount);
        for (int i = 0; i < coderCount; i++) {
            slots.addAll(utteranceIds);
        }
        Collections.shuffle(slots, random);
        return slots;
    }
}
