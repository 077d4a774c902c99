package com.vmcplatform.common.consensus;

import java.util.List;

/**
 * Reduces the parallel codes that the raters of one utterance gave for one field to a single
 * consensus value. Implementations hold no mutable state and are called from report
 * pipelines concurrently.
 *
 * <p>Shipped: {@link PluralityConsensusStrategy}. Wired as a bean in the report service
 * configuration.
 */
public interface ConsensusEngine {

    /** Number of independent raters every input list must contain. */
    int raterCount();

    /**
     * @param values one value per rater, exactly {@link #raterCount()} of them; may contain nulls
     * @return never {@code null}; no agreement is {@link FieldConsensus#none()}
     */
    <T> FieldConsensus<T> compute(List<T> values);
}
