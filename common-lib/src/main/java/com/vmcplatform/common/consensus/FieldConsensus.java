package com.vmcplatform.common.consensus;

/**
 * Consensus over one field of one utterance.
 *
 * @param consensus value held by a strict majority of raters, or {@code null} when there is none
 * @param agreement fraction of raters holding the consensus value, two decimals; 0.0 without consensus
 */
public record FieldConsensus<T>(T consensus, double agreement) {

    public static <T> FieldConsensus<T> none() {
        return new FieldConsensus<>(null, 0.0);
    }

    public boolean hasConsensus() {
        return agreement > 0.0;
    }
}
