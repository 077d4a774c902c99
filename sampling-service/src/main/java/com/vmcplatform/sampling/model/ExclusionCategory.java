package com.vmcplatform.sampling.model;

/**
 * Why a stretch of a recording must never be sampled.
 */
public enum ExclusionCategory {
    /** Child asleep. */
    NAP,
    /** Family asked for the audio to be removed. */
    SCRUB
}
