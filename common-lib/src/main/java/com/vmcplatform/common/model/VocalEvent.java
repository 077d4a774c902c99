package com.vmcplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One target-speaker vocal event reported by the audio/ITS provider, in seconds relative to
 * the recording start. Pitch statistics are optional; the provider omits them when no voiced
 * frame was found.
 */
public record VocalEvent(
    @JsonProperty("startSeconds") double startSeconds,
    @JsonProperty("endSeconds")   double endSeconds,
    @JsonProperty("minPitch")     Double minPitch,
    @JsonProperty("maxPitch")     Double maxPitch,
    @JsonProperty("averagePitch") Double averagePitch
) {
    public static VocalEvent of(double startSeconds, double endSeconds) {
        return new VocalEvent(startSeconds, endSeconds, null, null, null);
    }

    public boolean hasPitch() {
        return minPitch != null && maxPitch != null && averagePitch != null;
    }
}
