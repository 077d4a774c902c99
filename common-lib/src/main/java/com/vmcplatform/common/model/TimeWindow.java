package com.vmcplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open absolute interval {@code [start, end)} on a recording's wall clock.
 *
 * <p>Two windows that merely touch ({@code a.end == b.start}) do not intersect.
 */
public record TimeWindow(
    @JsonProperty("start") LocalDateTime start,
    @JsonProperty("end")   LocalDateTime end
) {
    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("window end " + end + " must be after start " + start);
        }
    }

    public boolean intersects(TimeWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    /** True when {@code other} lies entirely inside this window. */
    public boolean contains(TimeWindow other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
