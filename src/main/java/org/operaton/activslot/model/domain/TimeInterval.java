package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Half-open time range {@code [start, end)} on the local timeline.
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval bounds must not be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Interval start " + start + " must be before end " + end);
        }
    }

    public static TimeInterval ofMinutes(LocalDateTime start, long minutes) {
        return new TimeInterval(start, start.plusMinutes(minutes));
    }

    @JsonIgnore
    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(TimeInterval other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
