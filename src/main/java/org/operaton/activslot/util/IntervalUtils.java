package org.operaton.activslot.util;

import org.operaton.activslot.model.domain.TimeInterval;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Interval arithmetic on {@link TimeInterval}. All methods are pure.
 */
public final class IntervalUtils {

    private IntervalUtils() {
    }

    public static boolean overlaps(TimeInterval a, TimeInterval b) {
        return a.overlaps(b);
    }

    /**
     * Minutes from the end of {@code first} to the start of {@code second}.
     * Negative when the intervals overlap.
     */
    public static long gapMinutes(TimeInterval first, TimeInterval second) {
        return Duration.between(first.end(), second.start()).toMinutes();
    }

    /**
     * Shortest distance in minutes between two intervals regardless of order, zero when they overlap or touch.
     */
    public static long distanceMinutes(TimeInterval a, TimeInterval b) {
        if (a.overlaps(b)) {
            return 0;
        }
        long forward = gapMinutes(a, b);
        long backward = gapMinutes(b, a);
        return Math.max(0, Math.max(forward, backward));
    }

    /**
     * Sorts by start and merges overlapping or touching intervals.
     */
    public static List<TimeInterval> merge(List<TimeInterval> intervals) {
        List<TimeInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparing(TimeInterval::start).thenComparing(TimeInterval::end));

        List<TimeInterval> merged = new ArrayList<>();
        for (TimeInterval interval : sorted) {
            if (merged.isEmpty()) {
                merged.add(interval);
                continue;
            }
            TimeInterval last = merged.get(merged.size() - 1);
            if (!interval.start().isAfter(last.end())) {
                LocalDateTime end = interval.end().isAfter(last.end()) ? interval.end() : last.end();
                merged.set(merged.size() - 1, new TimeInterval(last.start(), end));
            } else {
                merged.add(interval);
            }
        }
        return merged;
    }

    /**
     * Part of {@code interval} inside {@code window}, empty when they do not intersect.
     */
    public static Optional<TimeInterval> clamp(TimeInterval interval, TimeInterval window) {
        LocalDateTime start = max(interval.start(), window.start());
        LocalDateTime end = min(interval.end(), window.end());
        if (!start.isBefore(end)) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(start, end));
    }

    public static LocalDateTime max(LocalDateTime a, LocalDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    public static LocalDateTime min(LocalDateTime a, LocalDateTime b) {
        return a.isBefore(b) ? a : b;
    }
}
