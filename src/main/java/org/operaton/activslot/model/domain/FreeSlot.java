package org.operaton.activslot.model.domain;

import java.time.LocalDateTime;

/**
 * A gap between busy intervals inside the active window.
 * Meal and preference flags are informational; filtering on them is up to the caller.
 */
public record FreeSlot(
    TimeInterval interval,
    long durationMinutes,
    SlotClass slotClass,
    boolean duringMeal,
    boolean preferredTime
) {

    public LocalDateTime start() {
        return interval.start();
    }

    public LocalDateTime end() {
        return interval.end();
    }

    public int startHour() {
        return interval.start().getHour();
    }
}
