package org.operaton.activslot.model.domain;

/**
 * Coarse time-of-day bucket used for adherence statistics.
 */
public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING;

    public static TimeOfDay fromHour(int hour) {
        if (hour < 12) {
            return MORNING;
        }
        if (hour < 17) {
            return AFTERNOON;
        }
        return EVENING;
    }
}
