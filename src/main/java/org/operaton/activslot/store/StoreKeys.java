package org.operaton.activslot.store;

import java.time.LocalDate;

/**
 * Keys used in the {@link KeyValueStore}.
 */
public final class StoreKeys {

    public static final String PREFERENCES = "preferences";
    public static final String PATTERNS = "patterns";
    public static final String ADHERENCE = "adherence";
    public static final String STREAK = "streak";
    public static final String WORKOUT_PROGRESS = "workout.progress";
    public static final String AUTOPILOT_WALKS = "autopilot.walks";
    public static final String AUTOPILOT_LAST_SCHEDULED_DATE = "autopilot.lastScheduledDate";

    public static final String PLAN_PREFIX = "plan:";
    public static final String SCHEDULED_ACTIVITIES_PREFIX = "scheduled:";
    public static final String CALENDAR_EVENTS_PREFIX = "calendar.events:";
    public static final String DAILY_STEPS_PREFIX = "activity.steps:";
    public static final String DAILY_WORKOUTS_PREFIX = "activity.workouts:";

    private StoreKeys() {
    }

    public static String plan(LocalDate date) {
        return PLAN_PREFIX + date;
    }

    public static String scheduledActivities(LocalDate date) {
        return SCHEDULED_ACTIVITIES_PREFIX + date;
    }

    public static String calendarEvents(LocalDate date) {
        return CALENDAR_EVENTS_PREFIX + date;
    }

    public static String dailySteps(LocalDate date) {
        return DAILY_STEPS_PREFIX + date;
    }

    public static String dailyWorkouts(LocalDate date) {
        return DAILY_WORKOUTS_PREFIX + date;
    }
}
