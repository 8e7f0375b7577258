package org.operaton.activslot.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Daily routine and planning preferences of the user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserPreferences {

    /**
     * Minutes around a meal time during which no activity should start.
     */
    public static final int MEAL_BUFFER_MINUTES = 30;

    @Builder.Default
    private LocalTime wakeTime = LocalTime.of(7, 0);

    @Builder.Default
    private LocalTime sleepTime = LocalTime.of(23, 0);

    @Builder.Default
    private LocalTime breakfastTime = LocalTime.of(8, 0);

    @Builder.Default
    private LocalTime lunchTime = LocalTime.of(12, 30);

    @Builder.Default
    private LocalTime dinnerTime = LocalTime.of(19, 0);

    @Builder.Default
    private int dailyStepGoal = 10000;

    @Builder.Default
    private PreferredTime preferredWalkTime = PreferredTime.NO_PREFERENCE;

    @Builder.Default
    private PreferredTime preferredGymTime = PreferredTime.NO_PREFERENCE;

    /**
     * Workout length in minutes: 30, 45, 60 or 90.
     */
    @Builder.Default
    private int workoutDuration = 45;

    /**
     * Gym days per week. Zero disables workout suggestions.
     */
    private int gymFrequency;

    private boolean autopilotEnabled;

    @Builder.Default
    private TrustLevel trustLevel = TrustLevel.CONFIRM_FIRST;

    @Builder.Default
    private int walksPerDay = 3;

    @Builder.Default
    private boolean includeMicroWalks = true;

    @Builder.Default
    private int minWalkDuration = 10;

    @Builder.Default
    private int maxWalkDuration = 30;

    /**
     * Calendar that receives autopilot walks. Blank means no calendar writes.
     */
    private String autopilotCalendarId;

    @JsonIgnore
    public boolean hasWorkoutGoal() {
        return gymFrequency > 0;
    }

    @JsonIgnore
    public List<LocalTime> getMealTimes() {
        return List.of(breakfastTime, lunchTime, dinnerTime);
    }

    /**
     * Whether the given time lies within the meal buffer of breakfast, lunch or dinner.
     */
    public boolean isDuringMeal(LocalTime time) {
        int minutes = time.getHour() * 60 + time.getMinute();
        for (LocalTime meal : getMealTimes()) {
            int mealMinutes = meal.getHour() * 60 + meal.getMinute();
            if (Math.abs(minutes - mealMinutes) < MEAL_BUFFER_MINUTES) {
                return true;
            }
        }
        return false;
    }

    public boolean isDuringMeal(LocalDateTime dateTime) {
        return isDuringMeal(dateTime.toLocalTime());
    }

    /**
     * Active window for a date: one hour after waking until one hour before sleep,
     * never later than {@code hardEndHour}. Empty when wake and sleep times leave no room.
     */
    public Optional<TimeInterval> activeWindow(LocalDate date, int hardEndHour) {
        if (!wakeTime.isBefore(sleepTime)) {
            return Optional.empty();
        }
        LocalDateTime start = date.atTime(wakeTime).plusHours(1);
        LocalDateTime sleepBound = date.atTime(sleepTime).minusHours(1);
        LocalDateTime hardEnd = date.atTime(LocalTime.of(hardEndHour, 0));
        LocalDateTime end = sleepBound.isBefore(hardEnd) ? sleepBound : hardEnd;
        if (!start.isBefore(end)) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(start, end));
    }

    public boolean isWithinBufferedActiveHours(LocalDateTime dateTime, int hardEndHour) {
        return activeWindow(dateTime.toLocalDate(), hardEndHour)
            .map(window -> window.contains(dateTime))
            .orElse(false);
    }

    /**
     * Whether an hour falls into the preferred walking band.
     */
    public boolean isPreferredWalkHour(int hour) {
        return switch (preferredWalkTime) {
            case MORNING -> hour >= 6 && hour < 11;
            case AFTERNOON -> hour >= 11 && hour < 17;
            case EVENING -> hour >= 17 && hour < 21;
            case NO_PREFERENCE -> true;
        };
    }
}
