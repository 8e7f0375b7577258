package org.operaton.activslot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.model.domain.PreferredTime;
import org.operaton.activslot.model.domain.TrustLevel;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.Set;

/**
 * Loads and saves the user's preferences.
 * Saving invalidates plan generations that are still running with the old values.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PreferencesService {

    private static final Set<Integer> WORKOUT_DURATIONS = Set.of(30, 45, 60, 90);
    private static final Set<Integer> GYM_FREQUENCIES = Set.of(0, 3, 4, 5);

    private final KeyValueStore store;
    private final PlanGenerationGuard generationGuard;

    @Value("${activslot.defaults.wake-time:07:00}")
    private String defaultWakeTime = "07:00";

    @Value("${activslot.defaults.sleep-time:23:00}")
    private String defaultSleepTime = "23:00";

    @Value("${activslot.defaults.daily-step-goal:10000}")
    private int defaultStepGoal = 10000;

    @Value("${activslot.defaults.trust-level:CONFIRM_FIRST}")
    private TrustLevel defaultTrustLevel = TrustLevel.CONFIRM_FIRST;

    @Value("${activslot.defaults.preferred-walk-time:NO_PREFERENCE}")
    private PreferredTime defaultWalkTime = PreferredTime.NO_PREFERENCE;

    /**
     * Stored preferences, or the configured defaults when none are stored.
     */
    public UserPreferences current() {
        return store.get(StoreKeys.PREFERENCES, UserPreferences.class)
            .orElseGet(this::defaults);
    }

    /**
     * Validate and store new preferences.
     *
     * @param preferences the new preferences
     * @return the stored preferences
     * @throws PlanningException if a value is out of range
     */
    public UserPreferences update(UserPreferences preferences) {
        validate(preferences);
        store.put(StoreKeys.PREFERENCES, preferences);
        generationGuard.invalidateInFlight();
        log.info("Preferences updated: goal={} steps, walk time={}, trust={}",
            preferences.getDailyStepGoal(), preferences.getPreferredWalkTime(), preferences.getTrustLevel());
        return preferences;
    }

    UserPreferences defaults() {
        return UserPreferences.builder()
            .wakeTime(LocalTime.parse(defaultWakeTime))
            .sleepTime(LocalTime.parse(defaultSleepTime))
            .dailyStepGoal(defaultStepGoal)
            .trustLevel(defaultTrustLevel)
            .preferredWalkTime(defaultWalkTime)
            .build();
    }

    private void validate(UserPreferences preferences) {
        requireSet(preferences.getWakeTime(), "Wake time");
        requireSet(preferences.getSleepTime(), "Sleep time");
        requireSet(preferences.getBreakfastTime(), "Breakfast time");
        requireSet(preferences.getLunchTime(), "Lunch time");
        requireSet(preferences.getDinnerTime(), "Dinner time");
        requireSet(preferences.getPreferredWalkTime(), "Preferred walk time");
        requireSet(preferences.getPreferredGymTime(), "Preferred gym time");
        requireSet(preferences.getTrustLevel(), "Trust level");
        if (preferences.getDailyStepGoal() <= 0) {
            throw new PlanningException("Daily step goal must be positive");
        }
        if (!WORKOUT_DURATIONS.contains(preferences.getWorkoutDuration())) {
            throw new PlanningException("Workout duration must be one of " + WORKOUT_DURATIONS);
        }
        if (!GYM_FREQUENCIES.contains(preferences.getGymFrequency())) {
            throw new PlanningException("Gym frequency must be one of " + GYM_FREQUENCIES);
        }
        if (preferences.getWalksPerDay() < 1) {
            throw new PlanningException("Autopilot needs at least one walk per day");
        }
        if (preferences.getMinWalkDuration() < 5 || preferences.getMinWalkDuration() > preferences.getMaxWalkDuration()) {
            throw new PlanningException("Walk duration range is invalid: "
                + preferences.getMinWalkDuration() + "-" + preferences.getMaxWalkDuration());
        }
        if (!preferences.getWakeTime().isBefore(preferences.getSleepTime())) {
            log.warn("Wake time {} is not before sleep time {}, plans will be empty",
                preferences.getWakeTime(), preferences.getSleepTime());
        }
    }

    private static void requireSet(Object value, String name) {
        if (value == null) {
            throw new PlanningException(name + " is required");
        }
    }
}
