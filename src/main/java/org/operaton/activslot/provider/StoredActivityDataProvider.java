package org.operaton.activslot.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.Workout;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Step totals and workouts reported through the REST API and kept in the key-value store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoredActivityDataProvider implements ActivityDataProvider {

    private static final TypeReference<List<Workout>> WORKOUT_LIST = new TypeReference<>() {
    };

    private final KeyValueStore store;

    @Override
    public int fetchSteps(LocalDate date) {
        return store.get(StoreKeys.dailySteps(date), Integer.class).orElse(0);
    }

    @Override
    public List<Workout> fetchWorkouts(LocalDate date) {
        return store.get(StoreKeys.dailyWorkouts(date), WORKOUT_LIST).orElseGet(List::of);
    }

    public void recordSteps(LocalDate date, int steps) {
        if (steps < 0) {
            throw new IllegalArgumentException("Step count must not be negative");
        }
        store.put(StoreKeys.dailySteps(date), steps);
        log.debug("Recorded {} steps for {}", steps, date);
    }

    public synchronized void recordWorkout(LocalDate date, Workout workout) {
        List<Workout> workouts = new ArrayList<>(fetchWorkouts(date));
        workouts.add(workout);
        store.put(StoreKeys.dailyWorkouts(date), workouts);
        log.debug("Recorded {} workout for {}", workout.getActivityType(), date);
    }
}
