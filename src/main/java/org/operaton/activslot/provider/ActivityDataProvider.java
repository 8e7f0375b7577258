package org.operaton.activslot.provider;

import org.operaton.activslot.model.domain.Workout;

import java.time.LocalDate;
import java.util.List;

/**
 * Access to recorded step counts and workouts.
 */
public interface ActivityDataProvider {

    int fetchSteps(LocalDate date);

    List<Workout> fetchWorkouts(LocalDate date);
}
