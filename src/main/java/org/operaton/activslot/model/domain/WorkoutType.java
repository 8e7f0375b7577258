package org.operaton.activslot.model.domain;

/**
 * Strength training split. Workouts rotate push, pull, legs.
 */
public enum WorkoutType {
    PUSH,
    PULL,
    LEGS;

    public WorkoutType next() {
        return switch (this) {
            case PUSH -> PULL;
            case PULL -> LEGS;
            case LEGS -> PUSH;
        };
    }
}
