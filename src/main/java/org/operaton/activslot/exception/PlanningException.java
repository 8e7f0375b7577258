package org.operaton.activslot.exception;

/**
 * Exception thrown when a planning request carries invalid input.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
