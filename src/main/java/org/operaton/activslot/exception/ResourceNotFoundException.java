package org.operaton.activslot.exception;

/**
 * Exception thrown when a plan, activity or autopilot walk does not exist
 * or is not in a state that allows the requested change.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
