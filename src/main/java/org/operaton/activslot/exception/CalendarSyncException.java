package org.operaton.activslot.exception;

/**
 * Exception thrown when writing to or deleting from the user's calendar fails.
 */
public class CalendarSyncException extends RuntimeException {

    public CalendarSyncException(String message) {
        super(message);
    }

    public CalendarSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
