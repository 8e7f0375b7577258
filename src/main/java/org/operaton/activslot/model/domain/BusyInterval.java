package org.operaton.activslot.model.domain;

/**
 * A time range blocked either by a calendar meeting or by an activity the user already committed to.
 */
public record BusyInterval(TimeInterval interval, Source source, String label) {

    public enum Source {
        MEETING,
        ACTIVITY
    }

    public static BusyInterval meeting(TimeInterval interval, String title) {
        return new BusyInterval(interval, Source.MEETING, title);
    }

    public static BusyInterval activity(TimeInterval interval, String label) {
        return new BusyInterval(interval, Source.ACTIVITY, label);
    }
}
