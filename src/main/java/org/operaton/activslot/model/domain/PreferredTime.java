package org.operaton.activslot.model.domain;

/**
 * Preferred time-of-day band for walks or gym sessions.
 */
public enum PreferredTime {
    MORNING,
    AFTERNOON,
    EVENING,
    NO_PREFERENCE
}
