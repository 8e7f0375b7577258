package org.operaton.activslot.model.domain;

/**
 * Duration class of a free slot.
 */
public enum SlotClass {
    /** Up to 10 minutes. */
    MICRO,
    /** 11 to 20 minutes. */
    SHORT,
    /** 21 to 40 minutes. */
    STANDARD,
    /** More than 40 minutes. */
    EXTENDED;

    public static SlotClass fromMinutes(long minutes) {
        if (minutes <= 10) {
            return MICRO;
        }
        if (minutes <= 20) {
            return SHORT;
        }
        if (minutes <= 40) {
            return STANDARD;
        }
        return EXTENDED;
    }
}
