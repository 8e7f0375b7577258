package org.operaton.activslot.model.domain;

/**
 * How much the autopilot may do on its own.
 */
public enum TrustLevel {
    /**
     * Walks are written to the calendar immediately.
     */
    FULL_AUTO,

    /**
     * Walks are queued and the user approves or rejects each one.
     */
    CONFIRM_FIRST,

    /**
     * Walks are only shown as suggestions, nothing is committed.
     */
    SUGGEST_ONLY
}
