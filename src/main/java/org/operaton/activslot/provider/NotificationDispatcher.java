package org.operaton.activslot.provider;

import org.operaton.activslot.model.domain.AutopilotWalk;

import java.time.LocalDate;
import java.util.List;

/**
 * Delivers autopilot notifications. Calls are fire-and-forget.
 */
public interface NotificationDispatcher {

    void scheduleApprovalPrompt(AutopilotWalk walk);

    void scheduleSummary(LocalDate date, List<AutopilotWalk> walks);
}
