package org.operaton.activslot.service;

import org.operaton.activslot.model.domain.DailyMovementPlan;

/**
 * Callback for committed plans. Invoked on the thread that generated the plan.
 */
@FunctionalInterface
public interface PlanListener {

    void onPlanCommitted(DailyMovementPlan plan);
}
