package org.operaton.activslot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.service.AutopilotService;
import org.operaton.activslot.service.SmartPlannerService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Deletes old autopilot walks and stored plans.
 * Runs daily at 3 AM.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CleanupScheduler {

    private final AutopilotService autopilotService;
    private final SmartPlannerService smartPlannerService;
    private final Clock clock;

    @Value("${activslot.autopilot.retention-days:7}")
    private int retentionDays = 7;

    @Value("${activslot.planning.plan-retention-days:30}")
    private int planRetentionDays = 30;

    @Scheduled(cron = "0 0 3 * * *")
    public void cleanup() {
        log.info("Starting scheduled cleanup: walks older than {} days, plans older than {} days",
            retentionDays, planRetentionDays);

        try {
            int walks = autopilotService.cleanupOldWalks(retentionDays);
            int plans = smartPlannerService.cleanupOldPlans(LocalDate.now(clock), planRetentionDays);

            if (walks + plans > 0) {
                log.info("Cleanup completed. Deleted {} walks and {} plans", walks, plans);
            } else {
                log.info("Cleanup completed. Nothing to delete");
            }

        } catch (Exception e) {
            log.error("Cleanup failed", e);
        }
    }
}
