package org.operaton.activslot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.AutopilotRunResult;
import org.operaton.activslot.service.AutopilotService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the autopilot every evening for the following day.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AutopilotScheduler {

    private final AutopilotService autopilotService;

    /**
     * Nightly autopilot run. Repeated triggers for the same day are skipped by the service.
     */
    @Scheduled(cron = "${activslot.autopilot.cron:0 0 20 * * *}")
    public void scheduleTomorrow() {
        log.info("Starting scheduled autopilot run");

        try {
            AutopilotRunResult result = autopilotService.scheduleWalksForTomorrow();

            if (result.isSkipped()) {
                log.info("Autopilot run for {} skipped: {}", result.getTargetDate(), result.getSkipReason());
            } else {
                log.info("Autopilot run for {} completed with {} walks", result.getTargetDate(), result.getWalks().size());
            }
            result.getErrors().forEach(error -> log.warn("Autopilot: {}", error));

        } catch (Exception e) {
            log.error("Autopilot run failed", e);
        }
    }
}
