package org.operaton.activslot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.UserActivityPatterns;
import org.operaton.activslot.service.PatternLearningService;
import org.operaton.activslot.service.PreferencesService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Relearns activity patterns from the recorded step history every night.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatternRefreshScheduler {

    private final PatternLearningService patternLearningService;
    private final PreferencesService preferencesService;
    private final Clock clock;

    @Scheduled(cron = "${activslot.planning.pattern-refresh-cron:0 30 2 * * *}")
    public void refreshPatterns() {
        log.info("Starting scheduled pattern refresh");

        try {
            UserActivityPatterns patterns = patternLearningService.refreshFromProvider(
                LocalDate.now(clock), preferencesService.current().getDailyStepGoal());
            log.info("Pattern refresh completed. Weekday average {}, weekend average {}",
                patterns.getWeekdayAverage(), patterns.getWeekendAverage());

        } catch (Exception e) {
            log.error("Pattern refresh failed", e);
        }
    }
}
