package org.operaton.activslot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.Streak;
import org.operaton.activslot.service.StreakService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Resets a lapsed streak when the application starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreakStartupValidator {

    private final StreakService streakService;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void validateStreak() {
        try {
            Streak streak = streakService.validate(LocalDate.now(clock));
            log.info("Streak validated: current {} days, longest {} days",
                streak.getCurrentStreak(), streak.getLongestStreak());
        } catch (Exception e) {
            log.error("Streak validation at startup failed", e);
        }
    }
}
