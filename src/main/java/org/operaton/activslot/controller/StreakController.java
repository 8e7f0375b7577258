package org.operaton.activslot.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.operaton.activslot.model.domain.Streak;
import org.operaton.activslot.model.dto.StepsRequest;
import org.operaton.activslot.provider.StoredActivityDataProvider;
import org.operaton.activslot.service.PreferencesService;
import org.operaton.activslot.service.StreakService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

/**
 * REST controller for the step goal streak.
 */
@RestController
@RequestMapping("/api/streak")
@RequiredArgsConstructor
public class StreakController {

    private final StreakService streakService;
    private final PreferencesService preferencesService;
    private final StoredActivityDataProvider activityDataProvider;
    private final Clock clock;

    @GetMapping
    public Streak getStreak() {
        return streakService.current();
    }

    /**
     * Record a day's step total. The streak only advances for today's total.
     */
    @PostMapping("/steps")
    public Streak recordSteps(@Valid @RequestBody StepsRequest request) {
        activityDataProvider.recordSteps(request.getDate(), request.getSteps());
        if (!request.getDate().equals(LocalDate.now(clock))) {
            return streakService.current();
        }
        return streakService.recordDailySteps(request.getDate(), request.getSteps(),
            preferencesService.current().getDailyStepGoal());
    }

    @PostMapping("/rebuild")
    public Streak rebuild() {
        return streakService.rebuildFromHistory(LocalDate.now(clock), preferencesService.current().getDailyStepGoal());
    }
}
