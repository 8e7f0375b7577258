package org.operaton.activslot.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.DailyMovementPlan;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.ScheduleConflict;
import org.operaton.activslot.model.domain.WalkWorkoutAllocation;
import org.operaton.activslot.model.dto.ScheduleActivityRequest;
import org.operaton.activslot.service.PatternLearningService;
import org.operaton.activslot.service.ScheduledActivityService;
import org.operaton.activslot.service.SmartPlannerService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for daily movement plans.
 */
@RestController
@RequestMapping("/api/plans/{date}")
@RequiredArgsConstructor
@Slf4j
public class PlanController {

    private final SmartPlannerService smartPlannerService;
    private final ScheduledActivityService scheduledActivityService;
    private final PatternLearningService patternLearningService;

    /**
     * Get the stored plan for a date.
     *
     * @param date the plan date
     * @return the plan, or 404 if none was generated yet
     */
    @GetMapping
    public ResponseEntity<DailyMovementPlan> getPlan(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return smartPlannerService.getPlan(date)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Generate the plan for a date, replacing the previous one.
     *
     * @param date the plan date
     * @return the committed plan
     */
    @PostMapping("/generate")
    public CompletableFuture<DailyMovementPlan> generatePlan(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("Plan generation requested for {}", date);
        return smartPlannerService.generatePlanAsync(date);
    }

    @PostMapping("/activities/{activityId}/complete")
    public PlannedActivity completeActivity(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                            @PathVariable UUID activityId) {
        return smartPlannerService.recordActivityCompleted(date, activityId);
    }

    @PostMapping("/activities/{activityId}/skip")
    public PlannedActivity skipActivity(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                        @PathVariable UUID activityId) {
        return smartPlannerService.recordActivitySkipped(date, activityId);
    }

    @PostMapping("/activities/{activityId}/reschedule")
    public PlannedActivity rescheduleActivity(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                              @PathVariable UUID activityId,
                                              @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start) {
        return smartPlannerService.rescheduleActivity(date, activityId, start);
    }

    @GetMapping("/conflicts")
    public List<ScheduleConflict> getConflicts(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return smartPlannerService.detectConflicts(date);
    }

    /**
     * Suggest one walk and one workout for the date, tiered by how much free time there is.
     */
    @GetMapping("/walk-workout")
    public WalkWorkoutAllocation suggestWalkAndWorkout(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return smartPlannerService.suggestWalkAndWorkout(date);
    }

    @GetMapping("/scheduled")
    public List<PlannedActivity> getScheduledActivities(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return scheduledActivityService.activitiesFor(date);
    }

    /**
     * Commit an activity by hand. It is kept in every regenerated plan for its date.
     */
    @PostMapping("/scheduled")
    public ResponseEntity<PlannedActivity> scheduleActivity(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                            @Valid @RequestBody ScheduleActivityRequest request) {
        if (!request.getStartTime().toLocalDate().equals(date)) {
            throw new IllegalArgumentException("Start time must be on " + date);
        }
        int pace = patternLearningService.currentPatterns().getStepsPerMinuteWalking();
        PlannedActivity activity = scheduledActivityService.schedule(request.toActivity(pace));
        return ResponseEntity.status(HttpStatus.CREATED).body(activity);
    }

    @DeleteMapping("/scheduled/{activityId}")
    public ResponseEntity<Void> removeScheduledActivity(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                        @PathVariable UUID activityId) {
        scheduledActivityService.remove(date, activityId);
        return ResponseEntity.noContent().build();
    }
}
