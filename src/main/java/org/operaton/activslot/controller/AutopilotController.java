package org.operaton.activslot.controller;

import lombok.RequiredArgsConstructor;
import org.operaton.activslot.model.domain.AutopilotRunResult;
import org.operaton.activslot.model.domain.AutopilotWalk;
import org.operaton.activslot.service.AutopilotService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for the walk autopilot and its approval workflow.
 */
@RestController
@RequestMapping("/api/autopilot")
@RequiredArgsConstructor
public class AutopilotController {

    private final AutopilotService autopilotService;
    private final Clock clock;

    @GetMapping("/pending")
    public List<AutopilotWalk> getPendingApprovals() {
        return autopilotService.pendingApprovals();
    }

    @GetMapping("/walks")
    public List<AutopilotWalk> getWalks(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return autopilotService.walksFor(date);
    }

    /**
     * Run the autopilot for tomorrow.
     *
     * @param force replace walks that were already scheduled for tomorrow
     * @return the run result
     */
    @PostMapping("/run")
    public AutopilotRunResult run(@RequestParam(defaultValue = "false") boolean force) {
        return force ? autopilotService.forceScheduleForTomorrow() : autopilotService.scheduleWalksForTomorrow();
    }

    @PostMapping("/walks/{walkId}/approve")
    public AutopilotWalk approve(@PathVariable UUID walkId) {
        return autopilotService.approveWalk(walkId);
    }

    @PostMapping("/walks/{walkId}/reject")
    public AutopilotWalk reject(@PathVariable UUID walkId) {
        return autopilotService.rejectWalk(walkId);
    }

    @PostMapping("/walks/{walkId}/adjust")
    public AutopilotWalk adjust(@PathVariable UUID walkId,
                                @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start) {
        return autopilotService.adjustWalkTime(walkId, start);
    }

    /**
     * Suggest a walk after a meeting that just ended.
     *
     * @param end end of the meeting
     * @return the suggestion, or 204 when there is no room for a walk
     */
    @GetMapping("/post-meeting")
    public ResponseEntity<AutopilotWalk> postMeetingOpportunity(
        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end
    ) {
        return autopilotService.checkPostMeetingOpportunity(end)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/sitting-break")
    public AutopilotWalk sittingBreak() {
        return autopilotService.suggestSittingBreak(LocalDateTime.now(clock));
    }
}
