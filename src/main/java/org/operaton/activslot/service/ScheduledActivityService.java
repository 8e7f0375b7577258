package org.operaton.activslot.service;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.exception.PlanningException;
import org.operaton.activslot.exception.ResourceNotFoundException;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.store.KeyValueStore;
import org.operaton.activslot.store.StoreKeys;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Activities the user committed to by hand. They count as busy time when plans are generated
 * and survive plan regeneration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledActivityService {

    private static final TypeReference<List<PlannedActivity>> ACTIVITY_LIST = new TypeReference<>() {
    };

    private final KeyValueStore store;

    public List<PlannedActivity> activitiesFor(LocalDate date) {
        return store.get(StoreKeys.scheduledActivities(date), ACTIVITY_LIST).orElseGet(List::of);
    }

    public List<TimeInterval> busyIntervalsFor(LocalDate date) {
        return activitiesFor(date).stream()
            .filter(activity -> activity.getStatus() != PlannedActivity.ActivityStatus.SKIPPED)
            .map(PlannedActivity::toInterval)
            .toList();
    }

    /**
     * Commit an activity for its start date.
     *
     * @param activity the activity; id and status are filled in when missing
     * @return the stored activity
     */
    public synchronized PlannedActivity schedule(PlannedActivity activity) {
        if (activity.getStartTime() == null || activity.getType() == null) {
            throw new PlanningException("A scheduled activity needs a type and a start time");
        }
        if (activity.getDurationMinutes() < 5) {
            throw new PlanningException("A scheduled activity must last at least 5 minutes");
        }
        if (activity.getId() == null) {
            activity.setId(UUID.randomUUID());
        }
        if (activity.getStatus() == null) {
            activity.setStatus(PlannedActivity.ActivityStatus.PLANNED);
        }
        activity.setManual(true);

        LocalDate date = activity.getStartTime().toLocalDate();
        List<PlannedActivity> activities = new ArrayList<>(activitiesFor(date));
        activities.removeIf(existing -> existing.getId().equals(activity.getId()));
        activities.add(activity);
        activities.sort(Comparator.comparing(PlannedActivity::getStartTime));
        store.put(StoreKeys.scheduledActivities(date), activities);
        log.info("Scheduled {} at {} for {} minutes", activity.getType(), activity.getStartTime(), activity.getDurationMinutes());
        return activity;
    }

    public synchronized void remove(LocalDate date, UUID activityId) {
        List<PlannedActivity> activities = new ArrayList<>(activitiesFor(date));
        if (!activities.removeIf(activity -> activity.getId().equals(activityId))) {
            throw new ResourceNotFoundException("No scheduled activity " + activityId + " on " + date);
        }
        store.put(StoreKeys.scheduledActivities(date), activities);
        log.info("Removed scheduled activity {} on {}", activityId, date);
    }

    /**
     * Update the status of a scheduled activity if it exists.
     *
     * @return true when the activity was found
     */
    public synchronized boolean updateStatus(LocalDate date, UUID activityId, PlannedActivity.ActivityStatus status) {
        List<PlannedActivity> activities = new ArrayList<>(activitiesFor(date));
        for (PlannedActivity activity : activities) {
            if (activity.getId().equals(activityId)) {
                activity.setStatus(status);
                store.put(StoreKeys.scheduledActivities(date), activities);
                return true;
            }
        }
        return false;
    }
}
