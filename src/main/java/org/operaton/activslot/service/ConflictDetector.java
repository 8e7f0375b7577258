package org.operaton.activslot.service;

import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.ScheduleConflict;
import org.operaton.activslot.model.domain.TimeInterval;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds scheduled activities that overlap a meeting or leave less than 30 minutes to it.
 * Conflicts are reported only; nothing is moved.
 */
@Component
public class ConflictDetector {

    public static final int MIN_DISTANCE_MINUTES = 30;

    public List<ScheduleConflict> detect(List<PlannedActivity> activities, List<CalendarMeeting> meetings) {
        List<ScheduleConflict> conflicts = new ArrayList<>();
        for (PlannedActivity activity : activities) {
            TimeInterval range = activity.toInterval();
            for (CalendarMeeting meeting : meetings) {
                if (!meeting.isRealMeeting() || meeting.isManaged()) {
                    continue;
                }
                TimeInterval busy = meeting.toInterval();
                if (range.overlaps(busy)) {
                    conflicts.add(conflict(activity, meeting, ScheduleConflict.ConflictType.OVERLAP));
                } else if (withinMinutes(range, busy)) {
                    conflicts.add(conflict(activity, meeting, ScheduleConflict.ConflictType.TOO_CLOSE));
                }
            }
        }
        return conflicts;
    }

    private boolean withinMinutes(TimeInterval activity, TimeInterval meeting) {
        long endToStart = Math.abs(Duration.between(activity.end(), meeting.start()).toMinutes());
        long startToEnd = Math.abs(Duration.between(meeting.end(), activity.start()).toMinutes());
        return endToStart < MIN_DISTANCE_MINUTES || startToEnd < MIN_DISTANCE_MINUTES;
    }

    private ScheduleConflict conflict(PlannedActivity activity, CalendarMeeting meeting, ScheduleConflict.ConflictType type) {
        return new ScheduleConflict(activity.getId(), meeting.getId(), meeting.getTitle(), type);
    }
}
