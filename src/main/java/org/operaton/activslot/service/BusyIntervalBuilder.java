package org.operaton.activslot.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.BusyInterval;
import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.util.IntervalUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Merges calendar meetings and committed activities into one sorted list of busy intervals.
 */
@Component
@Slf4j
public class BusyIntervalBuilder {

    private static final Comparator<BusyInterval> BY_START = Comparator
        .comparing((BusyInterval busy) -> busy.interval().start())
        .thenComparing(busy -> busy.interval().end());

    /**
     * Build the busy intervals of one day.
     * Only real meetings count; events the autopilot wrote itself are tagged as activities.
     * Every interval is clamped to {@code window}, intervals outside it are dropped.
     *
     * @param meetings calendar events of the day
     * @param committedActivities intervals of activities the user already committed to
     * @param window the active window of the day
     * @return busy intervals sorted by start
     */
    public List<BusyInterval> build(List<CalendarMeeting> meetings,
                                    List<TimeInterval> committedActivities,
                                    TimeInterval window) {
        List<BusyInterval> busy = new ArrayList<>();

        for (CalendarMeeting meeting : meetings) {
            if (!meeting.isRealMeeting() || !meeting.getStart().isBefore(meeting.getEnd())) {
                continue;
            }
            BusyInterval.Source source = meeting.isManaged() ? BusyInterval.Source.ACTIVITY : BusyInterval.Source.MEETING;
            IntervalUtils.clamp(meeting.toInterval(), window)
                .ifPresent(interval -> busy.add(new BusyInterval(interval, source, meeting.getTitle())));
        }

        for (TimeInterval activity : committedActivities) {
            Optional<TimeInterval> clamped = IntervalUtils.clamp(activity, window);
            clamped.ifPresent(interval -> busy.add(BusyInterval.activity(interval, "Scheduled activity")));
        }

        busy.sort(BY_START);
        log.debug("Built {} busy intervals within {} - {}", busy.size(), window.start(), window.end());
        return busy;
    }
}
