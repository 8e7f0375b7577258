package org.operaton.activslot.service;

import org.operaton.activslot.model.domain.CalendarMeeting;
import org.operaton.activslot.model.domain.WalkabilityResult;
import org.operaton.activslot.model.domain.WalkableMeeting;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Scores calendar meetings for walk suitability.
 * <p>
 * Two predicates are offered and they are not interchangeable:
 * {@link #isWalkingOneOnOne(CalendarMeeting)} picks small meetings the planner recommends walking through,
 * {@link #isBackgroundListenable(CalendarMeeting)} picks large meetings the user can follow while walking.
 */
@Component
public class WalkabilityClassifier {

    public static final int DEFAULT_STEPS_PER_MINUTE = 100;

    static final List<String> WALKABLE_KEYWORDS = List.of(
        "1:1", "one on one", "sync", "catch up", "check in", "chat", "coffee"
    );

    static final List<String> NON_WALKABLE_KEYWORDS = List.of(
        "presentation", "demo", "workshop", "training", "all hands", "all-hands",
        "standup", "stand-up", "review", "interview", "onsite", "on-site"
    );

    private static final int MIN_WALKABLE_MINUTES = 20;
    private static final int MAX_WALKABLE_MINUTES = 120;
    private static final int MIN_LISTENING_ATTENDEES = 4;
    private static final double RECOMMENDATION_THRESHOLD = 0.5;

    /**
     * Additive walkability score clamped to [0, 1].
     */
    public double score(CalendarMeeting meeting) {
        double score = 0.0;
        int attendees = meeting.getAttendeeCount();
        long duration = meeting.durationMinutes();
        String title = normalizedTitle(meeting);

        if (attendees <= 2) {
            score += 0.4;
        } else if (attendees <= 3) {
            score += 0.2;
        }

        if (duration >= 30 && duration <= 60) {
            score += 0.3;
        } else if (duration >= 20 && duration < 90) {
            score += 0.2;
        }

        if (containsAny(title, WALKABLE_KEYWORDS)) {
            score += 0.3;
        }

        if (containsAny(title, NON_WALKABLE_KEYWORDS)) {
            score = Math.max(0.0, score - 0.5);
        }

        return Math.min(1.0, Math.max(0.0, score));
    }

    /**
     * Classify a meeting as a walking 1:1 candidate.
     *
     * @param meeting the meeting
     * @return result whose {@code walkable} flag follows {@link #isWalkingOneOnOne(CalendarMeeting)}
     */
    public WalkabilityResult classify(CalendarMeeting meeting) {
        double score = score(meeting);
        boolean oneOnOne = isOneOnOne(meeting);
        boolean walkable = isWalkingOneOnOne(meeting, score);

        String reason;
        if (walkable) {
            reason = "Perfect for a walking 1:1";
        } else if (!oneOnOne) {
            reason = "Too many attendees for walking";
        } else {
            reason = "Meeting type not ideal for walking";
        }
        return new WalkabilityResult(walkable, score, reason, oneOnOne);
    }

    /**
     * Classify a meeting for listening in while walking.
     *
     * @param meeting the meeting
     * @return result whose {@code walkable} flag follows {@link #isBackgroundListenable(CalendarMeeting)}
     */
    public WalkabilityResult classifyForListening(CalendarMeeting meeting) {
        boolean listenable = isBackgroundListenable(meeting);
        String reason = listenable
            ? "Large meeting you can follow while walking"
            : "Not suitable for listening in while walking";
        return new WalkabilityResult(listenable, score(meeting), reason, isOneOnOne(meeting));
    }

    /**
     * Small meeting the planner recommends walking through: score of at least 0.5 and two attendees or fewer.
     */
    public boolean isWalkingOneOnOne(CalendarMeeting meeting) {
        return isWalkingOneOnOne(meeting, score(meeting));
    }

    /**
     * Large meeting the user attends passively: four or more attendees, not organized by the user,
     * and no presenting or interactive keyword in the title.
     */
    public boolean isBackgroundListenable(CalendarMeeting meeting) {
        return withinWalkableBounds(meeting)
            && meeting.getAttendeeCount() >= MIN_LISTENING_ATTENDEES
            && !meeting.isOrganizer()
            && !containsAny(normalizedTitle(meeting), NON_WALKABLE_KEYWORDS);
    }

    public boolean isOneOnOne(CalendarMeeting meeting) {
        return meeting.getAttendeeCount() <= 2;
    }

    public int estimatedSteps(CalendarMeeting meeting, int stepsPerMinute) {
        int pace = stepsPerMinute > 0 ? stepsPerMinute : DEFAULT_STEPS_PER_MINUTE;
        return (int) meeting.durationMinutes() * pace;
    }

    /**
     * Walking 1:1 view of a meeting as used in a daily plan. Steps are only counted when recommended.
     */
    public WalkableMeeting toWalkingOneOnOne(CalendarMeeting meeting, int stepsPerMinute) {
        return toWalkableMeeting(meeting, classify(meeting), stepsPerMinute);
    }

    /**
     * Listening view of a meeting, used to fill the step gap on combined walk and workout days.
     */
    public WalkableMeeting toListeningWalk(CalendarMeeting meeting, int stepsPerMinute) {
        return toWalkableMeeting(meeting, classifyForListening(meeting), stepsPerMinute);
    }

    private WalkableMeeting toWalkableMeeting(CalendarMeeting meeting, WalkabilityResult result, int stepsPerMinute) {
        return WalkableMeeting.builder()
            .meetingId(meeting.getId())
            .title(meeting.getTitle())
            .startTime(meeting.getStart())
            .durationMinutes((int) meeting.durationMinutes())
            .attendeeCount(meeting.getAttendeeCount())
            .oneOnOne(result.oneOnOne())
            .walkabilityScore(result.score())
            .recommended(result.walkable())
            .estimatedSteps(result.walkable() ? estimatedSteps(meeting, stepsPerMinute) : 0)
            .reason(result.reason())
            .build();
    }

    private boolean isWalkingOneOnOne(CalendarMeeting meeting, double score) {
        return withinWalkableBounds(meeting) && isOneOnOne(meeting) && score >= RECOMMENDATION_THRESHOLD;
    }

    private boolean withinWalkableBounds(CalendarMeeting meeting) {
        if (meeting.isAllDay()) {
            return false;
        }
        long duration = meeting.durationMinutes();
        return duration >= MIN_WALKABLE_MINUTES && duration <= MAX_WALKABLE_MINUTES;
    }

    private static String normalizedTitle(CalendarMeeting meeting) {
        return meeting.getTitle() == null ? "" : meeting.getTitle().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String title, List<String> keywords) {
        return keywords.stream().anyMatch(title::contains);
    }
}
