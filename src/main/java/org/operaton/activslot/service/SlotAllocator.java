package org.operaton.activslot.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.FreeSlot;
import org.operaton.activslot.model.domain.PlanAdherence;
import org.operaton.activslot.model.domain.PlanAssessment;
import org.operaton.activslot.model.domain.PlannedActivity;
import org.operaton.activslot.model.domain.PlannedActivity.ActivityType;
import org.operaton.activslot.model.domain.PlannedActivity.Priority;
import org.operaton.activslot.model.domain.PreferredTime;
import org.operaton.activslot.model.domain.TimeInterval;
import org.operaton.activslot.model.domain.TimeOfDay;
import org.operaton.activslot.model.domain.UserActivityPatterns;
import org.operaton.activslot.model.domain.UserPreferences;
import org.operaton.activslot.model.domain.WalkWorkoutAllocation;
import org.operaton.activslot.model.domain.WalkWorkoutRequest;
import org.operaton.activslot.model.domain.WalkableMeeting;
import org.operaton.activslot.model.domain.WorkoutType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.ToIntFunction;

/**
 * Scores free slots and fills them with activities until the step gap is closed.
 * <p>
 * Allocation is greedy by score and deterministic: identical inputs give identical activities,
 * including their ids.
 */
@Component
@Slf4j
public class SlotAllocator {

    public static final int MAX_WALK_MINUTES = 45;
    public static final double MAX_CONFIDENCE = 0.95;

    static final int BUFFER_MINUTES = 5;
    static final int MIN_ACTIVITY_MINUTES = 5;

    private static final int ONE_HOUR_SLOT_MINUTES = 60;
    private static final int MIN_WALK_WORKOUT_SLOT_MINUTES = 45;
    private static final int MAX_OTHER_WALKS = 2;

    private static final Comparator<ScoredSlot> BEST_FIRST = Comparator
        .comparingDouble(ScoredSlot::score).reversed()
        .thenComparing(scored -> scored.slot().start());

    /**
     * Fill free slots with walks until the step gap is closed.
     *
     * @param stepsNeeded steps still missing today
     * @param freeSlots candidate slots; meal-flagged slots are skipped
     * @param walkableMeetings meetings evaluated as walking 1:1s; recommended ones count toward the goal
     * @param patterns learned activity patterns
     * @param adherence completion statistics
     * @return activities ordered by start time
     */
    public List<PlannedActivity> allocate(int stepsNeeded,
                                          List<FreeSlot> freeSlots,
                                          List<WalkableMeeting> walkableMeetings,
                                          UserActivityPatterns patterns,
                                          PlanAdherence adherence) {
        int remaining = stepsNeeded - recommendedMeetingSteps(walkableMeetings);
        if (remaining <= 0) {
            return List.of();
        }

        int pace = pace(patterns);
        List<ScoredSlot> ranked = freeSlots.stream()
            .filter(slot -> !slot.duringMeal())
            .map(slot -> new ScoredSlot(slot, scoreSlot(slot, patterns, adherence)))
            .sorted(BEST_FIRST)
            .toList();

        List<PlannedActivity> activities = new ArrayList<>();
        for (ScoredSlot scored : ranked) {
            if (remaining <= 0) {
                break;
            }
            FreeSlot slot = scored.slot();

            int minutesNeeded = remaining / pace + BUFFER_MINUTES;
            int duration = (int) Math.min(Math.min(slot.durationMinutes() - BUFFER_MINUTES, minutesNeeded), MAX_WALK_MINUTES);
            if (duration < MIN_ACTIVITY_MINUTES) {
                continue;
            }

            int estimatedSteps = duration * pace;
            ActivityType type = activityTypeFor(slot);
            activities.add(PlannedActivity.builder()
                .id(activityId(slot.start(), type))
                .type(type)
                .startTime(slot.start())
                .durationMinutes(duration)
                .estimatedSteps(estimatedSteps)
                .priority(priorityFor(estimatedSteps, remaining))
                .status(PlannedActivity.ActivityStatus.PLANNED)
                .reason(reasonFor(slot, duration, patterns))
                .build());

            log.debug("Placed {} min {} at {} (score {})", duration, type, slot.start(), scored.score());
            remaining -= estimatedSteps;
        }

        activities.sort(Comparator.comparing(PlannedActivity::getStartTime));
        return activities;
    }

    /**
     * Score of a slot: peak hour, preferred band, length and time-of-day completion rate.
     */
    public double scoreSlot(FreeSlot slot, UserActivityPatterns patterns, PlanAdherence adherence) {
        int hour = slot.startHour();
        double score = 0.0;

        if (patterns.getPeakActivityHours().contains(hour)) {
            score += 0.3;
        }
        if (slot.preferredTime()) {
            score += 0.25;
        }
        if (slot.durationMinutes() >= 20) {
            score += 0.2;
        }
        if (slot.durationMinutes() >= 30) {
            score += 0.15;
        }
        score += 0.3 * adherence.rateFor(TimeOfDay.fromHour(hour));
        return score;
    }

    /**
     * Confidence and reasoning for a plan.
     *
     * @param stepsNeeded steps missing before planning
     * @param activities planned walks
     * @param walkableMeetings evaluated meetings
     * @param patterns learned patterns, for the goal achievement rate
     * @return the assessment
     */
    public PlanAssessment assess(int stepsNeeded,
                                 List<PlannedActivity> activities,
                                 List<WalkableMeeting> walkableMeetings,
                                 UserActivityPatterns patterns) {
        int plannedSteps = activities.stream()
            .filter(activity -> activity.getType().isWalk())
            .mapToInt(PlannedActivity::getEstimatedSteps)
            .sum() + recommendedMeetingSteps(walkableMeetings);

        double coverage = stepsNeeded > 0 ? Math.min(1.0, (double) plannedSteps / stepsNeeded) : 1.0;
        double confidence = Math.min(MAX_CONFIDENCE, 0.6 * coverage + 0.4 * patterns.getGoalAchievementRate());

        StringBuilder reasoning = new StringBuilder();
        if (stepsNeeded <= 0) {
            reasoning.append("You've already hit your step goal! Great job!");
        } else if (coverage >= 0.9) {
            reasoning.append("This plan covers your step goal. ")
                .append(activities.size())
                .append(activities.size() == 1 ? " walk" : " walks")
                .append(" scheduled across the day.");
        } else if (coverage >= 0.7) {
            reasoning.append("Plan covers ")
                .append((int) (coverage * 100))
                .append("% of steps needed. Consider walking meetings to close the gap.");
        } else {
            reasoning.append("Limited availability today. You'll need ~")
                .append(stepsNeeded - plannedSteps)
                .append(" extra steps from walking meetings or longer walks.");
        }

        if (walkableMeetings.stream().anyMatch(WalkableMeeting::isRecommended)) {
            reasoning.append(" Walking meeting opportunities identified.");
        }
        return new PlanAssessment(confidence, reasoning.toString());
    }

    /**
     * Capacity-tiered allocation of one walk and one workout.
     * <ul>
     *     <li>No one-hour slot: the workout takes a 45-59 minute slot if it fits, the walk goes to a
     *     listening meeting or the first shorter slot.</li>
     *     <li>One one-hour slot: it goes to the workout, the walk goes to a meeting or shorter slot.</li>
     *     <li>Two or more: workout and walk each take their best slot by preference score, up to two
     *     leftover one-hour slots are offered as extra walks.</li>
     * </ul>
     * Anything still missing is placed at the preferred time of day if the calendar allows.
     *
     * @param request allocation inputs
     * @return the allocation
     */
    public WalkWorkoutAllocation allocateWalkAndWorkout(WalkWorkoutRequest request) {
        UserPreferences preferences = request.getPreferences();
        int workoutMinutes = preferences.getWorkoutDuration();

        List<FreeSlot> valid = request.getFreeSlots().stream()
            .filter(slot -> slot.durationMinutes() >= MIN_WALK_WORKOUT_SLOT_MINUTES)
            .filter(slot -> !slot.duringMeal())
            .filter(slot -> preferences.isWithinBufferedActiveHours(slot.start(), request.getHardEndHour()))
            .sorted(Comparator.comparing(FreeSlot::start))
            .toList();
        List<FreeSlot> oneHourSlots = valid.stream()
            .filter(slot -> slot.durationMinutes() >= ONE_HOUR_SLOT_MINUTES)
            .toList();
        List<FreeSlot> shorterSlots = valid.stream()
            .filter(slot -> slot.durationMinutes() < ONE_HOUR_SLOT_MINUTES)
            .toList();
        List<WalkableMeeting> meetings = request.getListeningMeetings().stream()
            .filter(meeting -> !preferences.isDuringMeal(meeting.getStartTime()))
            .filter(meeting -> preferences.isWithinBufferedActiveHours(meeting.getStartTime(), request.getHardEndHour()))
            .sorted(Comparator.comparing(WalkableMeeting::getStartTime))
            .toList();

        WalkWorkoutAllocation result = new WalkWorkoutAllocation();
        FreeSlot workoutSlot = null;
        FreeSlot walkSlot = null;

        if (oneHourSlots.isEmpty()) {
            if (request.isNeedsWorkout()) {
                List<FreeSlot> fitting = shorterSlots.stream()
                    .filter(slot -> slot.durationMinutes() >= workoutMinutes)
                    .toList();
                workoutSlot = bestSlot(fitting, slot -> gymPreferenceScore(slot.startHour(), preferences.getPreferredGymTime()))
                    .orElse(null);
            }
            if (request.isNeedsWalk()) {
                if (!meetings.isEmpty()) {
                    result.setWalkingMeeting(meetings.get(0));
                } else if (!shorterSlots.isEmpty() && shorterSlots.get(0) != workoutSlot) {
                    walkSlot = shorterSlots.get(0);
                }
            }
        } else if (oneHourSlots.size() == 1) {
            FreeSlot onlySlot = oneHourSlots.get(0);
            if (request.isNeedsWorkout() && onlySlot.durationMinutes() >= workoutMinutes) {
                workoutSlot = onlySlot;
                if (request.isNeedsWalk()) {
                    if (!meetings.isEmpty()) {
                        result.setWalkingMeeting(meetings.get(0));
                    } else if (!shorterSlots.isEmpty()) {
                        walkSlot = shorterSlots.get(0);
                    }
                }
            } else if (request.isNeedsWalk()) {
                walkSlot = onlySlot;
            }
        } else {
            if (request.isNeedsWorkout()) {
                List<FreeSlot> fitting = oneHourSlots.stream()
                    .filter(slot -> slot.durationMinutes() >= workoutMinutes)
                    .toList();
                workoutSlot = bestSlot(fitting, slot -> gymPreferenceScore(slot.startHour(), preferences.getPreferredGymTime()))
                    .orElse(null);
            }
            if (request.isNeedsWalk()) {
                FreeSlot taken = workoutSlot;
                List<FreeSlot> forWalk = oneHourSlots.stream().filter(slot -> slot != taken).toList();
                walkSlot = bestSlot(forWalk, slot -> walkPreferenceScore(slot.startHour(), preferences.getPreferredWalkTime()))
                    .orElse(null);

                FreeSlot walkTaken = walkSlot;
                oneHourSlots.stream()
                    .filter(slot -> slot != taken && slot != walkTaken)
                    .limit(MAX_OTHER_WALKS)
                    .map(slot -> walkFromSlot(slot, request.getStepsPerMinute(), Priority.OPTIONAL))
                    .forEach(result.getOtherWalks()::add);
            }
        }

        if (workoutSlot != null) {
            result.setWorkout(workoutAt(workoutSlot.start(), workoutMinutes, request.getNextWorkoutType(), "Fits a free hour"));
        }
        if (walkSlot != null) {
            result.setWalk(walkFromSlot(walkSlot, request.getStepsPerMinute(), Priority.RECOMMENDED));
        }

        if (request.isNeedsWalk() && result.getWalk() == null && result.getWalkingMeeting() == null) {
            preferredTimeWalk(request, result.getWorkout()).ifPresent(result::setWalk);
        }
        if (request.isNeedsWorkout() && result.getWorkout() == null) {
            preferredTimeWorkout(request, result.getWalk()).ifPresent(result::setWorkout);
        }

        log.debug("Walk and workout allocation for {}: {} one-hour slots, workout={}, walk={}, meeting={}",
            request.getDate(), oneHourSlots.size(),
            result.getWorkout() != null ? result.getWorkout().getStartTime() : null,
            result.getWalk() != null ? result.getWalk().getStartTime() : null,
            result.getWalkingMeeting() != null ? result.getWalkingMeeting().getTitle() : null);
        return result;
    }

    /**
     * How well an hour suits a gym session under the given preference, 0 (poor) to 3 (ideal).
     */
    public int gymPreferenceScore(int hour, PreferredTime preference) {
        return switch (preference) {
            case MORNING -> hour >= 5 && hour < 10 ? 3 : (hour >= 10 && hour < 12 ? 1 : 0);
            case AFTERNOON -> hour >= 12 && hour < 17 ? 3 : 0;
            case EVENING -> hour >= 17 && hour < 21 ? 3 : 0;
            case NO_PREFERENCE -> (hour >= 6 && hour < 9) || (hour >= 17 && hour < 20) ? 2 : 1;
        };
    }

    /**
     * How well an hour suits a walk under the given preference, 0 (poor) to 3 (ideal).
     */
    public int walkPreferenceScore(int hour, PreferredTime preference) {
        return switch (preference) {
            case MORNING -> hour >= 6 && hour < 10 ? 3 : (hour >= 10 && hour < 12 ? 1 : 0);
            case AFTERNOON -> hour >= 12 && hour < 17 ? 3 : 0;
            case EVENING -> hour >= 17 && hour < 21 ? 3 : 0;
            case NO_PREFERENCE -> 1;
        };
    }

    private Optional<FreeSlot> bestSlot(List<FreeSlot> slots, ToIntFunction<FreeSlot> preferenceScore) {
        return slots.stream()
            .min(Comparator.comparingInt(preferenceScore).reversed().thenComparing(FreeSlot::start));
    }

    private Optional<PlannedActivity> preferredTimeWalk(WalkWorkoutRequest request, PlannedActivity workout) {
        UserPreferences preferences = request.getPreferences();
        PreferredTime preferred = preferences.getPreferredWalkTime();
        int idealHour = switch (preferred) {
            case MORNING -> preferences.getPreferredGymTime() == PreferredTime.MORNING && preferences.hasWorkoutGoal() ? 8 : 7;
            case AFTERNOON -> 13;
            case EVENING -> 18;
            case NO_PREFERENCE -> 8;
        };
        int[] range = switch (preferred) {
            case MORNING -> new int[]{6, 11};
            case AFTERNOON -> new int[]{12, 17};
            case EVENING -> new int[]{17, 21};
            case NO_PREFERENCE -> new int[]{7, 20};
        };

        return findOpenHour(request, idealHour, range, MAX_WALK_MINUTES, workout)
            .map(start -> {
                int steps = MAX_WALK_MINUTES * pace(request.getStepsPerMinute());
                ActivityType type = walkTypeForHour(start.getHour());
                return PlannedActivity.builder()
                    .id(activityId(start, type))
                    .type(type)
                    .startTime(start)
                    .durationMinutes(MAX_WALK_MINUTES)
                    .estimatedSteps(steps)
                    .priority(Priority.RECOMMENDED)
                    .reason(walkLabel(start.getHour()) + " at your preferred time")
                    .build();
            });
    }

    private Optional<PlannedActivity> preferredTimeWorkout(WalkWorkoutRequest request, PlannedActivity walk) {
        UserPreferences preferences = request.getPreferences();
        PreferredTime preferred = preferences.getPreferredGymTime();
        int idealHour = switch (preferred) {
            case MORNING, NO_PREFERENCE -> 7;
            case AFTERNOON -> 13;
            case EVENING -> 18;
        };
        int[] range = switch (preferred) {
            case MORNING -> new int[]{5, 11};
            case AFTERNOON -> new int[]{12, 17};
            case EVENING -> new int[]{17, 21};
            case NO_PREFERENCE -> new int[]{6, 21};
        };

        int minutes = preferences.getWorkoutDuration();
        return findOpenHour(request, idealHour, range, minutes, walk)
            .map(start -> workoutAt(start, minutes, request.getNextWorkoutType(), "Matches your preferred gym time"));
    }

    /**
     * First full hour, ideal hour first and then the preferred range, at which an activity of the given
     * length starts inside the active window, not at a meal and clear of busy time and {@code other}.
     */
    private Optional<LocalDateTime> findOpenHour(WalkWorkoutRequest request, int idealHour, int[] range,
                                                 int minutes, PlannedActivity other) {
        List<Integer> hours = new ArrayList<>();
        hours.add(idealHour);
        for (int hour = range[0]; hour < range[1]; hour++) {
            if (hour != idealHour) {
                hours.add(hour);
            }
        }

        UserPreferences preferences = request.getPreferences();
        LocalDate date = request.getDate();
        for (int hour : hours) {
            LocalDateTime start = date.atTime(LocalTime.of(hour, 0));
            TimeInterval candidate = TimeInterval.ofMinutes(start, minutes);

            if (request.getNotBefore() != null && start.isBefore(request.getNotBefore())) {
                continue;
            }
            if (!preferences.isWithinBufferedActiveHours(start, request.getHardEndHour())) {
                continue;
            }
            if (preferences.isDuringMeal(start)) {
                continue;
            }
            boolean conflicts = request.getBusyIntervals().stream().anyMatch(candidate::overlaps)
                || (other != null && other.toInterval().overlaps(candidate));
            if (!conflicts) {
                return Optional.of(start);
            }
        }
        return Optional.empty();
    }

    private PlannedActivity walkFromSlot(FreeSlot slot, int stepsPerMinute, Priority priority) {
        int duration = (int) Math.min(MAX_WALK_MINUTES, slot.durationMinutes());
        ActivityType type = walkTypeForHour(slot.startHour());
        return PlannedActivity.builder()
            .id(activityId(slot.start(), type))
            .type(type)
            .startTime(slot.start())
            .durationMinutes(duration)
            .estimatedSteps(duration * pace(stepsPerMinute))
            .priority(priority)
            .reason(walkLabel(slot.startHour()))
            .build();
    }

    private PlannedActivity workoutAt(LocalDateTime start, int minutes, WorkoutType workoutType, String why) {
        WorkoutType type = workoutType != null ? workoutType : WorkoutType.PUSH;
        return PlannedActivity.builder()
            .id(activityId(start, ActivityType.WORKOUT))
            .type(ActivityType.WORKOUT)
            .startTime(start)
            .durationMinutes(minutes)
            .estimatedSteps(0)
            .priority(Priority.RECOMMENDED)
            .workoutType(type)
            .reason(capitalize(type.name()) + " workout. " + why)
            .build();
    }

    private ActivityType activityTypeFor(FreeSlot slot) {
        int hour = slot.startHour();
        return switch (slot.slotClass()) {
            case MICRO -> ActivityType.MICRO_WALK;
            case SHORT -> bandedWalk(hour, true, ActivityType.SHORT_WALK);
            case STANDARD -> bandedWalk(hour, true, ActivityType.STANDARD_WALK);
            case EXTENDED -> bandedWalk(hour, false, ActivityType.STANDARD_WALK);
        };
    }

    private ActivityType bandedWalk(int hour, boolean lunchBand, ActivityType otherwise) {
        if (lunchBand && hour >= 11 && hour <= 13) {
            return ActivityType.LUNCH_WALK;
        }
        if (hour < 10) {
            return ActivityType.MORNING_WALK;
        }
        if (hour >= 17) {
            return ActivityType.EVENING_WALK;
        }
        return otherwise;
    }

    private ActivityType walkTypeForHour(int hour) {
        if (hour < 10) {
            return ActivityType.MORNING_WALK;
        }
        if (hour < 14) {
            return ActivityType.LUNCH_WALK;
        }
        if (hour < 17) {
            return ActivityType.STANDARD_WALK;
        }
        return ActivityType.EVENING_WALK;
    }

    private String walkLabel(int hour) {
        if (hour < 10) {
            return "Morning walk";
        }
        if (hour < 14) {
            return "Midday walk";
        }
        if (hour < 17) {
            return "Afternoon walk";
        }
        return "Evening walk";
    }

    private Priority priorityFor(int estimatedSteps, int remainingSteps) {
        double share = (double) estimatedSteps / remainingSteps;
        if (share > 0.4) {
            return Priority.CRITICAL;
        }
        if (share > 0.2) {
            return Priority.RECOMMENDED;
        }
        return Priority.OPTIONAL;
    }

    private String reasonFor(FreeSlot slot, int duration, UserActivityPatterns patterns) {
        List<String> reasons = new ArrayList<>();
        if (slot.preferredTime()) {
            reasons.add("Matches your preferred walking time");
        }
        if (patterns.getPeakActivityHours().contains(slot.startHour())) {
            reasons.add("You're typically most active around this time");
        }
        if (duration >= 30) {
            reasons.add(duration + "-min slot covers significant steps");
        } else if (duration >= 15) {
            reasons.add("Quick walk to boost your step count");
        } else {
            reasons.add("Micro-break to keep moving");
        }
        return String.join(". ", reasons);
    }

    private static int recommendedMeetingSteps(List<WalkableMeeting> meetings) {
        return meetings.stream()
            .filter(WalkableMeeting::isRecommended)
            .mapToInt(WalkableMeeting::getEstimatedSteps)
            .sum();
    }

    private static int pace(UserActivityPatterns patterns) {
        return pace(patterns.getStepsPerMinuteWalking());
    }

    private static int pace(int stepsPerMinute) {
        return stepsPerMinute > 0 ? stepsPerMinute : WalkabilityClassifier.DEFAULT_STEPS_PER_MINUTE;
    }

    private static UUID activityId(LocalDateTime start, ActivityType type) {
        return UUID.nameUUIDFromBytes(("activity:" + start + ":" + type).getBytes(StandardCharsets.UTF_8));
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }

    private record ScoredSlot(FreeSlot slot, double score) {
    }
}
