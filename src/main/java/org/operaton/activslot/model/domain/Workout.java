package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A recorded workout as reported by the activity data provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Workout {

    private String activityType;

    private LocalDateTime startTime;

    private int durationMinutes;
}
