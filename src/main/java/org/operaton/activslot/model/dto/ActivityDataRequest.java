package org.operaton.activslot.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.activslot.model.domain.Workout;

import java.util.ArrayList;
import java.util.List;

/**
 * Step total and workouts of one day, as imported from a health data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityDataRequest {

    @Min(value = 0, message = "Steps must not be negative")
    private int steps;

    @Valid
    @Builder.Default
    private List<Workout> workouts = new ArrayList<>();
}
