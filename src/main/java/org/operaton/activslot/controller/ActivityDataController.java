package org.operaton.activslot.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.domain.Workout;
import org.operaton.activslot.model.dto.ActivityDataRequest;
import org.operaton.activslot.provider.StoredActivityDataProvider;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST controller for importing step totals and workouts from a health data source.
 */
@RestController
@RequestMapping("/api/activity")
@RequiredArgsConstructor
@Slf4j
public class ActivityDataController {

    private final StoredActivityDataProvider activityDataProvider;

    @PutMapping("/{date}")
    public ResponseEntity<Void> importDay(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                          @Valid @RequestBody ActivityDataRequest request) {
        activityDataProvider.recordSteps(date, request.getSteps());
        for (Workout workout : request.getWorkouts()) {
            activityDataProvider.recordWorkout(date, workout);
        }
        log.info("Imported {} steps and {} workouts for {}", request.getSteps(), request.getWorkouts().size(), date);
        return ResponseEntity.noContent().build();
    }
}
