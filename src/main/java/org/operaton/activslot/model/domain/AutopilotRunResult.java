package org.operaton.activslot.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one autopilot run. Errors are non-fatal and shown to the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutopilotRunResult {

    private LocalDate targetDate;

    @Builder.Default
    private List<AutopilotWalk> walks = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    /**
     * True when the run did nothing, e.g. disabled or already done for the date.
     */
    private boolean skipped;

    private String skipReason;

    public static AutopilotRunResult skipped(LocalDate targetDate, String reason) {
        return AutopilotRunResult.builder()
            .targetDate(targetDate)
            .skipped(true)
            .skipReason(reason)
            .build();
    }
}
