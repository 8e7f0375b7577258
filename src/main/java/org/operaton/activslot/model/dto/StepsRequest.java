package org.operaton.activslot.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Daily step total reported by the client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepsRequest {

    @NotNull(message = "Date is required")
    private LocalDate date;

    @Min(value = 0, message = "Steps must not be negative")
    private int steps;
}
