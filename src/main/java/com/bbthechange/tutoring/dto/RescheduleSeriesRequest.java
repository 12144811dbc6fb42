package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.model.RecurrenceFrequency;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for moving a whole series. The first remaining session lands on
 * newAnchorDate; later ones follow at the given frequency.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleSeriesRequest {

    @NotNull(message = "New anchor date is required")
    private LocalDate newAnchorDate;     // ISO date, e.g. 2026-11-03

    @NotNull(message = "Frequency is required")
    private RecurrenceFrequency frequency;
}
