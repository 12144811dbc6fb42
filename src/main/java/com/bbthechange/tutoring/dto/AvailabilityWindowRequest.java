package com.bbthechange.tutoring.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or replacing an availability window.
 * Range and format checks happen in the service so that a bad window is
 * reported as an INVALID_WINDOW rejection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityWindowRequest {

    @NotNull(message = "Day of week is required")
    private Integer dayOfWeek;          // 0 = Sunday .. 6 = Saturday

    @NotBlank(message = "Start time is required")
    private String startTime;           // HH:mm

    @NotBlank(message = "End time is required")
    private String endTime;             // HH:mm

    private Boolean active;             // Optional, defaults to true
}
