package com.bbthechange.tutoring.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for booking a trial lesson. Trials are not tied to a subscription.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookTrialRequest {

    @NotBlank(message = "Tutor ID is required")
    private String tutorId;

    private String courseId;            // Optional

    @NotBlank(message = "Student name is required")
    @Size(max = 100, message = "Student name must not exceed 100 characters")
    private String studentName;

    @NotNull(message = "Scheduled time is required")
    private Long scheduledAt;

    @Min(value = 15, message = "Duration must be at least 15 minutes")
    @Max(value = 240, message = "Duration must not exceed 240 minutes")
    private Integer durationMinutes;    // Optional, defaults to tutoring.scheduling.trial-duration-minutes
}
