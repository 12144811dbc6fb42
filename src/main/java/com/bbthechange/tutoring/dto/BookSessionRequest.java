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
 * Request DTO for booking a single lesson against a subscription.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookSessionRequest {

    @NotBlank(message = "Tutor ID is required")
    private String tutorId;

    @NotBlank(message = "Subscription ID is required")
    private String subscriptionId;

    @NotNull(message = "Scheduled time is required")
    private Long scheduledAt;           // epoch millis

    @NotNull(message = "Duration is required")
    @Min(value = 15, message = "Duration must be at least 15 minutes")
    @Max(value = 240, message = "Duration must not exceed 240 minutes")
    private Integer durationMinutes;

    @Size(max = 100, message = "Student name must not exceed 100 characters")
    private String studentName;
}
