package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.model.RecurrenceFrequency;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for booking a run of recurring lessons in one go.
 * Either every occurrence is booked or none is.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookRecurringRequest {

    @NotBlank(message = "Tutor ID is required")
    private String tutorId;

    @NotBlank(message = "Subscription ID is required")
    private String subscriptionId;

    @NotNull(message = "First scheduled time is required")
    private Long firstScheduledAt;

    @NotNull(message = "Duration is required")
    @Min(value = 15, message = "Duration must be at least 15 minutes")
    @Max(value = 240, message = "Duration must not exceed 240 minutes")
    private Integer durationMinutes;

    @NotNull(message = "Frequency is required")
    private RecurrenceFrequency frequency;

    @NotNull(message = "Count is required")
    @Min(value = 1, message = "Count must be at least 1")
    @Max(value = 52, message = "Count must not exceed 52")
    private Integer count;

    @Size(max = 100, message = "Student name must not exceed 100 characters")
    private String studentName;
}
