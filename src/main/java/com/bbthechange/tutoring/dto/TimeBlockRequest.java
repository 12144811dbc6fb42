package com.bbthechange.tutoring.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeBlockRequest {

    @NotNull(message = "Start time is required")
    private Long startTime;

    @NotNull(message = "End time is required")
    private Long endTime;

    @Size(max = 200, message = "Reason must not exceed 200 characters")
    private String reason;
}
