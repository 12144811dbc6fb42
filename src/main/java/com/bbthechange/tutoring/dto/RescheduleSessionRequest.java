package com.bbthechange.tutoring.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleSessionRequest {

    @NotNull(message = "New scheduled time is required")
    private Long newScheduledAt;
}
