package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.model.SessionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a tutor recording how a session went (COMPLETED or NO_SHOW).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSessionStatusRequest {

    @NotNull(message = "Status is required")
    private SessionStatus status;
}
