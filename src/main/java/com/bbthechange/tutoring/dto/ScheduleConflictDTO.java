package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.service.ConflictDetector;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two booked sessions of the same tutor that overlap. Reported by the
 * schedule integrity check; a healthy schedule has none.
 */
@Data
@NoArgsConstructor
public class ScheduleConflictDTO {

    private SessionDTO first;
    private SessionDTO second;

    public ScheduleConflictDTO(ConflictDetector.Overlap overlap) {
        this.first = new SessionDTO(overlap.getFirst());
        this.second = new SessionDTO(overlap.getSecond());
    }
}
