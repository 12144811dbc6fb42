package com.bbthechange.tutoring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Bookable start times of a tutor over a horizon. An empty slot list means no availability.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvailableSlotsDTO {

    private String tutorId;
    private long horizonStart;
    private long horizonEnd;
    private int durationMinutes;
    private List<Long> slots;
}
