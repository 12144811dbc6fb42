package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.model.AvailabilityWindow;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class AvailabilityWindowDTO {

    private String windowId;
    private String tutorId;
    private Integer dayOfWeek;
    private String startTime;
    private String endTime;
    private boolean active;

    public AvailabilityWindowDTO(AvailabilityWindow window) {
        this.windowId = window.getWindowId();
        this.tutorId = window.getTutorId();
        this.dayOfWeek = window.getDayOfWeek();
        this.startTime = window.getStartTime();
        this.endTime = window.getEndTime();
        this.active = window.isActiveWindow();
    }
}
