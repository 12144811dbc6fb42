package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.model.TimeBlock;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class TimeBlockDTO {

    private String blockId;
    private String tutorId;
    private Long startTime;
    private Long endTime;
    private String reason;

    public TimeBlockDTO(TimeBlock block) {
        this.blockId = block.getBlockId();
        this.tutorId = block.getTutorId();
        this.startTime = block.getStartTime();
        this.endTime = block.getEndTime();
        this.reason = block.getReason();
    }
}
