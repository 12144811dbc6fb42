package com.bbthechange.tutoring.model;

import com.bbthechange.tutoring.util.TutoringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.UUID;

/**
 * A one-off period in which the tutor is unavailable (holiday, appointment).
 * Overrides the recurring windows: no slot overlapping a block is bookable.
 *
 * Key Pattern: PK = TUTOR#{tutorId}, SK = BLOCK#{blockId}
 */
@DynamoDbBean
public class TimeBlock extends BaseItem {

    public static final String ITEM_TYPE = "TIME_BLOCK";

    private String blockId;
    private String tutorId;
    private Long startTime;
    private Long endTime;
    private String reason;

    public TimeBlock() {
        super();
        setItemType(ITEM_TYPE);
    }

    public TimeBlock(String tutorId, long startTime, long endTime, String reason) {
        this();
        this.blockId = UUID.randomUUID().toString();
        this.tutorId = tutorId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.reason = reason;

        setPk(TutoringKeyFactory.getTutorPk(tutorId));
        setSk(TutoringKeyFactory.getBlockSk(blockId));
    }

    public String getBlockId() {
        return blockId;
    }

    public void setBlockId(String blockId) {
        this.blockId = blockId;
    }

    public String getTutorId() {
        return tutorId;
    }

    public void setTutorId(String tutorId) {
        this.tutorId = tutorId;
    }

    public Long getStartTime() {
        return startTime;
    }

    public void setStartTime(Long startTime) {
        this.startTime = startTime;
    }

    public Long getEndTime() {
        return endTime;
    }

    public void setEndTime(Long endTime) {
        this.endTime = endTime;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @DynamoDbIgnore
    public Interval getInterval() {
        return Interval.of(startTime, endTime);
    }
}
