package com.bbthechange.tutoring.model;

import com.bbthechange.tutoring.util.TutoringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * A recurring weekly period in which a tutor accepts bookings.
 * dayOfWeek follows the 0 = Sunday .. 6 = Saturday convention; times are
 * local "HH:mm" in the scheduling reference zone.
 *
 * Key Pattern: PK = TUTOR#{tutorId}, SK = WINDOW#{windowId}
 */
@DynamoDbBean
public class AvailabilityWindow extends BaseItem {

    public static final String ITEM_TYPE = "AVAILABILITY_WINDOW";

    private String windowId;
    private String tutorId;
    private Integer dayOfWeek;
    private String startTime;
    private String endTime;
    private Boolean active;

    // Default constructor for DynamoDB
    public AvailabilityWindow() {
        super();
        setItemType(ITEM_TYPE);
        this.active = true;
    }

    public AvailabilityWindow(String tutorId, int dayOfWeek, String startTime, String endTime) {
        this();
        this.windowId = UUID.randomUUID().toString();
        this.tutorId = tutorId;
        this.dayOfWeek = dayOfWeek;
        this.startTime = startTime;
        this.endTime = endTime;

        setPk(TutoringKeyFactory.getTutorPk(tutorId));
        setSk(TutoringKeyFactory.getWindowSk(windowId));
    }

    public String getWindowId() {
        return windowId;
    }

    public void setWindowId(String windowId) {
        this.windowId = windowId;
    }

    public String getTutorId() {
        return tutorId;
    }

    public void setTutorId(String tutorId) {
        this.tutorId = tutorId;
    }

    public Integer getDayOfWeek() {
        return dayOfWeek;
    }

    public void setDayOfWeek(Integer dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
        touch();
    }

    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime;
        touch();
    }

    public String getEndTime() {
        return endTime;
    }

    public void setEndTime(String endTime) {
        this.endTime = endTime;
        touch();
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
        touch();
    }

    @DynamoDbIgnore
    public boolean isActiveWindow() {
        return Boolean.TRUE.equals(active);
    }

    @DynamoDbIgnore
    public LocalTime getStartLocalTime() {
        return LocalTime.parse(startTime);
    }

    @DynamoDbIgnore
    public LocalTime getEndLocalTime() {
        return LocalTime.parse(endTime);
    }

    /**
     * Whether this window recurs on the given calendar date.
     */
    public boolean fallsOn(LocalDate date) {
        return dayOfWeek != null && dayOfWeek == toDayIndex(date.getDayOfWeek());
    }

    /**
     * Map java.time's Monday-first week to the 0 = Sunday index used by windows.
     */
    public static int toDayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }
}
