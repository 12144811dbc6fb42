package com.bbthechange.tutoring.model;

import com.bbthechange.tutoring.util.TutoringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

import java.util.UUID;

/**
 * A booked one-on-one lesson.
 *
 * Key Pattern: PK = SESSION#{sessionId}, SK = METADATA
 * GSI TutorTimeIndex: gsi1pk = TUTOR#{tutorId}, sort = scheduledAt
 * GSI SubscriptionIndex: gsi2pk = SUBSCRIPTION#{subscriptionId}, sort = scheduledAt (absent for trials)
 */
@DynamoDbBean
public class Session extends BaseItem {

    public static final String ITEM_TYPE = "SESSION";

    private String sessionId;
    private String subscriptionId;  // null for trial lessons
    private String tutorId;
    private String parentId;
    private String studentName;
    private String courseId;        // set for trial lessons
    private Boolean trial;
    private Long scheduledAt;       // epoch millis
    private Integer duration;       // minutes
    private SessionStatus status;
    private String notes;

    // Default constructor for DynamoDB
    public Session() {
        super();
        setItemType(ITEM_TYPE);
        this.trial = false;
        this.status = SessionStatus.SCHEDULED;
    }

    public Session(String tutorId, String parentId, String subscriptionId, long scheduledAt, int duration) {
        this();
        this.sessionId = UUID.randomUUID().toString();
        this.tutorId = tutorId;
        this.parentId = parentId;
        this.subscriptionId = subscriptionId;
        this.scheduledAt = scheduledAt;
        this.duration = duration;

        setPk(TutoringKeyFactory.getSessionPk(sessionId));
        setSk(TutoringKeyFactory.getMetadataSk());
        setGsi1pk(TutoringKeyFactory.getTutorPk(tutorId));
        if (subscriptionId != null) {
            setGsi2pk(TutoringKeyFactory.getSubscriptionPk(subscriptionId));
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public String getTutorId() {
        return tutorId;
    }

    public void setTutorId(String tutorId) {
        this.tutorId = tutorId;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getStudentName() {
        return studentName;
    }

    public void setStudentName(String studentName) {
        this.studentName = studentName;
    }

    public String getCourseId() {
        return courseId;
    }

    public void setCourseId(String courseId) {
        this.courseId = courseId;
    }

    public Boolean getTrial() {
        return trial;
    }

    public void setTrial(Boolean trial) {
        this.trial = trial;
    }

    @DynamoDbSecondarySortKey(indexNames = {TutoringKeyFactory.TUTOR_TIME_INDEX, TutoringKeyFactory.SUBSCRIPTION_INDEX})
    public Long getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(Long scheduledAt) {
        this.scheduledAt = scheduledAt;
        touch();
    }

    public Integer getDuration() {
        return duration;
    }

    public void setDuration(Integer duration) {
        this.duration = duration;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public void setStatus(SessionStatus status) {
        this.status = status;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    /**
     * Move this session into a terminal status.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transitionTo(SessionStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalStateException("Session " + sessionId + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        touch();
    }

    @DynamoDbIgnore
    public Interval getOccupiedInterval() {
        return Interval.ofMinutes(scheduledAt, duration);
    }

    @DynamoDbIgnore
    public boolean isScheduled() {
        return status == SessionStatus.SCHEDULED;
    }

    public boolean occupiesTime() {
        return status != null && status.occupiesTime();
    }

    @DynamoDbIgnore
    public boolean isTrialLesson() {
        return Boolean.TRUE.equals(trial);
    }
}
