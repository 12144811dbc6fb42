package com.bbthechange.tutoring.model;

import com.bbthechange.tutoring.util.TutoringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * Anchor of a recurring series. Its non-cancelled sessions form the series.
 * Created by the enrolment flow; the booking engine only reads it.
 *
 * Key Pattern: PK = SUBSCRIPTION#{subscriptionId}, SK = METADATA
 */
@DynamoDbBean
public class Subscription extends BaseItem {

    public static final String ITEM_TYPE = "SUBSCRIPTION";

    private String subscriptionId;
    private String tutorId;
    private String parentId;
    private Integer totalSessions;
    private Integer sessionsPerWeek;

    public Subscription() {
        super();
        setItemType(ITEM_TYPE);
    }

    public Subscription(String tutorId, String parentId, int totalSessions, int sessionsPerWeek) {
        this();
        this.subscriptionId = UUID.randomUUID().toString();
        this.tutorId = tutorId;
        this.parentId = parentId;
        this.totalSessions = totalSessions;
        this.sessionsPerWeek = sessionsPerWeek;

        setPk(TutoringKeyFactory.getSubscriptionPk(subscriptionId));
        setSk(TutoringKeyFactory.getMetadataSk());
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

    public Integer getTotalSessions() {
        return totalSessions;
    }

    public void setTotalSessions(Integer totalSessions) {
        this.totalSessions = totalSessions;
    }

    public Integer getSessionsPerWeek() {
        return sessionsPerWeek;
    }

    public void setSessionsPerWeek(Integer sessionsPerWeek) {
        this.sessionsPerWeek = sessionsPerWeek;
    }
}
