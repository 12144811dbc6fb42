package com.bbthechange.tutoring.testutil;

import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionStatus;

import java.util.UUID;

public class SessionTestBuilder {

    private String tutorId;
    private String parentId;
    private String subscriptionId;
    private long scheduledAt;
    private int duration;
    private SessionStatus status;
    private boolean trial;

    private SessionTestBuilder() {
        // Default values
        this.tutorId = UUID.randomUUID().toString();
        this.parentId = UUID.randomUUID().toString();
        this.duration = 60;
        this.status = SessionStatus.SCHEDULED;
    }

    public static SessionTestBuilder aSession() {
        return new SessionTestBuilder();
    }

    public SessionTestBuilder withTutor(String tutorId) {
        this.tutorId = tutorId;
        return this;
    }

    public SessionTestBuilder withParent(String parentId) {
        this.parentId = parentId;
        return this;
    }

    public SessionTestBuilder inSubscription(String subscriptionId) {
        this.subscriptionId = subscriptionId;
        return this;
    }

    public SessionTestBuilder at(long scheduledAt) {
        this.scheduledAt = scheduledAt;
        return this;
    }

    public SessionTestBuilder lasting(int minutes) {
        this.duration = minutes;
        return this;
    }

    public SessionTestBuilder withStatus(SessionStatus status) {
        this.status = status;
        return this;
    }

    public SessionTestBuilder asTrial() {
        this.trial = true;
        return this;
    }

    public Session build() {
        Session session = new Session(tutorId, parentId, subscriptionId, scheduledAt, duration);
        session.setStatus(status);
        session.setTrial(trial);
        return session;
    }
}
