package com.bbthechange.tutoring.dto;

import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * API view of a session.
 */
@Data
@NoArgsConstructor
public class SessionDTO {

    private String sessionId;
    private String subscriptionId;
    private String tutorId;
    private String parentId;
    private String studentName;
    private String courseId;
    private boolean trial;
    private Long scheduledAt;
    private Long endsAt;
    private Integer duration;
    private SessionStatus status;
    private String notes;

    public SessionDTO(Session session) {
        this.sessionId = session.getSessionId();
        this.subscriptionId = session.getSubscriptionId();
        this.tutorId = session.getTutorId();
        this.parentId = session.getParentId();
        this.studentName = session.getStudentName();
        this.courseId = session.getCourseId();
        this.trial = session.isTrialLesson();
        this.scheduledAt = session.getScheduledAt();
        this.endsAt = session.getOccupiedInterval().getEnd();
        this.duration = session.getDuration();
        this.status = session.getStatus();
        this.notes = session.getNotes();
    }
}
