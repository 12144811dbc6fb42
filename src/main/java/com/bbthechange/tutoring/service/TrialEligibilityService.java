package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.dto.TrialEligibilityDTO;
import com.bbthechange.tutoring.repository.TrialConsumption;

/**
 * Caps the number of trial lessons a parent can book.
 */
public interface TrialEligibilityService {

    /**
     * Whether the parent may book another trial. The cap applies across all
     * courses; courseId is accepted for callers that have one and does not
     * change the answer.
     */
    TrialEligibilityDTO checkEligibility(String parentId, String courseId);

    /**
     * Count the trial lesson {@code sessionId} against the parent's cap.
     * Call only after the trial session is committed. Calling again for the
     * same session id does not count it twice. When another trial filled the
     * last place in the meantime this returns LIMIT_REACHED and the caller
     * must release the session it committed.
     */
    TrialConsumption consumeTrial(String parentId, String sessionId);
}
