package com.bbthechange.tutoring.repository;

import com.bbthechange.tutoring.model.AvailabilityWindow;

import java.util.List;
import java.util.Optional;

/**
 * Repository for a tutor's recurring availability windows in the TutoringTable.
 */
public interface AvailabilityWindowRepository {

    /**
     * All windows of a tutor, active and inactive.
     *
     * @param tutorId The tutor identifier
     * @return windows in sort-key order; empty if the tutor has none
     */
    List<AvailabilityWindow> findByTutorId(String tutorId);

    Optional<AvailabilityWindow> findById(String tutorId, String windowId);

    /**
     * Create or replace a window.
     */
    AvailabilityWindow save(AvailabilityWindow window);

    /**
     * Delete a window. Succeeds even if the window does not exist.
     */
    void delete(String tutorId, String windowId);
}
