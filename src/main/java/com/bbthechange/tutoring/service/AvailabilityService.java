package com.bbthechange.tutoring.service;

import com.bbthechange.tutoring.dto.AvailabilityWindowDTO;
import com.bbthechange.tutoring.dto.AvailabilityWindowRequest;
import com.bbthechange.tutoring.dto.TimeBlockDTO;
import com.bbthechange.tutoring.dto.TimeBlockRequest;
import com.bbthechange.tutoring.model.SchedulingResult;

import java.util.List;

/**
 * Tutor-facing management of recurring availability windows and one-off time blocks.
 * Only the tutor may change their own availability.
 */
public interface AvailabilityService {

    List<AvailabilityWindowDTO> getWindows(String tutorId);

    /**
     * @return the created window, or INVALID_WINDOW if the day or times are malformed
     */
    SchedulingResult<AvailabilityWindowDTO> createWindow(String tutorId, AvailabilityWindowRequest request, String userId);

    SchedulingResult<AvailabilityWindowDTO> updateWindow(String tutorId, String windowId,
                                                         AvailabilityWindowRequest request, String userId);

    void deleteWindow(String tutorId, String windowId, String userId);

    List<TimeBlockDTO> getTimeBlocks(String tutorId, long from, long to);

    /**
     * @return the created block, or INVALID_WINDOW if it ends before it starts or overlaps another block
     */
    SchedulingResult<TimeBlockDTO> createTimeBlock(String tutorId, TimeBlockRequest request, String userId);

    void deleteTimeBlock(String tutorId, String blockId, String userId);
}
