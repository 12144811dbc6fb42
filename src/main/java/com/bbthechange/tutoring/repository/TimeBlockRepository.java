package com.bbthechange.tutoring.repository;

import com.bbthechange.tutoring.model.TimeBlock;

import java.util.List;
import java.util.Optional;

/**
 * Repository for one-off periods in which a tutor is unavailable.
 */
public interface TimeBlockRepository {

    /**
     * Time blocks of a tutor that overlap [from, to).
     *
     * @param tutorId The tutor identifier
     * @param from range start, epoch millis
     * @param to range end, epoch millis
     * @return overlapping blocks ordered by start time
     */
    List<TimeBlock> findOverlapping(String tutorId, long from, long to);

    Optional<TimeBlock> findById(String tutorId, String blockId);

    TimeBlock save(TimeBlock timeBlock);

    void delete(String tutorId, String blockId);
}
