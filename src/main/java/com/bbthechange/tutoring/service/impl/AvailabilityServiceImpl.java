package com.bbthechange.tutoring.service.impl;

import com.bbthechange.tutoring.dto.AvailabilityWindowDTO;
import com.bbthechange.tutoring.dto.AvailabilityWindowRequest;
import com.bbthechange.tutoring.dto.TimeBlockDTO;
import com.bbthechange.tutoring.dto.TimeBlockRequest;
import com.bbthechange.tutoring.exception.ResourceNotFoundException;
import com.bbthechange.tutoring.exception.UnauthorizedException;
import com.bbthechange.tutoring.exception.ValidationException;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.model.SchedulingRejection;
import com.bbthechange.tutoring.model.SchedulingResult;
import com.bbthechange.tutoring.model.TimeBlock;
import com.bbthechange.tutoring.repository.AvailabilityWindowRepository;
import com.bbthechange.tutoring.repository.TimeBlockRepository;
import com.bbthechange.tutoring.service.AvailabilityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Implementation of AvailabilityService.
 *
 * Windows must name a day 0..6 and two "HH:mm" times with start before end.
 * Time blocks must end after they start and may not overlap another block of
 * the same tutor. Both failures are INVALID_WINDOW rejections. Changing
 * availability never touches sessions that are already booked.
 */
@Service
public class AvailabilityServiceImpl implements AvailabilityService {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityServiceImpl.class);

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private final AvailabilityWindowRepository windowRepository;
    private final TimeBlockRepository timeBlockRepository;

    @Autowired
    public AvailabilityServiceImpl(AvailabilityWindowRepository windowRepository,
                                   TimeBlockRepository timeBlockRepository) {
        this.windowRepository = windowRepository;
        this.timeBlockRepository = timeBlockRepository;
    }

    @Override
    public List<AvailabilityWindowDTO> getWindows(String tutorId) {
        return windowRepository.findByTutorId(tutorId).stream()
            .sorted(Comparator.comparing(AvailabilityWindow::getDayOfWeek)
                .thenComparing(AvailabilityWindow::getStartTime))
            .map(AvailabilityWindowDTO::new)
            .collect(Collectors.toList());
    }

    @Override
    public SchedulingResult<AvailabilityWindowDTO> createWindow(String tutorId, AvailabilityWindowRequest request,
                                                                String userId) {
        verifyTutor(tutorId, userId);

        Optional<SchedulingRejection> invalid = validateWindow(request);
        if (invalid.isPresent()) {
            logger.warn("Rejected availability window for tutor {}: {}", tutorId, invalid.get().getMessage());
            return SchedulingResult.rejected(invalid.get());
        }

        AvailabilityWindow window = new AvailabilityWindow(tutorId, request.getDayOfWeek(),
            request.getStartTime(), request.getEndTime());
        if (request.getActive() != null) {
            window.setActive(request.getActive());
        }

        AvailabilityWindow saved = windowRepository.save(window);
        logger.info("Tutor {} added availability day {} {}-{}", tutorId,
            saved.getDayOfWeek(), saved.getStartTime(), saved.getEndTime());
        return SchedulingResult.success(new AvailabilityWindowDTO(saved));
    }

    @Override
    public SchedulingResult<AvailabilityWindowDTO> updateWindow(String tutorId, String windowId,
                                                                AvailabilityWindowRequest request, String userId) {
        verifyTutor(tutorId, userId);

        AvailabilityWindow window = windowRepository.findById(tutorId, windowId)
            .orElseThrow(() -> new ResourceNotFoundException("Availability window not found: " + windowId));

        Optional<SchedulingRejection> invalid = validateWindow(request);
        if (invalid.isPresent()) {
            logger.warn("Rejected update of window {} for tutor {}: {}", windowId, tutorId, invalid.get().getMessage());
            return SchedulingResult.rejected(invalid.get());
        }

        window.setDayOfWeek(request.getDayOfWeek());
        window.setStartTime(request.getStartTime());
        window.setEndTime(request.getEndTime());
        if (request.getActive() != null) {
            window.setActive(request.getActive());
        }

        AvailabilityWindow saved = windowRepository.save(window);
        logger.info("Tutor {} updated availability window {}", tutorId, windowId);
        return SchedulingResult.success(new AvailabilityWindowDTO(saved));
    }

    @Override
    public void deleteWindow(String tutorId, String windowId, String userId) {
        verifyTutor(tutorId, userId);
        if (windowRepository.findById(tutorId, windowId).isEmpty()) {
            throw new ResourceNotFoundException("Availability window not found: " + windowId);
        }
        windowRepository.delete(tutorId, windowId);
    }

    @Override
    public List<TimeBlockDTO> getTimeBlocks(String tutorId, long from, long to) {
        if (to <= from) {
            throw new ValidationException("Range end must be after range start");
        }
        return timeBlockRepository.findOverlapping(tutorId, from, to).stream()
            .map(TimeBlockDTO::new)
            .collect(Collectors.toList());
    }

    @Override
    public SchedulingResult<TimeBlockDTO> createTimeBlock(String tutorId, TimeBlockRequest request, String userId) {
        verifyTutor(tutorId, userId);

        if (request.getEndTime() <= request.getStartTime()) {
            return rejectBlock(tutorId, "End time must be after start time");
        }
        if (!timeBlockRepository.findOverlapping(tutorId, request.getStartTime(), request.getEndTime()).isEmpty()) {
            return rejectBlock(tutorId, "Time block overlaps an existing time block");
        }

        TimeBlock saved = timeBlockRepository.save(
            new TimeBlock(tutorId, request.getStartTime(), request.getEndTime(), request.getReason()));
        logger.info("Tutor {} blocked {} to {}", tutorId, saved.getStartTime(), saved.getEndTime());
        return SchedulingResult.success(new TimeBlockDTO(saved));
    }

    @Override
    public void deleteTimeBlock(String tutorId, String blockId, String userId) {
        verifyTutor(tutorId, userId);
        if (timeBlockRepository.findById(tutorId, blockId).isEmpty()) {
            throw new ResourceNotFoundException("Time block not found: " + blockId);
        }
        timeBlockRepository.delete(tutorId, blockId);
    }

    static Optional<SchedulingRejection> validateWindow(AvailabilityWindowRequest request) {
        Integer day = request.getDayOfWeek();
        if (day == null || day < 0 || day > 6) {
            return invalidWindow("Day of week must be between 0 (Sunday) and 6 (Saturday)");
        }
        if (!isValidTime(request.getStartTime()) || !isValidTime(request.getEndTime())) {
            return invalidWindow("Times must use HH:mm format");
        }
        if (!LocalTime.parse(request.getStartTime()).isBefore(LocalTime.parse(request.getEndTime()))) {
            return invalidWindow("End time must be after start time");
        }
        return Optional.empty();
    }

    private static boolean isValidTime(String time) {
        return time != null && TIME_PATTERN.matcher(time).matches();
    }

    private static Optional<SchedulingRejection> invalidWindow(String message) {
        return Optional.of(SchedulingRejection.of(SchedulingRejection.Reason.INVALID_WINDOW, message));
    }

    private SchedulingResult<TimeBlockDTO> rejectBlock(String tutorId, String message) {
        logger.warn("Rejected time block for tutor {}: {}", tutorId, message);
        return SchedulingResult.rejected(SchedulingRejection.Reason.INVALID_WINDOW, message);
    }

    private void verifyTutor(String tutorId, String userId) {
        if (!tutorId.equals(userId)) {
            throw new UnauthorizedException("Only the tutor can change their availability");
        }
    }
}
