package com.bbthechange.tutoring.controller;

import com.bbthechange.tutoring.dto.*;
import com.bbthechange.tutoring.service.BookingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for booking, rescheduling and cancelling sessions.
 *
 * Rejected bookings come back with the status of their rejection reason
 * (409 for slot and race conflicts, 422 for policy refusals, 400 for bad windows)
 * and a body of {@code {"error": REASON, "message": ...}}.
 */
@RestController
@RequestMapping("/sessions")
@Validated
@Tag(name = "Sessions", description = "Lesson booking and schedule changes")
public class BookingController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BookingController.class);

    private final BookingService bookingService;

    @Autowired
    public BookingController(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    /**
     * Book a single lesson of a subscription.
     * POST /sessions
     */
    @PostMapping
    @Operation(summary = "Book a lesson", description = "Books one lesson of the caller's subscription at the requested time.")
    public ResponseEntity<Object> bookSession(@Valid @RequestBody BookSessionRequest request,
                                              HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Booking session with tutor {} at {} for parent {}", request.getTutorId(), request.getScheduledAt(), userId);
        return toResponse(bookingService.bookSession(request, userId), HttpStatus.CREATED);
    }

    /**
     * Book a trial lesson.
     * POST /sessions/trial
     */
    @PostMapping("/trial")
    @Operation(summary = "Book a trial lesson", description = "Books a trial lesson if the caller has trials left.")
    public ResponseEntity<Object> bookTrial(@Valid @RequestBody BookTrialRequest request,
                                            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Booking trial with tutor {} for parent {}", request.getTutorId(), userId);
        return toResponse(bookingService.bookTrial(request, userId), HttpStatus.CREATED);
    }

    /**
     * Book a recurring series.
     * POST /sessions/recurring
     */
    @PostMapping("/recurring")
    @Operation(summary = "Book a recurring series",
               description = "Books every occurrence of a weekly or biweekly series, or none of them.")
    public ResponseEntity<Object> bookRecurring(@Valid @RequestBody BookRecurringRequest request,
                                                HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Booking {} {} sessions of subscription {} for parent {}",
            request.getCount(), request.getFrequency(), request.getSubscriptionId(), userId);
        return toResponse(bookingService.bookRecurring(request, userId), HttpStatus.CREATED);
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get a session")
    public ResponseEntity<SessionDTO> getSession(
            @Parameter(description = "Session ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid session ID format") String sessionId,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(bookingService.getSession(sessionId, userId));
    }

    /**
     * Move one session.
     * PUT /sessions/{sessionId}/schedule
     */
    @PutMapping("/{sessionId}/schedule")
    @Operation(summary = "Reschedule a session",
               description = "Moves a scheduled session to a new free slot. Not allowed inside the minimum notice window.")
    public ResponseEntity<Object> rescheduleSession(
            @Parameter(description = "Session ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid session ID format") String sessionId,
            @Valid @RequestBody RescheduleSessionRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Rescheduling session {} to {} by parent {}", sessionId, request.getNewScheduledAt(), userId);
        return toResponse(bookingService.rescheduleSession(sessionId, request.getNewScheduledAt(), userId), HttpStatus.OK);
    }

    /**
     * Cancel one session.
     * POST /sessions/{sessionId}/cancel
     */
    @PostMapping("/{sessionId}/cancel")
    @Operation(summary = "Cancel a session", description = "Cancels a scheduled session outside the minimum notice window.")
    public ResponseEntity<Object> cancelSession(
            @Parameter(description = "Session ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid session ID format") String sessionId,
            @Valid @RequestBody(required = false) CancelRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        String reason = request != null ? request.getReason() : null;
        logger.info("Cancelling session {} by parent {}", sessionId, userId);
        return toResponse(bookingService.cancelSession(sessionId, reason, userId), HttpStatus.OK);
    }

    /**
     * Tutor marks a session completed or no-show.
     * PUT /sessions/{sessionId}/status
     */
    @PutMapping("/{sessionId}/status")
    @Operation(summary = "Record session outcome", description = "Tutor marks a started session COMPLETED or NO_SHOW.")
    public ResponseEntity<Object> updateStatus(
            @Parameter(description = "Session ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid session ID format") String sessionId,
            @Valid @RequestBody UpdateSessionStatusRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Tutor {} marking session {} as {}", userId, sessionId, request.getStatus());
        return toResponse(bookingService.updateSessionStatus(sessionId, request.getStatus(), userId), HttpStatus.OK);
    }

    @GetMapping("/series/{subscriptionId}")
    @Operation(summary = "Get the sessions of a series")
    public ResponseEntity<List<SessionDTO>> getSeries(
            @Parameter(description = "Subscription ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid subscription ID format") String subscriptionId,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(bookingService.getSeries(subscriptionId, userId));
    }

    /**
     * Move a whole series to a new anchor date.
     * PUT /sessions/series/{subscriptionId}/schedule
     */
    @PutMapping("/series/{subscriptionId}/schedule")
    @Operation(summary = "Reschedule a series",
               description = "Moves every scheduled session of the series, or none if any occurrence does not fit.")
    public ResponseEntity<Object> rescheduleSeries(
            @Parameter(description = "Subscription ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid subscription ID format") String subscriptionId,
            @Valid @RequestBody RescheduleSeriesRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        logger.info("Rescheduling series {} to anchor {} ({}) by parent {}",
            subscriptionId, request.getNewAnchorDate(), request.getFrequency(), userId);
        return toResponse(bookingService.rescheduleSeries(subscriptionId, request.getNewAnchorDate(),
            request.getFrequency(), userId), HttpStatus.OK);
    }

    @PostMapping("/series/{subscriptionId}/cancel")
    @Operation(summary = "Cancel a series", description = "Cancels every scheduled session of the series.")
    public ResponseEntity<Object> cancelSeries(
            @Parameter(description = "Subscription ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid subscription ID format") String subscriptionId,
            @Valid @RequestBody(required = false) CancelRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        String reason = request != null ? request.getReason() : null;
        logger.info("Cancelling series {} by parent {}", subscriptionId, userId);
        return toResponse(bookingService.cancelSeries(subscriptionId, reason, userId), HttpStatus.OK);
    }
}
