package com.bbthechange.tutoring.controller;

import com.bbthechange.tutoring.dto.*;
import com.bbthechange.tutoring.service.AvailabilityService;
import com.bbthechange.tutoring.service.BookingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
 * REST controller for a tutor's availability: recurring windows, one-off
 * time blocks, the bookable-slot preview and the schedule consistency check.
 *
 * Reads are open to any caller; changes are limited to the tutor.
 */
@RestController
@RequestMapping("/tutors/{tutorId}")
@Validated
@Tag(name = "Availability", description = "Tutor availability and bookable slots")
public class AvailabilityController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityController.class);

    private final AvailabilityService availabilityService;
    private final BookingService bookingService;

    @Autowired
    public AvailabilityController(AvailabilityService availabilityService, BookingService bookingService) {
        this.availabilityService = availabilityService;
        this.bookingService = bookingService;
    }

    @GetMapping("/windows")
    @Operation(summary = "List availability windows")
    public ResponseEntity<List<AvailabilityWindowDTO>> getWindows(
            @Parameter(description = "Tutor ID")
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId) {
        return ResponseEntity.ok(availabilityService.getWindows(tutorId));
    }

    @PostMapping("/windows")
    @Operation(summary = "Add an availability window", description = "Adds a recurring weekly window. Tutor only.")
    public ResponseEntity<Object> createWindow(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @Valid @RequestBody AvailabilityWindowRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return toResponse(availabilityService.createWindow(tutorId, request, userId), HttpStatus.CREATED);
    }

    @PutMapping("/windows/{windowId}")
    @Operation(summary = "Update an availability window", description = "Existing bookings are not affected.")
    public ResponseEntity<Object> updateWindow(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid window ID format") String windowId,
            @Valid @RequestBody AvailabilityWindowRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return toResponse(availabilityService.updateWindow(tutorId, windowId, request, userId), HttpStatus.OK);
    }

    @DeleteMapping("/windows/{windowId}")
    @Operation(summary = "Delete an availability window")
    public ResponseEntity<Void> deleteWindow(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid window ID format") String windowId,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        availabilityService.deleteWindow(tutorId, windowId, userId);
        logger.info("Tutor {} deleted availability window {}", tutorId, windowId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/blocks")
    @Operation(summary = "List time blocks overlapping a range")
    public ResponseEntity<List<TimeBlockDTO>> getTimeBlocks(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @Parameter(description = "Range start, epoch millis") @RequestParam long from,
            @Parameter(description = "Range end, epoch millis") @RequestParam long to) {
        return ResponseEntity.ok(availabilityService.getTimeBlocks(tutorId, from, to));
    }

    @PostMapping("/blocks")
    @Operation(summary = "Block out a period", description = "Adds a one-off period in which the tutor cannot be booked.")
    public ResponseEntity<Object> createTimeBlock(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @Valid @RequestBody TimeBlockRequest request,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return toResponse(availabilityService.createTimeBlock(tutorId, request, userId), HttpStatus.CREATED);
    }

    @DeleteMapping("/blocks/{blockId}")
    @Operation(summary = "Delete a time block")
    public ResponseEntity<Void> deleteTimeBlock(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid block ID format") String blockId,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        availabilityService.deleteTimeBlock(tutorId, blockId, userId);
        logger.info("Tutor {} deleted time block {}", tutorId, blockId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Bookable start times in [from, to).
     * GET /tutors/{tutorId}/slots?from=...&to=...&durationMinutes=60
     */
    @GetMapping("/slots")
    @Operation(summary = "Preview bookable slots",
               description = "Lists start times inside the tutor's windows that are free of bookings and time blocks.")
    public ResponseEntity<AvailableSlotsDTO> getAvailableSlots(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @Parameter(description = "Horizon start, epoch millis") @RequestParam long from,
            @Parameter(description = "Horizon end, epoch millis") @RequestParam long to,
            @Parameter(description = "Lesson length in minutes")
            @RequestParam(defaultValue = "60") @Min(15) @Max(240) int durationMinutes) {
        return ResponseEntity.ok(bookingService.getAvailableSlots(tutorId, from, to, durationMinutes));
    }

    @GetMapping("/schedule-conflicts")
    @Operation(summary = "Check schedule consistency", description = "Lists pairs of booked sessions that overlap. Tutor only.")
    public ResponseEntity<List<ScheduleConflictDTO>> getScheduleConflicts(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid tutor ID format") String tutorId,
            @RequestParam long from,
            @RequestParam long to,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(bookingService.findScheduleConflicts(tutorId, from, to, userId));
    }
}
