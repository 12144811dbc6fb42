package com.bbthechange.tutoring.service.impl;

import com.bbthechange.tutoring.dto.AvailabilityWindowDTO;
import com.bbthechange.tutoring.dto.AvailabilityWindowRequest;
import com.bbthechange.tutoring.dto.TimeBlockDTO;
import com.bbthechange.tutoring.dto.TimeBlockRequest;
import com.bbthechange.tutoring.exception.ResourceNotFoundException;
import com.bbthechange.tutoring.exception.UnauthorizedException;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.model.SchedulingRejection;
import com.bbthechange.tutoring.model.SchedulingResult;
import com.bbthechange.tutoring.model.TimeBlock;
import com.bbthechange.tutoring.repository.AvailabilityWindowRepository;
import com.bbthechange.tutoring.repository.TimeBlockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.bbthechange.tutoring.testutil.TestTimes.MONDAY;
import static com.bbthechange.tutoring.testutil.TestTimes.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceImplTest {

    @Mock
    private AvailabilityWindowRepository windowRepository;

    @Mock
    private TimeBlockRepository timeBlockRepository;

    @InjectMocks
    private AvailabilityServiceImpl availabilityService;

    private String tutorId;

    @BeforeEach
    void setUp() {
        tutorId = UUID.randomUUID().toString();
    }

    @Test
    void validWindowIsSaved() {
        when(windowRepository.save(any(AvailabilityWindow.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SchedulingResult<AvailabilityWindowDTO> result = availabilityService.createWindow(tutorId,
            new AvailabilityWindowRequest(1, "09:00", "11:00", null), tutorId);

        assertThat(result.getValue().getDayOfWeek()).isEqualTo(1);
        assertThat(result.getValue().isActive()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "7, 09:00, 11:00",
        "-1, 09:00, 11:00",
        "1, 11:00, 09:00",
        "1, 10:00, 10:00",
        "1, 9:00, 11:00",
        "1, 24:00, 24:30"
    })
    void malformedWindowIsRejected(int day, String start, String end) {
        SchedulingResult<AvailabilityWindowDTO> result = availabilityService.createWindow(tutorId,
            new AvailabilityWindowRequest(day, start, end, true), tutorId);

        assertThat(result.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.INVALID_WINDOW);
        verify(windowRepository, never()).save(any());
    }

    @Test
    void onlyTheTutorCanChangeAvailability() {
        assertThatThrownBy(() -> availabilityService.createWindow(tutorId,
            new AvailabilityWindowRequest(1, "09:00", "11:00", true), UUID.randomUUID().toString()))
            .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(windowRepository);
    }

    @Test
    void windowCanBeDeactivated() {
        AvailabilityWindow window = new AvailabilityWindow(tutorId, 1, "09:00", "11:00");
        when(windowRepository.findById(tutorId, window.getWindowId())).thenReturn(Optional.of(window));
        when(windowRepository.save(window)).thenReturn(window);

        SchedulingResult<AvailabilityWindowDTO> result = availabilityService.updateWindow(tutorId, window.getWindowId(),
            new AvailabilityWindowRequest(2, "13:00", "15:00", false), tutorId);

        assertThat(result.getValue().isActive()).isFalse();
        assertThat(window.getDayOfWeek()).isEqualTo(2);
        assertThat(window.getStartTime()).isEqualTo("13:00");
    }

    @Test
    void deletingMissingWindowRaisesNotFound() {
        String windowId = UUID.randomUUID().toString();
        when(windowRepository.findById(tutorId, windowId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> availabilityService.deleteWindow(tutorId, windowId, tutorId))
            .isInstanceOf(ResourceNotFoundException.class);
        verify(windowRepository, never()).delete(anyString(), anyString());
    }

    @Test
    void timeBlockOverlappingAnotherIsRejected() {
        TimeBlock existing = new TimeBlock(tutorId, at(MONDAY, 9, 0), at(MONDAY, 12, 0), "Conference");
        when(timeBlockRepository.findOverlapping(tutorId, at(MONDAY, 11, 0), at(MONDAY, 13, 0)))
            .thenReturn(List.of(existing));

        SchedulingResult<TimeBlockDTO> result = availabilityService.createTimeBlock(tutorId,
            new TimeBlockRequest(at(MONDAY, 11, 0), at(MONDAY, 13, 0), null), tutorId);

        assertThat(result.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.INVALID_WINDOW);
        verify(timeBlockRepository, never()).save(any());
    }

    @Test
    void timeBlockEndingBeforeItStartsIsRejected() {
        SchedulingResult<TimeBlockDTO> result = availabilityService.createTimeBlock(tutorId,
            new TimeBlockRequest(at(MONDAY, 13, 0), at(MONDAY, 11, 0), null), tutorId);

        assertThat(result.getRejection().getReason()).isEqualTo(SchedulingRejection.Reason.INVALID_WINDOW);
        verifyNoInteractions(timeBlockRepository);
    }

    @Test
    void freeTimeBlockIsSaved() {
        when(timeBlockRepository.findOverlapping(tutorId, at(MONDAY, 9, 0), at(MONDAY, 10, 0))).thenReturn(List.of());
        when(timeBlockRepository.save(any(TimeBlock.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SchedulingResult<TimeBlockDTO> result = availabilityService.createTimeBlock(tutorId,
            new TimeBlockRequest(at(MONDAY, 9, 0), at(MONDAY, 10, 0), "Doctor"), tutorId);

        assertThat(result.getValue().getReason()).isEqualTo("Doctor");
        assertThat(result.getValue().getTutorId()).isEqualTo(tutorId);
    }
}
