package com.vmcplatform.sampling.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.sampling.dto.ExclusionRequest;
import com.vmcplatform.sampling.dto.ExclusionWindowDTO;
import com.vmcplatform.sampling.model.ExclusionDuration;
import com.vmcplatform.sampling.model.Recording;
import com.vmcplatform.sampling.repository.ExclusionDurationRepository;
import com.vmcplatform.sampling.repository.RecordingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExclusionServiceTest {

    @Mock private ExclusionDurationRepository exclusionRepository;
    @Mock private RecordingRepository recordingRepository;

    private ExclusionService service;

    @BeforeEach
    void setUp() {
        service = new ExclusionService(exclusionRepository, recordingRepository);
    }

    private static Recording recording() {
        Recording r = new Recording();
        r.setId(8L);
        r.setRecordingDate(LocalDate.of(2022, 3, 14));
        return r;
    }

    @Test
    @DisplayName("clock ranges are stored as absolute windows on the recording date")
    void storesWindows() {
        when(recordingRepository.findById(8L)).thenReturn(Mono.just(recording()));
        when(exclusionRepository.save(any(ExclusionDuration.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        List<ExclusionWindowDTO> stored = service
            .addExclusions(8L, new ExclusionRequest("nap", "1:30 PM - 3:00 PM, 11:30 PM - 12:15 AM"))
            .collectList()
            .block();

        assertEquals(2, stored.size());
        assertEquals("NAP", stored.get(0).category());
        assertEquals(LocalDateTime.of(2022, 3, 14, 13, 30), stored.get(0).startTime());
        assertEquals(LocalDateTime.of(2022, 3, 15, 0, 15), stored.get(1).endTime());
    }

    @Test
    @DisplayName("unknown category is rejected")
    void unknownCategory() {
        when(recordingRepository.findById(8L)).thenReturn(Mono.just(recording()));

        assertThrows(InputGuardException.class,
            () -> service.addExclusions(8L, new ExclusionRequest("holiday", "1:30 PM - 3:00 PM")).blockLast());
        verify(exclusionRepository, never()).save(any());
    }

    @Test
    @DisplayName("malformed ranges store nothing")
    void malformed() {
        when(recordingRepository.findById(8L)).thenReturn(Mono.just(recording()));

        assertThrows(InputGuardException.class,
            () -> service.addExclusions(8L, new ExclusionRequest("SCRUB", "1:30 PM to 3:00 PM")).blockLast());
        verify(exclusionRepository, never()).save(any());
    }

    @Test
    @DisplayName("unknown recording is rejected")
    void unknownRecording() {
        when(recordingRepository.findById(8L)).thenReturn(Mono.empty());

        assertThrows(InputGuardException.class,
            () -> service.addExclusions(8L, new ExclusionRequest("NAP", "1:30 PM - 3:00 PM")).blockLast());
    }
}
