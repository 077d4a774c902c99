package com.vmcplatform.sampling.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.exclusion.ExclusionWindowParser;
import com.vmcplatform.common.model.TimeWindow;
import com.vmcplatform.sampling.dto.ExclusionRequest;
import com.vmcplatform.sampling.dto.ExclusionWindowDTO;
import com.vmcplatform.sampling.model.ExclusionCategory;
import com.vmcplatform.sampling.model.ExclusionDuration;
import com.vmcplatform.sampling.model.Recording;
import com.vmcplatform.sampling.repository.ExclusionDurationRepository;
import com.vmcplatform.sampling.repository.RecordingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Stores nap and scrub windows entered by lab staff. Windows are read back by segment selection.
 */
@Service
public class ExclusionService {

    private static final Logger log = LoggerFactory.getLogger(ExclusionService.class);

    private final ExclusionDurationRepository exclusionRepository;
    private final RecordingRepository recordingRepository;

    public ExclusionService(ExclusionDurationRepository exclusionRepository,
                            RecordingRepository recordingRepository) {
        this.exclusionRepository = exclusionRepository;
        this.recordingRepository = recordingRepository;
    }

    @Transactional
    public Flux<ExclusionWindowDTO> addExclusions(long recordingId, ExclusionRequest request) {
        return Mono.fromCallable(() -> parseCategory(request.category()))
            .zipWith(recordingRepository.findById(recordingId)
                .switchIfEmpty(Mono.error(() ->
                    new InputGuardException("addExclusions", "unknown recording " + recordingId))))
            .flatMapMany(t -> {
                ExclusionCategory category = t.getT1();
                List<TimeWindow> windows = ExclusionWindowParser.parse(recordingDay(t.getT2()), request.windows());
                log.info("Storing exclusions. recordingId={} category={} windows={}",
                         recordingId, category, windows.size());
                return Flux.fromIterable(windows)
                    .map(w -> toEntity(recordingId, category, w))
                    .concatMap(exclusionRepository::save);
            })
            .map(ExclusionService::toDto)
            .doOnError(e -> log.error("Failed to store exclusions. recordingId={}", recordingId, e));
    }

    public Flux<ExclusionWindowDTO> findExclusions(long recordingId) {
        return exclusionRepository.findByRecordingIdOrderByStartTime(recordingId).map(ExclusionService::toDto);
    }

    public Mono<List<TimeWindow>> windowsFor(long recordingId) {
        return exclusionRepository.findByRecordingIdOrderByStartTime(recordingId)
            .map(e -> new TimeWindow(e.getStartTime(), e.getEndTime()))
            .collectList();
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static ExclusionCategory parseCategory(String raw) {
        if (raw == null) {
            throw new InputGuardException("addExclusions", "category is required");
        }
        try {
            return ExclusionCategory.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InputGuardException("addExclusions", "unknown category '" + raw + "'", e);
        }
    }

    private static LocalDate recordingDay(Recording recording) {
        if (recording.getRecordingDate() != null) {
            return recording.getRecordingDate();
        }
        if (recording.getStartTime() != null) {
            return recording.getStartTime().toLocalDate();
        }
        throw new InputGuardException("addExclusions", "recording " + recording.getId() + " has no date");
    }

    private static ExclusionDuration toEntity(long recordingId, ExclusionCategory category, TimeWindow window) {
        ExclusionDuration entity = new ExclusionDuration();
        entity.setRecordingId(recordingId);
        entity.setCategory(category.name());
        entity.setStartTime(window.start());
        entity.setEndTime(window.end());
        return entity;
    }

    private static ExclusionWindowDTO toDto(ExclusionDuration e) {
        return new ExclusionWindowDTO(e.getId(), e.getCategory(), e.getStartTime(), e.getEndTime());
    }
}
