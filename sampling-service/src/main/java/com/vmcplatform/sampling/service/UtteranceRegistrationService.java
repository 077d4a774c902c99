package com.vmcplatform.sampling.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.VocalEvent;
import com.vmcplatform.common.selection.AssignedUtterance;
import com.vmcplatform.common.selection.UtteranceAssigner;
import com.vmcplatform.sampling.model.Segment;
import com.vmcplatform.sampling.model.Utterance;
import com.vmcplatform.sampling.repository.SegmentRepository;
import com.vmcplatform.sampling.repository.UtteranceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns provider vocal events into utterance rows under the recording's selected segments.
 * Registration runs once per recording.
 */
@Service
public class UtteranceRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(UtteranceRegistrationService.class);

    private final SegmentRepository segmentRepository;
    private final UtteranceRepository utteranceRepository;

    public UtteranceRegistrationService(SegmentRepository segmentRepository,
                                        UtteranceRepository utteranceRepository) {
        this.segmentRepository   = segmentRepository;
        this.utteranceRepository = utteranceRepository;
    }

    /**
     * @return number of utterances created; 0 when the recording was registered before
     */
    @Transactional
    public Mono<Integer> registerUtterances(long recordingId, List<VocalEvent> events) {
        return segmentRepository.findSelectedByRecordingId(recordingId)
            .map(Segment::toCandidate)
            .collectList()
            .flatMap(selected -> {
                if (selected.isEmpty()) {
                    return Mono.error(new InputGuardException("registerUtterances",
                        "no selected segments for recording " + recordingId));
                }
                return utteranceRepository.countByRecordingId(recordingId)
                    .flatMap(existing -> {
                        if (existing > 0) {
                            log.info("Utterances already registered. recordingId={} existing={}",
                                     recordingId, existing);
                            return Mono.just(0);
                        }
                        List<AssignedUtterance> assigned = UtteranceAssigner.assign(selected, events);
                        return Flux.fromIterable(assigned)
                            .map(UtteranceRegistrationService::toEntity)
                            .concatMap(utteranceRepository::save)
                            .count()
                            .map(Long::intValue);
                    });
            })
            .doOnSuccess(n -> log.info("Utterances registered. recordingId={} events={} created={}",
                                       recordingId, events.size(), n))
            .doOnError(e -> log.error("Utterance registration failed. recordingId={}", recordingId, e));
    }

    private static Utterance toEntity(AssignedUtterance a) {
        Utterance u = new Utterance();
        u.setSegmentId(a.segmentId());
        u.setStartTimeInSeconds(a.startSeconds());
        u.setEndTimeInSeconds(a.endSeconds());
        u.setDurationInSeconds(a.durationSeconds());
        u.setMinimumPitch(a.minimumPitch());
        u.setMaximumPitch(a.maximumPitch());
        u.setAveragePitch(a.averagePitch());
        u.setPitchRange(a.pitchRange());
        return u;
    }
}
