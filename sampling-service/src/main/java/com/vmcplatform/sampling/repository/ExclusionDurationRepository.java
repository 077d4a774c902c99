package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.ExclusionDuration;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ExclusionDurationRepository extends ReactiveCrudRepository<ExclusionDuration, Long> {

    Flux<ExclusionDuration> findByRecordingIdOrderByStartTime(Long recordingId);
}
