package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.UtteranceCoding;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface UtteranceCodingRepository extends ReactiveCrudRepository<UtteranceCoding, Long> {

    Mono<UtteranceCoding> findByUtteranceIdAndCoderId(Long utteranceId, Long coderId);
}
