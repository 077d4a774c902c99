package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.UtteranceAnnotation;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface UtteranceAnnotationRepository extends ReactiveCrudRepository<UtteranceAnnotation, Long> {

    Mono<UtteranceAnnotation> findByDescription(String description);
}
