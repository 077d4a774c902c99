package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.Recording;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface RecordingRepository extends ReactiveCrudRepository<Recording, Long> {

    /**
     * Row lock held until the surrounding transaction ends. Serializes segment selection
     * per recording so two concurrent calls cannot both see "nothing selected yet".
     */
    @Query("SELECT * FROM recording WHERE id = :id FOR UPDATE")
    Mono<Recording> lockById(Long id);
}
