package com.vmcplatform.sampling.repository;

import com.vmcplatform.sampling.model.CodingBatch;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface CodingBatchRepository extends ReactiveCrudRepository<CodingBatch, Long> {

    Flux<CodingBatch> findByRecordingIdIn(Collection<Long> recordingIds);

    @Query("SELECT COALESCE(MAX(batch_group), 0) FROM coding_batch")
    Mono<Integer> findMaxBatchGroup();
}
