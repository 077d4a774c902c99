package com.vmcplatform.sampling.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.sampling.model.CodingBatch;
import com.vmcplatform.sampling.model.Recording;
import com.vmcplatform.sampling.repository.CodingBatchRepository;
import com.vmcplatform.sampling.repository.RecordingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups recordings into a sampling round. Groups step by {@value #GROUP_STEP}, starting at
 * {@value #GROUP_STEP}; a recording belongs to at most one group.
 */
@Service
public class CodingBatchService {

    private static final Logger log = LoggerFactory.getLogger(CodingBatchService.class);

    static final int GROUP_STEP = 100;

    private final CodingBatchRepository batchRepository;
    private final RecordingRepository recordingRepository;

    public CodingBatchService(CodingBatchRepository batchRepository, RecordingRepository recordingRepository) {
        this.batchRepository     = batchRepository;
        this.recordingRepository = recordingRepository;
    }

    /**
     * @return the new batch group, or empty when any of the recordings is already batched
     */
    @Transactional
    public Mono<Integer> createBatch(List<Long> recordingIds) {
        if (recordingIds == null || recordingIds.isEmpty()) {
            return Mono.error(new InputGuardException("createBatch", "no recordings given"));
        }
        Set<Long> ids = new LinkedHashSet<>(recordingIds);

        return recordingRepository.findAllById(ids)
            .map(Recording::getId)
            .collect(Collectors.toSet())
            .flatMap(found -> {
                if (found.size() != ids.size()) {
                    Set<Long> missing = new LinkedHashSet<>(ids);
                    missing.removeAll(found);
                    return Mono.error(new InputGuardException("createBatch", "unknown recordings " + missing));
                }
                return batchRepository.findByRecordingIdIn(ids).collectList();
            })
            .flatMap(existing -> {
                if (!existing.isEmpty()) {
                    log.warn("Recordings already batched. recordingIds={} existingGroups={}", ids,
                             existing.stream().map(CodingBatch::getBatchGroup).distinct().toList());
                    return Mono.empty();
                }
                return batchRepository.findMaxBatchGroup()
                    .defaultIfEmpty(0)
                    .flatMap(max -> insert(ids, max + GROUP_STEP));
            })
            .doOnError(e -> log.error("Failed to create batch. recordingIds={}", ids, e));
    }

    private Mono<Integer> insert(Set<Long> recordingIds, int group) {
        return Flux.fromIterable(recordingIds)
            .map(id -> {
                CodingBatch batch = new CodingBatch();
                batch.setRecordingId(id);
                batch.setBatchGroup(group);
                return batch;
            })
            .concatMap(batchRepository::save)
            .count()
            .map(count -> {
                log.info("Batch created. batchGroup={} recordings={}", group, count);
                return group;
            });
    }
}
