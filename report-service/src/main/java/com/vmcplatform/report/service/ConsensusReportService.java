package com.vmcplatform.report.service;

import com.vmcplatform.common.consensus.ConsensusAggregator;
import com.vmcplatform.common.consensus.ConsensusRecord;
import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.CoderCode;
import com.vmcplatform.common.model.UtteranceMetadata;
import com.vmcplatform.report.model.CoderCodeRow;
import com.vmcplatform.report.model.UtteranceReportRow;
import com.vmcplatform.report.repository.CoderCodeRepository;
import com.vmcplatform.report.repository.UtteranceReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds consensus reports from stored codings. Read-only.
 *
 * <p>The full report covers valid recordings whose pool work is finished; recordings with any
 * entry still unassigned or processing are left out entirely so that partial rater sets never
 * reach the aggregator.
 */
@Service
public class ConsensusReportService {

    private static final Logger log = LoggerFactory.getLogger(ConsensusReportService.class);

    private final UtteranceReportRepository utteranceRepository;
    private final CoderCodeRepository codeRepository;
    private final ConsensusAggregator aggregator;

    @Value("${vmc.consensus.legacy-comment:Legacy Code}")
    private String legacyComment = "Legacy Code";

    public ConsensusReportService(UtteranceReportRepository utteranceRepository,
                                  CoderCodeRepository codeRepository,
                                  ConsensusAggregator aggregator) {
        this.utteranceRepository = utteranceRepository;
        this.codeRepository      = codeRepository;
        this.aggregator          = aggregator;
    }

    public Mono<List<ConsensusRecord>> aggregate(Collection<Long> utteranceIds) {
        if (utteranceIds == null || utteranceIds.isEmpty()) {
            return Mono.error(new InputGuardException("aggregate", "no utterances given"));
        }
        Set<Long> ids = new LinkedHashSet<>(utteranceIds);

        Mono<List<UtteranceMetadata>> utterances = utteranceRepository.findByUtteranceIds(ids)
            .map(UtteranceReportRow::toMetadata)
            .collectList();
        Mono<List<CoderCode>> codes = codeRepository.findByUtteranceIds(ids, legacyComment)
            .map(CoderCodeRow::toCode)
            .collectList();

        return Mono.zip(utterances, codes)
            .flatMap(t -> {
                if (t.getT1().size() != ids.size()) {
                    Set<Long> missing = new LinkedHashSet<>(ids);
                    t.getT1().forEach(u -> missing.remove(u.utteranceId()));
                    return Mono.error(new InputGuardException("aggregate", "unknown utterances " + missing));
                }
                return run(t.getT1(), t.getT2());
            })
            .doOnError(e -> log.error("Consensus aggregation failed. utterances={}", ids.size(), e));
    }

    public Mono<List<ConsensusRecord>> generateReport() {
        Mono<List<UtteranceMetadata>> utterances = utteranceRepository.findReportUtterances(legacyComment)
            .map(UtteranceReportRow::toMetadata)
            .collectList();
        Mono<List<CoderCode>> codes = codeRepository.findReportCodes(legacyComment)
            .map(CoderCodeRow::toCode)
            .collectList();

        return Mono.zip(utterances, codes)
            .flatMap(t -> run(t.getT1(), t.getT2()))
            .doOnError(e -> log.error("Consensus report failed", e));
    }

    public Flux<Long> recordingsInProcess() {
        return utteranceRepository.findRecordingsInProcess();
    }

    private Mono<List<ConsensusRecord>> run(List<UtteranceMetadata> utterances, List<CoderCode> codes) {
        return Mono.fromCallable(() -> aggregator.aggregate(utterances, codes))
            .doOnNext(records -> log.info("Consensus computed. utterances={} codes={} records={}",
                                          utterances.size(), codes.size(), records.size()));
    }
}
