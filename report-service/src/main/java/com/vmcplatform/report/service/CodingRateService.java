package com.vmcplatform.report.service;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.CodingSession;
import com.vmcplatform.common.rate.CodingRateCalculator;
import com.vmcplatform.report.model.CoderCodeRow;
import com.vmcplatform.report.repository.CoderCodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Service
public class CodingRateService {

    private static final Logger log = LoggerFactory.getLogger(CodingRateService.class);

    static final LocalDateTime EARLIEST = LocalDateTime.of(1900, 1, 1, 0, 0);
    static final LocalDateTime LATEST   = LocalDateTime.of(9999, 12, 31, 0, 0);

    private final CoderCodeRepository codeRepository;

    @Value("${vmc.coding-rate.max-pause:PT10M}")
    private Duration maxPause = CodingRateCalculator.DEFAULT_MAX_PAUSE;

    @Value("${vmc.consensus.legacy-comment:Legacy Code}")
    private String legacyComment = "Legacy Code";

    public CodingRateService(CoderCodeRepository codeRepository) {
        this.codeRepository = codeRepository;
    }

    /**
     * Work sessions per coder for codes added in {@code [from, to)}. Either bound may be null.
     */
    public Mono<Map<String, List<CodingSession>>> codingRate(LocalDateTime from, LocalDateTime to) {
        LocalDateTime lower = from == null ? EARLIEST : from;
        LocalDateTime upper = to   == null ? LATEST   : to;
        if (!lower.isBefore(upper)) {
            return Mono.error(new InputGuardException("codingRate", "from " + lower + " is not before to " + upper));
        }

        return codeRepository.findCodedBetween(lower, upper, legacyComment)
            .map(CoderCodeRow::toEvent)
            .collectList()
            .map(events -> {
                Map<String, List<CodingSession>> sessions = CodingRateCalculator.sessions(events, maxPause);
                log.info("Coding rate computed. from={} to={} codes={} coders={} maxPause={}",
                         from, to, events.size(), sessions.size(), maxPause);
                return sessions;
            });
    }
}
