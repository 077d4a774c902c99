package com.vmcplatform.sampling.claim;

import com.vmcplatform.sampling.model.SamplePoolEntry;
import com.vmcplatform.sampling.repository.SamplePoolEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Compare-and-swap claim.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Read up to {@code claimWindow} eligible candidate ids, lowest id first.</li>
 *   <li>For each, issue the conditional {@code UPDATE}. One row → claimed, done.
 *       Zero rows → another session took it, try the next.</li>
 *   <li>Window exhausted → read a fresh window. No candidates → empty.</li>
 * </ol>
 *
 * <p>Every lost race means another claim succeeded, so the eligible set shrinks each round.
 * The round cap only bounds pathological churn from the lease sweeper releasing entries.
 * Hitting it fails with {@link ConcurrencyFailureException} rather than completing empty,
 * because eligible entries were still present; the HTTP layer turns that into a retryable 503.
 */
@Component
public class ConditionalUpdateClaimStrategy implements PoolClaimStrategy {

    private static final Logger log = LoggerFactory.getLogger(ConditionalUpdateClaimStrategy.class);

    static final int MAX_ROUNDS = 32;

    private final SamplePoolEntryRepository poolRepository;
    private final Clock clock;
    private final int claimWindow;

    public ConditionalUpdateClaimStrategy(SamplePoolEntryRepository poolRepository,
                                          Clock clock,
                                          @Value("${vmc.pool.claim-window:8}") int claimWindow) {
        if (claimWindow < 1) {
            throw new IllegalArgumentException("claimWindow must be at least 1 but was " + claimWindow);
        }
        this.poolRepository = poolRepository;
        this.clock          = clock;
        this.claimWindow    = claimWindow;
    }

    @Override
    public Mono<SamplePoolEntry> claim(long coderId) {
        return attempt(coderId, 1)
            .flatMap(poolRepository::findById);
    }

    private Mono<Long> attempt(long coderId, int round) {
        if (round > MAX_ROUNDS) {
            log.warn("Claim gave up after contention with entries still open. coderId={} rounds={}",
                     coderId, MAX_ROUNDS);
            return Mono.error(new ConcurrencyFailureException(
                "claim for coder " + coderId + " lost " + MAX_ROUNDS + " candidate windows"));
        }
        return poolRepository.findClaimCandidateIds(coderId, claimWindow)
            .collectList()
            .flatMap(candidates -> {
                if (candidates.isEmpty()) {
                    return Mono.empty();
                }
                return Flux.fromIterable(candidates)
                    .concatMap(id -> tryClaim(id, coderId))
                    .next()
                    .switchIfEmpty(Mono.defer(() -> {
                        log.debug("Claim window lost to other sessions. coderId={} round={} window={}",
                                  coderId, round, candidates.size());
                        return attempt(coderId, round + 1);
                    }));
            });
    }

    private Mono<Long> tryClaim(long id, long coderId) {
        return poolRepository.tryClaim(id, coderId, LocalDateTime.now(clock))
            .filter(rows -> rows == 1)
            .map(rows -> id);
    }
}
