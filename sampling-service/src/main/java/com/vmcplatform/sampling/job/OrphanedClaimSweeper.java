package com.vmcplatform.sampling.job;

import com.vmcplatform.sampling.repository.SamplePoolEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Returns claims abandoned by crashed or closed rater sessions to the pool.
 *
 * <p>An entry still processing and unassigned whose {@code claimed_at} is older than the lease
 * goes back to unassigned. A late submit for it then fails as a conflict.
 */
@Component
@ConditionalOnProperty(name = "vmc.pool.lease-sweep.enabled", havingValue = "true", matchIfMissing = true)
public class OrphanedClaimSweeper {

    private static final Logger log = LoggerFactory.getLogger(OrphanedClaimSweeper.class);

    private final SamplePoolEntryRepository poolRepository;
    private final Clock clock;
    private final Duration claimLease;

    public OrphanedClaimSweeper(SamplePoolEntryRepository poolRepository,
                                Clock clock,
                                @Value("${vmc.pool.claim-lease:PT1H}") Duration claimLease) {
        this.poolRepository = poolRepository;
        this.clock          = clock;
        this.claimLease     = claimLease;
        log.info("Orphaned claim sweeper enabled. lease={}", claimLease);
    }

    @Scheduled(fixedDelayString = "${vmc.pool.lease-sweep.interval:PT5M}",
               initialDelayString = "${vmc.pool.lease-sweep.interval:PT5M}")
    public void sweep() {
        releaseExpired()
            .subscribe(
                released -> { },
                e -> log.error("Orphaned claim sweep failed. lease={}", claimLease, e));
    }

    /**
     * @return number of claims released
     */
    public Mono<Integer> releaseExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(claimLease);
        return poolRepository.releaseClaimsOlderThan(cutoff, now)
            .doOnNext(released -> {
                if (released > 0) {
                    log.warn("Orphaned claims released. count={} cutoff={}", released, cutoff);
                } else {
                    log.debug("No orphaned claims. cutoff={}", cutoff);
                }
            });
    }
}
