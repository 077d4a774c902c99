package com.vmcplatform.sampling.claim;

import com.vmcplatform.sampling.model.SamplePoolEntry;
import reactor.core.publisher.Mono;

/**
 * Atomically finds and claims the next pool entry a coder may work on.
 *
 * <p>Implementations must guarantee that two concurrent callers never receive the same entry
 * and that a coder is never handed an utterance they have coded, are assigned, or currently
 * hold a claim on. Empty means no eligible entry; it is never an error and never waits.
 *
 * <p>Current implementation: {@link ConditionalUpdateClaimStrategy}.
 */
public interface PoolClaimStrategy {

    Mono<SamplePoolEntry> claim(long coderId);
}
