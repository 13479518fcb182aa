package com.sandkev.tradevol.shared.paging;

import java.time.Duration;

/**
 * Per-exchange knobs for {@link Paginator}.
 *
 * @param maxPages   hard bound on page iterations, guards against a cursor that never empties
 * @param maxRetries retries of the same page on 429/5xx/transport failures
 * @param backoff    fixed pause before a retry (stretched by Retry-After)
 * @param maxBackoff upper bound on a Retry-After stretched pause
 * @param pacing     pause between successful pages, zero to disable
 */
public record PagingPolicy(int maxPages, int maxRetries, Duration backoff, Duration maxBackoff, Duration pacing) {

    public static PagingPolicy defaults() {
        return new PagingPolicy(1_000, 3, Duration.ofSeconds(2), Duration.ofSeconds(60), Duration.ZERO);
    }

    public PagingPolicy withPacing(Duration pacing) {
        return new PagingPolicy(maxPages, maxRetries, backoff, maxBackoff, pacing);
    }
}
