package com.sandkev.tradevol.shared.paging;

import com.sandkev.tradevol.shared.error.ExchangeException;
import com.sandkev.tradevol.shared.error.SerializationException;
import com.sandkev.tradevol.shared.http.HttpRetrySupport;
import com.sandkev.tradevol.shared.http.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a {@link PageFetcher} until the upstream is exhausted.
 * <p>
 * Paging stops on an empty page, a missing or repeated continuation cursor, a short page, the
 * caller's {@code stopWhen} bound or {@link PagingPolicy#maxPages()}. Retryable failures (429, 5xx,
 * transport) are retried on the same cursor up to {@link PagingPolicy#maxRetries()} times;
 * any other failure aborts at once and the items gathered so far are returned with the error.
 */
@Slf4j
public class Paginator {

    private final PagingPolicy policy;
    private final Sleeper sleeper;

    public Paginator(PagingPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public PagingPolicy policy() {
        return policy;
    }

    public <T, C> PageResult<T> collect(PagedQuery<T, C> q) {
        Map<Object, T> seen = new LinkedHashMap<>();
        C cursor = q.initialCursor();
        int pages = 0;

        while (true) {
            if (pages >= policy.maxPages()) {
                log.warn("{}: stopped after {} pages with cursor still open", q.label(), pages);
                return result(q, seen, pages, null, true);
            }

            Page<T, C> page;
            try {
                page = fetchWithRetry(q, cursor);
            } catch (ExchangeException e) {
                log.warn("{}: aborting after {} pages, keeping {} items: {}", q.label(), pages, seen.size(), e.getMessage());
                return result(q, seen, pages, e, false);
            }
            pages++;

            List<T> items = page.items() == null ? List.of() : page.items();
            if (items.isEmpty()) break;
            for (T item : items) {
                seen.putIfAbsent(q.identity().apply(item), item);
            }

            if (page.next() == null) break;
            if (page.next().equals(cursor)) {
                log.warn("{}: cursor {} repeated, stopping after {} pages", q.label(), cursor, pages);
                break;
            }
            if (q.pageSize() > 0 && items.size() < q.pageSize()) break;
            if (q.stopWhen() != null && q.stopWhen().test(items)) break;
            if (Thread.currentThread().isInterrupted()) {
                log.warn("{}: interrupted after {} pages", q.label(), pages);
                return result(q, seen, pages, null, true);
            }

            cursor = page.next();
            if (!policy.pacing().isZero()) sleeper.sleep(policy.pacing());
        }
        return result(q, seen, pages, null, false);
    }

    private <T, C> Page<T, C> fetchWithRetry(PagedQuery<T, C> q, C cursor) {
        for (int attempt = 0; ; attempt++) {
            try {
                return fetchOnce(q, cursor);
            } catch (ExchangeException e) {
                if (!e.isRetryable() || attempt >= policy.maxRetries()) throw e;
                var pause = HttpRetrySupport.backoffFor(e, policy.backoff(), policy.maxBackoff());
                log.warn("{}: {} on cursor {} attempt {}/{}; sleeping {} ms",
                        q.label(), e.getClass().getSimpleName(), cursor, attempt + 1, policy.maxRetries(), pause.toMillis());
                sleeper.sleep(pause);
            }
        }
    }

    /** Anything a fetcher throws outside the exchange taxonomy is treated as an undecodable page. */
    private static <T, C> Page<T, C> fetchOnce(PagedQuery<T, C> q, C cursor) {
        try {
            return q.fetcher().fetch(cursor);
        } catch (ExchangeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SerializationException(q.label(), "page at cursor " + cursor + " failed: " + e, e);
        }
    }

    private static <T, C> PageResult<T> result(PagedQuery<T, C> q, Map<Object, T> seen, int pages,
                                               ExchangeException error, boolean truncated) {
        List<T> items = new ArrayList<>(seen.values());
        if (q.timestamp() != null) {
            items.sort(Comparator.comparingLong(q.timestamp()));
        }
        return new PageResult<>(List.copyOf(items), pages, error, truncated);
    }
}
