package com.sandkev.tradevol.shared.paging;

import lombok.Builder;
import lombok.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * What to page through and how to recognise the end.
 * <ul>
 *   <li>{@code identity}: dedupe key per item</li>
 *   <li>{@code timestamp}: sort key for the output; insertion order if absent</li>
 *   <li>{@code pageSize}: requested page size, a shorter page means exhaustion (0 disables the check)</li>
 *   <li>{@code stopWhen}: caller bound evaluated on each page, e.g. "oldest item is before the range"</li>
 * </ul>
 */
@Builder
public record PagedQuery<T, C>(
        @NonNull String label,
        @Nullable C initialCursor,
        @NonNull PageFetcher<T, C> fetcher,
        @NonNull Function<T, ?> identity,
        @Nullable ToLongFunction<T> timestamp,
        int pageSize,
        @Nullable Predicate<List<T>> stopWhen
) {}
