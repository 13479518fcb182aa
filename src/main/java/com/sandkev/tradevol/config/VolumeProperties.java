package com.sandkev.tradevol.config;

import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.price.PriceFallbackPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Aggregation settings, bound from {@code volume.*}.
 *
 * @param symbols per platform id, the symbols a backfill covers
 */
@ConfigurationProperties("volume")
public record VolumeProperties(
        Duration currentCacheTtl,
        Duration historicalCacheTtl,
        Duration platformTimeout,
        Duration backfillTimeout,
        int backfillDays,
        int threads,
        long cacheMaxEntries,
        Paging paging,
        Map<String, List<String>> symbols,
        PriceFallbackPolicy priceFallback
) {

    public record Paging(int maxPages, int maxRetries, Duration backoff, Duration maxBackoff) {}

    public List<String> symbolsFor(Platform platform) {
        if (symbols == null) return List.of();
        return symbols.getOrDefault(platform.id(), List.of());
    }
}
