package com.sandkev.tradevol.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record AggregatedVolume(
        BigDecimal totalVolume24hUsd,
        Instant lastUpdated,
        List<ExchangeVolumeInfo> platforms
) {

    /** Sums entries without an error; failed entries stay listed. */
    public static AggregatedVolume of(List<ExchangeVolumeInfo> infos, Instant completedAt) {
        BigDecimal total = infos.stream()
                .filter(i -> !i.hasError())
                .map(ExchangeVolumeInfo::volume24hUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new AggregatedVolume(total, completedAt, List.copyOf(infos));
    }
}
