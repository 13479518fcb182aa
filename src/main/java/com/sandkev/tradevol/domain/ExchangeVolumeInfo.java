package com.sandkev.tradevol.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trailing 24h volume for one platform, or the error that prevented measuring it.
 * A failed entry always carries zero volume.
 */
public record ExchangeVolumeInfo(
        Platform platform,
        String scope,
        BigDecimal volume24hUsd,
        Instant timestamp,
        @Nullable String error
) {

    public static ExchangeVolumeInfo ok(Platform platform, String scope, BigDecimal volume, Instant ts) {
        return new ExchangeVolumeInfo(platform, scope, volume, ts, null);
    }

    public static ExchangeVolumeInfo failed(Platform platform, String scope, String error, Instant ts) {
        return new ExchangeVolumeInfo(platform, scope, BigDecimal.ZERO, ts, error);
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
