package com.sandkev.tradevol.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/** One UTC calendar day of activity for (platform, symbol); volume is always USD-normalised. */
public record DailyVolumeRecord(
        Platform platform,
        String symbol,
        LocalDate date,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volumeQuoteUsd
) {

    public String key() {
        return platform.id() + "|" + symbol + "|" + date;
    }
}
