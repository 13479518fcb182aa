package com.sandkev.tradevol.exchange;

import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.Platform;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/** Rolls account fills up into one record per UTC day. */
public final class DailyCandleBuilder {

    private DailyCandleBuilder() {}

    /**
     * @param quoteUsdRate USD value of one unit of the symbol's quote asset on a given day
     */
    public static List<DailyVolumeRecord> fromFills(Platform platform, String symbol, List<Fill> fills,
                                                    LocalDate start, LocalDate end,
                                                    Function<LocalDate, BigDecimal> quoteUsdRate) {
        Map<LocalDate, List<Fill>> byDay = new TreeMap<>();
        fills.stream()
                .sorted(Comparator.comparingLong(Fill::timestampMs))
                .forEach(f -> {
                    LocalDate day = TimeRanges.utcDay(f.timestampMs());
                    if (!day.isBefore(start) && !day.isAfter(end)) {
                        byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(f);
                    }
                });

        List<DailyVolumeRecord> out = new ArrayList<>();
        byDay.forEach((day, dayFills) -> {
            BigDecimal high = dayFills.get(0).price();
            BigDecimal low = high;
            BigDecimal notional = BigDecimal.ZERO;
            for (Fill f : dayFills) {
                high = high.max(f.price());
                low = low.min(f.price());
                notional = notional.add(f.notional());
            }
            BigDecimal open = dayFills.get(0).price();
            BigDecimal close = dayFills.get(dayFills.size() - 1).price();
            out.add(new DailyVolumeRecord(platform, symbol, day, open, high, low, close,
                    notional.multiply(quoteUsdRate.apply(day))));
        });
        return out;
    }
}
