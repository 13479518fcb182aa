package com.sandkev.tradevol.exchange;

import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.Platform;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DailyCandleBuilderTest {

    private static final LocalDate DAY1 = LocalDate.of(2024, 3, 1);

    private static long at(LocalDate day, int hour) {
        return day.atTime(hour, 0).toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    @Test
    void twoFillsOnOneDay() {
        List<Fill> fills = List.of(
                new Fill("1", new BigDecimal("60000"), new BigDecimal("0.01"), at(DAY1, 9)),
                new Fill("2", new BigDecimal("61000"), new BigDecimal("0.02"), at(DAY1, 15)));

        List<DailyVolumeRecord> out = DailyCandleBuilder.fromFills(Platform.WOOX, "PERP_BTC_USDT", fills, DAY1, DAY1,
                day -> BigDecimal.ONE);

        assertThat(out).hasSize(1);
        DailyVolumeRecord r = out.get(0);
        assertThat(r.date()).isEqualTo(DAY1);
        assertThat(r.open()).isEqualByComparingTo("60000");
        assertThat(r.close()).isEqualByComparingTo("61000");
        assertThat(r.high()).isEqualByComparingTo("61000");
        assertThat(r.low()).isEqualByComparingTo("60000");
        assertThat(r.volumeQuoteUsd()).isEqualByComparingTo("1820");
    }

    @Test
    void openAndCloseFollowTimeNotInputOrder() {
        List<Fill> fills = List.of(
                new Fill("late", new BigDecimal("105"), BigDecimal.ONE, at(DAY1, 20)),
                new Fill("mid", new BigDecimal("90"), BigDecimal.ONE, at(DAY1, 12)),
                new Fill("early", new BigDecimal("100"), BigDecimal.ONE, at(DAY1, 1)));

        DailyVolumeRecord r = DailyCandleBuilder.fromFills(Platform.PARADEX, "BTC-USD-PERP", fills, DAY1, DAY1,
                day -> BigDecimal.ONE).get(0);

        assertThat(r.open()).isEqualByComparingTo("100");
        assertThat(r.close()).isEqualByComparingTo("105");
        assertThat(r.low()).isEqualByComparingTo("90");
    }

    @Test
    void daysOutsideTheRangeAreDropped_andQuoteRateApplied() {
        LocalDate day2 = DAY1.plusDays(1);
        List<Fill> fills = List.of(
                new Fill("a", new BigDecimal("10"), BigDecimal.ONE, at(DAY1.minusDays(1), 23)),
                new Fill("b", new BigDecimal("10"), BigDecimal.ONE, at(DAY1, 0)),
                new Fill("c", new BigDecimal("20"), BigDecimal.ONE, at(day2, 23)),
                new Fill("d", new BigDecimal("30"), BigDecimal.ONE, at(day2.plusDays(1), 0)));

        List<DailyVolumeRecord> out = DailyCandleBuilder.fromFills(Platform.WOOX, "SPOT_ETH_BTC", fills, DAY1, day2,
                day -> day.equals(DAY1) ? new BigDecimal("2") : new BigDecimal("3"));

        assertThat(out).extracting(DailyVolumeRecord::date).containsExactly(DAY1, day2);
        assertThat(out.get(0).volumeQuoteUsd()).isEqualByComparingTo("20");
        assertThat(out.get(1).volumeQuoteUsd()).isEqualByComparingTo("60");
    }
}
