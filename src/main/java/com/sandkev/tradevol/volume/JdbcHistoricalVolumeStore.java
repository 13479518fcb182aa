package com.sandkev.tradevol.volume;

import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

@Slf4j
public class JdbcHistoricalVolumeStore implements HistoricalVolumeStore {

    private final JdbcTemplate jdbc;

    public JdbcHistoricalVolumeStore(JdbcTemplate jdbc) { this.jdbc = jdbc; }

    @Override
    public int insertOrIgnore(List<DailyVolumeRecord> records) {
        int inserted = 0;
        for (DailyVolumeRecord r : records) {
            try {
                inserted += jdbc.update("""
                    insert into historical_daily_volume
                        (platform, symbol, trade_date, open_price, high_price, low_price, close_price, volume_quote_usd)
                    values (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                        r.platform().id(), r.symbol(), Date.valueOf(r.date()),
                        r.open(), r.high(), r.low(), r.close(), r.volumeQuoteUsd());
            } catch (DuplicateKeyException e) {
                // unique (platform, symbol, trade_date): the stored row wins
                log.debug("Skipping existing row {}", r.key());
            }
        }
        return inserted;
    }

    @Override
    public List<DailyVolumeRecord> queryRange(LocalDate start, LocalDate end) {
        return jdbc.query("""
            select platform, symbol, trade_date, open_price, high_price, low_price, close_price, volume_quote_usd
            from historical_daily_volume
            where trade_date between ? and ?
            order by trade_date, platform, symbol
        """,
                (rs, i) -> {
                    String platform = rs.getString("platform");
                    return new DailyVolumeRecord(
                            Platform.fromId(platform)
                                    .orElseThrow(() -> new IllegalStateException("unknown platform " + platform)),
                            rs.getString("symbol"),
                            rs.getDate("trade_date").toLocalDate(),
                            rs.getBigDecimal("open_price"),
                            rs.getBigDecimal("high_price"),
                            rs.getBigDecimal("low_price"),
                            rs.getBigDecimal("close_price"),
                            rs.getBigDecimal("volume_quote_usd"));
                },
                Date.valueOf(start), Date.valueOf(end));
    }
}
