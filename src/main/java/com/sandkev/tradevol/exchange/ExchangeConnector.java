package com.sandkev.tradevol.exchange;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.domain.Platform;
import org.springframework.lang.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * One exchange's volume protocol. Implementations report upstream failures as data
 * ({@link FetchResult#error()}, {@link ExchangeVolumeInfo#error()}) rather than throwing.
 */
public interface ExchangeConnector {

    Platform platform();

    /** Whether the connector can do anything useful without an account credential. */
    boolean requiresCredential();

    /**
     * Daily OHLC and USD volume for {@code symbol} over the inclusive UTC date range.
     * Days outside the range are never returned.
     */
    FetchResult<List<DailyVolumeRecord>> fetchHistoricalDaily(String symbol, LocalDate start, LocalDate end,
                                                              @Nullable Credential credential);

    /** Trailing 24h USD volume; a zero-volume entry with an error when it cannot be measured. */
    ExchangeVolumeInfo fetchLatest24h(@Nullable Credential credential);
}
