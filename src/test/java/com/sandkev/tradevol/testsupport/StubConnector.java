package com.sandkev.tradevol.testsupport;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.exchange.ExchangeConnector;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/** Connector whose answers are supplied by the test. */
public class StubConnector implements ExchangeConnector {
    private final Platform platform;
    private final boolean requiresCredential;
    private final Supplier<ExchangeVolumeInfo> latest;
    private final Function<String, FetchResult<List<DailyVolumeRecord>>> historical;
    private final AtomicInteger latestCalls = new AtomicInteger();
    private final AtomicInteger historicalCalls = new AtomicInteger();

    public StubConnector(Platform platform, boolean requiresCredential,
                         Supplier<ExchangeVolumeInfo> latest,
                         Function<String, FetchResult<List<DailyVolumeRecord>>> historical) {
        this.platform = platform;
        this.requiresCredential = requiresCredential;
        this.latest = latest;
        this.historical = historical;
    }

    public static StubConnector returning24h(Platform platform, String volume) {
        return new StubConnector(platform, false,
                () -> ExchangeVolumeInfo.ok(platform, "TOTAL", new BigDecimal(volume), Instant.EPOCH),
                symbol -> FetchResult.ok(List.of()));
    }

    public static StubConnector throwing24h(Platform platform, RuntimeException e) {
        return new StubConnector(platform, false, () -> { throw e; }, symbol -> FetchResult.ok(List.of()));
    }

    @Override public Platform platform() { return platform; }

    @Override public boolean requiresCredential() { return requiresCredential; }

    @Override
    public FetchResult<List<DailyVolumeRecord>> fetchHistoricalDaily(String symbol, LocalDate start, LocalDate end,
                                                                     Credential credential) {
        historicalCalls.incrementAndGet();
        return historical.apply(symbol);
    }

    @Override
    public ExchangeVolumeInfo fetchLatest24h(Credential credential) {
        latestCalls.incrementAndGet();
        return latest.get();
    }

    public int latestCalls() { return latestCalls.get(); }

    public int historicalCalls() { return historicalCalls.get(); }
}
