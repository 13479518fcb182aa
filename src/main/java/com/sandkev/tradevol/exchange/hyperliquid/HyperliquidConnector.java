package com.sandkev.tradevol.exchange.hyperliquid;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.exchange.AbstractExchangeConnector;
import com.sandkev.tradevol.exchange.Payloads;
import com.sandkev.tradevol.exchange.TimeRanges;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.shared.error.SerializationException;
import com.sandkev.tradevol.shared.http.ExchangeClient;
import com.sandkev.tradevol.shared.paging.Page;
import com.sandkev.tradevol.shared.paging.PageResult;
import com.sandkev.tradevol.shared.paging.PagedQuery;
import com.sandkev.tradevol.shared.paging.Paginator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hyperliquid {@code /info} API. Candles only carry base volume, so USD volume is
 * {@code v * (o + c) / 2} in USDC, then normalised.
 */
@Slf4j
public class HyperliquidConnector extends AbstractExchangeConnector {

    static final String SOURCE = "hyperliquid";
    /** Maximum candles per snapshot response. */
    static final int MAX_CANDLES = 5000;
    private static final String SETTLEMENT_ASSET = "USDC";
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final MathContext MC = MathContext.DECIMAL64;
    private static final ParameterizedTypeReference<List<Object>> LIST = new ParameterizedTypeReference<>() {};

    private final ExchangeClient client;

    record Candle(long openMs, long closeMs, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                  BigDecimal baseVolume) {}

    public HyperliquidConnector(ExchangeClient client, Paginator paginator, PriceNormalizer prices, Clock clock) {
        super(paginator, prices, clock);
        this.client = client;
    }

    @Override
    public Platform platform() {
        return Platform.HYPERLIQUID;
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }

    @Override
    protected String scopeLabel() {
        return "HYPERLIQUID_TOTAL";
    }

    @Override
    protected FetchResult<List<DailyVolumeRecord>> doFetchHistorical(String coin, LocalDate start, LocalDate end,
                                                                     @Nullable Credential credential) {
        long endMs = TimeRanges.endMsInclusive(end);

        PageResult<Candle> paged = paginator.collect(PagedQuery.<Candle, Long>builder()
                .label("hyperliquid candles " + coin)
                .initialCursor(TimeRanges.startMs(start))
                .fetcher(from -> candlePage(coin, from, endMs))
                .identity(Candle::openMs)
                .timestamp(Candle::openMs)
                .pageSize(MAX_CANDLES)
                .build());

        List<DailyVolumeRecord> records = new ArrayList<>();
        for (Candle c : paged.items()) {
            LocalDate day = TimeRanges.utcDay(c.openMs());
            if (day.isBefore(start) || day.isAfter(end)) continue;
            BigDecimal mid = c.open().add(c.close()).divide(TWO, MC);
            BigDecimal usd = c.baseVolume().multiply(mid).multiply(prices.usdPrice(SETTLEMENT_ASSET, day));
            records.add(new DailyVolumeRecord(Platform.HYPERLIQUID, coin, day, c.open(), c.high(), c.low(), c.close(), usd));
        }
        return toResult(records, paged);
    }

    /** {@code metaAndAssetCtxs} answers {@code [meta, [assetCtx...]]}; {@code dayNtlVlm} is USDC notional. */
    @Override
    protected ExchangeVolumeInfo doFetchLatest24h(@Nullable Credential credential) {
        List<Object> res = client.post("/info", Map.of("type", "metaAndAssetCtxs"), LIST);
        if (res == null || res.size() < 2) {
            return failed24h("unexpected metaAndAssetCtxs response shape");
        }
        List<Object> ctxs = Payloads.list(SOURCE, res.get(1), "assetCtxs");

        BigDecimal total = BigDecimal.ZERO;
        for (Object o : ctxs) {
            try {
                Map<String, Object> ctx = Payloads.map(SOURCE, o, "assetCtx");
                if (ctx.get("dayNtlVlm") == null) continue;
                total = total.add(Payloads.decimal(SOURCE, ctx, "dayNtlVlm"));
            } catch (SerializationException e) {
                log.warn("hyperliquid: skipping malformed asset context: {}", e.getMessage());
            }
        }
        return ExchangeVolumeInfo.ok(Platform.HYPERLIQUID, scopeLabel(),
                total.multiply(prices.usdPrice(SETTLEMENT_ASSET)), clock.instant());
    }

    private Page<Candle, Long> candlePage(String coin, long fromMs, long endMs) {
        var body = Map.of(
                "type", "candleSnapshot",
                "req", Map.of(
                        "coin", coin,
                        "interval", "1d",
                        "startTime", fromMs,
                        "endTime", endMs));
        List<Object> rows = client.post("/info", body, LIST);
        if (rows == null) return Page.last(List.of());

        List<Candle> candles = new ArrayList<>(rows.size());
        for (Object row : rows) {
            try {
                candles.add(parseCandle(row));
            } catch (SerializationException e) {
                log.warn("hyperliquid: skipping malformed candle for {}: {}", coin, e.getMessage());
            }
        }
        if (candles.isEmpty()) return Page.last(candles);

        long lastClose = candles.stream().mapToLong(Candle::closeMs).max().getAsLong();
        return new Page<>(candles, lastClose < endMs ? lastClose + 1 : null);
    }

    /** {@code {t, T, s, i, o, c, h, l, v, n}}; prices and volume are strings. */
    private static Candle parseCandle(Object row) {
        Map<String, Object> m = Payloads.map(SOURCE, row, "candle");
        return new Candle(
                Payloads.longValue(SOURCE, m, "t"),
                Payloads.longValue(SOURCE, m, "T"),
                Payloads.decimal(SOURCE, m, "o"),
                Payloads.decimal(SOURCE, m, "h"),
                Payloads.decimal(SOURCE, m, "l"),
                Payloads.decimal(SOURCE, m, "c"),
                Payloads.decimal(SOURCE, m, "v"));
    }
}
