package com.sandkev.tradevol.exchange.bybit;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.exchange.AbstractExchangeConnector;
import com.sandkev.tradevol.exchange.Payloads;
import com.sandkev.tradevol.exchange.TimeRanges;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.shared.error.AuthException;
import com.sandkev.tradevol.shared.error.ParameterException;
import com.sandkev.tradevol.shared.error.RateLimitedException;
import com.sandkev.tradevol.shared.error.SerializationException;
import com.sandkev.tradevol.shared.error.UpstreamProtocolException;
import com.sandkev.tradevol.shared.http.ExchangeClient;
import com.sandkev.tradevol.shared.paging.Page;
import com.sandkev.tradevol.shared.paging.PageResult;
import com.sandkev.tradevol.shared.paging.PagedQuery;
import com.sandkev.tradevol.shared.paging.Paginator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bybit v5 public market data. Daily klines carry turnover directly; the 24h figure is the
 * sum of {@code turnover24h} across USDT/USDC settled linear contracts.
 */
@Slf4j
public class BybitConnector extends AbstractExchangeConnector {

    static final String SOURCE = "bybit";
    static final int KLINE_LIMIT = 1000;
    private static final ParameterizedTypeReference<Map<String, Object>> ENVELOPE = new ParameterizedTypeReference<>() {};

    private final ExchangeClient client;

    record Kline(long startMs, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                 BigDecimal volume, BigDecimal turnover) {}

    public BybitConnector(ExchangeClient client, Paginator paginator, PriceNormalizer prices, Clock clock) {
        super(paginator, prices, clock);
        this.client = client;
    }

    @Override
    public Platform platform() {
        return Platform.BYBIT;
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }

    @Override
    protected String scopeLabel() {
        return "LINEAR_TOTAL";
    }

    @Override
    protected FetchResult<List<DailyVolumeRecord>> doFetchHistorical(String symbol, LocalDate start, LocalDate end,
                                                                     @Nullable Credential credential) {
        String sym = symbol.toUpperCase(Locale.ROOT);
        String category = category(sym);
        long startMs = TimeRanges.startMs(start);
        long endMs = TimeRanges.endMsInclusive(end);

        // newest first, so walk backwards by pulling the end of the window below each page
        PageResult<Kline> paged = paginator.collect(PagedQuery.<Kline, Long>builder()
                .label("bybit kline " + sym)
                .initialCursor(endMs)
                .fetcher(cursorEnd -> klinePage(category, sym, startMs, cursorEnd))
                .identity(Kline::startMs)
                .timestamp(Kline::startMs)
                .pageSize(KLINE_LIMIT)
                .build());

        // inverse contracts report turnover in the base coin
        String turnoverAsset = "inverse".equals(category) ? baseAsset(sym) : quoteAsset(sym);
        List<DailyVolumeRecord> records = new ArrayList<>();
        for (Kline k : paged.items()) {
            LocalDate day = TimeRanges.utcDay(k.startMs());
            if (day.isBefore(start) || day.isAfter(end)) continue;
            BigDecimal usd = k.turnover().multiply(prices.usdPrice(turnoverAsset, day));
            records.add(new DailyVolumeRecord(Platform.BYBIT, sym, day, k.open(), k.high(), k.low(), k.close(), usd));
        }
        return toResult(records, paged);
    }

    @Override
    protected ExchangeVolumeInfo doFetchLatest24h(@Nullable Credential credential) {
        Map<String, Object> result = checkRetCode(
                client.get("/v5/market/tickers", Map.of("category", "linear"), ENVELOPE), "/v5/market/tickers");
        List<Object> tickers = Payloads.list(SOURCE, result.get("list"), "result.list");
        if (tickers.isEmpty()) {
            return failed24h("no linear tickers returned");
        }

        BigDecimal total = BigDecimal.ZERO;
        for (Object t : tickers) {
            try {
                Map<String, Object> ticker = Payloads.map(SOURCE, t, "ticker");
                String sym = Payloads.string(SOURCE, ticker, "symbol");
                if (!isStableSettled(sym)) continue;
                total = total.add(Payloads.decimal(SOURCE, ticker, "turnover24h")
                        .multiply(prices.usdPrice(quoteAsset(sym))));
            } catch (SerializationException e) {
                log.warn("bybit: skipping malformed ticker: {}", e.getMessage());
            }
        }
        return ExchangeVolumeInfo.ok(Platform.BYBIT, scopeLabel(), total, clock.instant());
    }

    private Page<Kline, Long> klinePage(String category, String symbol, long startMs, long endMs) {
        var p = new LinkedHashMap<String, Object>();
        p.put("category", category);
        p.put("symbol", symbol);
        p.put("interval", "D");
        p.put("start", startMs);
        p.put("end", endMs);
        p.put("limit", KLINE_LIMIT);

        Map<String, Object> result = checkRetCode(client.get("/v5/market/kline", p, ENVELOPE), "/v5/market/kline");
        List<Object> rows = Payloads.list(SOURCE, result.get("list"), "result.list");

        List<Kline> klines = new ArrayList<>(rows.size());
        for (Object row : rows) {
            try {
                klines.add(parseKline(row));
            } catch (SerializationException e) {
                log.warn("bybit: skipping malformed kline for {}: {}", symbol, e.getMessage());
            }
        }
        if (klines.isEmpty()) return Page.last(klines);

        long oldest = klines.stream().mapToLong(Kline::startMs).min().getAsLong();
        return new Page<>(klines, oldest > startMs ? oldest - 1 : null);
    }

    /** {@code [startTime, open, high, low, close, volume, turnover]}, all strings. */
    private static Kline parseKline(Object row) {
        List<Object> f = Payloads.list(SOURCE, row, "kline");
        if (f.size() < 7) throw new SerializationException(SOURCE, "kline has " + f.size() + " fields", null);
        return new Kline(
                Payloads.epochMillis(SOURCE, f.get(0), "startTime"),
                Payloads.decimal(SOURCE, f.get(1), "open"),
                Payloads.decimal(SOURCE, f.get(2), "high"),
                Payloads.decimal(SOURCE, f.get(3), "low"),
                Payloads.decimal(SOURCE, f.get(4), "close"),
                Payloads.decimal(SOURCE, f.get(5), "volume"),
                Payloads.decimal(SOURCE, f.get(6), "turnover"));
    }

    static Map<String, Object> checkRetCode(Map<String, Object> body, String path) {
        if (body == null) throw new SerializationException(SOURCE, path + " returned an empty body", null);
        long code = Payloads.longValue(SOURCE, body, "retCode");
        if (code == 0) return Payloads.map(SOURCE, body.get("result"), "result");

        String msg = path + " retCode=" + code + " " + body.get("retMsg");
        throw switch ((int) code) {
            case 10001 -> new ParameterException(SOURCE, msg);
            case 10003, 10004, 10005 -> new AuthException(SOURCE, msg);
            case 10006, 10018 -> new RateLimitedException(SOURCE, msg, null);
            case 10016 -> new UpstreamProtocolException(SOURCE, msg, 500);
            default -> new UpstreamProtocolException(SOURCE, msg, 200);
        };
    }

    static String category(String symbol) {
        return symbol.endsWith("USD") ? "inverse" : "linear";
    }

    static String quoteAsset(String symbol) {
        if (symbol.endsWith("USDT")) return "USDT";
        if (symbol.endsWith("USDC") || symbol.endsWith("PERP")) return "USDC";
        if (symbol.endsWith("USD")) return "USD";
        return "USDT";
    }

    static String baseAsset(String symbol) {
        for (String suffix : List.of("USDT", "USDC", "PERP", "USD")) {
            if (symbol.endsWith(suffix)) return symbol.substring(0, symbol.length() - suffix.length());
        }
        return symbol;
    }

    private static boolean isStableSettled(String symbol) {
        return symbol.endsWith("USDT") || symbol.endsWith("USDC") || symbol.endsWith("PERP");
    }
}
