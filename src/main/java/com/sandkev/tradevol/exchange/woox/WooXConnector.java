package com.sandkev.tradevol.exchange.woox;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.exchange.AbstractExchangeConnector;
import com.sandkev.tradevol.exchange.DailyCandleBuilder;
import com.sandkev.tradevol.exchange.Fill;
import com.sandkev.tradevol.exchange.Payloads;
import com.sandkev.tradevol.exchange.TimeRanges;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.shared.error.AuthException;
import com.sandkev.tradevol.shared.error.ParameterException;
import com.sandkev.tradevol.shared.error.RateLimitedException;
import com.sandkev.tradevol.shared.error.SerializationException;
import com.sandkev.tradevol.shared.error.UpstreamProtocolException;
import com.sandkev.tradevol.shared.http.ExchangeWebClient;
import com.sandkev.tradevol.shared.paging.Page;
import com.sandkev.tradevol.shared.paging.PageResult;
import com.sandkev.tradevol.shared.paging.PagedQuery;
import com.sandkev.tradevol.shared.paging.Paginator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * WOO X account fills. The live {@code /v1/client/trades} endpoint only covers a trailing
 * retention window (90 days); older fills come from {@code /v1/client/hist_trades}. A range
 * that straddles the boundary is split, both halves fetched, then merged by trade id.
 */
@Slf4j
public class WooXConnector extends AbstractExchangeConnector {

    static final String SOURCE = "woox";
    static final String RECENT_PATH = "/v1/client/trades";
    static final String ARCHIVE_PATH = "/v1/client/hist_trades";
    private static final ParameterizedTypeReference<Map<String, Object>> ENVELOPE = new ParameterizedTypeReference<>() {};
    private static final BigDecimal SECONDS_THRESHOLD = new BigDecimal("100000000000");

    private final ExchangeWebClient web;
    private final Duration retention;
    private final int pageSize;
    private final List<String> accountSymbols;

    public WooXConnector(ExchangeWebClient web, Paginator paginator, PriceNormalizer prices, Clock clock,
                         Duration retention, int pageSize, List<String> accountSymbols) {
        super(paginator, prices, clock);
        this.web = web;
        this.retention = retention;
        this.pageSize = pageSize;
        this.accountSymbols = List.copyOf(accountSymbols);
    }

    @Override
    public Platform platform() {
        return Platform.WOOX;
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    @Override
    protected String scopeLabel() {
        return "WOOX_ACCOUNT_TOTAL";
    }

    @Override
    protected FetchResult<List<DailyVolumeRecord>> doFetchHistorical(String symbol, LocalDate start, LocalDate end,
                                                                     @Nullable Credential credential) {
        var client = signedClient(credential);
        String sym = symbol.toUpperCase(Locale.ROOT);
        FillWindow fills = fetchFills(client, sym, TimeRanges.startMs(start),
                Math.min(TimeRanges.endMsInclusive(end), clock.millis()));

        String quote = quoteAsset(sym);
        List<DailyVolumeRecord> records = DailyCandleBuilder.fromFills(Platform.WOOX, sym, fills.fills(), start, end,
                day -> prices.usdPrice(quote, day));
        return fills.errors().isEmpty()
                ? FetchResult.ok(records)
                : FetchResult.partial(records, String.join("; ", fills.errors()));
    }

    /** Sums the trailing 24h of fills over every configured account symbol. */
    @Override
    protected ExchangeVolumeInfo doFetchLatest24h(@Nullable Credential credential) {
        if (accountSymbols.isEmpty()) {
            return failed24h("no WOO X symbols configured; account-wide volume is not available");
        }
        var client = signedClient(credential);
        long now = clock.millis();
        long from = now - Duration.ofHours(24).toMillis();

        BigDecimal total = BigDecimal.ZERO;
        List<String> failures = new ArrayList<>();
        for (String symbol : accountSymbols) {
            FillWindow w = fetchFills(client, symbol, from, now);
            if (!w.errors().isEmpty()) {
                failures.add(symbol + ": " + String.join("; ", w.errors()));
                continue;
            }
            BigDecimal rate = prices.usdPrice(quoteAsset(symbol));
            for (Fill f : w.fills()) {
                total = total.add(f.notional().multiply(rate));
            }
        }
        if (!failures.isEmpty()) {
            return failed24h(failures.size() + " of " + accountSymbols.size() + " symbols failed: " + String.join(" | ", failures));
        }
        return ExchangeVolumeInfo.ok(Platform.WOOX, scopeLabel(), total, clock.instant());
    }

    record FillWindow(List<Fill> fills, List<String> errors) {}

    /** Fetches fills in [fromMs, toMs], splitting at the retention boundary when needed. */
    FillWindow fetchFills(WooXSignedClient client, String symbol, long fromMs, long toMs) {
        long boundary = clock.millis() - retention.toMillis();
        Map<String, Fill> merged = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        if (toMs >= boundary) {
            PageResult<Fill> recent = paginator.collect(recentQuery(client, symbol, Math.max(fromMs, boundary), toMs));
            recent.items().forEach(f -> merged.putIfAbsent(f.id(), f));
            describe(recent, RECENT_PATH).ifPresent(errors::add);
        }
        if (fromMs < boundary) {
            long archiveEnd = Math.min(toMs, boundary - 1);
            PageResult<Fill> archive = paginator.collect(archiveQuery(client, symbol, fromMs, archiveEnd));
            archive.items().forEach(f -> merged.putIfAbsent(f.id(), f));
            describe(archive, ARCHIVE_PATH).ifPresent(errors::add);
        }

        List<Fill> fills = new ArrayList<>(merged.values());
        fills.sort(Comparator.comparingLong(Fill::timestampMs));
        return new FillWindow(fills, errors);
    }

    private PagedQuery<Fill, Integer> recentQuery(WooXSignedClient client, String symbol, long fromMs, long toMs) {
        return PagedQuery.<Fill, Integer>builder()
                .label("woox trades " + symbol)
                .initialCursor(1)
                .fetcher(page -> {
                    var p = new LinkedHashMap<String, Object>();
                    p.put("symbol", symbol);
                    p.put("start_t", fromMs);
                    p.put("end_t", toMs);
                    p.put("page", page);
                    p.put("size", pageSize);
                    Map<String, Object> body = checkSuccess(client.get(RECENT_PATH, p, ENVELOPE), RECENT_PATH);
                    List<Fill> fills = parseFills(symbol, rows(body));
                    return new Page<>(fills, hasMorePages(body, page) ? page + 1 : null);
                })
                .identity(Fill::id)
                .timestamp(Fill::timestampMs)
                .build();
    }

    private PagedQuery<Fill, Long> archiveQuery(WooXSignedClient client, String symbol, long fromMs, long toMs) {
        return PagedQuery.<Fill, Long>builder()
                .label("woox hist_trades " + symbol)
                .fetcher(fromId -> {
                    var p = new LinkedHashMap<String, Object>();
                    p.put("symbol", symbol);
                    p.put("start_t", fromMs);
                    p.put("end_t", toMs);
                    if (fromId != null) p.put("fromId", fromId);
                    p.put("limit", pageSize);
                    Map<String, Object> body = checkSuccess(client.get(ARCHIVE_PATH, p, ENVELOPE), ARCHIVE_PATH);
                    List<Fill> fills = parseFills(symbol, rows(body));
                    Long next = fills.stream()
                            .map(f -> parseLongOrNull(f.id()))
                            .filter(Objects::nonNull)
                            .max(Long::compare)
                            .orElse(null);
                    return new Page<>(fills, next);
                })
                .identity(Fill::id)
                .timestamp(Fill::timestampMs)
                .pageSize(pageSize)
                .build();
    }

    private WooXSignedClient signedClient(@Nullable Credential credential) {
        if (credential == null || !credential.hasApiKey()) {
            throw new AuthException(SOURCE, "API key and secret are required");
        }
        return new WooXSignedClient(web, credential, clock);
    }

    static Map<String, Object> checkSuccess(Map<String, Object> body, String path) {
        if (body == null) throw new SerializationException(SOURCE, path + " returned an empty body", null);
        if (Boolean.TRUE.equals(body.get("success"))) return body;

        Object code = body.get("code");
        String msg = path + " code=" + code + " " + body.get("message");
        int c = code instanceof Number n ? n.intValue() : 0;
        throw switch (c) {
            case -1001, -1002 -> new AuthException(SOURCE, msg);
            case -1003 -> new RateLimitedException(SOURCE, msg, null);
            case -1004, -1005, -1006 -> new ParameterException(SOURCE, msg);
            case -1000 -> new UpstreamProtocolException(SOURCE, msg, 500);
            default -> new UpstreamProtocolException(SOURCE, msg, 200);
        };
    }

    /** Rows sit at the top level on some endpoints and under {@code data} on others. */
    private static List<Object> rows(Map<String, Object> body) {
        Object rows = body.get("rows");
        if (rows == null && body.get("data") instanceof Map<?, ?> data) rows = data.get("rows");
        return rows == null ? List.of() : Payloads.list(SOURCE, rows, "rows");
    }

    private static boolean hasMorePages(Map<String, Object> body, int page) {
        Object metaObj = body.get("meta");
        if (metaObj == null && body.get("data") instanceof Map<?, ?> data) metaObj = data.get("meta");
        if (!(metaObj instanceof Map<?, ?>)) return false;
        Map<String, Object> meta = Payloads.map(SOURCE, metaObj, "meta");

        long current = meta.get("current_page") != null ? Payloads.longValue(SOURCE, meta, "current_page") : page;
        long totalPages;
        if (meta.get("total_page") != null) {
            totalPages = Payloads.longValue(SOURCE, meta, "total_page");
        } else if (meta.get("total") != null && meta.get("records_per_page") != null) {
            long total = Payloads.longValue(SOURCE, meta, "total");
            long perPage = Math.max(1, Payloads.longValue(SOURCE, meta, "records_per_page"));
            totalPages = (total + perPage - 1) / perPage;
        } else {
            totalPages = current;
        }
        return current < totalPages;
    }

    private static List<Fill> parseFills(String symbol, List<Object> rows) {
        List<Fill> fills = new ArrayList<>(rows.size());
        for (Object row : rows) {
            try {
                Map<String, Object> m = Payloads.map(SOURCE, row, "trade");
                fills.add(new Fill(
                        Payloads.string(SOURCE, m, "id"),
                        Payloads.decimal(SOURCE, m, "executed_price"),
                        Payloads.decimal(SOURCE, m, "executed_quantity"),
                        timestampMs(Payloads.decimal(SOURCE, m, "executed_timestamp"))));
            } catch (SerializationException e) {
                log.warn("woox: skipping malformed trade for {}: {}", symbol, e.getMessage());
            }
        }
        return fills;
    }

    /** {@code executed_timestamp} arrives as seconds with a fraction or as epoch millis. */
    static long timestampMs(BigDecimal raw) {
        if (raw.compareTo(SECONDS_THRESHOLD) < 0) {
            return raw.movePointRight(3).longValue();
        }
        return raw.longValue();
    }

    /** {@code PERP_BTC_USDT} and {@code SPOT_BTC_USDT} quote in the last segment. */
    static String quoteAsset(String symbol) {
        int i = symbol.lastIndexOf('_');
        return i >= 0 ? symbol.substring(i + 1) : "USDT";
    }

    private static Long parseLongOrNull(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Optional<String> describe(PageResult<Fill> r, String path) {
        if (r.error() != null) return Optional.of(path + ": " + r.error().getMessage());
        if (r.truncated()) return Optional.of(path + ": paging stopped after " + r.pages() + " pages");
        return Optional.empty();
    }
}
