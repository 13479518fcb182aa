package com.sandkev.tradevol.exchange.paradex;

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
import com.sandkev.tradevol.shared.error.SerializationException;
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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Paradex account fills via {@code GET /v1/fills}, authenticated with a JWT from
 * {@link ParadexAuthClient}. Daily candles are rebuilt from the fills.
 */
@Slf4j
public class ParadexConnector extends AbstractExchangeConnector {

    static final String SOURCE = "paradex";
    static final String FILLS_PATH = "/v1/fills";
    static final int MAX_PAGE_SIZE = 5000;
    private static final ParameterizedTypeReference<Map<String, Object>> ENVELOPE = new ParameterizedTypeReference<>() {};

    private final ExchangeWebClient web;
    private final ParadexAuthClient auth;
    private final int pageSize;

    public ParadexConnector(ExchangeWebClient web, ParadexAuthClient auth, Paginator paginator,
                            PriceNormalizer prices, Clock clock, int pageSize) {
        super(paginator, prices, clock);
        this.web = web;
        this.auth = auth;
        this.pageSize = Math.min(Math.max(1, pageSize), MAX_PAGE_SIZE);
    }

    @Override
    public Platform platform() {
        return Platform.PARADEX;
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    @Override
    protected String scopeLabel() {
        return "PARADEX_ACCOUNT_TOTAL";
    }

    @Override
    protected FetchResult<List<DailyVolumeRecord>> doFetchHistorical(String market, LocalDate start, LocalDate end,
                                                                     @Nullable Credential credential) {
        String mkt = market.toUpperCase(Locale.ROOT);
        long endMs = Math.min(TimeRanges.endMsInclusive(end), clock.millis());
        PageResult<MarketFill> paged = paginator.collect(fillsQuery(session(credential), mkt, TimeRanges.startMs(start), endMs));

        String quote = quoteAsset(mkt);
        List<Fill> fills = paged.items().stream().map(MarketFill::fill).toList();
        List<DailyVolumeRecord> records = DailyCandleBuilder.fromFills(Platform.PARADEX, mkt, fills, start, end,
                day -> prices.usdPrice(quote, day));
        return toResult(records, paged);
    }

    /** Account-wide: fills for every market over the trailing 24h. */
    @Override
    protected ExchangeVolumeInfo doFetchLatest24h(@Nullable Credential credential) {
        long now = clock.millis();
        PageResult<MarketFill> paged = paginator.collect(
                fillsQuery(session(credential), null, now - Duration.ofHours(24).toMillis(), now));
        if (!paged.isComplete()) {
            return failed24h(paged.error() != null
                    ? paged.error().getMessage()
                    : "paging stopped after " + paged.pages() + " pages");
        }

        Map<String, BigDecimal> rates = new HashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (MarketFill f : paged.items()) {
            BigDecimal rate = rates.computeIfAbsent(quoteAsset(f.market()), prices::usdPrice);
            total = total.add(f.fill().notional().multiply(rate));
        }
        return ExchangeVolumeInfo.ok(Platform.PARADEX, scopeLabel(), total, clock.instant());
    }

    record MarketFill(String market, Fill fill) {}

    private PagedQuery<MarketFill, String> fillsQuery(Session session, @Nullable String market, long fromMs, long toMs) {
        return PagedQuery.<MarketFill, String>builder()
                .label("paradex fills " + (market == null ? "*" : market))
                .fetcher(cursor -> {
                    var p = new LinkedHashMap<String, Object>();
                    if (market != null) p.put("market", market);
                    p.put("start_at", fromMs);
                    p.put("end_at", toMs);
                    p.put("page_size", pageSize);
                    if (cursor != null) p.put("cursor", cursor);
                    Map<String, Object> body = session.get(FILLS_PATH, p);
                    if (body == null) throw new SerializationException(SOURCE, FILLS_PATH + " returned an empty body", null);

                    List<MarketFill> fills = parseFills(body.get("results"), market);
                    Object next = body.get("next");
                    return new Page<>(fills, next == null || String.valueOf(next).isBlank() ? null : String.valueOf(next));
                })
                .identity(f -> f.fill().id())
                .timestamp(f -> f.fill().timestampMs())
                .build();
    }

    private Session session(@Nullable Credential credential) {
        if (credential == null) throw new AuthException(SOURCE, "no Paradex credential");
        return new Session(credential, auth.bearerToken(credential));
    }

    /** Bearer-authenticated calls; a rejected issued token is dropped and reissued once. */
    private final class Session {
        private final Credential credential;
        private ParadexAuthClient.BearerToken token;
        private boolean reissued;

        Session(Credential credential, ParadexAuthClient.BearerToken token) {
            this.credential = credential;
            this.token = token;
        }

        Map<String, Object> get(String path, Map<String, Object> params) {
            try {
                return web.get(path, params, Map.of("Authorization", "Bearer " + token.jwt()), ENVELOPE);
            } catch (AuthException e) {
                if (!token.refreshable() || reissued) throw e;
                log.info("paradex: token rejected on {}, reissuing", path);
                auth.invalidate(credential);
                token = auth.bearerToken(credential);
                reissued = true;
                return web.get(path, params, Map.of("Authorization", "Bearer " + token.jwt()), ENVELOPE);
            }
        }
    }

    /** {@code results: [{id, market, price, size, created_at}]}; {@code created_at} is epoch millis. */
    private static List<MarketFill> parseFills(Object results, @Nullable String requestedMarket) {
        if (results == null) return List.of();
        List<Object> rows = Payloads.list(SOURCE, results, "results");
        List<MarketFill> fills = new ArrayList<>(rows.size());
        for (Object row : rows) {
            try {
                Map<String, Object> m = Payloads.map(SOURCE, row, "fill");
                Object market = m.get("market");
                fills.add(new MarketFill(
                        market != null ? String.valueOf(market) : requestedMarket != null ? requestedMarket : "",
                        new Fill(
                                Payloads.string(SOURCE, m, "id"),
                                Payloads.decimal(SOURCE, m, "price"),
                                Payloads.decimal(SOURCE, m, "size"),
                                Payloads.longValue(SOURCE, m, "created_at"))));
            } catch (SerializationException e) {
                log.warn("paradex: skipping malformed fill: {}", e.getMessage());
            }
        }
        return fills;
    }

    /** {@code BTC-USD-PERP} quotes in the middle segment. */
    static String quoteAsset(String market) {
        String[] parts = market.split("-");
        return parts.length >= 2 ? parts[1] : "USD";
    }
}
