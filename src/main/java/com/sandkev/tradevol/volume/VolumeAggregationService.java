package com.sandkev.tradevol.volume;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sandkev.tradevol.cache.JsonCache;
import com.sandkev.tradevol.config.VolumeProperties;
import com.sandkev.tradevol.credential.CredentialProvider;
import com.sandkev.tradevol.domain.AggregatedHistoricalPoint;
import com.sandkev.tradevol.domain.AggregatedVolume;
import com.sandkev.tradevol.domain.BackfillResult;
import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.exchange.ExchangeConnector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans volume requests out to every registered connector and folds the answers together.
 * A platform that throws or times out shows up as an entry with an error; it never takes
 * the rest of the batch down with it.
 */
@Slf4j
public class VolumeAggregationService {

    static final String CURRENT_KEY = "current_aggregated_volume";
    static final String HISTORICAL_KEY_PREFIX = "historical_aggregated_volume_";
    private static final TypeReference<AggregatedVolume> AGGREGATE = new TypeReference<>() {};
    private static final TypeReference<List<AggregatedHistoricalPoint>> POINTS = new TypeReference<>() {};

    private final Map<Platform, ExchangeConnector> connectors = new EnumMap<>(Platform.class);
    private final CredentialProvider credentials;
    private final HistoricalVolumeStore store;
    private final JsonCache cache;
    private final ExecutorService executor;
    private final VolumeProperties props;
    private final Clock clock;

    public VolumeAggregationService(List<ExchangeConnector> connectors, CredentialProvider credentials,
                                    HistoricalVolumeStore store, JsonCache cache, ExecutorService executor,
                                    VolumeProperties props, Clock clock) {
        for (ExchangeConnector c : connectors) {
            if (this.connectors.putIfAbsent(c.platform(), c) != null) {
                throw new IllegalArgumentException("duplicate connector for " + c.platform().id());
            }
        }
        this.credentials = credentials;
        this.store = store;
        this.cache = cache;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    /** Cached aggregate when fresh, otherwise a new fan-out. */
    public AggregatedVolume currentAggregate() {
        Optional<AggregatedVolume> cached = cache.get(CURRENT_KEY, AGGREGATE);
        if (cached.isPresent()) {
            log.debug("current aggregate served from cache");
            return cached.get();
        }
        return refreshCurrentAggregate();
    }

    /** Always fans out, then replaces the cached aggregate. */
    public AggregatedVolume refreshCurrentAggregate() {
        List<Platform> platforms = new ArrayList<>(connectors.keySet());
        Map<Platform, Credential> creds = lookupCredentials(platforms);

        List<CompletableFuture<ExchangeVolumeInfo>> futures = new ArrayList<>();
        for (Platform p : platforms) {
            ExchangeConnector connector = connectors.get(p);
            futures.add(CompletableFuture
                    .supplyAsync(() -> connector.fetchLatest24h(creds.get(p)), executor)
                    .orTimeout(props.platformTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> failedInfo(p, e)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ExchangeVolumeInfo> infos = futures.stream().map(CompletableFuture::join).toList();
        AggregatedVolume aggregate = AggregatedVolume.of(infos, clock.instant());
        long failed = infos.stream().filter(ExchangeVolumeInfo::hasError).count();
        log.info("24h volume across {} platforms: {} USD ({} failed)", infos.size(),
                aggregate.totalVolume24hUsd().toPlainString(), failed);

        cache.set(CURRENT_KEY, aggregate, props.currentCacheTtl());
        return aggregate;
    }

    /** Uncached 24h lookup for a single platform. */
    public ExchangeVolumeInfo currentForPlatform(Platform platform) {
        ExchangeConnector connector = connectors.get(platform);
        if (connector == null) {
            return ExchangeVolumeInfo.failed(platform, "ERROR", "no connector registered for " + platform.id(), clock.instant());
        }
        Credential credential = credentials.credentialFor(platform).orElse(null);
        return CompletableFuture
                .supplyAsync(() -> connector.fetchLatest24h(credential), executor)
                .orTimeout(props.platformTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> failedInfo(platform, e))
                .join();
    }

    /** Daily totals across every platform and symbol, oldest first. */
    public List<AggregatedHistoricalPoint> historicalAggregate(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end date " + end + " is before start date " + start);
        }
        String key = historicalKey(start, end);
        Optional<List<AggregatedHistoricalPoint>> cached = cache.get(key, POINTS);
        if (cached.isPresent()) return cached.get();

        Map<LocalDate, BigDecimal> byDay = new TreeMap<>();
        for (DailyVolumeRecord r : store.queryRange(start, end)) {
            byDay.merge(r.date(), r.volumeQuoteUsd(), BigDecimal::add);
        }
        List<AggregatedHistoricalPoint> points = byDay.entrySet().stream()
                .map(e -> new AggregatedHistoricalPoint(e.getKey(), e.getValue()))
                .toList();

        cache.set(key, points, props.historicalCacheTtl());
        return points;
    }

    /** Backfills the trailing {@code volume.backfill-days} days, ending yesterday (UTC). */
    public List<BackfillResult> fetchAndStoreTrailingWindow() {
        LocalDate end = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        LocalDate start = end.minusDays(Math.max(1, props.backfillDays()) - 1L);
        return fetchAndStoreHistorical(null, start, end);
    }

    /**
     * Fetches daily records for one platform, or all of them concurrently when {@code platform}
     * is null, and stores them insert-or-ignore. Never throws for a per-platform failure.
     */
    public List<BackfillResult> fetchAndStoreHistorical(@Nullable Platform platform, LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end date " + end + " is before start date " + start);
        }
        List<Platform> targets = platform == null ? new ArrayList<>(connectors.keySet()) : List.of(platform);
        Map<Platform, Credential> creds = lookupCredentials(targets);
        log.info("Backfilling {} from {} to {}", targets, start, end);

        List<CompletableFuture<BackfillResult>> futures = new ArrayList<>();
        for (Platform p : targets) {
            ExchangeConnector connector = connectors.get(p);
            if (connector == null) {
                futures.add(CompletableFuture.completedFuture(
                        BackfillResult.error(p, "no connector registered for " + p.id())));
                continue;
            }
            Credential credential = creds.get(p);
            if (connector.requiresCredential() && credential == null) {
                futures.add(CompletableFuture.completedFuture(
                        BackfillResult.error(p, "no active credential for " + p.id())));
                continue;
            }
            futures.add(CompletableFuture
                    .supplyAsync(() -> backfill(connector, credential, start, end), executor)
                    .orTimeout(props.backfillTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        String msg = describe(e, props.backfillTimeout().toSeconds());
                        log.error("Backfill for {} failed: {}", p.id(), msg);
                        return BackfillResult.error(p, msg);
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<BackfillResult> results = futures.stream().map(CompletableFuture::join).toList();
        if (results.stream().anyMatch(r -> r.stored() > 0)) {
            cache.delete(historicalKey(start, end));
        }
        results.forEach(r -> log.info("Backfill {}: {} fetched={} stored={} errors={}",
                r.platform().id(), r.status(), r.fetched(), r.stored(), r.errors().size()));
        return results;
    }

    private BackfillResult backfill(ExchangeConnector connector, @Nullable Credential credential,
                                    LocalDate start, LocalDate end) {
        Platform p = connector.platform();
        List<String> symbols = props.symbolsFor(p);
        if (symbols.isEmpty()) {
            log.warn("No symbols configured for {}, nothing to backfill", p.id());
            return BackfillResult.of(p, 0, 0, List.of());
        }

        int fetched = 0;
        int stored = 0;
        List<String> errors = new ArrayList<>();
        for (String symbol : symbols) {
            FetchResult<List<DailyVolumeRecord>> result = connector.fetchHistoricalDaily(symbol, start, end, credential);
            if (result.error() != null) {
                errors.add(symbol + ": " + result.error());
            }
            List<DailyVolumeRecord> records = result.value();
            fetched += records.size();
            if (!records.isEmpty()) {
                stored += store.insertOrIgnore(records);
            }
        }
        return BackfillResult.of(p, fetched, stored, errors);
    }

    /** Looked up before the fan-out so provider failures surface to the caller. */
    private Map<Platform, Credential> lookupCredentials(List<Platform> platforms) {
        Map<Platform, Credential> out = new EnumMap<>(Platform.class);
        for (Platform p : platforms) {
            credentials.credentialFor(p).ifPresent(c -> out.put(p, c));
        }
        return out;
    }

    private ExchangeVolumeInfo failedInfo(Platform platform, Throwable e) {
        String msg = describe(e, props.platformTimeout().toSeconds());
        log.error("24h volume for {} failed: {}", platform.id(), msg);
        return ExchangeVolumeInfo.failed(platform, "ERROR", msg, clock.instant());
    }

    private static String describe(Throwable e, long timeoutSeconds) {
        Throwable cause = unwrap(e);
        if (cause instanceof TimeoutException) return "timed out after " + timeoutSeconds + "s";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        return t;
    }

    static String historicalKey(LocalDate start, LocalDate end) {
        return HISTORICAL_KEY_PREFIX + start + "_" + end;
    }
}
