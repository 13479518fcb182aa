package com.sandkev.tradevol.exchange;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.FetchResult;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.price.PriceUnavailableException;
import com.sandkev.tradevol.shared.error.ExchangeException;
import com.sandkev.tradevol.shared.paging.PageResult;
import com.sandkev.tradevol.shared.paging.Paginator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Shared plumbing for connectors: argument checks, credential gate and the conversion of
 * exchange failures into result data. Subclasses implement the protocol.
 */
@Slf4j
public abstract class AbstractExchangeConnector implements ExchangeConnector {

    protected final Paginator paginator;
    protected final PriceNormalizer prices;
    protected final Clock clock;

    protected AbstractExchangeConnector(Paginator paginator, PriceNormalizer prices, Clock clock) {
        this.paginator = paginator;
        this.prices = prices;
        this.clock = clock;
    }

    /** Scope label reported with the 24h figure, e.g. {@code LINEAR_TOTAL}. */
    protected abstract String scopeLabel();

    protected abstract FetchResult<List<DailyVolumeRecord>> doFetchHistorical(String symbol, LocalDate start, LocalDate end,
                                                                              @Nullable Credential credential);

    protected abstract ExchangeVolumeInfo doFetchLatest24h(@Nullable Credential credential);

    @Override
    public final FetchResult<List<DailyVolumeRecord>> fetchHistoricalDaily(String symbol, LocalDate start, LocalDate end,
                                                                           @Nullable Credential credential) {
        if (symbol == null || symbol.isBlank()) return FetchResult.failed(List.of(), "symbol is required");
        if (end.isBefore(start)) return FetchResult.failed(List.of(), "end date " + end + " is before start date " + start);
        if (requiresCredential() && credential == null) {
            return FetchResult.failed(List.of(), "no active credential for " + platform().id());
        }
        try {
            return doFetchHistorical(symbol, start, end, credential);
        } catch (ExchangeException | PriceUnavailableException e) {
            log.warn("{} historical {} {}..{} failed: {}", platform().id(), symbol, start, end, e.getMessage());
            return FetchResult.failed(List.of(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} historical {} {}..{} failed unexpectedly", platform().id(), symbol, start, end, e);
            return FetchResult.failed(List.of(), "unexpected error: " + e);
        }
    }

    @Override
    public final ExchangeVolumeInfo fetchLatest24h(@Nullable Credential credential) {
        if (requiresCredential() && credential == null) {
            return failed24h("no active credential for " + platform().id());
        }
        try {
            return doFetchLatest24h(credential);
        } catch (ExchangeException | PriceUnavailableException e) {
            log.warn("{} 24h volume failed: {}", platform().id(), e.getMessage());
            return failed24h(e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} 24h volume failed unexpectedly", platform().id(), e);
            return failed24h("unexpected error: " + e);
        }
    }

    protected ExchangeVolumeInfo failed24h(String error) {
        return ExchangeVolumeInfo.failed(platform(), scopeLabel(), error, clock.instant());
    }

    /** Records built from a paging run; an aborted or truncated run makes the result partial. */
    protected static FetchResult<List<DailyVolumeRecord>> toResult(List<DailyVolumeRecord> records, PageResult<?> paging) {
        if (paging.error() != null) {
            return FetchResult.partial(records, paging.error().getMessage());
        }
        if (paging.truncated()) {
            return FetchResult.partial(records, "paging stopped after " + paging.pages() + " pages");
        }
        return FetchResult.ok(records);
    }
}
