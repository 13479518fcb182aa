package com.sandkev.tradevol.price;

import com.sandkev.tradevol.cache.JsonCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * USD price per unit of an asset, used to turn base- or quote-asset volume into USD.
 * <p>
 * Stablecoins are 1.0. Everything else goes through CoinGecko with a short-lived cache entry
 * per symbol ({@code price:usd:BTC}) and a long-lived last-known-good entry used when
 * CoinGecko fails. Past dates use the CoinGecko daily history and are cached for the
 * last-known TTL since they do not change.
 */
@Slf4j
public class PriceNormalizer {

    private static final Set<String> STABLES = Set.of("USD", "USDT", "USDC", "DAI", "BUSD", "TUSD", "FDUSD", "USDE");
    private static final String VS = "usd";

    private final PriceService prices;
    private final CoinGeckoIdResolver ids;
    private final JsonCache cache;
    private final Duration ttl;
    private final Duration lastKnownTtl;
    private final PriceFallbackPolicy fallback;
    private final Clock clock;

    public PriceNormalizer(PriceService prices, CoinGeckoIdResolver ids, JsonCache cache,
                           Duration ttl, Duration lastKnownTtl, PriceFallbackPolicy fallback, Clock clock) {
        this.prices = prices;
        this.ids = ids;
        this.cache = cache;
        this.ttl = ttl;
        this.lastKnownTtl = lastKnownTtl;
        this.fallback = fallback;
        this.clock = clock;
    }

    public static boolean isStable(String symbol) {
        return symbol != null && STABLES.contains(symbol.toUpperCase(Locale.ROOT));
    }

    public BigDecimal usdPrice(String symbol) {
        return usdPrice(symbol, null);
    }

    /**
     * @param asOf day the volume was traded; null, today and yesterday use the spot price
     */
    public BigDecimal usdPrice(String symbol, @Nullable LocalDate asOf) {
        String sym = symbol.toUpperCase(Locale.ROOT);
        if (isStable(sym)) return BigDecimal.ONE;

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate historicalDay = asOf != null && asOf.isBefore(today.minusDays(1)) ? asOf : null;
        String key = historicalDay == null ? spotKey(sym) : spotKey(sym) + ":" + historicalDay;

        Optional<String> cached = cache.getString(key);
        if (cached.isPresent()) return new BigDecimal(cached.get());

        BigDecimal price;
        try {
            price = lookup(sym, historicalDay);
        } catch (RuntimeException e) {
            return fallbackPrice(sym, e);
        }

        if (historicalDay == null) {
            cache.setString(key, price.toPlainString(), ttl);
            cache.setString(lastKnownKey(sym), price.toPlainString(), lastKnownTtl);
        } else {
            cache.setString(key, price.toPlainString(), lastKnownTtl);
        }
        return price;
    }

    private BigDecimal lookup(String sym, @Nullable LocalDate day) {
        String id = ids.resolve(sym)
                .orElseThrow(() -> new PriceUnavailableException("no CoinGecko id for " + sym));
        Optional<BigDecimal> price = day == null
                ? Optional.ofNullable(prices.getSimplePrice(Set.of(id), VS).get(id))
                : prices.getHistoricalPrice(id, day, VS);
        return price.filter(p -> p.signum() > 0)
                .orElseThrow(() -> new PriceUnavailableException("CoinGecko returned no USD price for " + id));
    }

    private BigDecimal fallbackPrice(String sym, RuntimeException cause) {
        Optional<String> last = cache.getString(lastKnownKey(sym));
        if (last.isPresent()) {
            log.warn("USD price lookup for {} failed ({}); using last known {}", sym, cause.getMessage(), last.get());
            return new BigDecimal(last.get());
        }
        if (fallback == PriceFallbackPolicy.FAIL_FAST) {
            throw new PriceUnavailableException("No USD price for " + sym, cause);
        }
        log.warn("USD price lookup for {} failed ({}); no cached value, defaulting to 1.0", sym, cause.getMessage());
        return BigDecimal.ONE;
    }

    private static String spotKey(String sym) {
        return "price:usd:" + sym;
    }

    private static String lastKnownKey(String sym) {
        return "price:usd:last:" + sym;
    }
}
