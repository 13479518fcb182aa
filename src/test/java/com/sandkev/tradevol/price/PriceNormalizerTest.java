package com.sandkev.tradevol.price;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.tradevol.cache.CaffeineCacheService;
import com.sandkev.tradevol.cache.JsonCache;
import com.sandkev.tradevol.testsupport.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PriceNormalizerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC);
    private final FakeTicker ticker = new FakeTicker();
    private PriceService prices;
    private JsonCache cache;

    @BeforeEach
    void setUp() {
        prices = mock(PriceService.class);
        cache = new JsonCache(new CaffeineCacheService(100, ticker), new ObjectMapper());
    }

    private PriceNormalizer normalizer(PriceFallbackPolicy policy) {
        return new PriceNormalizer(prices, new CoinGeckoIdResolver(), cache,
                Duration.ofMinutes(5), Duration.ofDays(7), policy, clock);
    }

    @Test
    void stablecoinsAreOneWithoutALookup() {
        var n = normalizer(PriceFallbackPolicy.DEFAULT_TO_ONE);

        assertThat(n.usdPrice("usdt")).isEqualByComparingTo("1");
        assertThat(n.usdPrice("USDC", LocalDate.of(2020, 1, 1))).isEqualByComparingTo("1");
        assertThat(n.usdPrice("USD")).isEqualByComparingTo("1");
        verifyNoInteractions(prices);
    }

    @Test
    void spotPriceIsCachedForItsTtl() {
        when(prices.getSimplePrice(Set.of("bitcoin"), "usd")).thenReturn(Map.of("bitcoin", new BigDecimal("60000")));
        var n = normalizer(PriceFallbackPolicy.DEFAULT_TO_ONE);

        assertThat(n.usdPrice("BTC")).isEqualByComparingTo("60000");
        assertThat(n.usdPrice("btc")).isEqualByComparingTo("60000");
        verify(prices, times(1)).getSimplePrice(any(), anyString());

        ticker.advance(Duration.ofMinutes(6));
        n.usdPrice("BTC");
        verify(prices, times(2)).getSimplePrice(any(), anyString());
    }

    @Test
    void failedLookupFallsBackToLastKnownPrice() {
        when(prices.getSimplePrice(Set.of("ethereum"), "usd"))
                .thenReturn(Map.of("ethereum", new BigDecimal("3000")))
                .thenThrow(new RuntimeException("coingecko down"));
        var n = normalizer(PriceFallbackPolicy.FAIL_FAST);

        assertThat(n.usdPrice("ETH")).isEqualByComparingTo("3000");
        ticker.advance(Duration.ofMinutes(10));
        assertThat(n.usdPrice("ETH")).isEqualByComparingTo("3000");
    }

    @Test
    void noPriceAtAll_defaultsToOneUnderDefaultPolicy() {
        when(prices.getSimplePrice(any(), anyString())).thenThrow(new RuntimeException("coingecko down"));

        assertThat(normalizer(PriceFallbackPolicy.DEFAULT_TO_ONE).usdPrice("SOL")).isEqualByComparingTo("1");
    }

    @Test
    void noPriceAtAll_throwsUnderFailFast() {
        when(prices.getSimplePrice(any(), anyString())).thenReturn(Map.of());

        assertThatThrownBy(() -> normalizer(PriceFallbackPolicy.FAIL_FAST).usdPrice("SOL"))
                .isInstanceOf(PriceUnavailableException.class);
    }

    @Test
    void unknownSymbolHasNoCoinGeckoId() {
        assertThatThrownBy(() -> normalizer(PriceFallbackPolicy.FAIL_FAST).usdPrice("NOPE"))
                .isInstanceOf(PriceUnavailableException.class);
        verifyNoInteractions(prices);
    }

    @Test
    void olderDaysUseDailyHistory_recentDaysUseSpot() {
        when(prices.getHistoricalPrice(eq("bitcoin"), eq(LocalDate.of(2024, 5, 1)), eq("usd")))
                .thenReturn(Optional.of(new BigDecimal("58000")));
        when(prices.getSimplePrice(Set.of("bitcoin"), "usd")).thenReturn(Map.of("bitcoin", new BigDecimal("61000")));
        var n = normalizer(PriceFallbackPolicy.FAIL_FAST);

        assertThat(n.usdPrice("BTC", LocalDate.of(2024, 5, 1))).isEqualByComparingTo("58000");
        assertThat(n.usdPrice("BTC", LocalDate.of(2024, 5, 1))).isEqualByComparingTo("58000");
        assertThat(n.usdPrice("BTC", LocalDate.of(2024, 5, 9))).isEqualByComparingTo("61000");
        verify(prices, times(1)).getHistoricalPrice(any(), any(), anyString());
    }
}
