package com.sandkev.tradevol.exchange.hyperliquid;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.sandkev.tradevol.domain.DailyVolumeRecord;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.shared.http.ExchangeWebClient;
import com.sandkev.tradevol.shared.paging.Paginator;
import com.sandkev.tradevol.shared.paging.PagingPolicy;
import com.sandkev.tradevol.testsupport.FakeSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HyperliquidConnectorTest {

    private static final LocalDate MAR1 = LocalDate.of(2024, 3, 1);

    private WireMockServer wm;
    private HyperliquidConnector connector;

    @BeforeEach
    void setUp() {
        wm = new WireMockServer(0);
        wm.start();
        PriceNormalizer prices = mock(PriceNormalizer.class);
        when(prices.usdPrice(anyString(), any())).thenReturn(BigDecimal.ONE);
        when(prices.usdPrice(anyString())).thenReturn(BigDecimal.ONE);

        Clock clock = Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC);
        var web = new ExchangeWebClient("hyperliquid", WebClient.builder().baseUrl("http://localhost:" + wm.port()).build(), clock);
        var paginator = new Paginator(new PagingPolicy(20, 1, Duration.ofMillis(1), Duration.ofSeconds(1), Duration.ZERO), new FakeSleeper());
        connector = new HyperliquidConnector(web, paginator, prices, clock);
    }

    @AfterEach
    void tearDown() {
        wm.stop();
    }

    @Test
    void candleVolumeIsPricedAtTheOpenCloseMidpoint() {
        wm.stubFor(post(urlEqualTo("/info"))
                .withRequestBody(matchingJsonPath("$.type", equalTo("candleSnapshot")))
                .withRequestBody(matchingJsonPath("$.req.coin", equalTo("BTC")))
                .withRequestBody(matchingJsonPath("$.req.interval", equalTo("1d")))
                .willReturn(okJson("""
                    [
                      {"t":1709251200000,"T":1709337599999,"s":"BTC","i":"1d","o":"100","c":"110","h":"120","l":"90","v":"2","n":40},
                      {"t":1709337600000,"T":1709423999999,"s":"BTC","i":"1d","o":"110","c":"90","h":"115","l":"85","v":"1","n":12}
                    ]
                    """)));

        var r = connector.fetchHistoricalDaily("BTC", MAR1, MAR1.plusDays(1), null);

        assertThat(r.isOk()).isTrue();
        assertThat(r.value()).extracting(DailyVolumeRecord::date).containsExactly(MAR1, MAR1.plusDays(1));
        DailyVolumeRecord first = r.value().get(0);
        assertThat(first.high()).isEqualByComparingTo("120");
        assertThat(first.volumeQuoteUsd()).isEqualByComparingTo("210");
        assertThat(r.value().get(1).volumeQuoteUsd()).isEqualByComparingTo("100");
        wm.verify(1, postRequestedFor(urlEqualTo("/info")));
    }

    @Test
    void candlesOutsideTheRequestedDaysAreDropped() {
        wm.stubFor(post(urlEqualTo("/info")).willReturn(okJson("""
            [{"t":1709164800000,"T":1709251199999,"o":"10","c":"10","h":"10","l":"10","v":"1"},
             {"t":1709251200000,"T":1709337599999,"o":"20","c":"20","h":"20","l":"20","v":"1"}]
            """)));

        var r = connector.fetchHistoricalDaily("ETH", MAR1, MAR1, null);

        assertThat(r.value()).extracting(DailyVolumeRecord::date).containsExactly(MAR1);
        assertThat(r.value().get(0).volumeQuoteUsd()).isEqualByComparingTo("20");
    }

    @Test
    void latest24h_sumsDayNotionalVolume() {
        wm.stubFor(post(urlEqualTo("/info"))
                .withRequestBody(matchingJsonPath("$.type", equalTo("metaAndAssetCtxs")))
                .willReturn(okJson("""
                    [{"universe":[{"name":"BTC"},{"name":"ETH"},{"name":"SOL"}]},
                     [{"dayNtlVlm":"1000.5","funding":"0.0001"},{"dayNtlVlm":"2000"},{"funding":"0"}]]
                    """)));

        ExchangeVolumeInfo info = connector.fetchLatest24h(null);

        assertThat(info.hasError()).isFalse();
        assertThat(info.scope()).isEqualTo("HYPERLIQUID_TOTAL");
        assertThat(info.volume24hUsd()).isEqualByComparingTo("3000.5");
    }

    @Test
    void latest24h_unexpectedShapeIsAFailedEntry() {
        wm.stubFor(post(urlEqualTo("/info")).willReturn(okJson("[{\"universe\":[]}]")));

        ExchangeVolumeInfo info = connector.fetchLatest24h(null);

        assertThat(info.hasError()).isTrue();
        assertThat(info.error()).contains("metaAndAssetCtxs");
    }
}
