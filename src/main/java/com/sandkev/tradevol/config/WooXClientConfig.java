package com.sandkev.tradevol.config;

import com.sandkev.tradevol.domain.Platform;
import com.sandkev.tradevol.exchange.woox.WooXConnector;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.shared.http.ExchangeWebClient;
import com.sandkev.tradevol.shared.http.Sleeper;
import com.sandkev.tradevol.shared.paging.Paginator;
import com.sandkev.tradevol.shared.paging.PagingPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(WooXClientConfig.WooXClientProperties.class)
@RequiredArgsConstructor
public class WooXClientConfig {

    private final WooXClientProperties props;

    @Bean("wooxWebClient")
    @Qualifier("wooxWebClient")
    public WebClient wooxWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public WooXConnector wooXConnector(@Qualifier("wooxWebClient") WebClient wooxWebClient,
                                       PagingPolicy pagingPolicy, Sleeper sleeper,
                                       PriceNormalizer priceNormalizer, Clock clock,
                                       VolumeProperties volume) {
        // private endpoints allow roughly 10 requests per second per key
        var paginator = new Paginator(pagingPolicy.withPacing(Duration.ofMillis(props.pacingMs())), sleeper);
        return new WooXConnector(
                new ExchangeWebClient("woox", wooxWebClient, clock),
                paginator,
                priceNormalizer,
                clock,
                Duration.ofDays(props.retentionDays()),
                props.pageSize(),
                volume.symbolsFor(Platform.WOOX));
    }

    @ConfigurationProperties("woox.client")
    public record WooXClientProperties(
            String baseUrl,       // e.g. https://api.woox.io
            int    timeoutMs,
            int    retentionDays, // how far back /v1/client/trades reaches
            int    pageSize,
            long   pacingMs
    ) {}
}
