package com.sandkev.tradevol.config;

import com.sandkev.tradevol.exchange.hyperliquid.HyperliquidConnector;
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
@EnableConfigurationProperties(HyperliquidClientConfig.HyperliquidClientProperties.class)
@RequiredArgsConstructor
public class HyperliquidClientConfig {

    private final HyperliquidClientProperties props;

    @Bean("hyperliquidWebClient")
    @Qualifier("hyperliquidWebClient")
    public WebClient hyperliquidWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public HyperliquidConnector hyperliquidConnector(@Qualifier("hyperliquidWebClient") WebClient hyperliquidWebClient,
                                                     PagingPolicy pagingPolicy, Sleeper sleeper,
                                                     PriceNormalizer priceNormalizer, Clock clock) {
        return new HyperliquidConnector(
                new ExchangeWebClient("hyperliquid", hyperliquidWebClient, clock),
                new Paginator(pagingPolicy, sleeper),
                priceNormalizer,
                clock);
    }

    @ConfigurationProperties("hyperliquid.client")
    public record HyperliquidClientProperties(
            String baseUrl,     // e.g. https://api.hyperliquid.xyz
            int    timeoutMs
    ) {}
}
