package com.sandkev.tradevol.config;

import com.sandkev.tradevol.exchange.bybit.BybitConnector;
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
@EnableConfigurationProperties(BybitClientConfig.BybitClientProperties.class)
@RequiredArgsConstructor
public class BybitClientConfig {

    private final BybitClientProperties props;

    @Bean("bybitWebClient")
    @Qualifier("bybitWebClient")
    public WebClient bybitWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public BybitConnector bybitConnector(@Qualifier("bybitWebClient") WebClient bybitWebClient,
                                         PagingPolicy pagingPolicy, Sleeper sleeper,
                                         PriceNormalizer priceNormalizer, Clock clock) {
        return new BybitConnector(
                new ExchangeWebClient("bybit", bybitWebClient, clock),
                new Paginator(pagingPolicy, sleeper),
                priceNormalizer,
                clock);
    }

    @ConfigurationProperties("bybit.client")
    public record BybitClientProperties(
            String baseUrl,     // e.g. https://api.bybit.com
            int    timeoutMs
    ) {}
}
