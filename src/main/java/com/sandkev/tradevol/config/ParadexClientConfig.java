package com.sandkev.tradevol.config;

import com.sandkev.tradevol.cache.JsonCache;
import com.sandkev.tradevol.exchange.paradex.ParadexAuthClient;
import com.sandkev.tradevol.exchange.paradex.ParadexConnector;
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
@EnableConfigurationProperties(ParadexClientConfig.ParadexClientProperties.class)
@RequiredArgsConstructor
public class ParadexClientConfig {

    private final ParadexClientProperties props;

    @Bean("paradexWebClient")
    @Qualifier("paradexWebClient")
    public WebClient paradexWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public ParadexAuthClient paradexAuthClient(@Qualifier("paradexWebClient") WebClient paradexWebClient,
                                               JsonCache jsonCache, Clock clock) {
        return new ParadexAuthClient(
                new ExchangeWebClient("paradex", paradexWebClient, clock),
                jsonCache,
                clock,
                props.chainId(),
                Duration.ofSeconds(props.expiryMarginSeconds()),
                props.jwtCacheTtl());
    }

    @Bean
    public ParadexConnector paradexConnector(@Qualifier("paradexWebClient") WebClient paradexWebClient,
                                             ParadexAuthClient paradexAuthClient,
                                             PagingPolicy pagingPolicy, Sleeper sleeper,
                                             PriceNormalizer priceNormalizer, Clock clock) {
        return new ParadexConnector(
                new ExchangeWebClient("paradex", paradexWebClient, clock),
                paradexAuthClient,
                new Paginator(pagingPolicy, sleeper),
                priceNormalizer,
                clock,
                props.pageSize());
    }

    @ConfigurationProperties("paradex.client")
    public record ParadexClientProperties(
            String   baseUrl,             // e.g. https://api.prod.paradex.trade
            int      timeoutMs,
            String   chainId,             // short string; blank to ask /v1/system/config
            long     expiryMarginSeconds,
            Duration jwtCacheTtl,
            int      pageSize
    ) {}
}
