package com.sandkev.tradevol.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.tradevol.cache.CacheService;
import com.sandkev.tradevol.cache.CaffeineCacheService;
import com.sandkev.tradevol.cache.JsonCache;
import com.sandkev.tradevol.credential.CredentialProvider;
import com.sandkev.tradevol.credential.PropertiesCredentialProvider;
import com.sandkev.tradevol.exchange.ExchangeConnector;
import com.sandkev.tradevol.price.CoinGeckoIdResolver;
import com.sandkev.tradevol.price.PriceNormalizer;
import com.sandkev.tradevol.price.PriceService;
import com.sandkev.tradevol.shared.http.Sleeper;
import com.sandkev.tradevol.shared.paging.PagingPolicy;
import com.sandkev.tradevol.volume.HistoricalVolumeStore;
import com.sandkev.tradevol.volume.JdbcHistoricalVolumeStore;
import com.sandkev.tradevol.volume.VolumeAggregationService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties({VolumeProperties.class, CredentialProperties.class})
public class VolumeConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    PagingPolicy pagingPolicy(VolumeProperties p) {
        var paging = p.paging();
        Duration maxBackoff = paging.maxBackoff() != null ? paging.maxBackoff() : Duration.ofSeconds(60);
        return new PagingPolicy(paging.maxPages(), paging.maxRetries(), paging.backoff(), maxBackoff, Duration.ZERO);
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService volumeExecutor(VolumeProperties p) {
        return Executors.newFixedThreadPool(Math.max(1, p.threads()), new CustomizableThreadFactory("volume-"));
    }

    @Bean
    CacheService cacheService(VolumeProperties p) {
        return new CaffeineCacheService(p.cacheMaxEntries());
    }

    @Bean
    JsonCache jsonCache(CacheService cacheService, ObjectMapper objectMapper) {
        return new JsonCache(cacheService, objectMapper);
    }

    @Bean
    PriceNormalizer priceNormalizer(PriceService priceService, CoinGeckoIdResolver ids, JsonCache jsonCache,
                                    CoinGeckoProperties gecko, VolumeProperties volume, Clock clock) {
        return new PriceNormalizer(priceService, ids, jsonCache,
                gecko.cacheTtl(), gecko.lastKnownTtl(), volume.priceFallback(), clock);
    }

    @Bean
    CredentialProvider credentialProvider(CredentialProperties p) {
        return new PropertiesCredentialProvider(p);
    }

    @Bean
    HistoricalVolumeStore historicalVolumeStore(JdbcTemplate jdbc) {
        return new JdbcHistoricalVolumeStore(jdbc);
    }

    @Bean
    VolumeAggregationService volumeAggregationService(List<ExchangeConnector> connectors, CredentialProvider credentials,
                                                      HistoricalVolumeStore store, JsonCache jsonCache,
                                                      ExecutorService volumeExecutor, VolumeProperties p, Clock clock) {
        return new VolumeAggregationService(connectors, credentials, store, jsonCache, volumeExecutor, p, clock);
    }
}
