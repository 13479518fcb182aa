package com.sandkev.tradevol.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("coingecko")
public record CoinGeckoProperties(
        String baseUrl,
        String apiKey,
        String apiKeyHeader,
        String userAgent,
        int timeoutMs,
        Duration cacheTtl,       // spot price reuse
        Duration lastKnownTtl,   // last good price, served when CoinGecko is down
        int maxRetries,
        int backoffMs
) {}
