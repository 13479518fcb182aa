package com.sandkev.tradevol.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.tradevol.domain.AggregatedVolume;
import com.sandkev.tradevol.domain.ExchangeVolumeInfo;
import com.sandkev.tradevol.domain.Platform;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonCacheTest {

    private final CaffeineCacheService raw = new CaffeineCacheService(100);
    private final JsonCache cache = new JsonCache(raw, new ObjectMapper().findAndRegisterModules());

    @Test
    void aggregateSurvivesTheJsonHop() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        var aggregate = AggregatedVolume.of(List.of(
                ExchangeVolumeInfo.ok(Platform.BYBIT, "LINEAR_TOTAL", new BigDecimal("100.5"), now),
                ExchangeVolumeInfo.failed(Platform.WOOX, "WOOX_ACCOUNT_TOTAL", "no credential", now)), now);

        cache.set("agg", aggregate, Duration.ofMinutes(1));
        AggregatedVolume back = cache.get("agg", new TypeReference<AggregatedVolume>() {}).orElseThrow();

        assertThat(back.totalVolume24hUsd()).isEqualByComparingTo("100.5");
        assertThat(back.lastUpdated()).isEqualTo(now);
        assertThat(back.platforms()).hasSize(2);
        assertThat(back.platforms().get(1).error()).isEqualTo("no credential");
    }

    @Test
    void unreadableEntryIsDroppedAndReportedAsMiss() {
        raw.set("agg", "{not json".getBytes(StandardCharsets.UTF_8), Duration.ofMinutes(1));

        assertThat(cache.get("agg", new TypeReference<AggregatedVolume>() {})).isEmpty();
        assertThat(raw.get("agg")).isEmpty();
    }

    @Test
    void plainStrings() {
        cache.setString("jwt", "abc.def", Duration.ofMinutes(1));
        assertThat(cache.getString("jwt")).contains("abc.def");
        cache.delete("jwt");
        assertThat(cache.getString("jwt")).isEmpty();
    }
}
