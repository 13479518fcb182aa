package com.sandkev.tradevol.cache;

import com.sandkev.tradevol.testsupport.FakeTicker;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineCacheServiceTest {

    private final FakeTicker ticker = new FakeTicker();
    private final CaffeineCacheService cache = new CaffeineCacheService(100, ticker);

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void valueLivesUntilItsTtlElapses() {
        cache.set("k", bytes("v"), Duration.ofMinutes(5));

        ticker.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertThat(cache.get("k")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("v")));

        ticker.advance(Duration.ofSeconds(2));
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void eachEntryKeepsItsOwnTtl() {
        cache.set("short", bytes("a"), Duration.ofSeconds(10));
        cache.set("long", bytes("b"), Duration.ofHours(1));

        ticker.advance(Duration.ofMinutes(1));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).isPresent();
    }

    @Test
    void overwriteRestartsTheClock() {
        cache.set("k", bytes("1"), Duration.ofSeconds(10));
        ticker.advance(Duration.ofSeconds(8));
        cache.set("k", bytes("2"), Duration.ofSeconds(10));
        ticker.advance(Duration.ofSeconds(8));

        assertThat(cache.get("k")).hasValueSatisfying(v -> assertThat(v).isEqualTo(bytes("2")));
    }

    @Test
    void deleteAndNonPositiveTtlRemoveTheEntry() {
        cache.set("a", bytes("1"), Duration.ofMinutes(1));
        cache.set("b", bytes("1"), Duration.ofMinutes(1));

        cache.delete("a");
        cache.set("b", bytes("2"), Duration.ZERO);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).isEmpty();
    }

    @Test
    void storedBytesAreCopied() {
        byte[] value = bytes("abc");
        cache.set("k", value, Duration.ofMinutes(1));
        value[0] = 'z';

        assertThat(new String(cache.get("k").orElseThrow(), StandardCharsets.UTF_8)).isEqualTo("abc");
    }
}
