package com.sandkev.tradevol.shared.http;

import com.sandkev.tradevol.shared.error.ExchangeException;
import com.sandkev.tradevol.shared.error.RateLimitedException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public final class HttpRetrySupport {

    private HttpRetrySupport() {}

    /** Fixed backoff, stretched to the server's Retry-After hint when one was sent, never beyond {@code max}. */
    public static Duration backoffFor(ExchangeException e, Duration base, Duration max) {
        Duration pause = base;
        if (e instanceof RateLimitedException rl) {
            pause = rl.retryAfter()
                    .filter(ra -> ra.compareTo(base) > 0)
                    .orElse(base);
        }
        return pause.compareTo(max) > 0 ? max : pause;
    }

    public static Duration parseRetryAfter(String v, Clock clock) {
        if (v == null || v.isBlank()) return null;
        String s = v.trim();
        // numeric seconds
        if (s.chars().allMatch(Character::isDigit)) {
            try {
                return Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException e) {
                return Duration.ofSeconds(Long.MAX_VALUE);
            }
        }
        // HTTP-date
        try {
            long target = ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME)
                    .toInstant().toEpochMilli();
            long delta = target - clock.millis();
            return Duration.ofMillis(Math.max(delta, 0L));
        } catch (DateTimeException e) {
            return null;
        }
    }

    public static void sleepQuietly(long ms) {
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
