package com.sandkev.tradevol.shared.http;

import com.sandkev.tradevol.shared.error.AuthException;
import com.sandkev.tradevol.shared.error.ParameterException;
import com.sandkev.tradevol.shared.error.RateLimitedException;
import com.sandkev.tradevol.shared.error.UpstreamProtocolException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ExchangeErrorsTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void classifiesByStatus() {
        assertThat(ExchangeErrors.fromStatus("x", "/p", 401, "", null, clock)).isInstanceOf(AuthException.class);
        assertThat(ExchangeErrors.fromStatus("x", "/p", 403, "", null, clock)).isInstanceOf(AuthException.class);
        var badRequest = ExchangeErrors.fromStatus("x", "/p", 400, "", null, clock);
        assertThat(badRequest).isInstanceOf(ParameterException.class);
        assertThat(badRequest.isRetryable()).isFalse();
        var unavailable = ExchangeErrors.fromStatus("x", "/p", 503, "", null, clock);
        assertThat(unavailable).isInstanceOf(UpstreamProtocolException.class);
        assertThat(unavailable.isRetryable()).isTrue();
    }

    @Test
    void rateLimitCarriesRetryAfter() {
        var headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "7");

        var e = (RateLimitedException) ExchangeErrors.fromStatus("x", "/p", 429, "slow down", headers, clock);

        assertThat(e.isRetryable()).isTrue();
        assertThat(e.retryAfter()).contains(Duration.ofSeconds(7));
        assertThat(HttpRetrySupport.backoffFor(e, Duration.ofSeconds(2), Duration.ofMinutes(1))).isEqualTo(Duration.ofSeconds(7));
        assertThat(HttpRetrySupport.backoffFor(e, Duration.ofSeconds(10), Duration.ofMinutes(1))).isEqualTo(Duration.ofSeconds(10));
        assertThat(HttpRetrySupport.backoffFor(e, Duration.ofSeconds(2), Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void hugeRetryAfterIsClampedInsteadOfFailing() {
        var headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "99999999999999999999999999");

        var e = (RateLimitedException) ExchangeErrors.fromStatus("x", "/p", 429, "", headers, clock);

        assertThat(e.retryAfter()).isPresent();
        assertThat(HttpRetrySupport.backoffFor(e, Duration.ofSeconds(2), Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void retryAfterAcceptsHttpDates() {
        assertThat(HttpRetrySupport.parseRetryAfter("Mon, 01 Jan 2024 00:00:30 GMT", clock)).isEqualTo(Duration.ofSeconds(30));
        assertThat(HttpRetrySupport.parseRetryAfter("soon", clock)).isNull();
        assertThat(HttpRetrySupport.parseRetryAfter(null, clock)).isNull();
    }

    @Test
    void longBodiesAreAbbreviated() {
        String body = "x".repeat(1000);
        assertThat(ExchangeErrors.fromStatus("x", "/p", 500, body, null, clock).getMessage()).hasSizeLessThan(400);
    }
}
