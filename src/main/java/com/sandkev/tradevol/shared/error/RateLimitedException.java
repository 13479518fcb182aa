package com.sandkev.tradevol.shared.error;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Optional;

public class RateLimitedException extends ExchangeException {

    private final Duration retryAfter;

    public RateLimitedException(String source, String message, @Nullable Duration retryAfter) {
        super(source, message, null);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
