package com.sandkev.tradevol.shared.error;

/**
 * Root of the upstream failure taxonomy. {@link #isRetryable()} drives the paginator:
 * retryable failures are retried on the same page, everything else aborts the fetch.
 */
public abstract class ExchangeException extends RuntimeException {

    private final String source;

    protected ExchangeException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }

    public abstract boolean isRetryable();
}
