package com.sandkev.tradevol.shared.error;

/**
 * Non-2xx response or API-level error code that is neither auth nor parameter related.
 * Only server-side (5xx) failures are worth retrying.
 */
public class UpstreamProtocolException extends ExchangeException {

    private final int status;

    public UpstreamProtocolException(String source, String message, int status) {
        super(source, message, null);
        this.status = status;
    }

    public int status() {
        return status;
    }

    @Override
    public boolean isRetryable() {
        return status >= 500;
    }
}
