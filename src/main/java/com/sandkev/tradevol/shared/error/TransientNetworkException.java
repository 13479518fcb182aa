package com.sandkev.tradevol.shared.error;

/** Timeout, connection reset or similar transport failure. */
public class TransientNetworkException extends ExchangeException {

    public TransientNetworkException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
