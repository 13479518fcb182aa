package com.sandkev.tradevol.shared.error;

/** Upstream payload that cannot be decoded into the expected shape. */
public class SerializationException extends ExchangeException {

    public SerializationException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
