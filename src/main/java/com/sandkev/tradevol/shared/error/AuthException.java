package com.sandkev.tradevol.shared.error;

/** Missing, invalid or expired credential. */
public class AuthException extends ExchangeException {

    public AuthException(String source, String message) {
        super(source, message, null);
    }

    public AuthException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
