package com.sandkev.tradevol.shared.error;

/** Bad symbol, bad range or any other request the exchange rejects as malformed. */
public class ParameterException extends ExchangeException {

    public ParameterException(String source, String message) {
        super(source, message, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
