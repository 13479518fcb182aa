package com.sandkev.tradevol.domain;

import org.springframework.lang.Nullable;

/**
 * Outcome of a connector fetch: the data gathered plus, when something went wrong, why.
 * A partial result has both a value and an error.
 */
public record FetchResult<T>(T value, @Nullable String error) {

    public static <T> FetchResult<T> ok(T value) {
        return new FetchResult<>(value, null);
    }

    public static <T> FetchResult<T> partial(T value, String error) {
        return new FetchResult<>(value, error);
    }

    public static <T> FetchResult<T> failed(T empty, String error) {
        return new FetchResult<>(empty, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
