package com.sandkev.tradevol.shared.http;

import org.springframework.core.ParameterizedTypeReference;

import java.util.Map;

/**
 * Blocking JSON client for one exchange. Failures surface as
 * {@link com.sandkev.tradevol.shared.error.ExchangeException} subtypes.
 */
public interface ExchangeClient {
    <T> T get (String path, Map<String, Object> params, ParameterizedTypeReference<T> bodyType);
    <T> T post(String path, Object body, ParameterizedTypeReference<T> bodyType);
}
