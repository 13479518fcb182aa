package com.sandkev.tradevol.exchange.woox;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.signing.HmacSigner;
import com.sandkev.tradevol.shared.http.ExchangeWebClient;
import org.springframework.core.ParameterizedTypeReference;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WOO X v1 private GETs. Each request carries {@code x-api-key}, {@code x-api-timestamp} and
 * {@code x-api-signature = hex(HMAC-SHA256(secret, sortedQuery|timestamp))}.
 * Bound to one credential for the duration of a fetch.
 */
public class WooXSignedClient {

    private final ExchangeWebClient web;
    private final Credential credential;
    private final Clock clock;

    public WooXSignedClient(ExchangeWebClient web, Credential credential, Clock clock) {
        this.web = web;
        this.credential = credential;
        this.clock = clock;
    }

    public <T> T get(String path, Map<String, Object> params, ParameterizedTypeReference<T> bodyType) {
        long ts = clock.millis();
        var headers = new LinkedHashMap<String, String>();
        headers.put("x-api-key", credential.apiKey());
        headers.put("x-api-timestamp", String.valueOf(ts));
        headers.put("x-api-signature", HmacSigner.sign(params, ts, credential.apiSecret()));
        return web.get(path, params, headers, bodyType);
    }
}
