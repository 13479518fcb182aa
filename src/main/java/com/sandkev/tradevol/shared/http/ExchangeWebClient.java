package com.sandkev.tradevol.shared.http;

import com.sandkev.tradevol.shared.error.ExchangeException;
import com.sandkev.tradevol.shared.error.SerializationException;
import com.sandkev.tradevol.shared.error.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.UnsupportedMediaTypeException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link WebClient} wrapper shared by all connectors: blocks on each call and translates
 * HTTP, transport and decoding failures into {@link ExchangeException}s. Signed clients
 * decorate it by supplying extra headers.
 */
@Slf4j
public class ExchangeWebClient implements ExchangeClient {

    private final String name;
    private final WebClient client;
    private final Clock clock;

    public ExchangeWebClient(String name, WebClient client) {
        this(name, client, Clock.systemUTC());
    }

    public ExchangeWebClient(String name, WebClient client, Clock clock) {
        this.name = name;
        this.client = client;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    @Override
    public <T> T get(String path, Map<String, Object> params, ParameterizedTypeReference<T> bodyType) {
        return get(path, params, Map.of(), bodyType);
    }

    @Override
    public <T> T post(String path, Object body, ParameterizedTypeReference<T> bodyType) {
        return post(path, Map.of(), body, Map.of(), bodyType);
    }

    public <T> T get(String path, Map<String, Object> params, Map<String, String> headers,
                     ParameterizedTypeReference<T> bodyType) {
        var qp = toQueryParams(params);
        log.debug("GET {} {} params={}", name, path, qp.keySet());
        return execute("GET", path, () -> client.get()
                .uri(u -> u.path(path).queryParams(qp).build())
                .headers(h -> headers.forEach(h::set))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> toError(path, r))
                .bodyToMono(bodyType)
                .block());
    }

    public <T> T post(String path, Map<String, Object> params, Object body, Map<String, String> headers,
                      ParameterizedTypeReference<T> bodyType) {
        var qp = toQueryParams(params);
        log.debug("POST {} {} params={}", name, path, qp.keySet());
        return execute("POST", path, () -> {
            var spec = client.post()
                    .uri(u -> u.path(path).queryParams(qp).build())
                    .headers(h -> headers.forEach(h::set))
                    .accept(MediaType.APPLICATION_JSON);
            WebClient.RequestHeadersSpec<?> withBody = body == null ? spec : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
            return withBody.retrieve()
                    .onStatus(s -> s.value() >= 400, r -> toError(path, r))
                    .bodyToMono(bodyType)
                    .block();
        });
    }

    private Mono<ExchangeException> toError(String path, ClientResponse r) {
        return r.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> ExchangeErrors.fromStatus(name, path, r.statusCode().value(), body,
                        r.headers().asHttpHeaders(), clock));
    }

    private <T> T execute(String method, String path, Supplier<T> call) {
        try {
            return call.get();
        } catch (ExchangeException e) {
            throw e;
        } catch (WebClientRequestException e) {
            throw new TransientNetworkException(name, method + " " + path + " failed: " + e.getMessage(), e);
        } catch (CodecException | UnsupportedMediaTypeException e) {
            throw unreadable(method, path, e);
        } catch (WebClientResponseException e) {
            if (e.getCause() instanceof CodecException || e.getCause() instanceof UnsupportedMediaTypeException
                    || e.getStatusCode().is2xxSuccessful()) {
                throw unreadable(method, path, e);
            }
            throw ExchangeErrors.fromStatus(name, path, e.getStatusCode().value(), e.getResponseBodyAsString(),
                    e.getHeaders(), clock);
        }
    }

    private SerializationException unreadable(String method, String path, Exception e) {
        return new SerializationException(name, method + " " + path + " returned an unreadable payload: " + e.getMessage(), e);
    }

    private static MultiValueMap<String, String> toQueryParams(Map<String, Object> params) {
        var qpm = new LinkedMultiValueMap<String, String>();
        if (params != null) {
            params.forEach((k, v) -> { if (v != null) qpm.add(k, String.valueOf(v)); });
        }
        return qpm;
    }
}
