package com.sandkev.tradevol.shared.http;

import com.sandkev.tradevol.shared.error.AuthException;
import com.sandkev.tradevol.shared.error.ExchangeException;
import com.sandkev.tradevol.shared.error.ParameterException;
import com.sandkev.tradevol.shared.error.RateLimitedException;
import com.sandkev.tradevol.shared.error.UpstreamProtocolException;
import org.springframework.http.HttpHeaders;

import java.time.Clock;

/** Maps HTTP status codes onto the exchange error taxonomy. */
public final class ExchangeErrors {

    private static final int MAX_BODY = 300;

    private ExchangeErrors() {}

    public static ExchangeException fromStatus(String source, String path, int status, String body,
                                               HttpHeaders headers, Clock clock) {
        String msg = path + " returned " + status + ": " + abbreviate(body);
        if (status == 429) {
            String retryAfter = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
            return new RateLimitedException(source, msg, HttpRetrySupport.parseRetryAfter(retryAfter, clock));
        }
        if (status == 401 || status == 403) return new AuthException(source, msg);
        if (status >= 400 && status < 500) return new ParameterException(source, msg);
        return new UpstreamProtocolException(source, msg, status);
    }

    static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_BODY ? body : body.substring(0, MAX_BODY) + "...";
    }
}
