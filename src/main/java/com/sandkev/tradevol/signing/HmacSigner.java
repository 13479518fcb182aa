package com.sandkev.tradevol.signing;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HMAC-SHA256 request signing over a canonical string:
 * {@code k1=v1&k2=v2|timestamp} with keys sorted, so insertion order never matters.
 */
public final class HmacSigner {

    private HmacSigner() {}

    public static String canonical(Map<String, ?> params, long timestampMs) {
        var sorted = new TreeMap<String, Object>();
        if (params != null) {
            params.forEach((k, v) -> { if (v != null) sorted.put(k, v); });
        }
        String qs = sorted.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return qs + "|" + timestampMs;
    }

    public static String sign(Map<String, ?> params, long timestampMs, String secret) {
        return hmacSha256Hex(canonical(params, timestampMs), secret);
    }

    public static String hmacSha256Hex(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] sig = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            var sb = new StringBuilder(sig.length * 2);
            for (byte b : sig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC signing failed", e);
        }
    }
}
