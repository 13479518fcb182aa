package com.sandkev.tradevol.exchange.paradex;

import com.sandkev.tradevol.cache.JsonCache;
import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.exchange.Payloads;
import com.sandkev.tradevol.shared.error.AuthException;
import com.sandkev.tradevol.shared.error.SerializationException;
import com.sandkev.tradevol.shared.http.ExchangeWebClient;
import com.sandkev.tradevol.signing.stark.Felt;
import com.sandkev.tradevol.signing.stark.StarkSigner;
import com.sandkev.tradevol.signing.stark.TypedData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Obtains Paradex bearer tokens: signs a typed-data {@code Request} with the account's Stark
 * key and trades the signature for a JWT at {@code POST /v1/auth}. Tokens are cached per
 * account until shortly before they lapse.
 */
@Slf4j
public class ParadexAuthClient {

    static final String AUTH_PATH = "/v1/auth";
    static final String SYSTEM_CONFIG_PATH = "/v1/system/config";
    /** Longest signature validity Paradex accepts. */
    static final Duration MAX_SIGNATURE_TTL = Duration.ofDays(7);
    private static final ParameterizedTypeReference<Map<String, Object>> MAP = new ParameterizedTypeReference<>() {};

    private final ExchangeWebClient web;
    private final JsonCache cache;
    private final Clock clock;
    private final String configuredChainId;
    private final Duration expiryMargin;
    private final Duration tokenTtl;

    /**
     * @param chainId      Starknet chain id as a short string, e.g. {@code PRIVATE_SN_PARACLEAR_MAINNET};
     *                     blank to read it from {@code /v1/system/config}
     * @param expiryMargin how far below the 7 day cap the signature expiration is set
     * @param tokenTtl     how long an issued JWT is reused
     */
    public ParadexAuthClient(ExchangeWebClient web, JsonCache cache, Clock clock,
                             String chainId, Duration expiryMargin, Duration tokenTtl) {
        this.web = web;
        this.cache = cache;
        this.clock = clock;
        this.configuredChainId = chainId;
        this.expiryMargin = expiryMargin;
        this.tokenTtl = tokenTtl;
    }

    /** {@code refreshable} is false for a JWT supplied with the credential, which cannot be reissued. */
    public record BearerToken(String jwt, boolean refreshable) {}

    /** The credential's own JWT if it has one, else a cached or freshly issued token. */
    public BearerToken bearerToken(Credential credential) {
        if (credential.hasJwt()) return new BearerToken(credential.jwt(), false);
        if (!credential.hasStarknetKey()) {
            throw new AuthException(ParadexConnector.SOURCE, "credential has neither a JWT nor a Starknet account key");
        }

        String key = tokenKey(credential);
        Optional<String> cached = cache.getString(key);
        if (cached.isPresent()) return new BearerToken(cached.get(), true);

        long timestamp = clock.instant().getEpochSecond();
        long expiration = timestamp + MAX_SIGNATURE_TTL.minus(expiryMargin).getSeconds();
        String jwt = issue(credential, timestamp, expiration);

        Duration ttl = tokenTtl;
        Duration untilExpiry = Duration.ofSeconds(expiration - timestamp);
        if (untilExpiry.compareTo(ttl) < 0) ttl = untilExpiry;
        cache.setString(key, jwt, ttl);
        return new BearerToken(jwt, true);
    }

    /** Drops a cached token the exchange has rejected. */
    public void invalidate(Credential credential) {
        if (credential.accountAddress() != null) {
            cache.delete(tokenKey(credential));
        }
    }

    private static BigInteger keyMaterial(String hex, String what) {
        if (hex == null || hex.isBlank()) {
            throw new AuthException(ParadexConnector.SOURCE, "Starknet " + what + " is missing");
        }
        try {
            return Felt.fromHex(hex.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthException(ParadexConnector.SOURCE, "Starknet " + what + " is not a valid field element", e);
        }
    }

    private String issue(Credential credential, long timestamp, long expiration) {
        BigInteger account = keyMaterial(credential.accountAddress(), "account address");
        BigInteger privateKey = keyMaterial(credential.privateKey(), "private key");
        TypedData message = authMessage(chainId(), timestamp, expiration);
        var sig = StarkSigner.sign(message.messageHash(account), privateKey);

        var headers = new LinkedHashMap<String, String>();
        headers.put("PARADEX-STARKNET-ACCOUNT", credential.accountAddress());
        headers.put("PARADEX-STARKNET-SIGNATURE", "[\"" + sig.r() + "\",\"" + sig.s() + "\"]");
        headers.put("PARADEX-TIMESTAMP", String.valueOf(timestamp));
        headers.put("PARADEX-SIGNATURE-EXPIRATION", String.valueOf(expiration));

        log.info("Requesting Paradex JWT for account {}", abbreviate(credential.accountAddress()));
        Map<String, Object> res = web.post(AUTH_PATH, Map.of(), null, headers, MAP);
        if (res == null) throw new SerializationException(ParadexConnector.SOURCE, AUTH_PATH + " returned an empty body", null);
        return Payloads.string(ParadexConnector.SOURCE, res, "jwt_token");
    }

    /** {@code StarkNetDomain{name:"Paradex", chainId, version:"1"}} with primary type {@code Request}. */
    static TypedData authMessage(BigInteger chainId, long timestamp, long expiration) {
        Map<String, List<TypedData.Member>> types = Map.of(
                TypedData.DOMAIN_TYPE, List.of(
                        new TypedData.Member("name", "felt"),
                        new TypedData.Member("chainId", "felt"),
                        new TypedData.Member("version", "felt")),
                "Request", List.of(
                        new TypedData.Member("method", "felt"),
                        new TypedData.Member("path", "felt"),
                        new TypedData.Member("body", "felt"),
                        new TypedData.Member("timestamp", "felt"),
                        new TypedData.Member("expiration", "felt")));

        Map<String, Object> domain = new LinkedHashMap<>();
        domain.put("name", "Paradex");
        domain.put("chainId", Felt.toHex(chainId));
        domain.put("version", "1");

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("method", "POST");
        request.put("path", AUTH_PATH);
        request.put("body", "");
        request.put("timestamp", timestamp);
        request.put("expiration", expiration);

        return new TypedData(types, "Request", domain, request);
    }

    private BigInteger chainId() {
        if (configuredChainId != null && !configuredChainId.isBlank()) {
            return Felt.fromShortString(configuredChainId);
        }
        Optional<String> cached = cache.getString("paradex:chain-id");
        String name = cached.orElseGet(() -> {
            Map<String, Object> cfg = web.get(SYSTEM_CONFIG_PATH, Map.of(), MAP);
            if (cfg == null) throw new SerializationException(ParadexConnector.SOURCE, SYSTEM_CONFIG_PATH + " returned an empty body", null);
            String fetched = Payloads.string(ParadexConnector.SOURCE, cfg, "starknet_chain_id");
            cache.setString("paradex:chain-id", fetched, Duration.ofDays(1));
            return fetched;
        });
        return Felt.fromShortString(name);
    }

    private static String tokenKey(Credential credential) {
        return "paradex:jwt:" + credential.accountAddress().toLowerCase(Locale.ROOT);
    }

    private static String abbreviate(String address) {
        return address.length() <= 10 ? address : address.substring(0, 10) + "...";
    }
}
