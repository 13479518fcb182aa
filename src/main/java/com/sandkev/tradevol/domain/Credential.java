package com.sandkev.tradevol.domain;

import org.springframework.lang.Nullable;

/**
 * Per-platform key material, borrowed for the duration of a single fetch.
 * <p>
 * HMAC exchanges use {@code apiKey}/{@code apiSecret}; Starknet based exchanges use the
 * account address and private key, or a pre-issued {@code jwt}.
 * {@link #toString()} never prints secrets.
 */
public record Credential(
        Platform platform,
        @Nullable String apiKey,
        @Nullable String apiSecret,
        @Nullable String accountAddress,
        @Nullable String privateKey,
        @Nullable String jwt
) {

    public static Credential hmac(Platform platform, String apiKey, String apiSecret) {
        return new Credential(platform, apiKey, apiSecret, null, null, null);
    }

    public static Credential starknet(Platform platform, String accountAddress, String privateKey) {
        return new Credential(platform, null, null, accountAddress, privateKey, null);
    }

    public static Credential bearer(Platform platform, String accountAddress, String jwt) {
        return new Credential(platform, null, null, accountAddress, null, jwt);
    }

    public boolean hasApiKey() {
        return notBlank(apiKey) && notBlank(apiSecret);
    }

    public boolean hasStarknetKey() {
        return notBlank(accountAddress) && notBlank(privateKey);
    }

    public boolean hasJwt() {
        return notBlank(jwt);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    @Override
    public String toString() {
        return "Credential[platform=" + platform
                + ", apiKey=" + mask(apiKey)
                + ", accountAddress=" + mask(accountAddress)
                + ", apiSecret=" + (apiSecret == null ? "null" : "***")
                + ", privateKey=" + (privateKey == null ? "null" : "***")
                + ", jwt=" + (jwt == null ? "null" : "***") + "]";
    }

    private static String mask(String s) {
        if (s == null) return "null";
        if (s.length() <= 6) return "***";
        return s.substring(0, 4) + "***";
    }
}
