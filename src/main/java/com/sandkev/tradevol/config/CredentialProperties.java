package com.sandkev.tradevol.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

@ConfigurationProperties("credentials")
public record CredentialProperties(Map<String, Bundle> platforms) {

    public record Bundle(
            String apiKey,
            String apiSecret,
            String accountAddress,   // Starknet account, hex
            String privateKey,       // Starknet private key, hex
            String jwt               // pre-issued bearer token, skips the auth handshake
    ) {
        public boolean isActive() {
            return notBlank(apiKey) || notBlank(accountAddress) || notBlank(jwt);
        }

        private static boolean notBlank(String s) {
            return s != null && !s.isBlank();
        }
    }
}
