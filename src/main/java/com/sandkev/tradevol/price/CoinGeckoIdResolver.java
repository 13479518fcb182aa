package com.sandkev.tradevol.price;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves base-asset tickers like BTC to CoinGecko coin ids like "bitcoin".
 * Seeded with the assets the connected venues list; {@link #learn} adds more at runtime.
 */
public class CoinGeckoIdResolver {

    // Seed common ids; extend as needed
    private static final Map<String, String> WELL_KNOWN = Map.ofEntries(
            Map.entry("BTC", "bitcoin"),
            Map.entry("ETH", "ethereum"),
            Map.entry("SOL", "solana"),
            Map.entry("BNB", "binancecoin"),
            Map.entry("XRP", "ripple"),
            Map.entry("DOGE", "dogecoin"),
            Map.entry("ADA", "cardano"),
            Map.entry("AVAX", "avalanche-2"),
            Map.entry("LINK", "chainlink"),
            Map.entry("DOT", "polkadot"),
            Map.entry("LTC", "litecoin"),
            Map.entry("ARB", "arbitrum"),
            Map.entry("OP", "optimism"),
            Map.entry("SUI", "sui"),
            Map.entry("HYPE", "hyperliquid"),
            Map.entry("WOO", "woo-network"),
            Map.entry("STRK", "starknet"),
            Map.entry("USDT", "tether"),
            Map.entry("USDC", "usd-coin"),
            Map.entry("DAI", "dai")
    );

    private final Map<String, String> cache = new ConcurrentHashMap<>(WELL_KNOWN);

    public Optional<String> resolve(String symbol) {
        if (symbol == null) return Optional.empty();
        return Optional.ofNullable(cache.get(symbol.toUpperCase(Locale.ROOT)));
    }

    public void learn(String symbol, String coinId) {
        if (symbol != null && coinId != null) {
            cache.put(symbol.toUpperCase(Locale.ROOT), coinId);
        }
    }
}
