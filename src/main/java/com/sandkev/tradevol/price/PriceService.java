package com.sandkev.tradevol.price;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface PriceService {
    /**
     * /simple/price: prices by CoinGecko coin IDs (e.g., "bitcoin,ethereum") in one vs currency.
     * Returns map: { coinId -> price }; ids CoinGecko does not know are absent.
     */
    Map<String, BigDecimal> getSimplePrice(Set<String> coinIds, String vsCurrency);

    /**
     * /coins/{id}/history: the price CoinGecko recorded for a UTC date.
     */
    Optional<BigDecimal> getHistoricalPrice(String coinId, LocalDate date, String vsCurrency);
}
