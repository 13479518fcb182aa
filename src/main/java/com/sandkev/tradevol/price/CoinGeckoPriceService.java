package com.sandkev.tradevol.price;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** CoinGecko HTTP lookups. Caching lives in {@link PriceNormalizer}. */
public class CoinGeckoPriceService implements PriceService {

    private static final DateTimeFormatter HISTORY_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    private static final ParameterizedTypeReference<Map<String, Object>> MAP = new ParameterizedTypeReference<>() {};

    private final WebClient http;
    private final Retry retry;

    public CoinGeckoPriceService(WebClient coingeckoWebClient, Retry geckoRetry) {
        this.http = coingeckoWebClient;
        this.retry = geckoRetry;
    }

    @Override
    public Map<String, BigDecimal> getSimplePrice(Set<String> coinIds, String vsCurrency) {
        if (coinIds.isEmpty()) return Map.of();
        String vs = vsCurrency.toLowerCase(Locale.ROOT);
        Map<String, Object> res = http.get()
                .uri(uri -> uri.path("/simple/price")
                        .queryParam("ids", String.join(",", sorted(coinIds)))
                        .queryParam("vs_currencies", vs)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(MAP)
                .retryWhen(retry)
                .block();

        var out = new LinkedHashMap<String, BigDecimal>();
        if (res == null) return out;
        res.forEach((id, v) -> {
            if (v instanceof Map<?, ?> vsMap && vsMap.get(vs) != null) {
                out.put(id, new BigDecimal(String.valueOf(vsMap.get(vs))));
            }
        });
        return out;
    }

    @Override
    public Optional<BigDecimal> getHistoricalPrice(String coinId, LocalDate date, String vsCurrency) {
        String vs = vsCurrency.toLowerCase(Locale.ROOT);
        Map<String, Object> res = http.get()
                .uri(uri -> uri.path("/coins/{id}/history")
                        .queryParam("date", HISTORY_DATE.format(date))
                        .queryParam("localization", false)
                        .build(coinId))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(MAP)
                .retryWhen(retry)
                .block();

        if (res == null || !(res.get("market_data") instanceof Map<?, ?> md)) return Optional.empty();
        if (!(md.get("current_price") instanceof Map<?, ?> prices) || prices.get(vs) == null) return Optional.empty();
        return Optional.of(new BigDecimal(String.valueOf(prices.get(vs))));
    }

    private static List<String> sorted(Collection<String> c) {
        return c.stream().sorted().toList();
    }
}
