package com.sandkev.tradevol.signing;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HmacSignerTest {

    private static final String SECRET = "test-secret";
    private static final long TS = 1700000000123L;

    @Test
    void canonicalString_sortsKeysAndAppendsTimestamp() {
        var params = new LinkedHashMap<String, Object>();
        params.put("symbol", "PERP_BTC_USDT");
        params.put("start_t", 1700000000000L);
        params.put("size", 500);

        assertThat(HmacSigner.canonical(params, TS))
                .isEqualTo("size=500&start_t=1700000000000&symbol=PERP_BTC_USDT|1700000000123");
    }

    @Test
    void signature_matchesKnownVector() {
        var params = Map.<String, Object>of("symbol", "PERP_BTC_USDT", "start_t", 1700000000000L, "size", 500);

        assertThat(HmacSigner.sign(params, TS, SECRET))
                .isEqualTo("c60c987ebd7706284f921b4590d1caa0a4feb423eeaa77a9d118df08d654315c");
    }

    @Test
    void signature_doesNotDependOnInsertionOrder() {
        var forward = new LinkedHashMap<String, Object>();
        forward.put("a", "1");
        forward.put("b", "2");
        forward.put("c", "3");
        var backward = new LinkedHashMap<String, Object>();
        backward.put("c", "3");
        backward.put("b", "2");
        backward.put("a", "1");

        String first = HmacSigner.sign(forward, TS, SECRET);
        assertThat(HmacSigner.sign(backward, TS, SECRET)).isEqualTo(first);
        assertThat(HmacSigner.sign(new HashMap<>(forward), TS, SECRET)).isEqualTo(first);
        assertThat(HmacSigner.sign(forward, TS, SECRET)).isEqualTo(first);
    }

    @Test
    void nullValuesAreLeftOut() {
        var params = new HashMap<String, Object>();
        params.put("symbol", "PERP_ETH_USDT");
        params.put("fromId", null);

        assertThat(HmacSigner.canonical(params, 1L)).isEqualTo("symbol=PERP_ETH_USDT|1");
    }

    @Test
    void timestampAndSecretBothChangeTheSignature() {
        var params = Map.<String, Object>of("symbol", "PERP_BTC_USDT");
        String base = HmacSigner.sign(params, TS, SECRET);

        assertThat(HmacSigner.sign(params, TS + 1, SECRET)).isNotEqualTo(base);
        assertThat(HmacSigner.sign(params, TS, "other-secret")).isNotEqualTo(base);
    }
}
