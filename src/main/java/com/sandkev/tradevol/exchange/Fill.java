package com.sandkev.tradevol.exchange;

import java.math.BigDecimal;

/** One executed trade on the account, as reported by a fills endpoint. */
public record Fill(String id, BigDecimal price, BigDecimal size, long timestampMs) {

    public BigDecimal notional() {
        return price.multiply(size);
    }
}
