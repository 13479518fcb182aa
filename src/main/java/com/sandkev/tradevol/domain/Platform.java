package com.sandkev.tradevol.domain;

import java.util.Locale;
import java.util.Optional;

/** Exchanges with a registered connector. The id is the lower-case name used in config and cache keys. */
public enum Platform {
    BYBIT,
    WOOX,
    HYPERLIQUID,
    PARADEX;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Platform> fromId(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        for (Platform p : values()) {
            if (p.id().equals(id.trim().toLowerCase(Locale.ROOT))) return Optional.of(p);
        }
        return Optional.empty();
    }
}
