package com.sandkev.tradevol.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry TTL shared by price lookups, auth tokens and
 * aggregate memoisation. Entries are opaque bytes; expired entries read as absent.
 */
public interface CacheService {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value, Duration ttl);

    void delete(String key);
}
