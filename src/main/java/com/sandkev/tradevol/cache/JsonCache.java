package com.sandkev.tradevol.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/** Typed view over {@link CacheService}: values are stored as JSON. */
@Slf4j
@RequiredArgsConstructor
public class JsonCache {

    private final CacheService cache;
    private final ObjectMapper mapper;

    /** An entry that no longer deserialises is dropped and reported as a miss. */
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        Optional<byte[]> raw = cache.get(key);
        if (raw.isEmpty()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(raw.get(), type));
        } catch (IOException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
            cache.delete(key);
            return Optional.empty();
        }
    }

    public void set(String key, Object value, Duration ttl) {
        try {
            cache.set(key, mapper.writeValueAsBytes(value), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise cache value for " + key, e);
        }
    }

    public Optional<String> getString(String key) {
        return cache.get(key).map(b -> new String(b, StandardCharsets.UTF_8));
    }

    public void setString(String key, String value, Duration ttl) {
        cache.set(key, value.getBytes(StandardCharsets.UTF_8), ttl);
    }

    public void delete(String key) {
        cache.delete(key);
    }
}
