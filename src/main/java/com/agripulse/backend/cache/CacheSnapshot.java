package com.agripulse.backend.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialized form of the whole store: every entry keyed by {@link TopicKey#toString()}
 * plus the store-wide last refresh instant.
 */
public record CacheSnapshot(@JsonProperty("version") int version,
                            @JsonProperty("entries") Map<String, CacheEntry> entries,
                            @JsonProperty("last_refresh") Instant lastRefresh) {

    public static final int CURRENT_VERSION = 1;

    public CacheSnapshot {
        // null values are kept so restore can skip them one by one
        entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static CacheSnapshot empty() {
        return new CacheSnapshot(CURRENT_VERSION, Map.of(), null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
