package com.agripulse.backend.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * One committed snapshot together with the instant it was stored.
 */
public record CacheEntry(@JsonProperty("payload") ObjectNode payload,
                         @JsonProperty("fetched_at") Instant fetchedAt) {

    /**
     * Copy of the payload that callers may annotate freely.
     */
    public ObjectNode payloadCopy() {
        return payload.deepCopy();
    }
}
