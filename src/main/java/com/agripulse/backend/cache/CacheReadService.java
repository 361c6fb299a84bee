package com.agripulse.backend.cache;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Set;

/**
 * Read side of the cache used by the controllers.
 *
 * <p>A hit is answered from the store and marked {@code served_from_cache=true}
 * with its {@code cached_at}. A miss, or a read that bypasses the cache, calls
 * the producer inline and marks it {@code served_from_cache=false}. Only the
 * topics the refresh schedulers own are stored by this path; any other topic
 * is produced on every request and never enters the store. This read-through
 * path and the refresh schedulers write the same store with no coordination
 * beyond {@link SnapshotCache#set}.
 */
@Slf4j
public class CacheReadService {

    public static final String SERVED_FROM_CACHE = "served_from_cache";
    public static final String CACHED_AT = "cached_at";

    private final SnapshotCache cache;
    private final Set<TopicKey> cachedTopics;

    public CacheReadService(SnapshotCache cache, Collection<TopicKey> cachedTopics) {
        this.cache = cache;
        this.cachedTopics = Set.copyOf(cachedTopics);
    }

    public boolean isCached(TopicKey key) {
        return cachedTopics.contains(key);
    }

    public Mono<ObjectNode> read(TopicKey key, boolean allowCache, SnapshotProducer producer) {
        boolean cacheable = isCached(key);
        if (!cacheable) {
            log.debug("Topic {} is not scheduled, producing without caching", key);
        } else if (allowCache) {
            var hit = cache.get(key);
            if (hit.isPresent()) {
                return Mono.just(annotateHit(hit.get()));
            }
            log.info("⚙️ Cache miss for {}, producing inline", key);
        }
        return Mono.defer(() -> producer.produce(key))
                .switchIfEmpty(Mono.error(() -> new SnapshotUnavailableException(key, "Producer returned no snapshot")))
                .map(payload -> {
                    if (cacheable) {
                        cache.set(key, payload);
                    }
                    return fresh(payload);
                })
                .onErrorMap(e -> !(e instanceof SnapshotUnavailableException),
                        e -> new SnapshotUnavailableException(key, e));
    }

    /**
     * Cache-only read: absent entries fail instead of being produced.
     */
    public Mono<ObjectNode> cached(TopicKey key) {
        return cache.get(key)
                .map(entry -> Mono.just(annotateHit(entry)))
                .orElseGet(() -> Mono.error(new SnapshotUnavailableException(key, "Cache not ready yet")));
    }

    /**
     * Marks a result that was produced without touching the cache.
     */
    public ObjectNode fresh(ObjectNode payload) {
        ObjectNode out = payload.deepCopy();
        out.put(SERVED_FROM_CACHE, false);
        out.remove(CACHED_AT);
        return out;
    }

    private static ObjectNode annotateHit(CacheEntry entry) {
        ObjectNode out = entry.payloadCopy();
        out.put(SERVED_FROM_CACHE, true);
        out.put(CACHED_AT, entry.fetchedAt().toString());
        return out;
    }
}
