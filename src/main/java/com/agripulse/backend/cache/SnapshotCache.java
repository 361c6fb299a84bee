package com.agripulse.backend.cache;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide store of the last good snapshot per topic.
 *
 * <p>Reads are lock-free map lookups. A write replaces one entry in a single
 * {@link ConcurrentHashMap#merge} so readers see either the previous entry or
 * the new one. Every write asks the {@link CoalescingSnapshotWriter} to persist
 * the store without waiting for it. Entries are never removed.
 */
@Slf4j
public class SnapshotCache {

    private final ConcurrentHashMap<TopicKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastRefresh = new AtomicReference<>();
    private final Clock clock;
    private final CoalescingSnapshotWriter writer;

    public SnapshotCache(Clock clock, CoalescingSnapshotWriter writer) {
        this.clock = clock;
        this.writer = writer;
    }

    public Optional<CacheEntry> get(TopicKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Commits a copy of {@code payload} for {@code key}, stamped with the current
     * instant. When a racing write already stored a later timestamp that write is
     * kept, so {@code fetchedAt} never goes backwards for a key.
     *
     * @return the entry visible for {@code key} after the call
     */
    public CacheEntry set(TopicKey key, ObjectNode payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null for " + key);
        }
        Instant now = clock.instant();
        CacheEntry fresh = new CacheEntry(payload.deepCopy(), now);
        CacheEntry committed = entries.merge(key, fresh,
                (old, neu) -> neu.fetchedAt().isBefore(old.fetchedAt()) ? old : neu);
        lastRefresh.accumulateAndGet(now, (prev, next) -> prev == null || next.isAfter(prev) ? next : prev);
        writer.request(this::snapshot);
        return committed;
    }

    /**
     * Bulk load used once at startup. Does not trigger a persistence write.
     * Entries whose key cannot be parsed or that lack a payload are skipped.
     */
    public void restore(CacheSnapshot snapshot) {
        int restored = 0;
        for (Map.Entry<String, CacheEntry> e : snapshot.entries().entrySet()) {
            CacheEntry entry = e.getValue();
            if (entry == null || entry.payload() == null || entry.fetchedAt() == null) {
                log.warn("⚠️ Skipping incomplete cache entry {}", e.getKey());
                continue;
            }
            try {
                entries.put(TopicKey.parse(e.getKey()), entry);
                restored++;
            } catch (IllegalArgumentException ex) {
                log.warn("⚠️ Skipping cache entry with bad key {}", e.getKey());
            }
        }
        if (snapshot.lastRefresh() != null) {
            lastRefresh.accumulateAndGet(snapshot.lastRefresh(),
                    (prev, next) -> prev == null || next.isAfter(prev) ? next : prev);
        }
        log.info("♻️ Restored {} cache entries", restored);
    }

    public CacheSnapshot snapshot() {
        Map<String, CacheEntry> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> copy.put(k.toString(), v));
        return new CacheSnapshot(CacheSnapshot.CURRENT_VERSION, copy, lastRefresh.get());
    }

    public Optional<Instant> lastRefresh() {
        return Optional.ofNullable(lastRefresh.get());
    }

    public Set<TopicKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }
}
