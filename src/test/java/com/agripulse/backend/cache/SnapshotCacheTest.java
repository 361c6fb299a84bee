package com.agripulse.backend.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCacheTest {

    private static final TopicKey WHEAT = TopicKey.of("terminal", "wheat");

    private MutableClock clock;
    private InMemorySnapshotPersistence persistence;
    private SnapshotCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        persistence = new InMemorySnapshotPersistence();
        cache = new SnapshotCache(clock, new CoalescingSnapshotWriter(persistence, Runnable::run));
    }

    private static ObjectNode payload(int v) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("v", v);
        n.put("check", v);
        return n;
    }

    @Test
    void absentKeyIsEmpty() {
        assertTrue(cache.get(WHEAT).isEmpty());
        assertTrue(cache.lastRefresh().isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void setIsVisibleToNextGet() {
        CacheEntry committed = cache.set(WHEAT, payload(1));

        CacheEntry read = cache.get(WHEAT).orElseThrow();
        assertEquals(committed, read);
        assertEquals(1, read.payload().get("v").asInt());
        assertEquals(clock.instant(), read.fetchedAt());
        assertEquals(clock.instant(), cache.lastRefresh().orElseThrow());
    }

    @Test
    void keysAreCaseInsensitive() {
        cache.set(TopicKey.of("Terminal", "WHEAT"), payload(1));
        assertTrue(cache.get(WHEAT).isPresent());
        assertEquals(1, cache.size());
    }

    @Test
    void laterWriteReplacesEarlier() {
        cache.set(WHEAT, payload(1));
        clock.advance(Duration.ofSeconds(300));
        cache.set(WHEAT, payload(2));

        CacheEntry e = cache.get(WHEAT).orElseThrow();
        assertEquals(2, e.payload().get("v").asInt());
        assertEquals(Instant.parse("2025-01-01T00:05:00Z"), e.fetchedAt());
    }

    @Test
    void olderTimestampNeverOverwritesNewer() {
        clock.set(Instant.parse("2025-01-01T00:10:00Z"));
        cache.set(WHEAT, payload(1));
        clock.set(Instant.parse("2025-01-01T00:05:00Z"));
        CacheEntry visible = cache.set(WHEAT, payload(2));

        assertEquals(1, visible.payload().get("v").asInt());
        assertEquals(Instant.parse("2025-01-01T00:10:00Z"), cache.get(WHEAT).orElseThrow().fetchedAt());
        assertEquals(Instant.parse("2025-01-01T00:10:00Z"), cache.lastRefresh().orElseThrow());
    }

    @Test
    void storedPayloadIsIsolatedFromCaller() {
        ObjectNode p = payload(1);
        cache.set(WHEAT, p);
        p.put("v", 99);

        assertEquals(1, cache.get(WHEAT).orElseThrow().payload().get("v").asInt());
    }

    @Test
    void rejectsNullPayload() {
        assertThrows(IllegalArgumentException.class, () -> cache.set(WHEAT, null));
        assertTrue(cache.get(WHEAT).isEmpty());
    }

    @Test
    void everySetRequestsPersistence() {
        cache.set(WHEAT, payload(1));
        cache.set(TopicKey.of("terminal", "rice"), payload(2));

        assertEquals(2, persistence.writes());
        CacheSnapshot stored = persistence.restore();
        assertEquals(2, stored.entries().size());
        assertNotNull(stored.entries().get("terminal:rice"));
    }

    @Test
    void restoreLoadsEntriesWithoutWriting() {
        CacheEntry e = new CacheEntry(payload(7), Instant.parse("2024-12-31T23:00:00Z"));
        cache.restore(new CacheSnapshot(1,
                Map.of("terminal:wheat", e, "garbage", e),
                Instant.parse("2024-12-31T23:00:00Z")));

        assertEquals(e, cache.get(WHEAT).orElseThrow());
        assertEquals(1, cache.size());
        assertEquals(0, persistence.writes());
        assertEquals(Instant.parse("2024-12-31T23:00:00Z"), cache.lastRefresh().orElseThrow());
    }

    @Test
    void concurrentReadersSeeSameEntry() throws Exception {
        cache.set(WHEAT, payload(5));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch go = new CountDownLatch(1);
            List<Future<CacheEntry>> reads = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                reads.add(pool.submit(() -> {
                    go.await();
                    return cache.get(WHEAT).orElseThrow();
                }));
            }
            go.countDown();
            CacheEntry first = reads.get(0).get(5, TimeUnit.SECONDS);
            for (Future<CacheEntry> f : reads) {
                assertSame(first, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void readersNeverObserveHalfWrittenEntry() throws Exception {
        cache.set(WHEAT, payload(0));
        AtomicBoolean stop = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(5);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 1; i <= 2000; i++) {
                    clock.advance(Duration.ofMillis(1));
                    cache.set(WHEAT, payload(i));
                }
                stop.set(true);
            });
            List<Future<Integer>> readers = new ArrayList<>();
            for (int r = 0; r < 4; r++) {
                readers.add(pool.submit(() -> {
                    int seen = 0;
                    do {
                        ObjectNode p = cache.get(WHEAT).orElseThrow().payload();
                        assertEquals(p.get("v").asInt(), p.get("check").asInt());
                        seen++;
                    } while (!stop.get());
                    return seen;
                }));
            }
            writer.get(30, TimeUnit.SECONDS);
            for (Future<Integer> f : readers) {
                assertTrue(f.get(30, TimeUnit.SECONDS) > 0);
            }
            assertEquals(2000, cache.get(WHEAT).orElseThrow().payload().get("v").asInt());
        } finally {
            pool.shutdownNow();
        }
    }
}
