package com.agripulse.backend.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheReadServiceTest {

    private static final TopicKey INDORE = TopicKey.of("dashboard", "indore");

    private MutableClock clock;
    private SnapshotCache cache;
    private CacheReadService service;
    private AtomicInteger calls;
    private SnapshotProducer producer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T08:00:00Z"));
        cache = new SnapshotCache(clock, new CoalescingSnapshotWriter(new InMemorySnapshotPersistence(), Runnable::run));
        service = new CacheReadService(cache, List.of(INDORE));
        calls = new AtomicInteger();
        producer = topic -> Mono.fromSupplier(() -> {
            ObjectNode n = JsonNodeFactory.instance.objectNode();
            n.put("location", "Indore");
            n.put("call", calls.incrementAndGet());
            return n;
        });
    }

    @Test
    void coldReadProducesAndStores() {
        ObjectNode first = service.read(INDORE, true, producer).block();

        assertNotNull(first);
        assertFalse(first.get(CacheReadService.SERVED_FROM_CACHE).asBoolean());
        assertFalse(first.has(CacheReadService.CACHED_AT));
        assertEquals(1, calls.get());
        assertTrue(cache.get(INDORE).isPresent());
    }

    @Test
    void warmReadIsServedFromCache() {
        service.read(INDORE, true, producer).block();
        clock.advance(Duration.ofSeconds(30));

        ObjectNode second = service.read(INDORE, true, producer).block();

        assertEquals(1, calls.get());
        assertTrue(second.get(CacheReadService.SERVED_FROM_CACHE).asBoolean());
        assertEquals("2025-06-01T08:00:00Z", second.get(CacheReadService.CACHED_AT).asText());
        assertEquals(1, second.get("call").asInt());
    }

    @Test
    void annotationsDoNotLeakIntoStoredEntry() {
        service.read(INDORE, true, producer).block();
        service.read(INDORE, true, producer).block();

        ObjectNode stored = cache.get(INDORE).orElseThrow().payload();
        assertFalse(stored.has(CacheReadService.SERVED_FROM_CACHE));
        assertFalse(stored.has(CacheReadService.CACHED_AT));
    }

    @Test
    void bypassAlwaysProducesAndRefreshesEntry() {
        service.read(INDORE, true, producer).block();
        clock.advance(Duration.ofSeconds(60));

        ObjectNode bypass = service.read(INDORE, false, producer).block();

        assertEquals(2, calls.get());
        assertFalse(bypass.get(CacheReadService.SERVED_FROM_CACHE).asBoolean());
        assertEquals(Instant.parse("2025-06-01T08:01:00Z"), cache.get(INDORE).orElseThrow().fetchedAt());
    }

    @Test
    void unscheduledTopicIsProducedButNeverStored() {
        TopicKey bhopal = TopicKey.of("dashboard", "bhopal");
        service.read(INDORE, true, producer).block();
        int before = cache.size();

        ObjectNode first = service.read(bhopal, true, producer).block();
        ObjectNode second = service.read(bhopal, true, producer).block();

        assertFalse(first.get(CacheReadService.SERVED_FROM_CACHE).asBoolean());
        assertFalse(second.get(CacheReadService.SERVED_FROM_CACHE).asBoolean());
        assertEquals(3, calls.get());
        assertEquals(before, cache.size());
        assertTrue(cache.get(bhopal).isEmpty());
        assertFalse(service.isCached(bhopal));
        assertTrue(service.isCached(TopicKey.of("Dashboard", "INDORE")));
    }

    @Test
    void producerFailureOnColdReadIsUnavailable() {
        StepVerifier.create(service.read(INDORE, true, t -> Mono.error(new IllegalStateException("weather down"))))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(SnapshotUnavailableException.class, e);
                    assertEquals(INDORE, ((SnapshotUnavailableException) e).topic());
                })
                .verify();
        assertTrue(cache.get(INDORE).isEmpty());
    }

    @Test
    void emptyProducerIsUnavailable() {
        StepVerifier.create(service.read(INDORE, true, t -> Mono.empty()))
                .expectError(SnapshotUnavailableException.class)
                .verify();
    }

    @Test
    void cachedOnlyFailsWhenCold() {
        StepVerifier.create(service.cached(INDORE))
                .expectErrorMessage("Cache not ready yet")
                .verify();
        assertEquals(0, calls.get());

        service.read(INDORE, true, producer).block();
        StepVerifier.create(service.cached(INDORE))
                .assertNext(n -> assertTrue(n.get(CacheReadService.SERVED_FROM_CACHE).asBoolean()))
                .verifyComplete();
    }

    @Test
    void freshStripsCacheMarkers() {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put(CacheReadService.CACHED_AT, "x");
        ObjectNode out = service.fresh(n);

        assertFalse(out.has(CacheReadService.CACHED_AT));
        assertFalse(out.get(CacheReadService.SERVED_FROM_CACHE).asBoolean());
        assertTrue(n.has(CacheReadService.CACHED_AT));
    }
}
