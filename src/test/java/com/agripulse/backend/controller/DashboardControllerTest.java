package com.agripulse.backend.controller;

import com.agripulse.backend.cache.CacheReadService;
import com.agripulse.backend.cache.SnapshotUnavailableException;
import com.agripulse.backend.service.DashboardSnapshotProducer;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;

@WebFluxTest(DashboardController.class)
class DashboardControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean private CacheReadService cacheReadService;
    @MockBean private DashboardSnapshotProducer producer;

    @Test
    void missingLocationUsesDefault() {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("location", "Indore");
        body.put(CacheReadService.SERVED_FROM_CACHE, true);
        body.put(CacheReadService.CACHED_AT, "2025-06-01T08:00:00Z");
        Mockito.when(cacheReadService.read(eq(DashboardSnapshotProducer.topic("Indore")), eq(true), same(producer)))
                .thenReturn(Mono.just(body));

        webTestClient.get().uri("/dashboard")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.location").isEqualTo("Indore")
                .jsonPath("$.cached_at").isEqualTo("2025-06-01T08:00:00Z");
    }

    @Test
    void coldCacheAndFailingProducerIs503() {
        Mockito.when(cacheReadService.read(eq(DashboardSnapshotProducer.topic("bhopal")), eq(true), same(producer)))
                .thenReturn(Mono.error(new SnapshotUnavailableException(
                        DashboardSnapshotProducer.topic("bhopal"), new IllegalStateException("all sources down"))));

        webTestClient.get().uri("/dashboard?location=Bhopal")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.detail").exists();
    }

    @Test
    void cachedEndpointIs503WhenCold() {
        Mockito.when(cacheReadService.cached(DashboardSnapshotProducer.topic("Indore")))
                .thenReturn(Mono.error(new SnapshotUnavailableException(
                        DashboardSnapshotProducer.topic("Indore"), "Cache not ready yet")));

        webTestClient.get().uri("/dashboard/cached")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Cache not ready yet");
    }
}
