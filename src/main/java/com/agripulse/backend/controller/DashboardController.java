package com.agripulse.backend.controller;

import com.agripulse.backend.cache.CacheReadService;
import com.agripulse.backend.service.DashboardSnapshotProducer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/dashboard")
public class DashboardController {

    private final CacheReadService cacheReadService;
    private final DashboardSnapshotProducer producer;
    private final String defaultLocation;

    public DashboardController(CacheReadService cacheReadService,
                               DashboardSnapshotProducer producer,
                               @Value("${cache.dashboard.default-location:Indore}") String defaultLocation) {
        this.cacheReadService = cacheReadService;
        this.producer = producer;
        this.defaultLocation = defaultLocation;
    }

    // GET /dashboard?location=Indore&use_cache=true
    @GetMapping({"", "/"})
    public Mono<ObjectNode> dashboard(@RequestParam(value = "location", required = false) String location,
                                      @RequestParam(value = "use_cache", defaultValue = "true") boolean useCache) {
        String loc = location == null || location.isBlank() ? defaultLocation : location;
        log.info("GET /dashboard location={} use_cache={}", loc, useCache);
        return cacheReadService.read(DashboardSnapshotProducer.topic(loc), useCache, producer);
    }

    @GetMapping("/cached")
    public Mono<ObjectNode> cached() {
        return cacheReadService.cached(DashboardSnapshotProducer.topic(defaultLocation));
    }
}
