package com.agripulse.backend.controller;

import com.agripulse.backend.cache.CacheReadService;
import com.agripulse.backend.service.FallbackDataProvider;
import com.agripulse.backend.service.InternationalOptionsProducer;
import com.agripulse.backend.service.TerminalSnapshotProducer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/terminal")
@RequiredArgsConstructor
public class TerminalController {

    private static final String DEFAULT_COMMODITY = "wheat";

    private final CacheReadService cacheReadService;
    private final TerminalSnapshotProducer terminalProducer;
    private final InternationalOptionsProducer optionsProducer;
    private final FallbackDataProvider fallback;

    // GET /terminal?commodity=wheat&harvest_days=53&location=Indore&use_cache=true
    @GetMapping({"", "/"})
    public Mono<ObjectNode> terminal(@RequestParam(value = "commodity", defaultValue = DEFAULT_COMMODITY) String commodity,
                                     @RequestParam(value = "harvest_days", required = false) Integer harvestDays,
                                     @RequestParam(value = "location", required = false) String location,
                                     @RequestParam(value = "use_cache", defaultValue = "true") boolean useCache) {
        if (commodity.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "commodity required");
        }
        int days = harvestDays != null ? harvestDays : terminalProducer.defaultHarvestDays();
        if (days < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "harvest_days");
        }
        String loc = location == null || location.isBlank() ? terminalProducer.defaultLocation() : location;
        log.info("GET /terminal commodity={} harvest_days={} location={} use_cache={}", commodity, days, loc, useCache);

        if (!terminalProducer.isDefault(loc, days)) {
            // cached entries only hold the default location and harvest window
            return terminalProducer.assemble(commodity, days, loc).map(cacheReadService::fresh);
        }
        return cacheReadService.read(TerminalSnapshotProducer.topic(commodity), useCache, terminalProducer);
    }

    @GetMapping("/cached")
    public Mono<ObjectNode> cached() {
        return cacheReadService.read(TerminalSnapshotProducer.topic(DEFAULT_COMMODITY), true, terminalProducer);
    }

    @GetMapping("/international-options")
    public Mono<ObjectNode> internationalOptions() {
        return cacheReadService.read(InternationalOptionsProducer.topic(), true, optionsProducer)
                .onErrorResume(ex -> {
                    log.warn("⚠️ Failed to load international options: {}", ex.getMessage());
                    return Mono.just(fallback.internationalOptions());
                });
    }
}
