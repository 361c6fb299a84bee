package com.agripulse.backend.controller;

import com.agripulse.backend.cache.CacheEntry;
import com.agripulse.backend.cache.RefreshReport;
import com.agripulse.backend.cache.RefreshScheduler;
import com.agripulse.backend.cache.SnapshotCache;
import com.agripulse.backend.cache.TopicKey;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class OpsController {
    private final SnapshotCache cache;
    private final List<RefreshScheduler> schedulers;
    private final Clock clock;

    public OpsController(SnapshotCache cache, List<RefreshScheduler> schedulers, Clock clock) {
        this.cache = cache;
        this.schedulers = schedulers;
        this.clock = clock;
    }

    @GetMapping("/ops/cache-status")
    public Map<String, Object> cacheStatus() {
        Instant now = clock.instant();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("now", now.toString());
        m.put("lastRefresh", cache.lastRefresh().map(Instant::toString).orElse(null));

        List<Map<String, Object>> entries = new ArrayList<>();
        cache.keys().stream()
                .sorted(Comparator.comparing(TopicKey::toString))
                .forEach(key -> cache.get(key).ifPresent(e -> entries.add(entry(key, e, now))));
        m.put("entries", entries);

        List<Map<String, Object>> refreshers = new ArrayList<>();
        for (RefreshScheduler s : schedulers) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("domain", s.domain());
            r.put("state", s.state().name());
            r.put("running", s.isRunning());
            r.put("intervalSec", s.interval().toSeconds());
            r.put("topics", s.topics().stream().map(TopicKey::toString).toList());
            r.put("lastPass", s.lastReport().map(OpsController::report).orElse(null));
            refreshers.add(r);
        }
        m.put("refreshers", refreshers);
        return m;
    }

    private static Map<String, Object> entry(TopicKey key, CacheEntry e, Instant now) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("key", key.toString());
        m.put("fetchedAt", e.fetchedAt().toString());
        m.put("ageSec", Duration.between(e.fetchedAt(), now).toSeconds());
        return m;
    }

    private static Map<String, Object> report(RefreshReport r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("startedAt", r.startedAt().toString());
        m.put("finishedAt", r.finishedAt().toString());
        m.put("durationMs", r.duration().toMillis());
        m.put("refreshed", r.refreshed().stream().map(TopicKey::toString).toList());
        m.put("failed", r.failed().stream().map(TopicKey::toString).toList());
        return m;
    }
}
