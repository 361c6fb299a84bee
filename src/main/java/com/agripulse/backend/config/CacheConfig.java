package com.agripulse.backend.config;

import com.agripulse.backend.cache.CacheReadService;
import com.agripulse.backend.cache.CoalescingSnapshotWriter;
import com.agripulse.backend.cache.FileSnapshotPersistence;
import com.agripulse.backend.cache.InMemorySnapshotPersistence;
import com.agripulse.backend.cache.RefreshLifecycle;
import com.agripulse.backend.cache.RefreshScheduler;
import com.agripulse.backend.cache.SnapshotCache;
import com.agripulse.backend.cache.SnapshotPersistence;
import com.agripulse.backend.cache.TopicKey;
import com.agripulse.backend.service.CacheDomains;
import com.agripulse.backend.service.DashboardSnapshotProducer;
import com.agripulse.backend.service.InternationalOptionsProducer;
import com.agripulse.backend.service.TerminalSnapshotProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the snapshot cache: persistence, the store itself (restored from disk
 * before anything reads it) and one refresher per domain.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Value("${cache.refresh-interval:300s}")
    private Duration refreshInterval;

    @Value("${cache.topic-timeout:60s}")
    private Duration topicTimeout;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SnapshotPersistence snapshotPersistence(@Value("${cache.persistence.enabled:true}") boolean enabled,
                                                   @Value("${cache.persistence.file:data/cache.json}") String file) {
        if (!enabled) {
            log.info("💾 Cache persistence disabled, keeping snapshots in memory only");
            return new InMemorySnapshotPersistence();
        }
        return new FileSnapshotPersistence(Paths.get(file));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService snapshotWriterExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cache-persist");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public SnapshotCache snapshotCache(Clock clock, SnapshotPersistence persistence, ExecutorService snapshotWriterExecutor) {
        SnapshotCache cache = new SnapshotCache(clock, new CoalescingSnapshotWriter(persistence, snapshotWriterExecutor));
        cache.restore(persistence.restore());
        return cache;
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler refreshTimer() {
        return Schedulers.newParallel("cache-refresh", 2, true);
    }

    @Bean
    public RefreshScheduler dashboardRefresher(DashboardSnapshotProducer producer, SnapshotCache cache,
                                               Scheduler refreshTimer, Clock clock,
                                               @Value("${cache.dashboard.locations:Indore}") List<String> locations) {
        List<TopicKey> topics = locations.stream().map(DashboardSnapshotProducer::topic).toList();
        return new RefreshScheduler(CacheDomains.DASHBOARD, topics, producer, cache,
                refreshInterval, topicTimeout, refreshTimer, clock);
    }

    @Bean
    public RefreshScheduler terminalRefresher(TerminalSnapshotProducer producer, SnapshotCache cache,
                                              Scheduler refreshTimer, Clock clock,
                                              @Value("${cache.terminal.commodities:wheat,rice,maize,soybean}") List<String> commodities) {
        List<TopicKey> topics = commodities.stream().map(TerminalSnapshotProducer::topic).toList();
        return new RefreshScheduler(CacheDomains.TERMINAL, topics, producer, cache,
                refreshInterval, topicTimeout, refreshTimer, clock);
    }

    @Bean
    public RefreshScheduler internationalRefresher(InternationalOptionsProducer producer, SnapshotCache cache,
                                                   Scheduler refreshTimer, Clock clock) {
        return new RefreshScheduler(CacheDomains.INTERNATIONAL, List.of(InternationalOptionsProducer.topic()),
                producer, cache, refreshInterval, topicTimeout, refreshTimer, clock);
    }

    @Bean
    public CacheReadService cacheReadService(SnapshotCache cache, List<RefreshScheduler> schedulers) {
        List<TopicKey> topics = schedulers.stream().flatMap(s -> s.topics().stream()).toList();
        return new CacheReadService(cache, topics);
    }

    @Bean
    public RefreshLifecycle refreshLifecycle(List<RefreshScheduler> schedulers) {
        return new RefreshLifecycle(schedulers);
    }
}
