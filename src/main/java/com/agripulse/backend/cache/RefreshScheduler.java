package com.agripulse.backend.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background refresher for one cache domain.
 *
 * <p>{@link #start()} runs one pass synchronously so the first requests after
 * boot hit a warm cache, then loops forever: wait {@code interval}, refresh every
 * topic, repeat. Each topic is bounded by {@code topicTimeout}; a topic that
 * fails or hangs keeps its previous entry and is retried on the next pass.
 * {@link #stop()} cancels the loop.
 */
@Slf4j
public class RefreshScheduler {

    public enum State { IDLE, REFRESHING, STOPPED }

    private final String domain;
    private final List<TopicKey> topics;
    private final SnapshotProducer producer;
    private final SnapshotCache cache;
    private final Duration interval;
    private final Duration topicTimeout;
    private final Scheduler scheduler;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicReference<Disposable> loop = new AtomicReference<>();
    private final AtomicReference<RefreshReport> lastReport = new AtomicReference<>();

    public RefreshScheduler(String domain,
                            List<TopicKey> topics,
                            SnapshotProducer producer,
                            SnapshotCache cache,
                            Duration interval,
                            Duration topicTimeout,
                            Scheduler scheduler,
                            Clock clock) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("refresh interval must be positive: " + interval);
        }
        this.domain = domain;
        this.topics = List.copyOf(topics);
        this.producer = producer;
        this.cache = cache;
        this.interval = interval;
        this.topicTimeout = topicTimeout;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("🧩 Prefilling {} cache on startup...", domain);
        try {
            refreshPass().block(topicTimeout.plus(interval));
        } catch (RuntimeException e) {
            log.warn("⚠️ Initial {} refresh failed, continuing: {}", domain, e.getMessage());
        }

        Disposable d = Mono.delay(interval, scheduler)
                .then(Mono.defer(this::refreshPass))
                .onErrorResume(e -> {
                    log.error("⚠️ {} refresh loop error", domain, e);
                    return Mono.empty();
                })
                .repeat()
                .subscribe();
        loop.set(d);
        if (state.get() == State.STOPPED) {
            d.dispose();
        }
        log.info("🚀 {} cache refresher started (every {}s, {} topics)", domain, interval.toSeconds(), topics.size());
    }

    public void stop() {
        state.set(State.STOPPED);
        Disposable d = loop.getAndSet(null);
        if (d != null) {
            d.dispose();
            log.info("🛑 {} cache refresher stopped", domain);
        }
    }

    /**
     * Refreshes every topic of the domain once. Never signals an error.
     */
    public Mono<RefreshReport> refreshPass() {
        return Mono.defer(() -> {
            state.compareAndSet(State.IDLE, State.REFRESHING);
            Instant startedAt = clock.instant();
            log.info("🔄 Refreshing {} cache ({} topics)", domain, topics.size());
            return Flux.fromIterable(topics)
                    .flatMap(this::refreshTopic)
                    .collectList()
                    .map(outcomes -> report(startedAt, outcomes))
                    .doOnNext(r -> {
                        lastReport.set(r);
                        if (r.complete()) {
                            log.info("✅ {} cache updated: {} topics in {} ms", domain, r.refreshed().size(), r.duration().toMillis());
                        } else {
                            log.warn("⚠️ {} cache partially updated: refreshed={} failed={}", domain, r.refreshed(), r.failed());
                        }
                    })
                    .doFinally(sig -> state.compareAndSet(State.REFRESHING, State.IDLE));
        });
    }

    private Mono<Outcome> refreshTopic(TopicKey topic) {
        return Mono.defer(() -> producer.produce(topic))
                .timeout(topicTimeout, scheduler)
                .map(payload -> {
                    cache.set(topic, payload);
                    return new Outcome(topic, true);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("⚠️ Producer returned nothing for {}", topic);
                    return new Outcome(topic, false);
                }))
                .onErrorResume(e -> {
                    log.warn("⚠️ Cache refresh failed for {}: {}", topic, e.toString());
                    return Mono.just(new Outcome(topic, false));
                });
    }

    private RefreshReport report(Instant startedAt, List<Outcome> outcomes) {
        List<TopicKey> ok = new ArrayList<>();
        List<TopicKey> failed = new ArrayList<>();
        for (Outcome o : outcomes) {
            (o.success() ? ok : failed).add(o.topic());
        }
        return new RefreshReport(domain, startedAt, clock.instant(), ok, failed);
    }

    public String domain() {
        return domain;
    }

    public List<TopicKey> topics() {
        return topics;
    }

    public Duration interval() {
        return interval;
    }

    public State state() {
        return state.get();
    }

    public boolean isRunning() {
        return loop.get() != null && state.get() != State.STOPPED;
    }

    public Optional<RefreshReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    private record Outcome(TopicKey topic, boolean success) {}
}
