package com.agripulse.backend.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Fire-and-forget persistence dispatcher. A request made while another write is
 * still queued is folded into it; the queued write reads the store state at the
 * moment it runs, so the latest commit always reaches disk. Run it on a
 * single-threaded executor so writes never overlap.
 */
@Slf4j
public class CoalescingSnapshotWriter {

    private final SnapshotPersistence persistence;
    private final Executor executor;
    private final AtomicBoolean pending = new AtomicBoolean(false);

    public CoalescingSnapshotWriter(SnapshotPersistence persistence, Executor executor) {
        this.persistence = persistence;
        this.executor = executor;
    }

    public void request(Supplier<CacheSnapshot> source) {
        if (!pending.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> flush(source));
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.warn("⚠️ Cache persistence skipped, writer is shut down");
        }
    }

    private void flush(Supplier<CacheSnapshot> source) {
        // cleared before reading so commits that land during the write schedule another one
        pending.set(false);
        try {
            persistence.persist(source.get());
        } catch (RuntimeException e) {
            log.warn("⚠️ Cache persistence failed: {}", e.getMessage());
        }
    }
}
