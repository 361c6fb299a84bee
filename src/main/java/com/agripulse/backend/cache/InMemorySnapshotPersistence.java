package com.agripulse.backend.cache;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last persisted snapshot in memory. Used when file persistence is
 * switched off.
 */
public class InMemorySnapshotPersistence implements SnapshotPersistence {

    private final AtomicReference<CacheSnapshot> stored = new AtomicReference<>(CacheSnapshot.empty());
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public CacheSnapshot restore() {
        return stored.get();
    }

    @Override
    public void persist(CacheSnapshot snapshot) {
        stored.set(snapshot);
        writes.incrementAndGet();
    }

    public int writes() {
        return writes.get();
    }
}
