package com.agripulse.backend.cache;

/**
 * Stable storage for the whole cache. Implementations are best-effort: neither
 * method may throw, failures are logged and the cache keeps running in memory.
 */
public interface SnapshotPersistence {

    /**
     * Loads the last persisted snapshot, or {@link CacheSnapshot#empty()} when
     * nothing usable is stored.
     */
    CacheSnapshot restore();

    /**
     * Replaces the stored snapshot with the given one.
     */
    void persist(CacheSnapshot snapshot);
}
