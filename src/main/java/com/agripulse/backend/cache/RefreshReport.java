package com.agripulse.backend.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one refresh pass over a domain's topics.
 */
public record RefreshReport(String domain,
                            Instant startedAt,
                            Instant finishedAt,
                            List<TopicKey> refreshed,
                            List<TopicKey> failed) {

    public RefreshReport {
        refreshed = List.copyOf(refreshed);
        failed = List.copyOf(failed);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean complete() {
        return failed.isEmpty();
    }
}
