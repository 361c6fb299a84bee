package com.agripulse.backend.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Starts every {@link RefreshScheduler} when the context starts and stops them on
 * shutdown. Runs in an early phase so the initial passes finish before the web
 * server begins accepting requests.
 */
@Slf4j
public class RefreshLifecycle implements SmartLifecycle {

    private final List<RefreshScheduler> schedulers;
    private volatile boolean running;

    public RefreshLifecycle(List<RefreshScheduler> schedulers) {
        this.schedulers = List.copyOf(schedulers);
    }

    @Override
    public void start() {
        for (RefreshScheduler s : schedulers) {
            try {
                s.start();
            } catch (RuntimeException e) {
                log.error("❌ Could not start {} cache refresher", s.domain(), e);
            }
        }
        running = true;
    }

    @Override
    public void stop() {
        schedulers.forEach(RefreshScheduler::stop);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    public List<RefreshScheduler> schedulers() {
        return schedulers;
    }
}
