package com.agentnet.sweeper;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SweepTimerImpl implements SweepTimer {
    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private Runnable sweepHandler;
    private ScheduledFuture<?> scheduledTask;

    public SweepTimerImpl(Duration interval) {
        this.intervalMs = interval.toMillis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "consensus-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void start() {
        if (sweepHandler == null) {
            throw new IllegalStateException("Sweep handler not set");
        }
        stop();
        log.info("SweepTimer: Starting with interval {}ms", intervalMs);
        scheduledTask = scheduler.scheduleWithFixedDelay(this::triggerSweep, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void stop() {
        if (scheduledTask != null) {
            log.debug("SweepTimer: Stopping");
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    @Override
    public synchronized void setSweepHandler(Runnable handler) {
        this.sweepHandler = handler;
    }

    private void triggerSweep() {
        Runnable handler;
        synchronized (this) {
            handler = sweepHandler;
        }
        if (handler == null) {
            return;
        }
        try {
            handler.run();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel all future runs
            log.error("SweepTimer: Sweep failed", e);
        }
    }

    @Override
    public void shutdown() {
        stop();
        scheduler.shutdown();
    }
}
