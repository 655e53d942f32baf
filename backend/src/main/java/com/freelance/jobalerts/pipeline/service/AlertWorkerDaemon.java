package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.CycleStats;
import com.freelance.jobalerts.pipeline.model.WorkerStatusResponse;
import com.freelance.jobalerts.pipeline.stats.LastCycleStatsHolder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop: run a cycle, then sleep the configured interval. The next cycle starts only
 * after the previous one returned, so a slow cycle pushes the following one back.
 */
@Service
public class AlertWorkerDaemon {
    private static final Logger log = LoggerFactory.getLogger(AlertWorkerDaemon.class);
    private static final long SLEEP_SLICE_MS = 200;

    private final AlertCycleService cycleService;
    private final LastCycleStatsHolder statsHolder;
    private final AlertsProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;

    public AlertWorkerDaemon(
        AlertCycleService cycleService,
        LastCycleStatsHolder statsHolder,
        AlertsProperties properties
    ) {
        this.cycleService = cycleService;
        this.statsHolder = statsHolder;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public WorkerStatusResponse getStatus() {
        return new WorkerStatusResponse(running.get(), cycleService.currentState(), statsHolder.latest());
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("alert-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            long intervalMs = TimeUnit.SECONDS.toMillis(properties.getWorker().getIntervalSeconds());
            executor.submit(() -> workerLoop(intervalMs));
            log.info("Alert worker started, interval {}s", properties.getWorker().getIntervalSeconds());
        }
    }

    /**
     * Lets an in-flight cycle finish within the shutdown grace period, then interrupts it.
     * An interrupted cycle stops between deliveries, so nothing is marked without a send.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(properties.getWorker().getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                        executor.shutdownNow();
                        executor.awaitTermination(5, TimeUnit.SECONDS);
                    }
                } catch (InterruptedException ignored) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Alert worker stopped");
        }
    }

    public CycleStats runOnce() {
        return cycleService.runCycle();
    }

    private void workerLoop(long intervalMs) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                cycleService.runCycle();
            } catch (CycleInProgressException e) {
                log.info("Skipping scheduled cycle: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Alert cycle failed unexpectedly", e);
            }
            sleep(intervalMs);
        }
    }

    private void sleep(long intervalMs) {
        long deadline = System.currentTimeMillis() + intervalMs;
        while (running.get()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(SLEEP_SLICE_MS, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
