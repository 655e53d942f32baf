package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.stats.LastCycleStatsHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertWorkerDaemonTest {
    private static final long SLOW_CYCLE_MS = 400;

    @Mock
    private AlertCycleService cycleService;

    private AlertWorkerDaemon daemon;

    @BeforeEach
    void setUp() {
        AlertsProperties properties = new AlertsProperties();
        properties.getWorker().setIntervalSeconds(1);
        properties.getWorker().setShutdownGraceSeconds(5);
        daemon = new AlertWorkerDaemon(cycleService, new LastCycleStatsHolder(), properties);
    }

    @AfterEach
    void tearDown() {
        daemon.stop();
    }

    @Test
    void slowCycleDelaysTheNextOneAndCyclesNeverOverlap() throws Exception {
        List<long[]> windows = new CopyOnWriteArrayList<>();
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch twoCycles = new CountDownLatch(2);
        when(cycleService.runCycle()).thenAnswer(invocation -> {
            int active = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(active, Math::max);
            long start = System.nanoTime();
            Thread.sleep(SLOW_CYCLE_MS);
            long end = System.nanoTime();
            concurrent.decrementAndGet();
            windows.add(new long[] {start, end});
            twoCycles.countDown();
            return null;
        });

        daemon.start();
        assertThat(twoCycles.await(10, TimeUnit.SECONDS)).isTrue();
        daemon.stop();

        assertThat(maxConcurrent.get()).isEqualTo(1);
        long firstEnd = windows.get(0)[1];
        long secondStart = windows.get(1)[0];
        long firstStart = windows.get(0)[0];
        assertThat(TimeUnit.NANOSECONDS.toMillis(secondStart - firstEnd)).isGreaterThanOrEqualTo(950);
        assertThat(TimeUnit.NANOSECONDS.toMillis(secondStart - firstStart)).isGreaterThanOrEqualTo(950 + SLOW_CYCLE_MS);
    }

    @Test
    void startAndStopToggleRunningFlag() {
        daemon.start();
        daemon.start();
        assertThat(daemon.getStatus().running()).isTrue();

        daemon.stop();
        assertThat(daemon.isRunning()).isFalse();
        assertThat(daemon.getStatus().running()).isFalse();
    }

    @Test
    void unexpectedCycleFailureDoesNotKillTheLoop() throws Exception {
        CountDownLatch secondAttempt = new CountDownLatch(2);
        when(cycleService.runCycle()).thenAnswer(invocation -> {
            secondAttempt.countDown();
            throw new IllegalStateException("boom");
        });

        daemon.start();

        assertThat(secondAttempt.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(daemon.isRunning()).isTrue();
    }
}
