package com.freelance.jobalerts.pipeline.notify;

import java.time.Duration;

/**
 * Single send budget shared by every delivery of a cycle. {@link #awaitTurn()} enforces the
 * minimum gap between consecutive sends; {@link #pause(Duration)} delays only the caller.
 */
public class SendThrottle {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final long minIntervalNanos;
    private final Sleeper sleeper;
    private long lastSendNanos;
    private boolean hasSent;

    public SendThrottle(long minIntervalMs, Sleeper sleeper) {
        this.minIntervalNanos = Duration.ofMillis(Math.max(0, minIntervalMs)).toNanos();
        this.sleeper = sleeper;
    }

    public static SendThrottle threadSleeping(long minIntervalMs) {
        return new SendThrottle(minIntervalMs, duration -> Thread.sleep(duration.toMillis()));
    }

    public synchronized void awaitTurn() throws InterruptedException {
        if (hasSent && minIntervalNanos > 0) {
            long waitNanos = minIntervalNanos - (System.nanoTime() - lastSendNanos);
            if (waitNanos > 0) {
                sleeper.sleep(Duration.ofNanos(waitNanos));
            }
        }
        lastSendNanos = System.nanoTime();
        hasSent = true;
    }

    public void pause(Duration duration) throws InterruptedException {
        if (duration != null && !duration.isZero() && !duration.isNegative()) {
            sleeper.sleep(duration);
        }
    }
}
