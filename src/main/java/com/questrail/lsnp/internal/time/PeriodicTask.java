package com.questrail.lsnp.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * PeriodicTask
 * =============================================================================
 * Runs an action at a fixed cadence on a {@link MonotonicScheduler}.
 *
 * <p>Each run re-arms the next one on the grid of the first deadline (not the
 * completion time), so the cadence does not drift with execution time. An
 * action that throws is logged and the cadence continues.</p>
 *
 * <p>Thread-safe. {@link #stop()} is idempotent.</p>
 */
public final class PeriodicTask
{
    private static final Logger log = LoggerFactory.getLogger(PeriodicTask.class);

    private final String name;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Runnable action;

    private Cancellable pending;
    private long nextDeadlineNanos;
    private boolean running;

    public PeriodicTask(String name,
                        MonotonicScheduler scheduler,
                        MonotonicClock clock,
                        Duration interval,
                        Runnable action)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.action = Objects.requireNonNull(action, "action");

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
    }

    /**
     * Starts the cadence.
     *
     * @param runImmediately if {@code true}, the first run is due now rather
     *                       than after one interval
     */
    public synchronized void start(boolean runImmediately)
    {
        if (running) {
            return;
        }
        running = true;
        nextDeadlineNanos = clock.nowNanos() + (runImmediately ? 0L : interval.toNanos());
        pending = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
    }

    public synchronized void stop()
    {
        running = false;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private void fire()
    {
        synchronized (this) {
            if (!running) {
                return;
            }
        }

        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Periodic task '{}' failed; continuing", name, e);
        }

        synchronized (this) {
            if (!running) {
                return;
            }
            // Missed periods are skipped rather than replayed back to back.
            long now = clock.nowNanos();
            do {
                nextDeadlineNanos += interval.toNanos();
            } while (nextDeadlineNanos <= now);
            pending = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
        }
    }
}
