package com.questrail.lsnp.time;

import com.questrail.lsnp.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that only moves when a test moves it. Starts at zero; the
 * peer registry and periodic tasks read it, so advancing it is how tests make
 * peers go stale or timers fall due.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nanos.get();
    }

    public void advance(Duration d) {
        if (d.isNegative()) {
            throw new IllegalArgumentException("Monotonic time cannot go back: " + d);
        }
        nanos.addAndGet(d.toNanos());
    }

    public void advanceNanos(long delta) {
        advance(Duration.ofNanos(delta));
    }

    public void advanceMillis(long millis) {
        advanceNanos(TimeUnit.MILLISECONDS.toNanos(millis));
    }
}
