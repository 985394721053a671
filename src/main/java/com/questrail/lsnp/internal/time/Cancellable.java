package com.questrail.lsnp.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle returned by {@link MonotonicScheduler}.
 *
 * <p>Implemented by the executor-backed production scheduler and by the
 * deterministic scheduler used in tests.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
