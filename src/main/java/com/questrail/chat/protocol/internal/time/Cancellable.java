package com.questrail.chat.protocol.internal.time;

/**
 * Cancellation handle for a task placed on a {@link MonotonicScheduler}.
 *
 * <p>Acknowledgment waits, reply timeouts and shutdown stage bounds all hold
 * one of these so the owning component can disarm the task once the awaited
 * signal arrives.</p>
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
