package com.questrail.kitchen.internal.time;

/**
 * Handle to a scheduled task.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled before
     */
    boolean cancel();
}
