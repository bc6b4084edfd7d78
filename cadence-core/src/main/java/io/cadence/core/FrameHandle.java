package io.cadence.core;

/**
 * Cancellation handle for a task scheduled on a FrameScheduler.
 * cancel() is idempotent and may be called from inside the task itself.
 */
public interface FrameHandle {

    void cancel();

    boolean isCancelled();
}
