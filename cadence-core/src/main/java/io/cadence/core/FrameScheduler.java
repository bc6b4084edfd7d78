package io.cadence.core;

/**
 * Host-provided source of per-frame callbacks (the display refresh loop).
 *
 * The playback engine schedules its position tracker here and never assumes
 * a particular thread. A frame task runs until its handle is cancelled.
 *
 * THREAD SAFETY:
 *   schedule() may be called from any thread. Frame tasks of one scheduler
 *   must not run concurrently with themselves.
 */
public interface FrameScheduler {

    /**
     * Runs frameTask once per frame until the returned handle is cancelled.
     * The first run happens no earlier than the next frame.
     *
     * @param frameTask task to run every frame; must not be null
     * @return handle cancelling further runs
     */
    FrameHandle schedule(Runnable frameTask);
}
