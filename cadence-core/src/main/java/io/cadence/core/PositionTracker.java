package io.cadence.core;

/**
 * One tracking run of the playback engine: a frame task bound to its own handle.
 *
 * Every frame asks the engine to sample the audio clock. When tracking should
 * end (not playing, or the user owns the playhead) the engine cancels the
 * tracker from inside that frame. A cancelled tracker is never restarted;
 * the engine creates a fresh one.
 */
final class PositionTracker implements Runnable {

    private final PlaybackEngine engine;

    private volatile FrameHandle handle = null;
    private volatile boolean cancelled = false;

    PositionTracker(PlaybackEngine engine) {
        this.engine = engine;
    }

    void start(FrameScheduler scheduler) {
        FrameHandle h = scheduler.schedule(this);
        handle = h;
        // cancel() may have raced the schedule call
        if (cancelled) {
            h.cancel();
        }
    }

    void cancel() {
        cancelled = true;
        FrameHandle h = handle;
        if (h != null) {
            h.cancel();
        }
    }

    boolean isActive() {
        return !cancelled;
    }

    @Override
    public void run() {
        if (cancelled) {
            return;
        }
        engine.trackFrame(this);
    }
}
