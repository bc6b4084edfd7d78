package io.cadence.core;

import io.cadence.api.TransportConstants;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FrameScheduler backed by a single daemon thread ticking at a fixed rate.
 *
 * Used when the host has no display loop of its own. All frame tasks share the
 * one thread, so a task never runs concurrently with itself or with another task.
 *
 * A task that throws is logged and keeps its schedule; only cancel() stops it.
 */
public final class ScheduledFrameScheduler implements FrameScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledFrameScheduler.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final ScheduledExecutorService executor;
    private final long periodMicros;

    /** Ticks at POSITION_UPDATE_RATE_HZ. */
    public ScheduledFrameScheduler() {
        this(TransportConstants.POSITION_UPDATE_RATE_HZ);
    }

    /**
     * @param rateHz frames per second; must be positive
     */
    public ScheduledFrameScheduler(int rateHz) {
        if (rateHz <= 0) {
            throw new IllegalArgumentException("rateHz must be positive: " + rateHz);
        }
        this.periodMicros = 1_000_000L / rateHz;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cadence-frame-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public FrameHandle schedule(Runnable frameTask) {
        if (frameTask == null) {
            throw new NullPointerException("frameTask");
        }
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
            try {
                frameTask.run();
            } catch (RuntimeException e) {
                log.warn("Frame task threw; continuing on next frame", e);
            }
        }, periodMicros, periodMicros, TimeUnit.MICROSECONDS);
        return new FutureHandle(future);
    }

    public long periodMicros() { return periodMicros; }

    /** Stops the frame thread. Scheduled tasks never run again. */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class FutureHandle implements FrameHandle {

        private final ScheduledFuture<?> future;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
