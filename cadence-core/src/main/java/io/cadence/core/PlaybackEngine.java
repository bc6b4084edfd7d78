package io.cadence.core;

import io.cadence.api.AudioEngine;
import io.cadence.api.AudioTransport;
import io.cadence.api.PlaybackState;
import io.cadence.api.StateChangeReason;
import io.cadence.api.Subscription;
import io.cadence.api.TransportConstants;
import io.cadence.api.TransportEvent;
import io.cadence.api.TransportEventType;
import io.cadence.api.TransportListener;
import io.cadence.api.TransportState;
import java.time.Clock;
import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The transport: owns playback state, drives the audio engine and tracks the playhead.
 *
 * STATE MACHINE:
 *   STOPPED --play--> PLAYING --pause--> PAUSED --play--> PLAYING
 *   any --stop--> STOPPED (position re-homed to loopStart when looping from > 0, else 0)
 *
 * COMMAND PROTOCOL:
 *   Every command returns a CompletableFuture<Boolean>: true when the transition
 *   happened, false when it was a no-op or the audio engine failed. Failures never
 *   surface as exceptional futures. A failed engine call (synchronous throw or
 *   exceptional future) is logged at WARN and leaves the state as it was.
 *   An engine call that has not completed within config.commandTimeout() counts
 *   as failed, so a stalled engine future never blocks the commands behind it.
 *
 *   Transport transitions (play, pause, stop, toggle, jump) run one at a time
 *   through a command chain. A transition issued while another is in flight
 *   waits for it and then re-evaluates the state it finds, so two rapid play()
 *   calls produce one PLAYING transition and one false.
 *   Settings commands (tempo, loop, ghost) are not chained.
 *
 * POSITION TRACKING:
 *   While PLAYING, a PositionTracker runs on the FrameScheduler. Each frame it
 *   converts the audio clock's tick to steps and commits it when it moved by more
 *   than positionEpsilon. It ends itself on the first frame that finds the
 *   transport not playing or the user scrubbing; releasing the scrub restarts it.
 *
 * SCRUBBING:
 *   isUserScrubbing() is true while an explicit beginScrub()/endScrub() bracket is
 *   open or while any jump is inside its release window. SCRUB_START and SCRUB_END
 *   fire on the transitions of that combined flag only.
 *
 * THREAD SAFETY:
 *   State is one immutable TransportState replaced under a private monitor.
 *   Events are published after the monitor is released, on whichever thread made
 *   the change: a caller, an audio engine completion thread, or the frame thread.
 */
public final class PlaybackEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PlaybackEngine.class);

    private final AudioEngine audioEngine;
    private final PlaybackEngineConfig config;
    private final FrameScheduler frameScheduler;
    private final ScheduledFrameScheduler ownedScheduler;
    private final Clock clock;
    private final TransportEventBus eventBus = new TransportEventBus();

    private final Object lock = new Object();

    // -- Guarded by lock ------------------------------------------------------

    private volatile TransportState state;
    private PositionTracker tracker = null;
    private int pendingJumpScrubs = 0;
    private boolean userScrub = false;

    // -- Command chain --------------------------------------------------------

    private final AtomicReference<CompletableFuture<Boolean>> commandTail =
        new AtomicReference<>(CompletableFuture.completedFuture(Boolean.TRUE));

    private volatile boolean closed = false;

    /** Engine with default settings and its own frame thread. */
    public PlaybackEngine(AudioEngine audioEngine) {
        this(audioEngine, PlaybackEngineConfig.DEFAULTS);
    }

    /**
     * @param audioEngine audio facade; must not be null
     * @param config      settings; must not be null
     */
    public PlaybackEngine(AudioEngine audioEngine, PlaybackEngineConfig config) {
        if (audioEngine == null) throw new NullPointerException("audioEngine");
        if (config == null) throw new NullPointerException("config");
        this.audioEngine = audioEngine;
        this.config = config;
        this.clock = config.clock();
        if (config.frameScheduler() != null) {
            this.frameScheduler = config.frameScheduler();
            this.ownedScheduler = null;
        } else {
            this.ownedScheduler = new ScheduledFrameScheduler();
            this.frameScheduler = ownedScheduler;
        }
        this.state = TransportState.initial(
            config.initialBpm(), config.loopStart(), config.loopEnd(), config.loopEnabled());
        log.debug("PlaybackEngine created: {}", state);
    }

    // -- Subscription ---------------------------------------------------------

    /**
     * Registers a listener for every event type and immediately replays the
     * current state to it, and only to it, with reason SUBSCRIPTION.
     */
    public Subscription subscribe(TransportListener listener) {
        return subscribe(null, listener);
    }

    /**
     * Registers a listener for one event type. The SUBSCRIPTION replay is only
     * sent when the filter accepts state-change events.
     *
     * @param type event type to receive; null for all
     */
    public Subscription subscribe(TransportEventType type, TransportListener listener) {
        if (listener == null) {
            throw new NullPointerException("listener");
        }
        if (closed) {
            log.debug("subscribe ignored: engine closed");
            return () -> { };
        }
        Subscription subscription = eventBus.subscribe(type, listener);
        if (type == null || type == TransportEventType.STATE_CHANGE) {
            eventBus.deliver(listener, new TransportEvent.StateChanged(
                state, StateChangeReason.SUBSCRIPTION, clock.millis()));
        }
        return subscription;
    }

    public int subscriberCount() {
        return eventBus.listenerCount();
    }

    // -- Transport commands ---------------------------------------------------

    /** Resumes or starts playback from the current position. */
    public CompletableFuture<Boolean> play() {
        return enqueue("play", () -> doPlay(null));
    }

    /**
     * Relocates to startPosition (clamped to >= 0) and starts playback there.
     * False if already playing.
     */
    public CompletableFuture<Boolean> play(double startPosition) {
        double step = Math.max(0.0, startPosition);
        return enqueue("play", () -> doPlay(step));
    }

    /** PLAYING -> PAUSED. False in any other state. */
    public CompletableFuture<Boolean> pause() {
        return enqueue("pause", this::doPause);
    }

    /**
     * Any state -> STOPPED. Re-homes to loopStart when looping with loopStart > 0,
     * otherwise to 0. Repeating it leaves the same state behind.
     */
    public CompletableFuture<Boolean> stop() {
        return enqueue("stop", this::doStop);
    }

    /**
     * PLAYING pauses, PAUSED resumes from the current position, STOPPED plays from
     * the current position. The choice is made when the command runs.
     */
    public CompletableFuture<Boolean> togglePlayPause() {
        return enqueue("togglePlayPause", () -> {
            switch (state.playbackState()) {
                case PLAYING:
                    return doPause();
                case PAUSED:
                    return doPlay(null);
                case STOPPED:
                default:
                    return doPlay(state.currentPosition());
            }
        });
    }

    /** Smooth jump without auto-play. */
    public CompletableFuture<Boolean> jumpToPosition(double position) {
        return jumpToPosition(position, JumpOptions.DEFAULTS);
    }

    /**
     * Moves the playhead to position (clamped to >= 0).
     *
     * The new position is committed and published before the audio engine confirms.
     * If the engine fails the position is rolled back, unless something else moved
     * it in the meantime, and the result is false.
     */
    public CompletableFuture<Boolean> jumpToPosition(double position, JumpOptions options) {
        if (options == null) {
            throw new NullPointerException("options");
        }
        double target = Math.max(0.0, position);
        return enqueue("jumpToPosition", () -> doJump(target, options));
    }

    // -- Scrub ----------------------------------------------------------------

    /** The UI starts dragging the playhead. Tracking stops on its next frame. */
    public void beginScrub() {
        TransportState changed;
        synchronized (lock) {
            userScrub = true;
            changed = applyScrubFlag();
        }
        announceScrub(changed);
    }

    /** The UI releases the playhead. Tracking resumes if still playing. */
    public void endScrub() {
        TransportState changed;
        synchronized (lock) {
            userScrub = false;
            changed = applyScrubFlag();
        }
        announceScrub(changed);
    }

    // -- Ghost playhead -------------------------------------------------------

    /** Shows a preview playhead. Never moves the committed position. */
    public void setGhostPosition(double position) {
        if (closed) {
            return;
        }
        mutate(s -> s.toBuilder().ghostPosition(position).build());
        eventBus.publish(new TransportEvent.GhostPositionChanged(
            OptionalDouble.of(position), clock.millis()));
    }

    public void clearGhostPosition() {
        if (closed) {
            return;
        }
        mutate(s -> s.toBuilder().clearGhostPosition().build());
        eventBus.publish(new TransportEvent.GhostPositionChanged(
            OptionalDouble.empty(), clock.millis()));
    }

    // -- Settings -------------------------------------------------------------

    /**
     * Sets the tempo, clamped to [MIN_BPM, MAX_BPM]. The position is not touched.
     * NaN is ignored.
     */
    public CompletableFuture<Boolean> setBpm(double bpm) {
        if (closed || Double.isNaN(bpm)) {
            return done(false);
        }
        double clamped = Math.max(TransportConstants.MIN_BPM,
            Math.min(TransportConstants.MAX_BPM, bpm));
        return call("setBpm", () -> audioEngine.setBpm(clamped)).thenApply(ok -> {
            if (ok) {
                TransportState after = mutate(s -> s.toBuilder().bpm(clamped).build());
                publishState(after, StateChangeReason.BPM_CHANGE);
            }
            return ok;
        });
    }

    /** start = max(0, start), end = max(start + 1, end). */
    public CompletableFuture<Boolean> setLoopRange(double start, double end) {
        if (closed || Double.isNaN(start) || Double.isNaN(end)) {
            return done(false);
        }
        double loopStart = Math.max(0.0, start);
        double loopEnd = Math.max(loopStart + 1.0, end);
        return call("setLoopPoints", () -> audioEngine.setLoopPoints(loopStart, loopEnd))
            .thenApply(ok -> {
                if (ok) {
                    TransportState after = mutate(s -> s.toBuilder()
                        .loopStart(loopStart)
                        .loopEnd(loopEnd)
                        .build());
                    publishState(after, StateChangeReason.LOOP_CHANGE);
                }
                return ok;
            });
    }

    public CompletableFuture<Boolean> setLoopEnabled(boolean enabled) {
        if (closed) {
            return done(false);
        }
        return call("setLoopEnabled", () -> audioEngine.setLoopEnabled(enabled)).thenApply(ok -> {
            if (ok) {
                TransportState after = mutate(s -> s.toBuilder().loopEnabled(enabled).build());
                publishState(after, StateChangeReason.LOOP_CHANGE);
            }
            return ok;
        });
    }

    // -- Accessors ------------------------------------------------------------

    /** Current immutable snapshot. */
    public TransportState getState() {
        return state;
    }

    public double currentPosition() {
        return state.currentPosition();
    }

    /** Position to draw the playhead at: always the committed position. */
    public double displayPosition() {
        return state.currentPosition();
    }

    public boolean isTracking() {
        synchronized (lock) {
            return tracker != null && tracker.isActive();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public PlaybackEngineConfig config() {
        return config;
    }

    /**
     * Stops tracking and drops every subscriber. Later commands complete with false.
     * Does not stop the audio engine. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stopTracking();
        eventBus.clear();
        if (ownedScheduler != null) {
            ownedScheduler.close();
        }
        log.debug("PlaybackEngine closed");
    }

    // -- Frame tracking (PositionTracker callback) ----------------------------

    /**
     * Samples the audio clock once on behalf of self.
     *
     * The decision to end tracking and the teardown of self happen under the
     * same monitor hold, so startTracking() never sees a tracker that is about
     * to stop as live.
     */
    void trackFrame(PositionTracker self) {
        synchronized (lock) {
            if (endTrackingIfIdle(self)) {
                return;
            }
        }
        double position;
        try {
            AudioTransport transport = audioEngine.transport();
            position = transport.ticksToSteps(transport.currentTick());
        } catch (RuntimeException e) {
            log.warn("Audio transport read failed; skipping frame", e);
            return;
        }
        long now = clock.millis();
        double committed;
        synchronized (lock) {
            if (endTrackingIfIdle(self)) {
                return;
            }
            TransportState current = state;
            if (!(Math.abs(position - current.currentPosition()) > config.positionEpsilon())) {
                return;
            }
            state = current.toBuilder().currentPosition(position).lastUpdateTime(now).build();
            committed = state.currentPosition();
        }
        eventBus.publish(new TransportEvent.PositionUpdate(committed, now));
    }

    /** Must hold lock. Cancels self and returns true when tracking should end. */
    private boolean endTrackingIfIdle(PositionTracker self) {
        TransportState current = state;
        if (!closed && current.isPlaying() && !current.isUserScrubbing() && tracker == self) {
            return false;
        }
        if (tracker == self) {
            tracker = null;
        }
        self.cancel();
        log.debug("Position tracking ended");
        return true;
    }

    // -- Command bodies (run inside the chain) --------------------------------

    private CompletableFuture<Boolean> doPlay(Double requested) {
        TransportState before = state;
        if (before.isPlaying()) {
            log.debug("play ignored: already playing");
            return done(false);
        }
        double previous = before.currentPosition();
        if (requested == null) {
            return call("play", () -> audioEngine.play(previous)).thenApply(ok -> {
                if (ok) {
                    playStarted(previous, previous);
                }
                return ok;
            });
        }
        double step = requested;
        // the requested start is visible while the engine call is in flight
        mutate(s -> s.toBuilder().currentPosition(step).build());
        return call("jumpToStep", () -> audioEngine.jumpToStep(step))
            .thenCompose(ok -> ok ? call("play", () -> audioEngine.play(step)) : done(false))
            .thenApply(ok -> {
                if (ok) {
                    playStarted(step, previous);
                } else {
                    restorePosition(step, previous);
                }
                return ok;
            });
    }

    private void playStarted(double step, double previous) {
        TransportState after;
        synchronized (lock) {
            state = state.toBuilder()
                .playbackState(PlaybackState.PLAYING)
                .currentPosition(step)
                .build();
            after = state;
        }
        startTracking();
        publishState(after, StateChangeReason.PLAY_COMMAND);
        if (step != previous) {
            eventBus.publish(new TransportEvent.PositionUpdate(after.currentPosition(), clock.millis()));
        }
    }

    /** Undoes an optimistic position write unless something else moved the playhead since. */
    private boolean restorePosition(double written, double previous) {
        synchronized (lock) {
            if (state.currentPosition() != written) {
                return false;
            }
            state = state.toBuilder().currentPosition(previous).build();
            return true;
        }
    }

    private CompletableFuture<Boolean> doPause() {
        if (!state.isPlaying()) {
            log.debug("pause ignored: not playing");
            return done(false);
        }
        return call("pause", audioEngine::pause).thenApply(ok -> {
            if (ok) {
                stopTracking();
                TransportState after = mutate(s -> s.toBuilder()
                    .playbackState(PlaybackState.PAUSED)
                    .build());
                publishState(after, StateChangeReason.PAUSE_COMMAND);
            }
            return ok;
        });
    }

    private CompletableFuture<Boolean> doStop() {
        return call("stop", audioEngine::stop).thenApply(ok -> {
            if (ok) {
                stopTracking();
                long now = clock.millis();
                TransportState after = mutate(s -> s.toBuilder()
                    .playbackState(PlaybackState.STOPPED)
                    .currentPosition(s.loopEnabled() && s.loopStart() > 0.0 ? s.loopStart() : 0.0)
                    .lastStopTime(now)
                    .build());
                publishState(after, StateChangeReason.STOP_COMMAND);
                eventBus.publish(new TransportEvent.PositionUpdate(after.currentPosition(), now));
            }
            return ok;
        });
    }

    private CompletableFuture<Boolean> doJump(double target, JumpOptions options) {
        claimJumpScrub();
        double previous;
        boolean playing;
        synchronized (lock) {
            previous = state.currentPosition();
            playing = state.isPlaying();
            state = state.toBuilder().currentPosition(target).build();
        }
        eventBus.publish(new TransportEvent.PositionUpdate(target, clock.millis()));

        CompletableFuture<Boolean> relocated = playing && options.smooth()
            ? smoothRelocate(target, previous)
            : call("jumpToStep", () -> audioEngine.jumpToStep(target));

        return relocated
            .thenCompose(ok -> {
                if (!ok) {
                    rollbackJump(target, previous);
                    return done(false);
                }
                if (options.autoPlay() && state.playbackState() == PlaybackState.STOPPED) {
                    return doPlay(target);
                }
                return done(true);
            })
            .whenComplete((ok, err) -> scheduleScrubRelease());
    }

    private CompletableFuture<Boolean> smoothRelocate(double target, double previous) {
        return call("pause", audioEngine::pause)
            .thenCompose(ok -> ok
                ? delay(config.smoothJumpSettle())
                    .thenCompose(v -> call("play", () -> audioEngine.play(target)))
                    .thenCompose(restarted -> restarted ? done(true) : resumeAfterFailedJump(previous))
                : done(false));
    }

    /** The engine was paused for a jump that could not restart; puts it back where it was. */
    private CompletableFuture<Boolean> resumeAfterFailedJump(double previous) {
        return call("play", () -> audioEngine.play(previous)).thenApply(resumed -> {
            if (!resumed) {
                log.warn("Audio engine left paused at {} while transport reports PLAYING", previous);
            }
            return false;
        });
    }

    private void rollbackJump(double target, double previous) {
        boolean restored = restorePosition(target, previous);
        log.warn("Jump to {} failed; position {}", target,
            restored ? "restored to " + previous : "left as moved since");
        if (restored) {
            eventBus.publish(new TransportEvent.PositionUpdate(previous, clock.millis()));
        }
    }

    // -- Scrub bookkeeping ----------------------------------------------------

    private void claimJumpScrub() {
        TransportState changed;
        synchronized (lock) {
            pendingJumpScrubs++;
            changed = applyScrubFlag();
        }
        announceScrub(changed);
    }

    private void releaseJumpScrub() {
        TransportState changed;
        synchronized (lock) {
            pendingJumpScrubs = Math.max(0, pendingJumpScrubs - 1);
            changed = applyScrubFlag();
        }
        announceScrub(changed);
    }

    private void scheduleScrubRelease() {
        Duration release = config.scrubRelease();
        if (release.isZero()) {
            releaseJumpScrub();
        } else {
            delayedExecutor(release).execute(this::releaseJumpScrub);
        }
    }

    /** Must hold lock. Returns the new state if the scrub flag flipped, else null. */
    private TransportState applyScrubFlag() {
        boolean scrubbing = userScrub || pendingJumpScrubs > 0;
        if (scrubbing == state.isUserScrubbing()) {
            return null;
        }
        state = state.toBuilder().userScrubbing(scrubbing).build();
        return state;
    }

    private void announceScrub(TransportState changed) {
        if (changed == null) {
            return;
        }
        if (changed.isUserScrubbing()) {
            publishState(changed, StateChangeReason.SCRUB_START);
        } else {
            if (changed.isPlaying()) {
                startTracking();
            }
            publishState(changed, StateChangeReason.SCRUB_END);
        }
    }

    // -- Tracking lifecycle ---------------------------------------------------

    private void startTracking() {
        PositionTracker started;
        synchronized (lock) {
            if (closed || (tracker != null && tracker.isActive())) {
                return;
            }
            started = new PositionTracker(this);
            tracker = started;
        }
        started.start(frameScheduler);
        log.debug("Position tracking started");
    }

    private void stopTracking() {
        PositionTracker stopped;
        synchronized (lock) {
            stopped = tracker;
            tracker = null;
        }
        if (stopped != null) {
            stopped.cancel();
        }
    }

    // -- Internal helpers -----------------------------------------------------

    private TransportState mutate(UnaryOperator<TransportState> change) {
        synchronized (lock) {
            state = change.apply(state);
            return state;
        }
    }

    private void publishState(TransportState snapshot, StateChangeReason reason) {
        eventBus.publish(new TransportEvent.StateChanged(snapshot, reason, clock.millis()));
    }

    private CompletableFuture<Boolean> enqueue(String name,
                                               Supplier<CompletableFuture<Boolean>> command) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        CompletableFuture<Boolean> previous = commandTail.getAndSet(result);
        previous.whenComplete((ignored, ignoredError) ->
            runCommand(name, command).whenComplete((ok, err) -> {
                if (err != null) {
                    log.warn("Transport command {} failed", name, unwrap(err));
                    result.complete(false);
                } else {
                    result.complete(Boolean.TRUE.equals(ok));
                }
            }));
        return result;
    }

    private CompletableFuture<Boolean> runCommand(String name,
                                                  Supplier<CompletableFuture<Boolean>> command) {
        if (closed) {
            log.debug("{} ignored: engine closed", name);
            return done(false);
        }
        log.debug("Transport command {} on {}", name, state);
        try {
            return command.get();
        } catch (RuntimeException e) {
            log.warn("Transport command {} failed", name, e);
            return done(false);
        }
    }

    /** Invokes the audio engine, folding synchronous throws and exceptional futures into false. */
    private CompletableFuture<Boolean> call(String operation,
                                            Supplier<CompletableFuture<Void>> invocation) {
        CompletableFuture<Void> pending;
        try {
            pending = invocation.get();
        } catch (RuntimeException e) {
            log.warn("AudioEngine.{} rejected", operation, e);
            return done(false);
        }
        if (pending == null) {
            return done(true);
        }
        // only the copy times out; the engine's own future is left to complete
        return pending.copy()
            .orTimeout(config.commandTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .handle((v, err) -> {
                Throwable cause = unwrap(err);
                if (cause instanceof TimeoutException) {
                    log.warn("AudioEngine.{} did not complete within {}", operation,
                        config.commandTimeout());
                    return false;
                }
                if (cause != null) {
                    log.warn("AudioEngine.{} failed", operation, cause);
                    return false;
                }
                return true;
            });
    }

    private static CompletableFuture<Void> delay(Duration duration) {
        if (duration.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> { }, delayedExecutor(duration));
    }

    private static Executor delayedExecutor(Duration duration) {
        return CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static CompletableFuture<Boolean> done(boolean value) {
        return CompletableFuture.completedFuture(value);
    }

    private static Throwable unwrap(Throwable t) {
        return (t instanceof CompletionException && t.getCause() != null) ? t.getCause() : t;
    }
}
