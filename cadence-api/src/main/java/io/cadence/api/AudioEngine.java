package io.cadence.api;

import java.util.concurrent.CompletableFuture;

/**
 * Facade over the audio rendering engine.
 *
 * The transport delegates real sound start/stop/relocation here. Every command
 * is asynchronous: the returned future completes when the engine has applied
 * the command, or completes exceptionally if it could not. Implementations may
 * also throw synchronously; callers treat both the same way.
 *
 * Positions are in steps. The engine owns its own tick resolution and exposes
 * it through transport().
 */
public interface AudioEngine {

    /** Starts playback at the given step. */
    CompletableFuture<Void> play(double step);

    /** Pauses playback, keeping the engine's position. */
    CompletableFuture<Void> pause();

    /** Stops playback. */
    CompletableFuture<Void> stop();

    /** Relocates the engine playhead without changing its run state. */
    CompletableFuture<Void> jumpToStep(double step);

    /** Sets the engine tempo. Callers clamp to [MIN_BPM..MAX_BPM] beforehand. */
    CompletableFuture<Void> setBpm(double bpm);

    /** Sets the loop range in steps. end > start is guaranteed by callers. */
    CompletableFuture<Void> setLoopPoints(double start, double end);

    /** Enables or disables looping between the loop points. */
    CompletableFuture<Void> setLoopEnabled(boolean enabled);

    /** Synchronous clock view. Never null. */
    AudioTransport transport();
}
