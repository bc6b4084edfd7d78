package io.cadence.api;

/**
 * Synchronous view of the audio engine's clock.
 *
 * The audio engine advances its tick counter on its own thread. Readers get
 * the latest value without blocking; the value is authoritative for the
 * playhead while the transport is playing.
 */
public interface AudioTransport {

    /** Current playhead position in engine ticks. */
    long currentTick();

    /** Converts engine ticks to steps at the engine's resolution. */
    double ticksToSteps(long ticks);
}
