package io.cadence.api;

/**
 * Receives transport events.
 *
 * Called synchronously on the publishing thread. An exception thrown here is
 * logged by the publisher and does not stop delivery to other listeners.
 * Implementations must not block: the publisher may be the frame scheduler.
 */
@FunctionalInterface
public interface TransportListener {

    void onEvent(TransportEvent event);
}
