package io.cadence.api;

/**
 * Unchecked exception raised by AudioEngine implementations when a transport
 * command cannot be applied.
 *
 * The playback engine catches it (and any other delegate failure), logs it,
 * leaves transport state unchanged and reports false to the caller.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
