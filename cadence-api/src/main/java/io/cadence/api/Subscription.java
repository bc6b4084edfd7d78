package io.cadence.api;

/**
 * Handle returned by a subscribe call. Unsubscribing is idempotent.
 * Usable in try-with-resources for scoped listeners.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
