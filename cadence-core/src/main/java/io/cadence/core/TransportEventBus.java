package io.cadence.core;

import io.cadence.api.Subscription;
import io.cadence.api.TransportEvent;
import io.cadence.api.TransportEventType;
import io.cadence.api.TransportListener;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous in-process fan-out of transport events.
 *
 * DELIVERY:
 *   publish() calls every matching listener on the publishing thread, in
 *   registration order, before returning. Nothing is queued. A listener that
 *   throws is logged and skipped; the remaining listeners still receive the event.
 *
 * THREAD SAFETY:
 *   Registrations live in a CopyOnWriteArrayList. publish() iterates a snapshot,
 *   so listeners may subscribe or unsubscribe from inside a callback.
 */
public final class TransportEventBus {

    private static final Logger log = LoggerFactory.getLogger(TransportEventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    /** Registers a listener for every event type. */
    public Subscription subscribe(TransportListener listener) {
        return subscribe(null, listener);
    }

    /**
     * Registers a listener for one event type.
     *
     * @param type     event type to receive; null receives every type
     * @param listener callback; must not be null
     * @return handle removing this registration
     */
    public Subscription subscribe(TransportEventType type, TransportListener listener) {
        if (listener == null) {
            throw new NullPointerException("listener");
        }
        Registration registration = new Registration(type, listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /** Delivers event to every listener whose filter accepts it. */
    public void publish(TransportEvent event) {
        for (Registration registration : registrations) {
            if (registration.accepts(event.type())) {
                deliver(registration.listener(), event);
            }
        }
    }

    /** Delivers event to a single listener with the same failure isolation as publish(). */
    public void deliver(TransportListener listener, TransportEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Transport listener failed on {} event", event.type().wireName(), e);
        }
    }

    public int listenerCount() {
        return registrations.size();
    }

    /** Drops every registration. */
    public void clear() {
        registrations.clear();
    }

    // Identity semantics: the same listener may be registered twice.
    private static final class Registration {

        private final TransportEventType type;
        private final TransportListener listener;

        private Registration(TransportEventType type, TransportListener listener) {
            this.type = type;
            this.listener = listener;
        }

        boolean accepts(TransportEventType eventType) {
            return type == null || type == eventType;
        }

        TransportListener listener() { return listener; }
    }
}
