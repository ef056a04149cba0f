package com.pawpal.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process fan-out of {@link PawPalEvent}s.
 * <p>
 * A subscription either follows one owner or every owner. Events are delivered on
 * the publishing thread, in subscription order, before {@link #publish} returns.
 * A subscriber that throws is logged and skipped; the publisher never sees the failure.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(PawPalEvent event) {
        log.debug("Publishing {} for owner {}", event.eventType(), event.ownerId());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliverSafely(registration.consumer(), event);
            }
        }
    }

    /**
     * Receive events concerning one owner only.
     *
     * @return a handle that cancels the subscription
     */
    public Subscription subscribe(String ownerId, Consumer<PawPalEvent> consumer) {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId must not be null; use subscribeAll");
        }
        return register(new Registration(ownerId, consumer));
    }

    /**
     * Receive every published event.
     */
    public Subscription subscribeAll(Consumer<PawPalEvent> consumer) {
        return register(new Registration(null, consumer));
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        log.debug("Subscribed to {}", registration.ownerId() != null ? "owner " + registration.ownerId() : "all owners");
        return () -> registrations.remove(registration);
    }

    private void deliverSafely(Consumer<PawPalEvent> subscriber, PawPalEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for owner {}: {}",
                    event.eventType(), event.ownerId(), e.getMessage(), e);
        }
    }

    /** {@code ownerId == null} follows every owner. */
    private record Registration(String ownerId, Consumer<PawPalEvent> consumer) {

        boolean accepts(PawPalEvent event) {
            return ownerId == null || ownerId.equals(event.ownerId());
        }
    }
}
