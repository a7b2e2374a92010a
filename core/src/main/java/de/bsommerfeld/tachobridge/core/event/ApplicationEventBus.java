package de.bsommerfeld.tachobridge.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. Connection state changes and
 * card synchronization results travel through here so the presentation layer
 * never holds a reference to the services producing them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A failing subscriber is
 * logged and does not affect other subscribers or the poster.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable error, SubscriberExceptionContext context) {
        LOG.error("Subscriber {} failed on {}", context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(), error);
    }
}
