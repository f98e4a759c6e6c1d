package de.bsommerfeld.layerkit.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application-wide Guava {@link EventBus}. The presentation layer talks to
 * its view models through it: views post input events, view models post
 * state changes.
 *
 * <p>
 * Delivery is synchronous on the posting thread. Posts may come from any
 * thread, including the completion threads of asynchronous use cases.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event.getClass().getSimpleName());
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
        LOG.error("Subscriber {}#{} failed handling {}",
                context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(),
                error);
    }
}
