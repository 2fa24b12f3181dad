package de.bsommerfeld.promptstore.core.event;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers {@link StorageEvents.StorageEvent}s to whoever holds open database
 * connections, so the storage components can announce relocations and
 * imports without knowing their listeners.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A listener that throws is
 * logged and does not stop delivery to the others, nor does it fail the
 * operation that posted the event: by the time an event is posted the
 * files have already moved.
 */
@Singleton
public class StorageEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(StorageEventBus.class);

    private final EventBus eventBus;

    public StorageEventBus() {
        this.eventBus = new EventBus(StorageEventBus::onListenerFailure);
        this.eventBus.register(new Object() {
            @Subscribe
            public void onDeadEvent(DeadEvent dead) {
                LOG.debug("No listener for {}", dead.getEvent());
            }
        });
    }

    public void post(StorageEvents.StorageEvent event) {
        LOG.debug("Posting {}", event);
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

    private static void onListenerFailure(Throwable cause, SubscriberExceptionContext context) {
        LOG.error("Listener {}.{} failed on {}",
                context.getSubscriber().getClass().getName(), context.getSubscriberMethod().getName(),
                context.getEvent(), cause);
    }
}
