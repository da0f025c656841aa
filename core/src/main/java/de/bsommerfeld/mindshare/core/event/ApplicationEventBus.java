package de.bsommerfeld.mindshare.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guava {@link EventBus} carrying {@link PipelineEvents}. Stages post their
 * outcomes here so each write step is observable on its own.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A listener that throws is
 * logged and skipped; it never fails the run.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::onListenerFailure);
    }

    public void post(Object event) {
        LOG.debug("Pipeline event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }

    private static void onListenerFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.warn("Listener {}.{} failed on {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(), exception);
    }
}
