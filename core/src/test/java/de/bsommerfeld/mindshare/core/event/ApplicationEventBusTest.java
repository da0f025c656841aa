package de.bsommerfeld.mindshare.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.SnapshotPersistedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.SnapshotWriteFailedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.Target;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("test-event");

        assertEquals("test-event", received.get());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        assertEquals("first", received.get());

        eventBus.unregister(listener);
        eventBus.post("second");
        assertEquals("first", received.get());
    }

    @Test
    void post_shouldRouteByEventType() {
        var eventBus = new ApplicationEventBus();
        List<SnapshotPersistedEvent> persisted = new ArrayList<>();
        List<SnapshotWriteFailedEvent> failed = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onPersisted(SnapshotPersistedEvent event) {
                persisted.add(event);
            }

            @Subscribe
            public void onFailed(SnapshotWriteFailedEvent event) {
                failed.add(event);
            }
        };
        eventBus.register(listener);

        eventBus.post(new SnapshotPersistedEvent(Target.STORE, "AggregatedYapScores_2024_01_12_1430", 3));
        eventBus.post(new SnapshotWriteFailedEvent(Target.CSV, "AggregatedYapScores_2024_01_12_1430",
                new IOException("disk full")));

        assertEquals(1, persisted.size());
        assertEquals(Target.STORE, persisted.get(0).target());
        assertEquals(1, failed.size());
        assertEquals("disk full", failed.get(0).cause().getMessage());
    }

    @Test
    void post_shouldKeepDeliveringWhenOneListenerFails() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(String event) {
                throw new IllegalStateException("broken listener");
            }
        });
        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        });

        assertDoesNotThrow(() -> eventBus.post("still-delivered"));
        assertEquals("still-delivered", received.get());
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post("nobody-listens"));
    }
}
