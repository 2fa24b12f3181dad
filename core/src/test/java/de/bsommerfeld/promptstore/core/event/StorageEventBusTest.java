package de.bsommerfeld.promptstore.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StorageEventBusTest {

    @Test
    void post_shouldDeliverRelocationToListener() {
        var eventBus = new StorageEventBus();
        var received = new AtomicReference<StorageEvents.DatabaseRelocatedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onRelocated(StorageEvents.DatabaseRelocatedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        var event = new StorageEvents.DatabaseRelocatedEvent(Path.of("/a/prompts.db"), Path.of("/b/prompts.db"));
        eventBus.post(event);

        assertEquals(event, received.get());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new StorageEventBus();
        var received = new AtomicReference<StorageEvents.LegacyImportCompletedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onImport(StorageEvents.LegacyImportCompletedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new StorageEvents.LegacyImportCompletedEvent(1, 0, 0));
        eventBus.unregister(listener);
        eventBus.post(new StorageEvents.LegacyImportCompletedEvent(2, 0, 0));

        assertEquals(1, received.get().imported());
    }

    @Test
    void post_shouldReachOtherListenersWhenOneFails() {
        var eventBus = new StorageEventBus();
        List<String> calls = new ArrayList<>();

        eventBus.register(new Object() {
            @Subscribe
            public void onRelocated(StorageEvents.DatabaseRelocatedEvent event) {
                calls.add("failing");
                throw new IllegalStateException("connection pool closed");
            }
        });
        eventBus.register(new Object() {
            @Subscribe
            public void onRelocated(StorageEvents.DatabaseRelocatedEvent event) {
                calls.add("healthy");
            }
        });

        assertDoesNotThrow(() -> eventBus.post(
                new StorageEvents.DatabaseRelocatedEvent(Path.of("/a/prompts.db"), Path.of("/b/prompts.db"))));
        assertEquals(2, calls.size());
        assertTrue(calls.contains("healthy"));
    }

    @Test
    void post_shouldNotThrowWithoutListeners() {
        var eventBus = new StorageEventBus();
        assertDoesNotThrow(() -> eventBus.post(new StorageEvents.LegacyImportCompletedEvent(0, 0, 1)));
    }
}
