package de.bsommerfeld.layerkit.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

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
        eventBus.post("login");

        assertEquals("login", received.get());
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
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }

    @Test
    void post_shouldKeepDeliveringAfterSubscriberThrows() {
        var eventBus = new ApplicationEventBus();
        List<String> received = new ArrayList<>();

        Object failing = new Object() {
            @Subscribe
            public void onEvent(String event) {
                throw new IllegalStateException("listener broke");
            }
        };
        Object healthy = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.add(event);
            }
        };

        eventBus.register(failing);
        eventBus.register(healthy);

        assertDoesNotThrow(() -> eventBus.post("one"));
        assertDoesNotThrow(() -> eventBus.post("two"));
        assertEquals(List.of("one", "two"), received);
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post("nobody-listens"));
    }
}
