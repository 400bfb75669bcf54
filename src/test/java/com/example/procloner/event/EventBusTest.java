package com.example.procloner.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private final EventBus bus = new EventBus();

    @Test
    void sessionSubscriberOnlySeesItsSession() {
        List<SessionEvent> received = new ArrayList<>();
        bus.subscribe("s-1", received::add);

        bus.publish(SessionEvent.progressUpdate("s-1", 10, 3));
        bus.publish(SessionEvent.progressUpdate("s-2", 20, 4));

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getSessionId()).isEqualTo("s-1");
    }

    @Test
    void globalSubscriberSeesEverything() {
        List<SessionEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        bus.publish(SessionEvent.progressUpdate("s-1", 10, 3));
        bus.publish(SessionEvent.of(null, EventType.REQUEST_REJECTED));

        assertThat(received).extracting(SessionEvent::getType)
                .containsExactly(EventType.PROGRESS_UPDATE, EventType.REQUEST_REJECTED);
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<SessionEvent> received = new ArrayList<>();
        EventBus.Subscription sub = bus.subscribe("s-1", received::add);
        assertThat(bus.subscriberCount("s-1")).isEqualTo(1);

        sub.unsubscribe();
        bus.publish(SessionEvent.progressUpdate("s-1", 10, 3));

        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount("s-1")).isZero();
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() {
        List<SessionEvent> received = new CopyOnWriteArrayList<>();
        bus.subscribe("s-1", e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("s-1", received::add);

        bus.publish(SessionEvent.progressUpdate("s-1", 50, 8));

        assertThat(received).hasSize(1);
    }

    @Test
    void frameFlattensPayload() {
        SessionEvent event = SessionEvent.progressUpdate("s-1", 42, 7);

        assertThat(event.toFrame())
                .containsEntry("type", "progress_update")
                .containsEntry("sessionId", "s-1")
                .containsEntry("progress", 42)
                .containsEntry("totalAssets", 7)
                .containsKey("timestamp");
    }
}
