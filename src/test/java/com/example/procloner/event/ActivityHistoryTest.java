package com.example.procloner.event;

import com.example.procloner.config.SessionProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityHistoryTest {

    private final EventBus bus = new EventBus();
    private ActivityHistory history;

    @BeforeEach
    void setUp() {
        SessionProperties properties = new SessionProperties();
        properties.setHistorySize(3);
        history = new ActivityHistory(bus, properties);
        history.init();
    }

    @AfterEach
    void tearDown() {
        history.shutdown();
    }

    @Test
    void keepsOnlyTheMostRecentEvents() {
        for (int i = 1; i <= 5; i++) {
            bus.publish(SessionEvent.progressUpdate("s-1", i * 10, i));
        }

        assertThat(history.recent("s-1")).extracting(e -> e.getPayload().get("progress"))
                .containsExactly(30, 40, 50);
    }

    @Test
    void skipsReplyOnlyEventsAndAnonymousEvents() {
        bus.publish(SessionEvent.of("s-1", EventType.SESSION_NOT_FOUND));
        bus.publish(SessionEvent.withMessage("s-1", EventType.REQUEST_REJECTED, "reason", "no"));
        bus.publish(SessionEvent.of(null, EventType.STATUS_UPDATE));
        bus.publish(SessionEvent.of("s-1", EventType.SESSION_RESUMED));

        assertThat(history.recent("s-1")).extracting(SessionEvent::getType)
                .containsExactly(EventType.SESSION_RESUMED);
    }

    @Test
    void forgetDropsSessionHistory() {
        bus.publish(SessionEvent.progressUpdate("s-1", 10, 1));
        history.forget("s-1");

        assertThat(history.recent("s-1")).isEmpty();
        assertThat(history.recent("unknown")).isEmpty();
    }
}
