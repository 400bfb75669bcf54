package com.example.procloner.service;

import com.example.procloner.config.SessionProperties;
import com.example.procloner.event.ActivityHistory;
import com.example.procloner.event.EventBus;
import com.example.procloner.event.SessionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PushChannelServiceTest {

    private EventBus eventBus;
    private ActivityHistory history;
    private PushChannelService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        history = new ActivityHistory(eventBus, new SessionProperties());
        history.init();
        service = new PushChannelService(eventBus, history, 0L);
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
        history.shutdown();
    }

    @Test
    @DisplayName("a session stream subscribes to that session only")
    void sessionStream() {
        SseEmitter emitter = service.open("s-1");

        assertThat(emitter).isNotNull();
        assertThat(eventBus.subscriberCount("s-1")).isEqualTo(1);
        assertThat(eventBus.subscriberCount("s-2")).isZero();
        assertThat(service.activeStreamCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("each open creates its own stream")
    void separateStreams() {
        SseEmitter first = service.open("s-1");
        SseEmitter second = service.open("s-1");
        SseEmitter everything = service.open(null);

        assertThat(first).isNotSameAs(second);
        assertThat(everything).isNotNull();
        assertThat(eventBus.subscriberCount("s-1")).isEqualTo(2);
        assertThat(service.activeStreamCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("opening after activity replays history and later events are forwarded")
    void replayAndForward() {
        eventBus.publish(SessionEvent.progressUpdate("s-1", 10, 2));
        eventBus.publish(SessionEvent.progressUpdate("s-1", 20, 3));

        service.open("s-1");

        assertThatCode(() -> eventBus.publish(SessionEvent.progressUpdate("s-1", 30, 4)))
                .doesNotThrowAnyException();
        assertThat(history.recent("s-1")).hasSize(3);
    }
}
