package com.example.procloner.service;

import com.example.procloner.event.ChannelReply;
import com.example.procloner.event.EventType;
import com.example.procloner.event.SessionEvent;
import com.example.procloner.model.ClientMessage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChannelMessageRouterTest {

    private static final String ID = "0f8fad5b-d9cb-469f-a165-70867728950e";

    private final RecoveryProtocolHandler handler = mock(RecoveryProtocolHandler.class);
    private final ChannelMessageRouter router = new ChannelMessageRouter(handler);

    @Test
    void dispatchesByType() {
        ChannelReply resumed = ChannelReply.of(SessionEvent.of(ID, EventType.SESSION_RESUMED));
        when(handler.resume(ID)).thenReturn(resumed);

        assertThat(router.route(new ClientMessage("resume_session", ID))).isSameAs(resumed);

        router.route(new ClientMessage("recover_session", ID));
        router.route(new ClientMessage("pause_session", ID));
        router.route(new ClientMessage("cancel_session", ID));
        verify(handler).recover(ID);
        verify(handler).pause(ID);
        verify(handler).cancel(ID);
    }

    @Test
    void sessionIdIsCanonicalized() {
        router.route(new ClientMessage("recover_session", "  " + ID.toUpperCase() + " "));

        verify(handler).recover(ID);
    }

    @Test
    void malformedMessagesAreRejected() {
        assertRejected(router.route(null));
        assertRejected(router.route(new ClientMessage(null, ID)));
        assertRejected(router.route(new ClientMessage("delete_everything", ID)));
        assertRejected(router.route(new ClientMessage("recover_session", null)));
        assertRejected(router.route(new ClientMessage("recover_session", "not-a-uuid")));
        assertRejected(router.route(new ClientMessage("recover_session", "../../etc/passwd")));

        verifyNoInteractions(handler);
    }

    @Test
    void normalizeSessionId() {
        assertThat(ChannelMessageRouter.normalizeSessionId(ID)).isEqualTo(ID);
        assertThat(ChannelMessageRouter.normalizeSessionId("1-1-1-1-1")).isNull();
        assertThat(ChannelMessageRouter.normalizeSessionId("")).isNull();
    }

    private static void assertRejected(ChannelReply reply) {
        assertThat(reply.getType()).isEqualTo(EventType.REQUEST_REJECTED);
        assertThat(reply.getReply().getSessionId()).isNull();
        assertThat(reply.getReply().getPayload()).containsKey("reason");
    }
}
