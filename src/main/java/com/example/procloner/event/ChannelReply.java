package com.example.procloner.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Answer to one inbound channel message: the typed reply frame, plus earlier events to replay
 * when a client reattaches to a session.
 */
public final class ChannelReply {

    private final SessionEvent reply;
    private final List<SessionEvent> replay;

    public ChannelReply(SessionEvent reply, List<SessionEvent> replay) {
        this.reply = reply;
        this.replay = replay == null
                ? Collections.<SessionEvent>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(replay));
    }

    public static ChannelReply of(SessionEvent reply) {
        return new ChannelReply(reply, null);
    }

    public SessionEvent getReply() {
        return reply;
    }

    public List<SessionEvent> getReplay() {
        return replay;
    }

    public EventType getType() {
        return reply.getType();
    }
}
