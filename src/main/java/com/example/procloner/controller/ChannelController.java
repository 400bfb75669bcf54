package com.example.procloner.controller;

import com.example.procloner.event.ChannelReply;
import com.example.procloner.event.SessionEvent;
import com.example.procloner.model.ClientMessage;
import com.example.procloner.service.ChannelMessageRouter;
import com.example.procloner.service.PushChannelService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Push channel: an SSE stream out, JSON messages in.
 */
@RestController
@RequestMapping("/api/channel")
public class ChannelController {

    private final PushChannelService pushChannel;
    private final ChannelMessageRouter router;

    public ChannelController(PushChannelService pushChannel, ChannelMessageRouter router) {
        this.pushChannel = pushChannel;
        this.router = router;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "sessionId", required = false) String sessionId) {
        String id = sessionId == null || sessionId.trim().isEmpty() ? null : sessionId.trim();
        return pushChannel.open(id);
    }

    /**
     * Returns the reply frame; replayed history, when any, is listed under {@code history}.
     */
    @PostMapping("/messages")
    public Map<String, Object> message(@RequestBody(required = false) ClientMessage message) {
        ChannelReply reply = router.route(message);
        Map<String, Object> body = new LinkedHashMap<>(reply.getReply().toFrame());
        if (!reply.getReplay().isEmpty()) {
            List<Map<String, Object>> history = new ArrayList<>();
            for (SessionEvent e : reply.getReplay()) {
                history.add(e.toFrame());
            }
            body.put("history", history);
        }
        return body;
    }
}
