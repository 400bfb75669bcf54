package com.example.procloner.controller;

import com.example.procloner.event.ChannelReply;
import com.example.procloner.event.EventType;
import com.example.procloner.event.SessionEvent;
import com.example.procloner.model.ClientMessage;
import com.example.procloner.service.ChannelMessageRouter;
import com.example.procloner.service.PushChannelService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Arrays;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChannelController.class)
class ChannelControllerTest {

    private static final String ID = "0f8fad5b-d9cb-469f-a165-70867728950e";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PushChannelService pushChannel;

    @MockBean
    private ChannelMessageRouter router;

    @Test
    @DisplayName("GET /channel/stream opens a session stream")
    void streamForSession() throws Exception {
        when(pushChannel.open(ID)).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/channel/stream").param("sessionId", ID))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(pushChannel).open(ID);
    }

    @Test
    @DisplayName("GET /channel/stream without a session follows every session")
    void streamForAll() throws Exception {
        when(pushChannel.open(isNull())).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/channel/stream").param("sessionId", " "))
                .andExpect(status().isOk());

        verify(pushChannel).open(null);
    }

    @Test
    @DisplayName("POST /channel/messages returns the reply frame")
    void replyFrame() throws Exception {
        when(router.route(any(ClientMessage.class))).thenReturn(ChannelReply.of(
                SessionEvent.withMessage(ID, EventType.SESSION_NOT_FOUND, "message", "Session not found or expired")));

        mockMvc.perform(post("/api/channel/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"recover_session\",\"sessionId\":\"" + ID + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("session_not_found"))
                .andExpect(jsonPath("$.sessionId").value(ID))
                .andExpect(jsonPath("$.message").value("Session not found or expired"))
                .andExpect(jsonPath("$.history").doesNotExist());
    }

    @Test
    @DisplayName("POST /channel/messages includes replayed history on reattach")
    void replyWithHistory() throws Exception {
        ChannelReply reply = new ChannelReply(SessionEvent.of(ID, EventType.STATUS_UPDATE), Arrays.asList(
                SessionEvent.progressUpdate(ID, 10, 1),
                SessionEvent.progressUpdate(ID, 20, 2)));
        when(router.route(any(ClientMessage.class))).thenReturn(reply);

        mockMvc.perform(post("/api/channel/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"recover_session\",\"sessionId\":\"" + ID + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("status_update"))
                .andExpect(jsonPath("$.history", hasSize(2)))
                .andExpect(jsonPath("$.history[1].progress").value(20));
    }
}
