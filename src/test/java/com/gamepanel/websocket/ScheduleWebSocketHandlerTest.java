package com.gamepanel.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamepanel.scheduler.ScheduleService;
import com.gamepanel.scheduler.ScheduleStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleWebSocketHandler Tests")
class ScheduleWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ScheduleService scheduleService;

    @Mock
    private WebSocketSession subscribed;

    @Mock
    private WebSocketSession unsubscribed;

    private ScheduleWebSocketHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        handler = new ScheduleWebSocketHandler(scheduleService);
        when(subscribed.getId()).thenReturn("s1");
        when(subscribed.isOpen()).thenReturn(true);
        when(unsubscribed.getId()).thenReturn("s2");
        when(unsubscribed.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(subscribed);
        handler.afterConnectionEstablished(unsubscribed);
    }

    private List<JsonNode> sentTo(WebSocketSession session) throws Exception {
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> nodes = new ArrayList<>();
        for (WebSocketMessage<?> message : captor.getAllValues()) {
            nodes.add(objectMapper.readTree(((TextMessage) message).getPayload()));
        }
        return nodes;
    }

    @Test
    @DisplayName("New sessions are greeted")
    void greetsOnConnect() throws Exception {
        assertEquals("connected", sentTo(subscribed).get(0).get("type").asText());
        assertEquals(2, handler.getConnectionCount());
    }

    @Test
    @DisplayName("Subscribing sends a status snapshot for the server")
    void subscribeSendsSnapshot() throws Exception {
        when(scheduleService.getStatuses("srv-1")).thenReturn(List.of(ScheduleStatus.builder()
                .id("sched-1").serverId("srv-1").name("Nightly").enabled(true).build()));

        handler.handleMessage(subscribed, new TextMessage("{\"type\":\"subscribe\",\"serverId\":\"srv-1\"}"));

        List<JsonNode> sent = sentTo(subscribed);
        JsonNode sync = sent.get(sent.size() - 1);
        assertEquals("schedule_status_sync", sync.get("type").asText());
        assertEquals("sched-1", sync.get("data").get("schedules").get(0).get("id").asText());
        assertFalse(sync.get("data").get("schedules").get(0).get("executing").asBoolean());
    }

    @Test
    @DisplayName("Ping is answered with pong")
    void pingPong() throws Exception {
        handler.handleMessage(unsubscribed, new TextMessage("{\"type\":\"ping\"}"));

        List<JsonNode> sent = sentTo(unsubscribed);
        assertEquals("pong", sent.get(sent.size() - 1).get("type").asText());
    }

    @Test
    @DisplayName("Broadcasts reach subscribers of the server and unsubscribed sessions only")
    void broadcastFiltersByServer() throws Exception {
        when(scheduleService.getStatuses("srv-1")).thenReturn(List.of());
        handler.handleMessage(subscribed, new TextMessage("{\"type\":\"subscribe\",\"serverId\":\"srv-1\"}"));
        clearInvocations(subscribed, unsubscribed);

        handler.broadcast("srv-2", Map.of("type", "schedule_status"));

        verify(subscribed, never()).sendMessage(any());
        verify(unsubscribed).sendMessage(any());

        handler.broadcast("srv-1", Map.of("type", "schedule_status"));

        verify(subscribed).sendMessage(any());
    }

    @Test
    @DisplayName("Closed sessions stop receiving broadcasts")
    void closedSessionRemoved() throws Exception {
        handler.afterConnectionClosed(unsubscribed, CloseStatus.NORMAL);
        clearInvocations(unsubscribed);

        handler.broadcast(null, Map.of("type", "schedule_status"));

        verify(unsubscribed, never()).sendMessage(any());
        assertEquals(1, handler.getConnectionCount());
    }

    @Test
    @DisplayName("Malformed input gets an error reply")
    void malformedMessage() throws Exception {
        handler.handleMessage(unsubscribed, new TextMessage("not json"));

        List<JsonNode> sent = sentTo(unsubscribed);
        assertEquals("error", sent.get(sent.size() - 1).get("type").asText());
    }
}
