package com.gamepanel.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gamepanel.scheduler.ScheduleService;
import com.gamepanel.scheduler.ScheduleStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live schedule progress for panel clients.
 *
 * <p>A session receives every schedule event until it sends {@code {"type":"subscribe","serverId":...}};
 * from then on only that server's events, starting with a {@code schedule_status_sync} snapshot.</p>
 */
@Slf4j
@Component
public class ScheduleWebSocketHandler extends TextWebSocketHandler {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> subscriptions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ScheduleService scheduleService;

    public ScheduleWebSocketHandler(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("WebSocket connected: {}", session.getId());

        sendToSession(session, Map.of(
                "type", "connected",
                "message", "Connected to schedule events",
                "sessionId", session.getId()
        ));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        subscriptions.remove(session.getId());
        log.info("WebSocket closed: {} ({})", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> data = objectMapper.readValue(message.getPayload(), Map.class);
            String type = String.valueOf(data.get("type"));

            switch (type) {
                case "ping" -> sendToSession(session, Map.of("type", "pong"));
                case "subscribe" -> subscribe(session, data.get("serverId"));
                case "unsubscribe" -> {
                    subscriptions.remove(session.getId());
                    log.info("Session {} now receives all schedule events", session.getId());
                }
                default -> log.warn("Unknown message type from {}: {}", session.getId(), type);
            }
        } catch (IOException e) {
            log.warn("Malformed WebSocket message from {}: {}", session.getId(), e.getMessage());
            sendToSession(session, Map.of("type", "error", "message", "Malformed message"));
        }
    }

    private void subscribe(WebSocketSession session, Object serverId) {
        if (!(serverId instanceof String id) || id.isBlank()) {
            sendToSession(session, Map.of("type", "error", "message", "subscribe requires a serverId"));
            return;
        }
        subscriptions.put(session.getId(), id);
        log.info("Session {} subscribed to server {}", session.getId(), id);

        try {
            List<ScheduleStatus> statuses = scheduleService.getStatuses(id);
            sendToSession(session, Map.of(
                    "type", "schedule_status_sync",
                    "data", Map.of("serverId", id, "schedules", statuses),
                    "timestamp", Instant.now().toEpochMilli()
            ));
        } catch (RuntimeException e) {
            log.error("Could not load schedule statuses for server {}", id, e);
            sendToSession(session, Map.of("type", "error", "message", "Could not load schedule statuses"));
        }
    }

    /**
     * Sends to every session subscribed to {@code serverId} and to every session without a subscription.
     * A null {@code serverId} reaches all sessions.
     */
    public void broadcast(String serverId, Map<String, Object> message) {
        sessions.values().forEach(session -> {
            String subscribed = subscriptions.get(session.getId());
            if (serverId == null || subscribed == null || subscribed.equals(serverId)) {
                sendToSession(session, message);
            }
        });
    }

    private void sendToSession(WebSocketSession session, Map<String, Object> message) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(message);
            // WebSocketSession is not safe for concurrent sends; runs publish from several threads
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.error("Failed to send WebSocket message: {}", session.getId(), e);
        }
    }

    public int getConnectionCount() {
        return sessions.size();
    }
}
