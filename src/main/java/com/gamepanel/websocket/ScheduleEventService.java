package com.gamepanel.websocket;

import com.gamepanel.scheduler.ProgressChannel;
import com.gamepanel.scheduler.RunState;
import com.gamepanel.scheduler.RunStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Publishes run progress to WebSocket clients as {@code schedule_status} events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleEventService implements ProgressChannel {

    private final ScheduleWebSocketHandler webSocketHandler;
    private final RunStateRegistry runStateRegistry;

    @Override
    public void publish(String scheduleId, Integer taskIndex) {
        Optional<RunState> run = runStateRegistry.find(scheduleId);

        Map<String, Object> data = new HashMap<>();
        data.put("id", scheduleId);
        data.put("executing", taskIndex != null);
        data.put("executingTaskIndex", taskIndex);
        run.ifPresent(state -> {
            data.put("serverId", state.getServerId());
            data.put("name", state.getScheduleName());
            data.put("trigger", state.getTrigger().name());
            data.put("startedAt", state.getAcquiredAt().toEpochMilli());
        });

        broadcast(run.map(RunState::getServerId).orElse(null), "schedule_status", data);
    }

    private void broadcast(String serverId, String type, Map<String, Object> data) {
        Map<String, Object> message = new HashMap<>();
        message.put("type", type);
        message.put("data", data);
        message.put("timestamp", Instant.now().toEpochMilli());

        webSocketHandler.broadcast(serverId, message);
        log.debug("Broadcast {} for schedule {} (connections: {})",
                type, data.get("id"), webSocketHandler.getConnectionCount());
    }
}
