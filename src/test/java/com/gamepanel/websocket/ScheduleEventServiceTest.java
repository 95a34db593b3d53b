package com.gamepanel.websocket;

import com.gamepanel.scheduler.ChainRunReport;
import com.gamepanel.scheduler.RunState;
import com.gamepanel.scheduler.RunStateRegistry;
import com.gamepanel.scheduler.RunStatus;
import com.gamepanel.scheduler.TaskChainExecutor;
import com.gamepanel.scheduler.dispatch.ActionDispatcher;
import com.gamepanel.scheduler.dispatch.DispatchResult;
import com.gamepanel.scheduler.model.PowerAction;
import com.gamepanel.scheduler.model.RunTrigger;
import com.gamepanel.scheduler.model.Schedule;
import com.gamepanel.scheduler.model.ScheduleTask;
import com.gamepanel.scheduler.model.TaskAction;
import com.gamepanel.scheduler.model.TriggerMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleEventService Tests")
class ScheduleEventServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T04:00:00Z");

    @Mock
    private ScheduleWebSocketHandler webSocketHandler;

    @Mock
    private ActionDispatcher dispatcher;

    @Captor
    private ArgumentCaptor<Map<String, Object>> messages;

    private RunStateRegistry registry;
    private ScheduleEventService eventService;

    @BeforeEach
    void setUp() {
        registry = new RunStateRegistry();
        eventService = new ScheduleEventService(webSocketHandler, registry);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(Map<String, Object> message) {
        return (Map<String, Object>) message.get("data");
    }

    @Test
    @DisplayName("A one-task run broadcasts its index and then the end of the run to the server's subscribers")
    void broadcastsRunProgress() {
        TaskChainExecutor executor = new TaskChainExecutor(dispatcher, eventService,
                Clock.fixed(NOW, ZoneOffset.UTC), duration -> { });
        when(dispatcher.powerAction("srv-1", PowerAction.RESTART)).thenReturn(DispatchResult.success(null, 1));
        Schedule schedule = Schedule.builder()
                .id("sched-1")
                .serverId("srv-1")
                .name("Nightly restart")
                .cronExpression("0 4 * * *")
                .active(true)
                .task(ScheduleTask.builder()
                        .id("t0").scheduleId("sched-1").action(TaskAction.POWER_RESTART)
                        .sequence(0).triggerMode(TriggerMode.TIME_DELAY).timeOffset(0)
                        .build())
                .build();
        RunState run = registry.tryAcquire("sched-1", RunTrigger.MANUAL, NOW).orElseThrow();

        ChainRunReport report = executor.execute(schedule, run);

        assertEquals(RunStatus.SUCCESS, report.getStatus());
        verify(webSocketHandler, times(2)).broadcast(eq("srv-1"), messages.capture());
        List<Map<String, Object>> sent = messages.getAllValues();

        assertEquals("schedule_status", sent.get(0).get("type"));
        Map<String, Object> started = data(sent.get(0));
        assertEquals("sched-1", started.get("id"));
        assertEquals(true, started.get("executing"));
        assertEquals(0, started.get("executingTaskIndex"));
        assertEquals("Nightly restart", started.get("name"));
        assertEquals("MANUAL", started.get("trigger"));

        Map<String, Object> finished = data(sent.get(1));
        assertEquals(false, finished.get("executing"));
        assertTrue(finished.containsKey("executingTaskIndex"));
        assertNull(finished.get("executingTaskIndex"));
    }

    @Test
    @DisplayName("An event for a schedule without a run goes to every session")
    void broadcastsWithoutRun() {
        eventService.publish("sched-9", null);

        verify(webSocketHandler).broadcast(isNull(), messages.capture());
        Map<String, Object> data = data(messages.getValue());
        assertEquals("sched-9", data.get("id"));
        assertEquals(false, data.get("executing"));
        assertFalse(data.containsKey("serverId"));
    }
}
