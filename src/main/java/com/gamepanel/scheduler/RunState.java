package com.gamepanel.scheduler;

import com.gamepanel.scheduler.model.RunTrigger;
import com.gamepanel.scheduler.model.Schedule;
import lombok.Getter;

import java.time.Instant;

/**
 * Run-state entry for one in-flight chain. Owned by the registry, written only by the executor running
 * the chain, read by observers.
 */
@Getter
public class RunState {

    private final String scheduleId;
    private final RunTrigger trigger;
    private final Instant acquiredAt;

    private volatile String serverId;
    private volatile String scheduleName;
    private volatile Integer executingTaskIndex;

    RunState(String scheduleId, RunTrigger trigger, Instant acquiredAt) {
        this.scheduleId = scheduleId;
        this.trigger = trigger;
        this.acquiredAt = acquiredAt;
    }

    void bind(Schedule schedule) {
        this.serverId = schedule.getServerId();
        this.scheduleName = schedule.getName();
    }

    void setExecutingTaskIndex(Integer executingTaskIndex) {
        this.executingTaskIndex = executingTaskIndex;
    }
}
