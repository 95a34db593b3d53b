package com.gamepanel.scheduler.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a schedule definition as read from the store.
 *
 * <p>The engine never mutates a definition; a run works on the snapshot it loaded, so edits made while a
 * chain is executing only apply to the next run.</p>
 */
@Value
@Builder(toBuilder = true)
public class Schedule {
    String id;
    String serverId;
    String name;
    String cronExpression;
    boolean active;
    @Singular
    List<ScheduleTask> tasks;
    Instant lastRunAt;
    Instant nextRunAt;
    String lastRunStatus;

    public int getTaskCount() {
        return tasks.size();
    }
}
