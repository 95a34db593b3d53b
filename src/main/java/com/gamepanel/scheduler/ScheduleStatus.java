package com.gamepanel.scheduler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a schedule for clients resyncing after (re)connecting.
 */
@Value
@Builder
public class ScheduleStatus {
    String id;
    String serverId;
    String name;
    boolean enabled;
    boolean executing;
    Integer executingTaskIndex;
    Instant lastRunAt;
    Instant nextRunAt;
    /** {@code success} or {@code failed}; null until the first run finishes. */
    String lastResult;
}
