package com.gamepanel.scheduler;

import com.gamepanel.scheduler.dispatch.DispatchResult;
import com.gamepanel.scheduler.model.TaskAction;

import java.time.Instant;

/**
 * Result of dispatching one task within a run.
 */
public record TaskOutcome(int index,
                          String taskId,
                          TaskAction action,
                          DispatchResult.Status status,
                          String output,
                          String error,
                          Instant startedAt,
                          Instant finishedAt) {

    public boolean isSuccess() {
        return status == DispatchResult.Status.SUCCESS;
    }
}
