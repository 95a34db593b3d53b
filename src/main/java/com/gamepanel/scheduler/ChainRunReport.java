package com.gamepanel.scheduler;

import com.gamepanel.scheduler.model.RunTrigger;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ChainRunReport {
    String scheduleId;
    String serverId;
    RunTrigger trigger;
    Instant startedAt;
    Instant finishedAt;
    List<TaskOutcome> outcomes;
    boolean aborted;

    public long getFailedCount() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
    }

    public RunStatus getStatus() {
        if (aborted) {
            return RunStatus.ABORTED;
        }
        return getFailedCount() == 0 ? RunStatus.SUCCESS : RunStatus.FAILED;
    }

    public long getDurationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
