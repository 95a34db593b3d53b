package com.gamepanel.scheduler;

import com.gamepanel.scheduler.model.RunTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arena of in-flight runs keyed by schedule id.
 *
 * <p>{@link #tryAcquire} is the single atomic check-and-set guarding against two overlapping runs of the same
 * schedule, whichever way they were triggered. The state is in-memory only: a restart starts from an empty
 * registry.</p>
 */
@Slf4j
@Component
public class RunStateRegistry {

    private final Map<String, RunState> runs = new ConcurrentHashMap<>();
    private final Map<String, RunStatus> lastResults = new ConcurrentHashMap<>();

    public Optional<RunState> tryAcquire(String scheduleId, RunTrigger trigger, Instant now) {
        RunState candidate = new RunState(scheduleId, trigger, now);
        RunState existing = runs.putIfAbsent(scheduleId, candidate);
        if (existing != null) {
            log.debug("Schedule {} already running (trigger={}, since {})",
                    scheduleId, existing.getTrigger(), existing.getAcquiredAt());
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Ends a run. {@code result} is null when the run never produced a report.
     */
    public void complete(RunState state, RunStatus result) {
        if (result != null) {
            lastResults.put(state.getScheduleId(), result);
        }
        runs.remove(state.getScheduleId(), state);
    }

    public void release(RunState state) {
        complete(state, null);
    }

    public boolean isRunning(String scheduleId) {
        return runs.containsKey(scheduleId);
    }

    public Optional<RunState> find(String scheduleId) {
        return Optional.ofNullable(runs.get(scheduleId));
    }

    public Integer executingTaskIndex(String scheduleId) {
        RunState state = runs.get(scheduleId);
        return state != null ? state.getExecutingTaskIndex() : null;
    }

    public Optional<RunStatus> lastResult(String scheduleId) {
        return Optional.ofNullable(lastResults.get(scheduleId));
    }

    public void forget(String scheduleId) {
        lastResults.remove(scheduleId);
    }

    public int runningCount() {
        return runs.size();
    }
}
