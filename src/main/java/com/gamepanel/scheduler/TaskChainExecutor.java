package com.gamepanel.scheduler;

import com.gamepanel.scheduler.dispatch.ActionDispatcher;
import com.gamepanel.scheduler.dispatch.DispatchResult;
import com.gamepanel.scheduler.model.PowerAction;
import com.gamepanel.scheduler.model.Schedule;
import com.gamepanel.scheduler.model.ScheduleTask;
import com.gamepanel.scheduler.model.TriggerMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs one schedule's task chain from the first task to the last, in sequence order.
 *
 * <p>A failed or timed-out dispatch is recorded and the chain moves on to the next task. The only way a chain
 * stops early is an interrupt of the run thread, which ends the run as {@link RunStatus#ABORTED}. Whatever the
 * outcome, the run finishes by clearing its executing index and publishing {@code null}.</p>
 */
@Component
public class TaskChainExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TaskChainExecutor.class);

    private final ActionDispatcher actionDispatcher;
    private final ProgressChannel progressChannel;
    private final Clock clock;
    private final Sleeper sleeper;

    public TaskChainExecutor(ActionDispatcher actionDispatcher,
                             ProgressChannel progressChannel,
                             Clock clock,
                             Sleeper sleeper) {
        this.actionDispatcher = actionDispatcher;
        this.progressChannel = progressChannel;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public ChainRunReport execute(Schedule schedule, RunState state) {
        state.bind(schedule);
        List<ScheduleTask> tasks = schedule.getTasks().stream()
                .sorted(Comparator.comparingInt(ScheduleTask::getSequence))
                .toList();
        List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
        Instant startedAt = clock.instant();
        boolean aborted = false;

        logger.info("Running schedule {} ({}) for server {}: {} task(s), trigger={}",
                schedule.getName(), schedule.getId(), schedule.getServerId(), tasks.size(), state.getTrigger());

        try {
            for (int index = 0; index < tasks.size(); index++) {
                ScheduleTask task = tasks.get(index);
                if (!awaitTrigger(schedule, task, index)) {
                    aborted = true;
                    break;
                }
                state.setExecutingTaskIndex(index);
                publish(schedule.getId(), index);
                outcomes.add(runTask(schedule, task, index));
            }
        } finally {
            state.setExecutingTaskIndex(null);
            publish(schedule.getId(), null);
        }

        ChainRunReport report = ChainRunReport.builder()
                .scheduleId(schedule.getId())
                .serverId(schedule.getServerId())
                .trigger(state.getTrigger())
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .outcomes(List.copyOf(outcomes))
                .aborted(aborted)
                .build();

        logger.info("Schedule {} ({}) finished: {} ({} of {} task(s) failed, {}ms)",
                schedule.getName(), schedule.getId(), report.getStatus(),
                report.getFailedCount(), tasks.size(), report.getDurationMs());
        return report;
    }

    /**
     * Blocks until the task may start. Returns false when the run thread was interrupted.
     */
    private boolean awaitTrigger(Schedule schedule, ScheduleTask task, int index) {
        if (Thread.currentThread().isInterrupted()) {
            logger.warn("Schedule {} interrupted before task {}", schedule.getId(), index);
            return false;
        }
        if (task.getTriggerMode() == TriggerMode.ON_COMPLETION) {
            return true;
        }
        Duration delay = Duration.ofSeconds(Math.max(0, task.getTimeOffset()));
        if (delay.isZero()) {
            return true;
        }
        logger.debug("Schedule {} waiting {}s before task {}", schedule.getId(), delay.toSeconds(), index);
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Schedule {} interrupted while waiting for task {}", schedule.getId(), index);
            return false;
        }
    }

    private TaskOutcome runTask(Schedule schedule, ScheduleTask task, int index) {
        Instant taskStart = clock.instant();
        DispatchResult result;
        try {
            result = dispatch(schedule.getServerId(), task);
            if (result == null) {
                result = DispatchResult.failure("Dispatcher returned no result",
                        Duration.between(taskStart, clock.instant()).toMillis());
            }
        } catch (RuntimeException e) {
            logger.error("Task {} ({}) of schedule {} threw: {}",
                    index, task.getAction().getCode(), schedule.getId(), e.getMessage(), e);
            result = DispatchResult.failure(e.getMessage(), Duration.between(taskStart, clock.instant()).toMillis());
        }

        if (result.isSuccess()) {
            logger.info("Task {} ({}) of schedule {} dispatched in {}ms",
                    index, task.getAction().getCode(), schedule.getId(), result.getDurationMs());
        } else {
            logger.warn("Task {} ({}) of schedule {} {}: {}; continuing with the next task",
                    index, task.getAction().getCode(), schedule.getId(),
                    result.getStatus() == DispatchResult.Status.TIMED_OUT ? "timed out" : "failed",
                    result.getError());
        }

        return new TaskOutcome(index, task.getId(), task.getAction(), result.getStatus(),
                result.getOutput(), result.getError(), taskStart, clock.instant());
    }

    private DispatchResult dispatch(String serverId, ScheduleTask task) {
        return switch (task.getAction()) {
            case POWER_START -> actionDispatcher.powerAction(serverId, PowerAction.START);
            case POWER_STOP -> actionDispatcher.powerAction(serverId, PowerAction.STOP);
            case POWER_RESTART -> actionDispatcher.powerAction(serverId, PowerAction.RESTART);
            case BACKUP -> actionDispatcher.createBackup(serverId);
            case COMMAND -> actionDispatcher.runCommand(serverId, task.getPayload());
        };
    }

    private void publish(String scheduleId, Integer taskIndex) {
        try {
            progressChannel.publish(scheduleId, taskIndex);
        } catch (RuntimeException e) {
            logger.warn("Failed to publish progress for schedule {} (index={}): {}",
                    scheduleId, taskIndex, e.getMessage());
        }
    }
}
