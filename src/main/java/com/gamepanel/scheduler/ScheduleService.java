package com.gamepanel.scheduler;

import com.gamepanel.config.SchedulerProperties;
import com.gamepanel.entity.ScheduleRunLogEntity;
import com.gamepanel.scheduler.cron.CronEvaluator;
import com.gamepanel.scheduler.model.Schedule;
import com.gamepanel.scheduler.model.ScheduleTask;
import com.gamepanel.scheduler.model.TaskAction;
import com.gamepanel.scheduler.model.TriggerMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Validated write path for schedule definitions plus the read models built on top of the run state.
 */
@Service
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleStore scheduleStore;
    private final RunStateRegistry runStateRegistry;
    private final SchedulerProperties properties;
    private final Clock clock;

    public ScheduleService(ScheduleStore scheduleStore,
                           RunStateRegistry runStateRegistry,
                           SchedulerProperties properties,
                           Clock clock) {
        this.scheduleStore = scheduleStore;
        this.runStateRegistry = runStateRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    public Schedule createSchedule(CreateScheduleRequest request) {
        logger.info("Creating schedule: {} for server {}", request.getName(), request.getServerId());

        if (request.getServerId() == null || request.getServerId().isBlank()) {
            throw new IllegalArgumentException("serverId is required");
        }
        if (request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }

        String scheduleId = UUID.randomUUID().toString();
        List<ScheduleTask> tasks = toTasks(scheduleId, request.getTasks());
        ScheduleValidator.validate(request.getCronExpression(), tasks);

        Schedule schedule = Schedule.builder()
                .id(scheduleId)
                .serverId(request.getServerId())
                .name(request.getName().trim())
                .cronExpression(request.getCronExpression().trim())
                .active(request.isActive())
                .tasks(tasks)
                .nextRunAt(request.isActive() ? nextFireTime(request.getCronExpression()) : null)
                .build();

        schedule = scheduleStore.saveSchedule(schedule);
        logger.info("Schedule created: {} ({}), next run at {}",
                schedule.getName(), schedule.getId(), schedule.getNextRunAt());
        return schedule;
    }

    public Schedule updateSchedule(String scheduleId, UpdateScheduleRequest request) {
        logger.info("Updating schedule: {}", scheduleId);

        Schedule existing = getScheduleOrThrow(scheduleId);
        Schedule.ScheduleBuilder builder = existing.toBuilder();
        boolean needsReschedule = false;

        String cronExpression = existing.getCronExpression();
        if (request.getCronExpression() != null) {
            cronExpression = request.getCronExpression().trim();
            builder.cronExpression(cronExpression);
            needsReschedule = !cronExpression.equals(existing.getCronExpression());
        }
        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            builder.name(request.getName().trim());
        }
        boolean active = existing.isActive();
        if (request.getActive() != null) {
            active = request.getActive();
            builder.active(active);
            needsReschedule |= active != existing.isActive();
        }
        List<ScheduleTask> tasks = existing.getTasks();
        if (request.getTasks() != null) {
            tasks = toTasks(scheduleId, request.getTasks());
            builder.clearTasks().tasks(tasks);
        }

        ScheduleValidator.validate(cronExpression, tasks);

        Schedule updated = scheduleStore.saveSchedule(builder.build());
        if (needsReschedule) {
            Instant nextRunAt = active ? nextFireTime(cronExpression) : null;
            scheduleStore.recordNextRunAt(scheduleId, nextRunAt);
            updated = updated.toBuilder().nextRunAt(nextRunAt).build();
        }
        if (runStateRegistry.isRunning(scheduleId)) {
            logger.info("Schedule {} is running; changes apply from its next run", scheduleId);
        }
        logger.info("Schedule updated: {} ({})", updated.getName(), updated.getId());
        return updated;
    }

    public void deleteSchedule(String scheduleId) {
        logger.info("Deleting schedule: {}", scheduleId);

        Schedule schedule = getScheduleOrThrow(scheduleId);
        scheduleStore.deleteSchedule(scheduleId);
        runStateRegistry.forget(scheduleId);

        logger.info("Schedule deleted: {} ({})", schedule.getName(), schedule.getId());
    }

    public Optional<Schedule> getSchedule(String scheduleId) {
        return scheduleStore.loadSchedule(scheduleId);
    }

    public List<Schedule> listSchedules(String serverId) {
        return scheduleStore.listSchedules(serverId);
    }

    public List<ScheduleRunLogEntity> getRunHistory(String scheduleId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return scheduleStore.getRunHistory(scheduleId, limit);
    }

    public ScheduleStatus getStatus(String scheduleId) {
        return toStatus(getScheduleOrThrow(scheduleId));
    }

    public List<ScheduleStatus> getStatuses(String serverId) {
        return scheduleStore.listSchedules(serverId).stream()
                .map(this::toStatus)
                .toList();
    }

    public SchedulerStatus getSchedulerStatus() {
        return new SchedulerStatus(
                scheduleStore.countSchedules(),
                scheduleStore.countActiveSchedules(),
                runStateRegistry.runningCount());
    }

    private ScheduleStatus toStatus(Schedule schedule) {
        String lastResult = runStateRegistry.lastResult(schedule.getId())
                .map(ScheduleService::resultLabel)
                .orElseGet(() -> schedule.getLastRunStatus() != null
                        ? resultLabel(RunStatus.valueOf(schedule.getLastRunStatus()))
                        : null);
        return ScheduleStatus.builder()
                .id(schedule.getId())
                .serverId(schedule.getServerId())
                .name(schedule.getName())
                .enabled(schedule.isActive())
                .executing(runStateRegistry.isRunning(schedule.getId()))
                .executingTaskIndex(runStateRegistry.executingTaskIndex(schedule.getId()))
                .lastRunAt(schedule.getLastRunAt())
                .nextRunAt(schedule.getNextRunAt())
                .lastResult(lastResult)
                .build();
    }

    private static String resultLabel(RunStatus status) {
        return status == RunStatus.SUCCESS ? "success" : "failed";
    }

    private Schedule getScheduleOrThrow(String scheduleId) {
        return scheduleStore.loadSchedule(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    private Instant nextFireTime(String cronExpression) {
        return CronEvaluator.nextFireTime(cronExpression, clock.instant(), properties.getZone());
    }

    private List<ScheduleTask> toTasks(String scheduleId, List<TaskRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<ScheduleTask> tasks = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            TaskRequest request = requests.get(i);
            TaskAction action = TaskAction.fromCode(request.getAction());
            TriggerMode triggerMode = parseTriggerMode(request.getTriggerMode());
            int timeOffset = request.getTimeOffset() != null ? request.getTimeOffset() : 0;
            String payload = request.getPayload() != null && !request.getPayload().isBlank()
                    ? request.getPayload()
                    : null;

            tasks.add(ScheduleTask.builder()
                    .id(request.getId() != null && !request.getId().isBlank()
                            ? request.getId()
                            : UUID.randomUUID().toString())
                    .scheduleId(scheduleId)
                    .action(action)
                    .payload(payload)
                    .sequence(request.getSequence() != null ? request.getSequence() : i)
                    .triggerMode(triggerMode)
                    // the offset only means something for TIME_DELAY
                    .timeOffset(triggerMode == TriggerMode.ON_COMPLETION ? 0 : timeOffset)
                    .build());
        }
        tasks.sort(Comparator.comparingInt(ScheduleTask::getSequence));
        return tasks;
    }

    private static TriggerMode parseTriggerMode(String value) {
        if (value == null || value.isBlank()) {
            return TriggerMode.TIME_DELAY;
        }
        try {
            return TriggerMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown trigger mode: " + value, e);
        }
    }
}
