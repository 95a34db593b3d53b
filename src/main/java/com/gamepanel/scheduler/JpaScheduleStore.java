package com.gamepanel.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gamepanel.entity.ScheduleEntity;
import com.gamepanel.entity.ScheduleRunLogEntity;
import com.gamepanel.entity.ScheduleTaskEntity;
import com.gamepanel.repository.ScheduleRepository;
import com.gamepanel.repository.ScheduleRunLogRepository;
import com.gamepanel.repository.ScheduleTaskRepository;
import com.gamepanel.scheduler.model.Schedule;
import com.gamepanel.scheduler.model.ScheduleSummary;
import com.gamepanel.scheduler.model.ScheduleTask;
import com.gamepanel.scheduler.model.TaskAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
public class JpaScheduleStore implements ScheduleStore {

    private final ScheduleRepository scheduleRepository;
    private final ScheduleTaskRepository scheduleTaskRepository;
    private final ScheduleRunLogRepository scheduleRunLogRepository;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public JpaScheduleStore(ScheduleRepository scheduleRepository,
                            ScheduleTaskRepository scheduleTaskRepository,
                            ScheduleRunLogRepository scheduleRunLogRepository) {
        this.scheduleRepository = scheduleRepository;
        this.scheduleTaskRepository = scheduleTaskRepository;
        this.scheduleRunLogRepository = scheduleRunLogRepository;
    }

    @Override
    public List<ScheduleSummary> listActiveSchedules() {
        return scheduleRepository.findByActive(true).stream()
                .map(entity -> new ScheduleSummary(entity.getId(), entity.getCronExpression(), entity.getNextRunAt()))
                .toList();
    }

    @Override
    public Optional<Schedule> loadSchedule(String scheduleId) {
        return scheduleRepository.findById(scheduleId).map(this::toSchedule);
    }

    @Override
    @Transactional
    public void recordRunStart(String scheduleId, Instant startedAt) {
        scheduleRepository.updateLastRunAt(scheduleId, startedAt);
    }

    @Override
    @Transactional
    public void recordNextRunAt(String scheduleId, Instant nextRunAt) {
        scheduleRepository.updateNextRunAt(scheduleId, nextRunAt);
    }

    @Override
    @Transactional
    public void recordRunFinished(ChainRunReport report) {
        ScheduleRunLogEntity log = new ScheduleRunLogEntity();
        log.setId(UUID.randomUUID().toString());
        log.setScheduleId(report.getScheduleId());
        log.setServerId(report.getServerId());
        log.setTrigger(report.getTrigger().name());
        log.setStartTime(report.getStartedAt());
        log.setEndTime(report.getFinishedAt());
        log.setStatus(report.getStatus().name());
        log.setFailedTasks((int) report.getFailedCount());
        log.setDurationMs(report.getDurationMs());
        log.setTaskResults(serializeOutcomes(report.getOutcomes()));

        scheduleRunLogRepository.save(log);
        scheduleRepository.updateLastRunStatus(report.getScheduleId(), report.getStatus().name());
    }

    @Override
    @Transactional
    public Schedule saveSchedule(Schedule schedule) {
        Optional<ScheduleEntity> stored = scheduleRepository.findById(schedule.getId());
        ScheduleEntity entity = stored.orElseGet(ScheduleEntity::new);
        entity.setId(schedule.getId());
        entity.setServerId(schedule.getServerId());
        entity.setName(schedule.getName());
        entity.setCronExpression(schedule.getCronExpression());
        entity.setActive(schedule.isActive());
        if (stored.isEmpty()) {
            entity.setLastRunAt(schedule.getLastRunAt());
            entity.setNextRunAt(schedule.getNextRunAt());
            entity.setLastRunStatus(schedule.getLastRunStatus());
        }
        // run timestamps and status of an existing row belong to the tick and the runs
        scheduleRepository.save(entity);

        // tasks are replaced wholesale; the bulk delete flushes the schedule row first
        scheduleTaskRepository.deleteAllByScheduleId(schedule.getId());
        scheduleTaskRepository.saveAll(schedule.getTasks().stream()
                .map(task -> toTaskEntity(schedule.getId(), task))
                .toList());

        return loadSchedule(schedule.getId())
                .orElseThrow(() -> new IllegalStateException("Schedule vanished after save: " + schedule.getId()));
    }

    @Override
    @Transactional
    public void deleteSchedule(String scheduleId) {
        scheduleTaskRepository.deleteAllByScheduleId(scheduleId);
        scheduleRunLogRepository.deleteAllByScheduleId(scheduleId);
        scheduleRepository.deleteById(scheduleId);
    }

    @Override
    public List<Schedule> listSchedules(String serverId) {
        List<ScheduleEntity> entities = serverId == null
                ? scheduleRepository.findAllByOrderByNameAsc()
                : scheduleRepository.findByServerIdOrderByNameAsc(serverId);
        return entities.stream().map(this::toSchedule).toList();
    }

    @Override
    public List<ScheduleRunLogEntity> getRunHistory(String scheduleId, int limit) {
        return scheduleRunLogRepository.findByScheduleIdOrderByStartTimeDesc(scheduleId, PageRequest.of(0, limit));
    }

    @Override
    public long countSchedules() {
        return scheduleRepository.count();
    }

    @Override
    public long countActiveSchedules() {
        return scheduleRepository.countByActive(true);
    }

    private Schedule toSchedule(ScheduleEntity entity) {
        List<ScheduleTask> tasks = scheduleTaskRepository.findByScheduleIdOrderBySequenceAsc(entity.getId()).stream()
                .map(JpaScheduleStore::toTask)
                .toList();
        return Schedule.builder()
                .id(entity.getId())
                .serverId(entity.getServerId())
                .name(entity.getName())
                .cronExpression(entity.getCronExpression())
                .active(Boolean.TRUE.equals(entity.getActive()))
                .tasks(tasks)
                .lastRunAt(entity.getLastRunAt())
                .nextRunAt(entity.getNextRunAt())
                .lastRunStatus(entity.getLastRunStatus())
                .build();
    }

    private static ScheduleTask toTask(ScheduleTaskEntity entity) {
        return ScheduleTask.builder()
                .id(entity.getId())
                .scheduleId(entity.getScheduleId())
                .action(TaskAction.fromCode(entity.getAction()))
                .payload(entity.getPayload())
                .sequence(entity.getSequence())
                .triggerMode(entity.getTriggerMode())
                .timeOffset(entity.getTimeOffset() != null ? entity.getTimeOffset() : 0)
                .build();
    }

    private static ScheduleTaskEntity toTaskEntity(String scheduleId, ScheduleTask task) {
        ScheduleTaskEntity entity = new ScheduleTaskEntity();
        entity.setId(task.getId());
        entity.setScheduleId(scheduleId);
        entity.setAction(task.getAction().getCode());
        entity.setPayload(task.getPayload());
        entity.setSequence(task.getSequence());
        entity.setTriggerMode(task.getTriggerMode());
        entity.setTimeOffset(task.getTimeOffset());
        return entity;
    }

    private String serializeOutcomes(List<TaskOutcome> outcomes) {
        try {
            return objectMapper.writeValueAsString(outcomes);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize task outcomes: {}", e.getMessage());
            return "[]";
        }
    }
}
