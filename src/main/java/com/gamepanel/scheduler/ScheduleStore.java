package com.gamepanel.scheduler;

import com.gamepanel.entity.ScheduleRunLogEntity;
import com.gamepanel.scheduler.model.Schedule;
import com.gamepanel.scheduler.model.ScheduleSummary;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of schedule definitions and their run bookkeeping.
 */
public interface ScheduleStore {

    List<ScheduleSummary> listActiveSchedules();

    Optional<Schedule> loadSchedule(String scheduleId);

    void recordRunStart(String scheduleId, Instant startedAt);

    void recordNextRunAt(String scheduleId, Instant nextRunAt);

    void recordRunFinished(ChainRunReport report);

    /**
     * Inserts or updates a definition. On an existing row {@code lastRunAt}, {@code nextRunAt} and
     * {@code lastRunStatus} are left as stored; change them through the {@code record*} methods.
     */
    Schedule saveSchedule(Schedule schedule);

    void deleteSchedule(String scheduleId);

    /**
     * @param serverId owning server, or null for every schedule
     */
    List<Schedule> listSchedules(String serverId);

    List<ScheduleRunLogEntity> getRunHistory(String scheduleId, int limit);

    long countSchedules();

    long countActiveSchedules();
}
