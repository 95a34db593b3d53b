package com.gamepanel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "schedule_run_logs", indexes = {
        @Index(name = "idx_schedule_run_logs_schedule", columnList = "schedule_id")
})
public class ScheduleRunLogEntity {

    @Id
    private String id;

    @Column(name = "schedule_id", nullable = false)
    private String scheduleId;

    @Column(name = "server_id")
    private String serverId;

    @Column(name = "run_trigger", nullable = false)
    private String trigger;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(nullable = false)
    private String status;

    @Column(name = "failed_tasks")
    private Integer failedTasks;

    @Column(name = "duration_ms")
    private Long durationMs;

    /** Per-task outcomes as a JSON array. */
    @Column(name = "task_results", columnDefinition = "TEXT")
    private String taskResults;
}
