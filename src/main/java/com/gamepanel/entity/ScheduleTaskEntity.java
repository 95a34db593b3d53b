package com.gamepanel.entity;

import com.gamepanel.scheduler.model.TriggerMode;
import jakarta.persistence.*;
import lombok.Data;

@Data
@Entity
@Table(name = "schedule_tasks", indexes = {
        @Index(name = "idx_schedule_tasks_schedule", columnList = "schedule_id")
})
public class ScheduleTaskEntity {

    @Id
    private String id;

    @Column(name = "schedule_id", nullable = false)
    private String scheduleId;

    /** Wire code of {@link com.gamepanel.scheduler.model.TaskAction}. */
    @Column(nullable = false)
    private String action;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private Integer sequence = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_mode", nullable = false)
    private TriggerMode triggerMode = TriggerMode.TIME_DELAY;

    @Column(name = "time_offset", nullable = false)
    private Integer timeOffset = 0;
}
