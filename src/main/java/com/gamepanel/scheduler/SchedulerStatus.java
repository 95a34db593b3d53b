package com.gamepanel.scheduler;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SchedulerStatus {
    private long totalSchedules;
    private long activeSchedules;
    private int runningSchedules;
}
