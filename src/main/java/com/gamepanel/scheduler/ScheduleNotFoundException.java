package com.gamepanel.scheduler;

public class ScheduleNotFoundException extends IllegalArgumentException {

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
    }
}
