package com.gamepanel.scheduler;

public class ScheduleAlreadyRunningException extends RuntimeException {

    private final String scheduleId;

    public ScheduleAlreadyRunningException(String scheduleId) {
        super("Schedule is already running: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String getScheduleId() {
        return scheduleId;
    }
}
