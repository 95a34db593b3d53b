package com.gamepanel.scheduler.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ScheduleTask {
    String id;
    String scheduleId;
    TaskAction action;
    String payload;
    int sequence;
    TriggerMode triggerMode;
    int timeOffset;
}
