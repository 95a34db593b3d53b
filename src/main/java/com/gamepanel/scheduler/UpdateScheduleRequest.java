package com.gamepanel.scheduler;

import lombok.Data;

import java.util.List;

@Data
public class UpdateScheduleRequest {
    private String name;
    private String cronExpression;
    private Boolean active;
    private List<TaskRequest> tasks;
}
