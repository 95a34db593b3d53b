package com.gamepanel.scheduler;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CreateScheduleRequest {
    private String serverId;
    private String name;
    private String cronExpression;
    private boolean active = true;
    private List<TaskRequest> tasks = new ArrayList<>();
}
