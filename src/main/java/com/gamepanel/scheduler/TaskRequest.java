package com.gamepanel.scheduler;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {
    private String id;
    private String action;
    private String payload;
    private Integer sequence;
    private String triggerMode;
    private Integer timeOffset;
}
