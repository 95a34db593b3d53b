package com.gamepanel.scheduler.model;

public enum RunTrigger {
    TIMER,
    MANUAL
}
