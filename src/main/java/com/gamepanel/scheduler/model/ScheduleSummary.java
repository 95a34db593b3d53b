package com.gamepanel.scheduler.model;

import java.time.Instant;

/**
 * Lightweight projection the tick driver works from.
 */
public record ScheduleSummary(String id, String cronExpression, Instant nextRunAt) {
}
