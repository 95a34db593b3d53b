package com.gamepanel.scheduler;

/**
 * Push-only sink for live run progress.
 *
 * <p>{@code taskIndex} is the index of the task that just started, or {@code null} once the run has ended.
 * Subscribers reconcile by schedule id.</p>
 */
@FunctionalInterface
public interface ProgressChannel {

    void publish(String scheduleId, Integer taskIndex);
}
