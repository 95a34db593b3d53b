package com.gamepanel.scheduler.model;

/**
 * When a task starts relative to its predecessor.
 */
public enum TriggerMode {

    /** Wait {@code timeOffset} seconds, then dispatch. */
    TIME_DELAY,

    /** Dispatch as soon as the previous task's dispatch call has returned. */
    ON_COMPLETION
}
