package com.gamepanel.scheduler;

public enum RunStatus {
    /** Every task dispatched successfully. */
    SUCCESS,
    /** The chain ran to the end but at least one task failed or timed out. */
    FAILED,
    /** The chain was interrupted before its last task. */
    ABORTED
}
