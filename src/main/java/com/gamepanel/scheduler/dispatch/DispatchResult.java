package com.gamepanel.scheduler.dispatch;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DispatchResult {

    public enum Status {
        SUCCESS,
        FAILED,
        TIMED_OUT
    }

    private Status status;
    private String output;
    private String error;
    private long durationMs;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public static DispatchResult success(String output, long durationMs) {
        return new DispatchResult(Status.SUCCESS, output, null, durationMs);
    }

    public static DispatchResult failure(String error, long durationMs) {
        return new DispatchResult(Status.FAILED, null, error, durationMs);
    }

    public static DispatchResult timedOut(String error, long durationMs) {
        return new DispatchResult(Status.TIMED_OUT, null, error, durationMs);
    }
}
