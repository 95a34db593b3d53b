package com.gamepanel.scheduler;

import java.util.List;

/**
 * A schedule definition that breaks the task-chain rules. Carries every violation found, not just the first.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    private final List<String> violations;

    public InvalidScheduleException(List<String> violations) {
        super("Invalid schedule: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
