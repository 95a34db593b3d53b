package com.gamepanel.scheduler;

import com.gamepanel.scheduler.cron.CronEvaluator;
import com.gamepanel.scheduler.model.ScheduleTask;
import com.gamepanel.scheduler.model.TriggerMode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Write-time checks for schedule definitions. The engine assumes every stored schedule passed these.
 */
public final class ScheduleValidator {

    private ScheduleValidator() {
    }

    /**
     * @throws com.gamepanel.scheduler.cron.CronParseException if the cron expression is not supported
     * @throws InvalidScheduleException if the task chain is malformed
     */
    public static void validate(String cronExpression, List<ScheduleTask> tasks) {
        CronEvaluator.parse(cronExpression);
        validateTasks(tasks);
    }

    public static void validateTasks(List<ScheduleTask> tasks) {
        List<String> violations = new ArrayList<>();
        if (tasks == null) {
            tasks = List.of();
        }

        Set<Integer> sequences = new HashSet<>();
        for (ScheduleTask task : tasks) {
            String label = "task " + task.getSequence();
            if (!sequences.add(task.getSequence())) {
                violations.add("duplicate sequence " + task.getSequence());
            }
            if (task.getAction() == null) {
                violations.add(label + ": action is required");
            } else if (task.getAction().requiresPayload()) {
                if (task.getPayload() == null || task.getPayload().isBlank()) {
                    violations.add(label + ": command payload must not be empty");
                }
            } else if (task.getPayload() != null) {
                violations.add(label + ": payload is only allowed for command tasks");
            }
            if (task.getTriggerMode() == null) {
                violations.add(label + ": trigger mode is required");
            }
            if (task.getTimeOffset() < 0) {
                violations.add(label + ": time offset must not be negative");
            }
            if (task.getSequence() == 0 && task.getTriggerMode() == TriggerMode.ON_COMPLETION) {
                violations.add("the first task must use TIME_DELAY; there is no previous task to wait for");
            }
        }
        for (int expected = 0; expected < tasks.size(); expected++) {
            if (!sequences.contains(expected)) {
                violations.add("sequences must be contiguous from 0; missing " + expected);
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidScheduleException(violations);
        }
    }
}
