package com.gamepanel.controller;

import com.gamepanel.entity.ScheduleRunLogEntity;
import com.gamepanel.scheduler.CreateScheduleRequest;
import com.gamepanel.scheduler.InvalidScheduleException;
import com.gamepanel.scheduler.RunState;
import com.gamepanel.scheduler.ScheduleAlreadyRunningException;
import com.gamepanel.scheduler.ScheduleNotFoundException;
import com.gamepanel.scheduler.ScheduleService;
import com.gamepanel.scheduler.ScheduleStatus;
import com.gamepanel.scheduler.SchedulerLoop;
import com.gamepanel.scheduler.SchedulerStatus;
import com.gamepanel.scheduler.UpdateScheduleRequest;
import com.gamepanel.scheduler.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final SchedulerLoop schedulerLoop;

    public ScheduleController(ScheduleService scheduleService, SchedulerLoop schedulerLoop) {
        this.scheduleService = scheduleService;
        this.schedulerLoop = schedulerLoop;
    }

    @PostMapping("/schedules")
    public ResponseEntity<Map<String, Object>> createSchedule(@RequestBody CreateScheduleRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Schedule schedule = scheduleService.createSchedule(request);
            response.put("success", true);
            response.put("schedule", schedule);
            response.put("message", "Schedule created successfully");
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Failed to create schedule: {}", e.getMessage());
            return badRequest(response, e);
        } catch (Exception e) {
            logger.error("Error creating schedule", e);
            return internalError(response, e);
        }
    }

    @GetMapping("/schedules")
    public ResponseEntity<Map<String, Object>> listSchedules(@RequestParam(required = false) String serverId) {
        Map<String, Object> response = new HashMap<>();
        try {
            List<Schedule> schedules = scheduleService.listSchedules(serverId);
            response.put("success", true);
            response.put("schedules", schedules);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error listing schedules", e);
            return internalError(response, e);
        }
    }

    @GetMapping("/schedules/{id}")
    public ResponseEntity<Map<String, Object>> getSchedule(@PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        try {
            return scheduleService.getSchedule(id)
                    .map(schedule -> {
                        response.put("success", true);
                        response.put("schedule", schedule);
                        return ResponseEntity.ok(response);
                    })
                    .orElseGet(() -> notFound(response, "Schedule not found: " + id));
        } catch (Exception e) {
            logger.error("Error getting schedule: {}", id, e);
            return internalError(response, e);
        }
    }

    @PutMapping("/schedules/{id}")
    public ResponseEntity<Map<String, Object>> updateSchedule(@PathVariable String id,
                                                              @RequestBody UpdateScheduleRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Schedule schedule = scheduleService.updateSchedule(id, request);
            response.put("success", true);
            response.put("schedule", schedule);
            response.put("message", "Schedule updated successfully");
            return ResponseEntity.ok(response);
        } catch (ScheduleNotFoundException e) {
            return notFound(response, e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.warn("Failed to update schedule {}: {}", id, e.getMessage());
            return badRequest(response, e);
        } catch (Exception e) {
            logger.error("Error updating schedule: {}", id, e);
            return internalError(response, e);
        }
    }

    @DeleteMapping("/schedules/{id}")
    public ResponseEntity<Map<String, Object>> deleteSchedule(@PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        try {
            scheduleService.deleteSchedule(id);
            response.put("success", true);
            response.put("message", "Schedule deleted successfully");
            return ResponseEntity.ok(response);
        } catch (ScheduleNotFoundException e) {
            return notFound(response, e.getMessage());
        } catch (Exception e) {
            logger.error("Error deleting schedule: {}", id, e);
            return internalError(response, e);
        }
    }

    @PostMapping("/schedules/{id}/run")
    public ResponseEntity<Map<String, Object>> runSchedule(@PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        try {
            RunState run = schedulerLoop.runNow(id);
            response.put("success", true);
            response.put("started", true);
            response.put("scheduleId", id);
            response.put("startedAt", run.getAcquiredAt());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        } catch (ScheduleNotFoundException e) {
            return notFound(response, e.getMessage());
        } catch (ScheduleAlreadyRunningException e) {
            response.put("success", false);
            response.put("started", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        } catch (Exception e) {
            logger.error("Error running schedule: {}", id, e);
            return internalError(response, e);
        }
    }

    @GetMapping("/schedules/{id}/status")
    public ResponseEntity<Map<String, Object>> getScheduleStatus(@PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        try {
            ScheduleStatus status = scheduleService.getStatus(id);
            response.put("success", true);
            response.put("status", status);
            return ResponseEntity.ok(response);
        } catch (ScheduleNotFoundException e) {
            return notFound(response, e.getMessage());
        } catch (Exception e) {
            logger.error("Error getting schedule status: {}", id, e);
            return internalError(response, e);
        }
    }

    @GetMapping("/schedules/{id}/history")
    public ResponseEntity<Map<String, Object>> getRunHistory(@PathVariable String id,
                                                             @RequestParam(defaultValue = "50") int limit) {
        Map<String, Object> response = new HashMap<>();
        try {
            List<ScheduleRunLogEntity> history = scheduleService.getRunHistory(id, limit);
            response.put("success", true);
            response.put("history", history);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return badRequest(response, e);
        } catch (Exception e) {
            logger.error("Error getting run history: {}", id, e);
            return internalError(response, e);
        }
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<Map<String, Object>> getSchedulerStatus() {
        Map<String, Object> response = new HashMap<>();
        try {
            SchedulerStatus status = scheduleService.getSchedulerStatus();
            response.put("success", true);
            response.put("status", status);
            response.put("ticking", schedulerLoop.isTicking());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error getting scheduler status", e);
            return internalError(response, e);
        }
    }

    private static ResponseEntity<Map<String, Object>> badRequest(Map<String, Object> response,
                                                                  IllegalArgumentException e) {
        response.put("success", false);
        response.put("error", e.getMessage());
        if (e instanceof InvalidScheduleException invalid) {
            response.put("violations", invalid.getViolations());
        }
        return ResponseEntity.badRequest().body(response);
    }

    private static ResponseEntity<Map<String, Object>> notFound(Map<String, Object> response, String message) {
        response.put("success", false);
        response.put("error", message);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    private static ResponseEntity<Map<String, Object>> internalError(Map<String, Object> response, Exception e) {
        response.put("success", false);
        response.put("error", "Internal server error: " + e.getMessage());
        return ResponseEntity.internalServerError().body(response);
    }
}
