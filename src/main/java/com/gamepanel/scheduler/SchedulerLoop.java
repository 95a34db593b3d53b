package com.gamepanel.scheduler;

import com.gamepanel.config.SchedulerProperties;
import com.gamepanel.scheduler.cron.CronEvaluator;
import com.gamepanel.scheduler.model.RunTrigger;
import com.gamepanel.scheduler.model.Schedule;
import com.gamepanel.scheduler.model.ScheduleSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the recurring tick and launches chain runs.
 *
 * <p>On every tick each active schedule whose {@code nextRunAt} has passed (or was never computed) gets a fresh
 * {@code nextRunAt}, persisted straight away, and is launched when due. Runs of different schedules are
 * independent; only overlapping runs of the same schedule are refused, through {@link RunStateRegistry}.</p>
 */
@Service
public class SchedulerLoop {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

    private final TaskScheduler tickScheduler;
    private final TaskExecutor runExecutor;
    private final ScheduleStore scheduleStore;
    private final TaskChainExecutor chainExecutor;
    private final RunStateRegistry runStateRegistry;
    private final SchedulerProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> tickFuture;

    public SchedulerLoop(@Qualifier("scheduleTickScheduler") TaskScheduler tickScheduler,
                         @Qualifier("scheduleRunExecutor") TaskExecutor runExecutor,
                         ScheduleStore scheduleStore,
                         TaskChainExecutor chainExecutor,
                         RunStateRegistry runStateRegistry,
                         SchedulerProperties properties,
                         Clock clock) {
        this.tickScheduler = tickScheduler;
        this.runExecutor = runExecutor;
        this.scheduleStore = scheduleStore;
        this.chainExecutor = chainExecutor;
        this.runStateRegistry = runStateRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.isEnabled()) {
            logger.info("Scheduler tick disabled (panel.scheduler.enabled=false); manual runs only");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (tickFuture != null) {
            logger.warn("Scheduler tick already started");
            return;
        }
        tickFuture = tickScheduler.scheduleAtFixedRate(this::tick, properties.getTickInterval());
        logger.info("Scheduler tick started: interval={}, zone={}, misfireThreshold={}",
                properties.getTickInterval(), properties.getZone(), properties.getMisfireThreshold());
    }

    @PreDestroy
    public synchronized void stop() {
        if (tickFuture != null) {
            tickFuture.cancel(false);
            tickFuture = null;
            logger.info("Scheduler tick stopped; {} run(s) still in flight end when the run executor shuts down",
                    runStateRegistry.runningCount());
        }
    }

    public synchronized boolean isTicking() {
        return tickFuture != null;
    }

    /**
     * One evaluation pass over the active schedules. Never throws: a failing store skips the whole tick, a
     * failing schedule skips only itself, and both are retried on the next tick.
     */
    public void tick() {
        Instant now = clock.instant();
        List<ScheduleSummary> active;
        try {
            active = scheduleStore.listActiveSchedules();
        } catch (RuntimeException e) {
            logger.error("Could not load active schedules, skipping tick at {}", now, e);
            return;
        }

        int launched = 0;
        for (ScheduleSummary summary : active) {
            try {
                if (evaluate(summary, now)) {
                    launched++;
                }
            } catch (RuntimeException e) {
                logger.error("Failed to evaluate schedule {}, will retry next tick", summary.id(), e);
            }
        }
        if (launched > 0) {
            logger.info("Tick at {}: {} of {} active schedule(s) launched", now, launched, active.size());
        } else {
            logger.debug("Tick at {}: nothing due among {} active schedule(s)", now, active.size());
        }
    }

    /**
     * Starts a run right away, whatever the schedule's active flag or cron.
     *
     * @throws ScheduleNotFoundException if no such schedule exists
     * @throws ScheduleAlreadyRunningException if a run of this schedule is in flight
     */
    public RunState runNow(String scheduleId) {
        logger.info("Manual run requested for schedule {}", scheduleId);
        return launch(scheduleId, RunTrigger.MANUAL)
                .orElseThrow(() -> {
                    logger.warn("Manual run of schedule {} rejected: already running", scheduleId);
                    return new ScheduleAlreadyRunningException(scheduleId);
                });
    }

    private boolean evaluate(ScheduleSummary summary, Instant now) {
        Instant previousNextRunAt = summary.nextRunAt();
        if (previousNextRunAt != null && previousNextRunAt.isAfter(now)) {
            logger.debug("Schedule {} not due until {}", summary.id(), previousNextRunAt);
            return false;
        }

        Instant nextRunAt = CronEvaluator.nextFireTime(summary.cronExpression(), now, properties.getZone());
        scheduleStore.recordNextRunAt(summary.id(), nextRunAt);

        if (previousNextRunAt == null) {
            logger.debug("Schedule {} first evaluated, next run at {}", summary.id(), nextRunAt);
            return false;
        }
        Duration lateness = Duration.between(previousNextRunAt, now);
        if (lateness.compareTo(properties.getMisfireThreshold()) > 0) {
            logger.warn("Schedule {} missed its run at {} ({} late), next run at {}",
                    summary.id(), previousNextRunAt, lateness, nextRunAt);
            return false;
        }

        Optional<RunState> run = launch(summary.id(), RunTrigger.TIMER);
        if (run.isEmpty()) {
            logger.info("Schedule {} is still running, skipping the firing due at {}", summary.id(), previousNextRunAt);
            return false;
        }
        return true;
    }

    /**
     * Acquires the run slot and hands the chain to a worker. Empty when the schedule is already running.
     */
    private Optional<RunState> launch(String scheduleId, RunTrigger trigger) {
        Optional<RunState> acquired = runStateRegistry.tryAcquire(scheduleId, trigger, clock.instant());
        if (acquired.isEmpty()) {
            return Optional.empty();
        }
        RunState state = acquired.get();
        try {
            Schedule schedule = scheduleStore.loadSchedule(scheduleId)
                    .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
            runExecutor.execute(() -> executeRun(schedule, state));
        } catch (RuntimeException e) {
            runStateRegistry.release(state);
            throw e;
        }
        return acquired;
    }

    private void executeRun(Schedule schedule, RunState state) {
        RunStatus result = null;
        try {
            try {
                scheduleStore.recordRunStart(schedule.getId(), clock.instant());
            } catch (RuntimeException e) {
                logger.error("Could not record run start of schedule {}", schedule.getId(), e);
            }

            ChainRunReport report = chainExecutor.execute(schedule, state);
            result = report.getStatus();

            try {
                scheduleStore.recordRunFinished(report);
            } catch (RuntimeException e) {
                logger.error("Could not record run result of schedule {}", schedule.getId(), e);
            }
        } catch (RuntimeException e) {
            logger.error("Run of schedule {} failed unexpectedly", schedule.getId(), e);
        } finally {
            runStateRegistry.complete(state, result);
        }
    }
}
