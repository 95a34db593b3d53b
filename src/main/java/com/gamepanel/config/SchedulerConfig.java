package com.gamepanel.config;

import com.gamepanel.scheduler.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    /**
     * Single thread driving the periodic tick. Chains never run here.
     */
    @Bean
    public ThreadPoolTaskScheduler scheduleTickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("schedule-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * One thread per in-flight chain: no queue, so a run never waits behind another schedule's delays.
     * Shutdown interrupts running chains.
     */
    @Bean
    public ThreadPoolTaskExecutor scheduleRunExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRunPoolSize());
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("schedule-run-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
