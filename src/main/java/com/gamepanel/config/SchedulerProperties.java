package com.gamepanel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Scheduler settings, read from {@code panel.scheduler.*}.
 *
 * <pre>
 * panel:
 *   scheduler:
 *     enabled: true
 *     tick-interval: PT1M
 *     zone: Europe/Berlin
 *     misfire-threshold: PT5M
 *     run-pool-size: 8
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "panel.scheduler")
public class SchedulerProperties {

    /**
     * Start the tick driver when the application starts.
     */
    private boolean enabled = true;

    /**
     * How often due schedules are looked for. Should not exceed one minute, the cron granularity.
     */
    private Duration tickInterval = Duration.ofMinutes(1);

    /**
     * Zone the cron fields are interpreted in.
     */
    private ZoneId zone = ZoneOffset.UTC;

    /**
     * A stored next-run time older than this is treated as missed while the panel was down: it is recomputed
     * without firing.
     */
    private Duration misfireThreshold = Duration.ofMinutes(5);

    /**
     * Run worker threads kept alive while idle. More are created on demand, one per in-flight chain.
     */
    private int runPoolSize = 8;
}
