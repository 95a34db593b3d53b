package com.gamepanel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Game panel scheduler service.
 *
 * <p>Fires cron-triggered schedules of server actions (power, backup, console command) against the daemon
 * and streams run progress to connected panel clients.</p>
 *
 * <ul>
 *   <li>REST: {@code /api/schedules}, {@code /api/scheduler/status}</li>
 *   <li>WebSocket: {@code /ws/schedules}</li>
 * </ul>
 */
@SpringBootApplication
public class GamePanelApplication {

    public static void main(String[] args) {
        SpringApplication.run(GamePanelApplication.class, args);
    }
}
