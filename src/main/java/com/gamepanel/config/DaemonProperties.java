package com.gamepanel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the game server daemon, read from {@code panel.daemon.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "panel.daemon")
public class DaemonProperties {

    private String baseUrl = "http://localhost:8443";

    /**
     * Bearer token sent with every request. Empty disables the header.
     */
    private String token = "";

    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Upper bound for a single dispatch call.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);
}
