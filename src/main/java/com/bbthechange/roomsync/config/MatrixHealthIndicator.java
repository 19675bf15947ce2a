package com.bbthechange.roomsync.config;

import com.bbthechange.roomsync.client.ChatNetworkClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the Matrix homeserver rooms are administered on.
 */
@Component
public class MatrixHealthIndicator implements HealthIndicator {

    private final ChatNetworkClient chatClient;
    private final MatrixProperties properties;

    public MatrixHealthIndicator(ChatNetworkClient chatClient, MatrixProperties properties) {
        this.chatClient = chatClient;
        this.properties = properties;
    }

    @Override
    public Health health() {
        try {
            chatClient.ping();
            return Health.up()
                .withDetail("homeserver", properties.getHomeserverUrl())
                .withDetail("serverName", properties.getServerName())
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "Homeserver unreachable")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
