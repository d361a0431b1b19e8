package com.appetite.kitchen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code kitchen.*} properties from application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "kitchen")
@Data
public class KitchenProperties {

    private Kafka kafka = new Kafka();
    private Cache cache = new Cache();
    private Stream stream = new Stream();

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private boolean liveApply = false;
        private String groupId = "kitchen-ticket-cache";
        private Topics topics = new Topics();
    }

    @Data
    public static class Topics {
        private String tickets = "kitchen.tickets";
        private String orderItems = "orders.items";
    }

    @Data
    public static class Cache {
        private boolean warmOnStartup = true;
        private int replayBatchSize = 10_000;
        private Duration replayPollTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Stream {
        private int bufferSize = 100;
        private int maxSubscribers = 64;
        private Duration emitterTimeout = Duration.ofMinutes(30);
        // Idle streams send a keep-alive this often so dead connections surface as send failures
        private Duration heartbeatInterval = Duration.ofSeconds(15);
    }
}
