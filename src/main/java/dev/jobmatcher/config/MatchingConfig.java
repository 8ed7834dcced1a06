package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the matching pass, its scheduler and the keyword relevance weights.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private Scheduler scheduler = new Scheduler();
    private Scan scan = new Scan();
    private Scoring scoring = new Scoring();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private boolean runOnStartup = true;
        // Aligned with the ingester's refresh cadence
        private Duration interval = Duration.ofMinutes(240);
        private Duration retryDelay = Duration.ofSeconds(60);
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class Scan {
        private int workerThreads = 4;
        private int progressLogInterval = 1000;
    }

    @Data
    public static class Scoring {
        private double threshold = 0.10;
        private double titleWeight = 0.3;
        private double companyWeight = 0.1;
        private double recencyWeight = 0.1;
        private int recencyWindowHours = 24;
    }
}
