package dev.jobmatcher.config;

import dev.jobmatcher.scheduler.MatchScheduler;
import dev.jobmatcher.service.MatchingEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Starts the periodic matching loop unless 'matching.scheduler.enabled' is false.
 */
@Configuration
public class SchedulerConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "matching.scheduler.enabled", havingValue = "true", matchIfMissing = true)
    public MatchScheduler matchScheduler(MatchingEngine matchingEngine, MatchingConfig matchingConfig) {
        MatchingConfig.Scheduler scheduler = matchingConfig.getScheduler();
        return new MatchScheduler(
                matchingEngine,
                scheduler.getInterval(),
                scheduler.getRetryDelay(),
                scheduler.getShutdownGrace(),
                scheduler.isRunOnStartup());
    }
}
