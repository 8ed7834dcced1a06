package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Push delivery settings. Loaded from application.yml under 'push' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "push")
public class PushConfig {

    /**
     * "apns" for real delivery, "log" to only log payloads.
     */
    private String provider = "log";
    private String deepLinkScheme = "jobmatcher";
    /**
     * Notification records older than this are deleted after each pass. Zero or negative keeps them forever.
     */
    private Duration notificationRetention = Duration.ofDays(30);
    private Apns apns = new Apns();

    @Data
    public static class Apns {
        private String baseUrl = "https://api.push.apple.com";
        private String topic;
        private String teamId;
        private String keyId;
        // PEM contents of the AuthKey .p8 file; takes precedence over privateKeyPath
        private String privateKey;
        private String privateKeyPath;
        /**
         * Age at which the provider token is re-signed. Kept between 20 and 55 minutes.
         */
        private Duration tokenRefresh = Duration.ofMinutes(50);
        private Duration timeout = Duration.ofSeconds(10);
    }
}
