package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Data;

/**
 * Push delivery target linked to a subscriber (a registered device).
 */
@Data
@Builder
public class NotificationTarget {
    private String targetId;
    private String deviceToken;
    private boolean active;
}
