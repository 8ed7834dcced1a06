package dev.jobmatcher.model;

import java.time.Instant;
import java.util.List;

/**
 * A persisted match as shown in a subscriber's inbox.
 */
public record MatchView(
        String matchId,
        String jobId,
        List<String> matchedKeywords,
        double relevanceScore,
        int relevancePercent,
        boolean read,
        Instant matchedAt) {
}
