package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A subscriber's standing keyword interest together with its delivery target.
 */
@Data
@Builder
public class Subscription {
    private String subscriptionId;
    private String subscriberId;
    private List<String> keywords;
    private Set<String> sourceFilter;
    private LocationFilter locationFilter;
    private boolean active;
    private NotificationTarget target;

    public boolean hasSourceFilter() {
        return sourceFilter != null && !sourceFilter.isEmpty();
    }

    public boolean acceptsSource(String source) {
        return !hasSourceFilter() || (source != null && sourceFilter.contains(source));
    }

    /**
     * Trims, drops blanks and removes case-insensitive duplicates, keeping the first spelling.
     */
    public static List<String> normalizeKeywords(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String keyword : raw) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String trimmed = keyword.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
