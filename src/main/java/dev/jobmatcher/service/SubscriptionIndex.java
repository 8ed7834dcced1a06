package dev.jobmatcher.service;

import dev.jobmatcher.model.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscriptions grouped by source filter, so a job only visits subscriptions that accept its source.
 */
@Slf4j
final class SubscriptionIndex {

    private final List<Subscription> unfiltered;
    private final Map<String, List<Subscription>> bySource;
    private final int size;

    private SubscriptionIndex(List<Subscription> unfiltered, Map<String, List<Subscription>> bySource, int size) {
        this.unfiltered = unfiltered;
        this.bySource = bySource;
        this.size = size;
    }

    static SubscriptionIndex of(List<Subscription> subscriptions) {
        List<Subscription> unfiltered = new ArrayList<>();
        Map<String, List<Subscription>> bySource = new HashMap<>();
        int size = 0;

        for (Subscription subscription : subscriptions) {
            if (subscription.getKeywords() != null && subscription.getKeywords().isEmpty()) {
                log.debug("Subscription {} has no keywords, skipping", subscription.getSubscriptionId());
                continue;
            }
            size++;
            if (!subscription.hasSourceFilter()) {
                unfiltered.add(subscription);
                continue;
            }
            for (String source : subscription.getSourceFilter()) {
                bySource.computeIfAbsent(source, key -> new ArrayList<>()).add(subscription);
            }
        }
        return new SubscriptionIndex(unfiltered, bySource, size);
    }

    /**
     * Subscriptions whose source filter accepts the given source.
     */
    List<Subscription> candidatesFor(String source) {
        List<Subscription> filtered = source != null ? bySource.get(source) : null;
        if (filtered == null || filtered.isEmpty()) {
            return Collections.unmodifiableList(unfiltered);
        }
        List<Subscription> candidates = new ArrayList<>(unfiltered.size() + filtered.size());
        candidates.addAll(unfiltered);
        candidates.addAll(filtered);
        return candidates;
    }

    int size() {
        return size;
    }
}
