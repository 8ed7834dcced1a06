package dev.jobmatcher.service;

import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.model.JobPosting;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lexical relevance scoring used by the bulk matching pass.
 * Only title and company are considered since other fields are not guaranteed by the ingester.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeywordScorer {

    // Absorbs float error so that e.g. 1 of 10 keywords sits exactly on a 0.10 threshold
    private static final double EPSILON = 1e-9;

    private final MatchingConfig matchingConfig;
    private final Clock clock;

    /**
     * Result of scoring.
     *
     * @param matchedKeywords subscription keywords found in the job, in subscription order
     * @param relevance       score in [0, 1]
     * @param accepted        true if at least one keyword matched and relevance clears the threshold
     */
    public record KeywordScore(List<String> matchedKeywords, double relevance, boolean accepted) {

        static KeywordScore none() {
            return new KeywordScore(List.of(), 0.0, false);
        }
    }

    /**
     * Score a job against a subscription's keywords.
     *
     * @param job      The job to score
     * @param keywords The subscription keywords
     * @return KeywordScore with matched keywords, relevance and threshold decision
     */
    public KeywordScore score(JobPosting job, List<String> keywords) {
        if (job == null) {
            throw new IllegalArgumentException("Job must not be null");
        }
        if (keywords == null) {
            throw new IllegalArgumentException("Keywords must not be null for job " + job.getId());
        }

        List<String> usable = keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .toList();
        if (usable.isEmpty()) {
            return KeywordScore.none();
        }

        String title = lower(job.getTitle());
        String company = lower(job.getCompany());
        String matchingText = title + " " + company;

        List<String> matched = new ArrayList<>();
        int titleMatches = 0;
        int companyMatches = 0;
        for (String keyword : usable) {
            String needle = keyword.trim().toLowerCase(Locale.ROOT);
            if (!matchingText.contains(needle)) {
                continue;
            }
            matched.add(keyword);
            if (title.contains(needle)) {
                titleMatches++;
            }
            if (company.contains(needle)) {
                companyMatches++;
            }
        }

        if (matched.isEmpty()) {
            return KeywordScore.none();
        }

        MatchingConfig.Scoring weights = matchingConfig.getScoring();
        double base = (double) matched.size() / usable.size();
        double titleBonus = weights.getTitleWeight() * titleMatches / matched.size();
        double companyBonus = weights.getCompanyWeight() * companyMatches / matched.size();
        double recencyBonus = recencyBonus(job.getCreatedAt(), weights);

        double relevance = Math.max(0.0, Math.min(1.0, base + titleBonus + companyBonus + recencyBonus));
        boolean accepted = relevance + EPSILON >= weights.getThreshold();

        log.trace("Job {} scored {} with keywords {} (accepted: {})", job.getId(), relevance, matched, accepted);

        return new KeywordScore(List.copyOf(matched), relevance, accepted);
    }

    /**
     * Linear bonus for postings younger than the recency window, zero otherwise.
     */
    private double recencyBonus(Instant createdAt, MatchingConfig.Scoring weights) {
        if (createdAt == null || weights.getRecencyWindowHours() <= 0) {
            return 0.0;
        }
        double window = weights.getRecencyWindowHours();
        double ageHours = Math.max(0.0, Duration.between(createdAt, clock.instant()).toMillis() / 3_600_000.0);
        if (ageHours >= window) {
            return 0.0;
        }
        return weights.getRecencyWeight() * (window - ageHours) / window;
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Get the configured relevance threshold.
     */
    public double getThreshold() {
        return matchingConfig.getScoring().getThreshold();
    }
}
