package dev.jobmatcher.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.jobmatcher.config.ProfileScoringConfig;
import dev.jobmatcher.model.JobPosting;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Multi-field weighted scoring for interactive recommendation queries.
 * Not used by the bulk matching pass.
 */
@Slf4j
@Service
public class ProfileScorer {

    private static final double MAX_MULTIPLIER = 2.0;
    private static final double MAX_FUZZY_MULTIPLIER = 1.0;
    private static final double SYNONYM_FACTOR = 0.5;
    private static final int MIN_FUZZY_LENGTH = 4;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9+#.]+");

    private final ProfileScoringConfig config;

    /**
     * Word-boundary patterns keyed by the searched term. Terms come from user queries, so the cache is bounded.
     */
    private final Cache<String, Pattern> patternCache;

    public ProfileScorer(ProfileScoringConfig config) {
        this.config = config;
        this.patternCache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, config.getPatternCacheSize()))
                .build();
    }

    public enum MatchType {
        DIRECT,
        SYNONYM,
        FUZZY,
        NONE
    }

    /**
     * Score details for a single keyword.
     */
    public record KeywordBreakdown(double score, MatchType matchType, Map<String, Double> fieldScores) {
    }

    /**
     * Result of profile scoring.
     */
    public record ProfileMatchDetail(
            int score,
            List<String> matchedKeywords,
            List<String> reasons,
            Map<String, KeywordBreakdown> keywordBreakdown) {
    }

    private record Field(String name, String text, int weight) {
    }

    /**
     * Score a job against a keyword list.
     *
     * @param job      The job to score, optional fields may be null
     * @param keywords Keywords to look for
     * @return ProfileMatchDetail with a 0-100 score
     */
    public ProfileMatchDetail score(JobPosting job, List<String> keywords) {
        if (job == null || keywords == null || keywords.isEmpty()) {
            return new ProfileMatchDetail(0, List.of(), List.of(), Map.of());
        }

        List<Field> fields = List.of(
                new Field("title", normalize(job.getTitle()), config.getTitleWeight()),
                new Field("requirements", normalize(stripHtml(job.getRequirements())), config.getRequirementsWeight()),
                new Field("description", normalize(stripHtml(job.getDescription())), config.getDescriptionWeight()),
                new Field("company", normalize(job.getCompany()), config.getCompanyWeight()));

        List<String> matched = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        Map<String, KeywordBreakdown> breakdown = new LinkedHashMap<>();
        double total = 0.0;
        int keywordCount = 0;

        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            keywordCount++;
            String needle = normalize(keyword);
            KeywordBreakdown result = scoreKeyword(needle, keyword, fields, reasons);
            breakdown.put(keyword, result);
            total += result.score();
            if (result.matchType() == MatchType.DIRECT || result.matchType() == MatchType.SYNONYM) {
                matched.add(keyword);
            }
        }

        if (keywordCount == 0) {
            return new ProfileMatchDetail(0, List.of(), List.of(), Map.of());
        }

        double normalized = total / (keywordCount * 100.0) * 100.0;
        int breadthBonus = Math.min(config.getMaxBreadthBonus(), matched.size() * config.getBreadthBonusPerKeyword());
        int score = (int) Math.min(100, Math.round(normalized + breadthBonus));

        if (!matched.isEmpty()) {
            reasons.add(String.format("Matched %d of %d keywords", matched.size(), keywordCount));
        }

        log.debug("Job '{}' profile score {} (matched: {})", job.getTitle(), score, matched);
        return new ProfileMatchDetail(score, List.copyOf(matched), List.copyOf(reasons), breakdown);
    }

    private KeywordBreakdown scoreKeyword(String needle, String keyword, List<Field> fields, List<String> reasons) {
        Map<String, Double> fieldScores = new LinkedHashMap<>();
        MatchType best = MatchType.NONE;
        double sum = 0.0;

        for (Field field : fields) {
            if (field.text().isEmpty()) {
                continue;
            }

            double multiplier = relevanceMultiplier(field.text(), needle);
            if (multiplier > 0) {
                double points = field.weight() * multiplier;
                fieldScores.put(field.name(), points);
                sum += points;
                best = MatchType.DIRECT;
                reasons.add(String.format("'%s' found in %s", keyword, field.name()));
                continue;
            }

            String synonym = findSynonym(field.text(), needle);
            if (synonym != null) {
                double points = field.weight() * SYNONYM_FACTOR * relevanceMultiplier(field.text(), synonym);
                fieldScores.put(field.name(), points);
                sum += points;
                if (best != MatchType.DIRECT) {
                    best = MatchType.SYNONYM;
                }
                reasons.add(String.format("'%s' related to '%s' in %s", synonym, keyword, field.name()));
                continue;
            }

            double ratio = fuzzyRatio(field.text(), needle);
            if (ratio > 0) {
                double points = Math.min(MAX_FUZZY_MULTIPLIER, ratio) * config.getFuzzyScale();
                fieldScores.put(field.name(), points);
                sum += points;
                if (best == MatchType.NONE) {
                    best = MatchType.FUZZY;
                }
            }
        }

        return new KeywordBreakdown(sum, best, fieldScores);
    }

    /**
     * Multiplier in (0, 2] for a direct hit, 0 if the keyword is absent.
     * Rewards word-boundary matches, repeated occurrences and early position.
     */
    double relevanceMultiplier(String text, String needle) {
        int first = text.indexOf(needle);
        if (needle.isEmpty() || first < 0) {
            return 0.0;
        }

        double multiplier = 1.0;
        if (containsWord(text, needle)) {
            multiplier += 0.5;
        }

        int occurrences = countOccurrences(text, needle);
        if (occurrences > 1) {
            multiplier += 0.25 * Math.log1p(occurrences - 1.0);
        }

        multiplier += 0.25 * (1.0 - (double) first / text.length());

        return Math.min(MAX_MULTIPLIER, multiplier);
    }

    private String findSynonym(String text, String needle) {
        for (String synonym : synonymsOf(needle)) {
            String candidate = normalize(synonym);
            if (!candidate.isEmpty() && containsWord(text, candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Synonyms are symmetric: "django" also finds "python".
     */
    private List<String> synonymsOf(String needle) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : config.getSynonyms().entrySet()) {
            String head = normalize(entry.getKey());
            if (head.equals(needle)) {
                result.addAll(entry.getValue());
            } else if (entry.getValue().stream().anyMatch(s -> normalize(s).equals(needle))) {
                result.add(head);
            }
        }
        return result;
    }

    /**
     * Partial similarity between the keyword and the closest token in the text, 0 if none.
     */
    double fuzzyRatio(String text, String needle) {
        if (needle.length() < MIN_FUZZY_LENGTH) {
            return 0.0;
        }
        double best = 0.0;
        for (String token : TOKEN_SPLIT.split(text)) {
            if (token.length() < 3) {
                continue;
            }
            int longest = Math.max(token.length(), needle.length());
            double ratio = 0.0;
            if (token.contains(needle) || needle.contains(token)) {
                ratio = (double) Math.min(token.length(), needle.length()) / longest;
            } else {
                int prefix = commonPrefix(token, needle);
                if (prefix >= MIN_FUZZY_LENGTH) {
                    ratio = (double) prefix / longest;
                }
            }
            best = Math.max(best, ratio);
        }
        return best;
    }

    private static int commonPrefix(String a, String b) {
        int limit = Math.min(a.length(), b.length());
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }

    private boolean containsWord(String text, String word) {
        Pattern pattern = patternCache.get(word,
                term -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(term) + "(?![a-z0-9])"));
        return pattern.matcher(text).find();
    }

    long cachedPatternCount() {
        patternCache.cleanUp();
        return patternCache.estimatedSize();
    }

    private static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    private static String normalize(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }
}
