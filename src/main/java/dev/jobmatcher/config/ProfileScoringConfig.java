package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field weights and synonym table for recommendation scoring.
 * Loaded from application.yml under 'profile-scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "profile-scoring")
public class ProfileScoringConfig {

    private int titleWeight = 40;
    private int requirementsWeight = 30;
    private int descriptionWeight = 20;
    private int companyWeight = 10;
    private double fuzzyScale = 5.0;
    private int breadthBonusPerKeyword = 5;
    private int maxBreadthBonus = 20;
    private long patternCacheSize = 1024;
    private Map<String, List<String>> synonyms = defaultSynonyms();

    private static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("python", List.of("django", "fastapi", "flask"));
        synonyms.put("javascript", List.of("js", "node", "react", "typescript"));
        synonyms.put("java", List.of("spring", "kotlin", "jvm"));
        synonyms.put("docker", List.of("containerization", "kubernetes", "container"));
        synonyms.put("devops", List.of("ci/cd", "terraform", "ansible"));
        synonyms.put("frontend", List.of("front-end", "ui developer", "react", "vue"));
        synonyms.put("backend", List.of("back-end", "server-side", "api"));
        synonyms.put("ios", List.of("swift", "swiftui", "objective-c"));
        synonyms.put("android", List.of("kotlin", "jetpack"));
        synonyms.put("data", List.of("analytics", "sql", "etl"));
        synonyms.put("machine learning", List.of("ml", "ai", "deep learning"));
        return synonyms;
    }
}
