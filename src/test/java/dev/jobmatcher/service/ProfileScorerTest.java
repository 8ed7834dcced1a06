package dev.jobmatcher.service;

import dev.jobmatcher.config.ProfileScoringConfig;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.service.ProfileScorer.MatchType;
import dev.jobmatcher.service.ProfileScorer.ProfileMatchDetail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProfileScorerTest {

    private ProfileScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ProfileScorer(new ProfileScoringConfig());
    }

    private JobPosting job(String title, String description, String requirements) {
        return JobPosting.builder()
                .id("job-1")
                .title(title)
                .company("Acme")
                .description(description)
                .requirements(requirements)
                .build();
    }

    @Nested
    @DisplayName("Direct matches")
    class DirectMatchTests {

        @Test
        @DisplayName("Should rank a title hit above a description hit")
        void shouldWeightTitleAboveDescription() {
            ProfileMatchDetail inTitle = scorer.score(job("Rust Engineer", "Build things", null), List.of("rust"));
            ProfileMatchDetail inDescription = scorer.score(job("Engineer", "We use rust daily", null), List.of("rust"));

            assertThat(inTitle.score()).isGreaterThan(inDescription.score());
            assertThat(inTitle.keywordBreakdown().get("rust").matchType()).isEqualTo(MatchType.DIRECT);
            assertThat(inTitle.reasons()).contains("'rust' found in title");
        }

        @Test
        @DisplayName("Should cap the total score at 100")
        void shouldCapScore() {
            ProfileMatchDetail result = scorer.score(
                    job("Python Python Python", "python", "python"), List.of("python"));

            assertThat(result.score()).isEqualTo(100);
        }

        @Test
        @DisplayName("Should add a breadth bonus per matched keyword")
        void shouldAddBreadthBonus() {
            ProfileMatchDetail result = scorer.score(job("Office Manager", null, null), List.of("office"));

            assertThat(result.matchedKeywords()).containsExactly("office");
            assertThat(result.reasons()).contains("Matched 1 of 1 keywords");
            // 40 * 1.75 for the title plus 5 breadth
            assertThat(result.score()).isEqualTo(75);
        }

        @Test
        @DisplayName("Should read text out of HTML descriptions")
        void shouldStripHtml() {
            ProfileMatchDetail markup = scorer.score(job("Engineer", "<p>Strong <b>kafka</b> skills</p>", null),
                    List.of("kafka"));
            ProfileMatchDetail attribute = scorer.score(job("Engineer", "<div class=\"kafka\">Cooking</div>", null),
                    List.of("kafka"));

            assertThat(markup.matchedKeywords()).containsExactly("kafka");
            assertThat(attribute.matchedKeywords()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Synonyms and fuzzy matches")
    class IndirectMatchTests {

        @Test
        @DisplayName("Should credit a synonym at reduced weight")
        void shouldMatchSynonym() {
            ProfileMatchDetail synonym = scorer.score(job("Engineer", "Django services", null), List.of("python"));
            ProfileMatchDetail direct = scorer.score(job("Engineer", "Python services", null), List.of("python"));

            assertThat(synonym.matchedKeywords()).containsExactly("python");
            assertThat(synonym.keywordBreakdown().get("python").matchType()).isEqualTo(MatchType.SYNONYM);
            assertThat(synonym.score()).isLessThan(direct.score());
        }

        @Test
        @DisplayName("Should resolve synonyms in both directions")
        void shouldMatchReverseSynonym() {
            ProfileMatchDetail result = scorer.score(job("Python Engineer", null, null), List.of("django"));

            assertThat(result.keywordBreakdown().get("django").matchType()).isEqualTo(MatchType.SYNONYM);
        }

        @Test
        @DisplayName("Should give fuzzy credit without counting the keyword as matched")
        void shouldMatchFuzzy() {
            ProfileMatchDetail result = scorer.score(job("Postgres Administrator", null, null), List.of("postgresql"));

            assertThat(result.matchedKeywords()).isEmpty();
            assertThat(result.keywordBreakdown().get("postgresql").matchType()).isEqualTo(MatchType.FUZZY);
            assertThat(result.keywordBreakdown().get("postgresql").score()).isCloseTo(4.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Helpers")
    class HelperTests {

        @Test
        @DisplayName("Should reward whole words and early position")
        void shouldComputeMultiplier() {
            assertThat(scorer.relevanceMultiplier("java developer", "java")).isCloseTo(1.75, within(1e-9));
            assertThat(scorer.relevanceMultiplier("javascript developer", "java")).isCloseTo(1.25, within(1e-9));
            assertThat(scorer.relevanceMultiplier("java java java java", "java")).isEqualTo(2.0);
            assertThat(scorer.relevanceMultiplier("developer", "java")).isZero();
        }

        @Test
        @DisplayName("Should keep the word pattern cache bounded across many distinct query keywords")
        void shouldBoundPatternCache() {
            ProfileScoringConfig config = new ProfileScoringConfig();
            config.setPatternCacheSize(16);
            ProfileScorer bounded = new ProfileScorer(config);
            StringBuilder description = new StringBuilder();
            for (int i = 0; i < 500; i++) {
                description.append("kw").append(i).append(' ');
            }
            JobPosting posting = job("Engineer", description.toString(), null);

            for (int i = 0; i < 500; i++) {
                assertThat(bounded.score(posting, List.of("kw" + i)).matchedKeywords()).containsExactly("kw" + i);
            }

            assertThat(bounded.cachedPatternCount()).isLessThanOrEqualTo(16);
        }

        @Test
        @DisplayName("Should skip fuzzy matching for short keywords")
        void shouldSkipShortFuzzy() {
            assertThat(scorer.fuzzyRatio("golang engineer", "go")).isZero();
        }
    }

    @Test
    @DisplayName("Should return zero for empty keywords or missing job")
    void shouldHandleEmptyInput() {
        assertThat(scorer.score(job("Engineer", null, null), List.of()).score()).isZero();
        assertThat(scorer.score(null, List.of("java")).score()).isZero();
        assertThat(scorer.score(job("Engineer", null, null), List.of(" ")).score()).isZero();
    }
}
