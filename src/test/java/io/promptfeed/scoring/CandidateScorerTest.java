package io.promptfeed.scoring;

import io.promptfeed.category.KeywordCategorizer;
import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import io.promptfeed.profile.SkillLevel;
import io.promptfeed.profile.TimeOfDay;
import io.promptfeed.profile.UserProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static io.promptfeed.support.Items.NOW;
import static org.junit.jupiter.api.Assertions.*;

class CandidateScorerTest {

    private static final double EPS = 1e-9;

    private CandidateScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new CandidateScorer(FeedProperties.defaults().scoring(), new KeywordCategorizer());
    }

    private static UserProfile profile(double appetite, Map<String, Double> affinities, Map<String, Integer> exposures) {
        return new UserProfile("u1", affinities, exposures, Map.of(), SkillLevel.BEGINNER, appetite, TimeOfDay.ANYTIME);
    }

    private static CandidateItem item(double effectiveness, long usage, long remixes, long unique,
                                      double momentum, Instant createdAt) {
        return new CandidateItem("p1", "alice", "", "technical", effectiveness,
                usage, remixes, unique, momentum, createdAt);
    }

    @Test
    void shouldCombineAllSignalsWithDefaultWeights() {
        var candidate = item(0.6, 0, 0, 0, 0.0, NOW);
        var user = profile(0.5, Map.of("technical", 0.4), Map.of("technical", 1));

        var breakdown = scorer.breakdown(candidate, user, 0.9, NOW);

        assertEquals(0.6, breakdown.effectiveness(), EPS);
        assertEquals(0.5, breakdown.novelty(), EPS);
        assertEquals(0.1, breakdown.viralPotential(), EPS);
        assertEquals(0.4, breakdown.userAffinity(), EPS);
        assertEquals(1.0, breakdown.recency(), EPS);
        assertEquals(0.9, breakdown.creatorTrust(), EPS);
        assertFalse(breakdown.boosted());
        assertEquals(0.505, breakdown.total(), EPS);
    }

    @Test
    void shouldBeDeterministicForIdenticalInputs() {
        var candidate = item(0.7, 100, 12, 40, 0.8, NOW.minus(Duration.ofHours(30)));
        var user = profile(0.4, Map.of("technical", 0.2), Map.of("technical", 3));

        double first = scorer.score(candidate, user, 0.6, NOW);
        double second = scorer.score(candidate, user, 0.6, NOW);

        assertEquals(first, second);
    }

    @Test
    void shouldBoostHighExplorationAppetite() {
        var candidate = item(0.6, 10, 1, 5, 0.0, NOW.minus(Duration.ofHours(2)));

        double normal = scorer.score(candidate, profile(0.7, Map.of(), Map.of()), 0.5, NOW);
        double boosted = scorer.score(candidate, profile(0.71, Map.of(), Map.of()), 0.5, NOW);

        assertEquals(normal * 1.2, boosted, EPS);
    }

    @Test
    void shouldDecayNoveltyWithCategoryExposure() {
        var candidate = item(0.5, 0, 0, 0, 0.0, NOW);

        assertEquals(1.0, scorer.breakdown(candidate, profile(0.5, Map.of(), Map.of()), null, NOW).novelty(), EPS);
        assertEquals(0.25, scorer.breakdown(candidate,
                profile(0.5, Map.of(), Map.of("technical", 3)), null, NOW).novelty(), EPS);
        assertEquals(1.0, scorer.breakdown(candidate,
                profile(0.5, Map.of(), Map.of("creative", 9)), null, NOW).novelty(), EPS);
    }

    @Test
    void shouldClampAffinityToUnitInterval() {
        var candidate = item(0.5, 0, 0, 0, 0.0, NOW);

        assertEquals(1.0, scorer.breakdown(candidate,
                profile(0.5, Map.of("technical", 2.5), Map.of()), null, NOW).userAffinity(), EPS);
        assertEquals(0.0, scorer.breakdown(candidate,
                profile(0.5, Map.of("technical", -0.3), Map.of()), null, NOW).userAffinity(), EPS);
    }

    @Test
    void shouldDecayRecencyOverAWeek() {
        var weekOld = item(0.5, 0, 0, 0, 0.0, NOW.minus(Duration.ofHours(168)));

        var breakdown = scorer.breakdown(weekOld, profile(0.5, Map.of(), Map.of()), null, NOW);

        assertEquals(Math.exp(-1.0), breakdown.recency(), EPS);
    }

    @Test
    void shouldTreatFutureTimestampsAsBrandNew() {
        var future = item(0.5, 0, 0, 0, 0.0, NOW.plus(Duration.ofHours(5)));

        assertEquals(1.0, scorer.breakdown(future, profile(0.5, Map.of(), Map.of()), null, NOW).recency(), EPS);
    }

    @Test
    void shouldUseNeutralTrustForUnknownCreator() {
        var candidate = item(0.5, 0, 0, 0, 0.0, NOW);

        assertEquals(0.5, scorer.breakdown(candidate, profile(0.5, Map.of(), Map.of()), null, NOW).creatorTrust(), EPS);
    }

    @Test
    void shouldComputeViralPotentialForFreshItem() {
        var candidate = item(0.5, 100, 15, 50, 1.0, NOW.minus(Duration.ofHours(1)));

        var breakdown = scorer.breakdown(candidate, profile(0.5, Map.of(), Map.of()), null, NOW);

        // 0.4 * 1.0 + 0.3 * 0.5 + 0.2 * 0.5 + 0.1 * 1.0
        assertEquals(0.75, breakdown.viralPotential(), EPS);
    }

    @Test
    void shouldReduceFreshnessAfterOneDay() {
        var candidate = item(0.5, 100, 15, 50, 1.0, NOW.minus(Duration.ofHours(48)));

        var breakdown = scorer.breakdown(candidate, profile(0.5, Map.of(), Map.of()), null, NOW);

        assertEquals(0.73, breakdown.viralPotential(), EPS);
    }

    @Test
    void shouldNotFailOnZeroUsage() {
        var candidate = item(0.5, 0, 7, 3, 0.0, NOW);

        var breakdown = scorer.breakdown(candidate, profile(0.5, Map.of(), Map.of()), null, NOW);

        assertEquals(0.1, breakdown.viralPotential(), EPS);
        assertTrue(Double.isFinite(breakdown.total()));
    }

    @Test
    void shouldHonourCustomWeights() {
        var weights = new ScoringWeights(1.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        var config = new FeedProperties.Scoring(weights, null, null, null, null, null, null);
        var effectivenessOnly = new CandidateScorer(config, new KeywordCategorizer());

        double score = effectivenessOnly.score(item(0.42, 10, 5, 5, 3.0, NOW), profile(0.5, Map.of(), Map.of()), 1.0, NOW);

        assertEquals(0.42, score, EPS);
    }

    @Test
    void shouldCategorizeFromTemplateWhenCategoryMissing() {
        var candidate = new CandidateItem("p2", "bob", "Write a story about dragons", null, 0.5,
                0, 0, 0, 0.0, NOW);
        var user = profile(0.5, Map.of("creative", 0.8), Map.of("creative", 1));

        var breakdown = scorer.breakdown(candidate, user, null, NOW);

        assertEquals(0.8, breakdown.userAffinity(), EPS);
        assertEquals(0.5, breakdown.novelty(), EPS);
    }
}
