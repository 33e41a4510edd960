package io.promptfeed.scoring;

import io.promptfeed.category.Categorizer;
import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import io.promptfeed.profile.UserProfile;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes a single utility score for a (candidate, user profile) pair.
 *
 * <p>Six independent signals, each roughly in [0,1], are combined by the configured
 * {@link ScoringWeights}. Users whose exploration appetite exceeds the boost threshold get
 * their scores multiplied by the exploration boost.</p>
 *
 * <p>Scoring is side-effect free. Time enters only through the explicit {@code now} argument,
 * so identical inputs always produce the identical score.</p>
 */
public class CandidateScorer {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final ScoringWeights weights;
    private final FeedProperties.Scoring config;
    private final Categorizer categorizer;

    public CandidateScorer(FeedProperties.Scoring config, Categorizer categorizer) {
        this.weights = config.weights();
        this.config = config;
        this.categorizer = categorizer;
    }

    /**
     * Scores a candidate for a user.
     *
     * @param candidate    the candidate, with its current trending momentum
     * @param profile      the user's profile
     * @param creatorTrust trust of the candidate's creator in [0,1], or null if unknown
     * @param now          reference time for age computations
     */
    public double score(CandidateItem candidate, UserProfile profile, Double creatorTrust, Instant now) {
        return breakdown(candidate, profile, creatorTrust, now).total();
    }

    /**
     * Same as {@link #score} but returns every sub-score alongside the total.
     */
    public ScoreBreakdown breakdown(CandidateItem candidate, UserProfile profile, Double creatorTrust, Instant now) {
        String category = categorizer.categoryOf(candidate);
        double ageHours = ageHours(candidate, now);

        double effectiveness = candidate.effectivenessScore();
        double novelty = 1.0 / (1.0 + profile.exposures(category));
        double viral = viralPotential(candidate, ageHours);
        double affinity = clamp(profile.affinity(category));
        double recency = Math.exp(-ageHours / config.recencyScaleHours());
        double trust = creatorTrust == null ? config.defaultCreatorTrust() : clamp(creatorTrust);

        double total = weights.effectiveness() * effectiveness
                + weights.novelty() * novelty
                + weights.viralPotential() * viral
                + weights.userAffinity() * affinity
                + weights.recency() * recency
                + weights.creatorTrust() * trust;

        boolean boosted = profile.explorationAppetite() > config.explorationBoostThreshold();
        if (boosted) {
            total *= config.explorationBoost();
        }

        return new ScoreBreakdown(effectiveness, novelty, viral, affinity, recency, trust, boosted, total);
    }

    /**
     * Viral potential: {@code 0.4 * min(10 * remixRate, 1) + 0.3 * retention + 0.2 * momentum + 0.1 * freshness}.
     * Retention and momentum are squashed into [0,1]; freshness is 1.0 inside the fresh window.
     */
    double viralPotential(CandidateItem candidate, double ageHours) {
        double remixSignal = Math.min(candidate.remixRate() * 10.0, 1.0);
        double retention = clamp(candidate.retention());
        double momentum = candidate.trendingMomentum();
        double momentumSignal = momentum / (1.0 + momentum);
        double freshness = ageHours < config.freshWindowHours() ? 1.0 : config.staleFreshness();

        return 0.4 * remixSignal + 0.3 * retention + 0.2 * momentumSignal + 0.1 * freshness;
    }

    private static double ageHours(CandidateItem candidate, Instant now) {
        long millis = Duration.between(candidate.createdAt(), now).toMillis();
        // items stamped in the future count as brand new
        return Math.max(0L, millis) / MILLIS_PER_HOUR;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
