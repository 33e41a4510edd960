package io.promptfeed.config;

import io.promptfeed.exploration.ExplorationPolicy;
import io.promptfeed.scoring.ScoringWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunable policy for the feed engine.
 *
 * <p>Binds to {@code feed} in application.yml:</p>
 * <pre>
 * feed:
 *   candidate-multiplier: 5
 *   scoring:
 *     weights:
 *       effectiveness: 0.30
 *       novelty: 0.20
 *     exploration-boost-threshold: 0.7
 *   trend:
 *     decay-base: 0.99
 *     decay-unit: 1m
 *     viral-remix-threshold: 0.10
 *   diversity:
 *     max-per-creator: 2
 *   exploration:
 *     policy: random-overwrite
 *   catalog:
 *     path: classpath:catalog/prompts.json
 * </pre>
 *
 * <p>Every section and value is optional; missing ones fall back to the defaults below.</p>
 */
@ConfigurationProperties(prefix = "feed")
public record FeedProperties(
        Integer candidateMultiplier,
        Scoring scoring,
        Profile profile,
        Trend trend,
        Diversity diversity,
        Exploration exploration,
        Catalog catalog
) {

    public FeedProperties {
        if (candidateMultiplier == null) candidateMultiplier = 5;
        if (candidateMultiplier < 1) {
            throw new IllegalArgumentException("feed.candidate-multiplier must be >= 1");
        }
        if (scoring == null) scoring = new Scoring(null, null, null, null, null, null, null);
        if (profile == null) profile = new Profile(null, null, null);
        if (trend == null) trend = new Trend(null, null, null, null, null, null, null);
        if (diversity == null) diversity = new Diversity(null, null);
        if (exploration == null) exploration = new Exploration(null, null, null);
        if (catalog == null) catalog = new Catalog(null);
    }

    public static FeedProperties defaults() {
        return new FeedProperties(null, null, null, null, null, null, null);
    }

    /**
     * Scorer settings.
     *
     * @param weights                   signal weight vector
     * @param explorationBoostThreshold appetite above which the final score is boosted
     * @param explorationBoost          multiplier applied to boosted scores
     * @param defaultCreatorTrust       trust for creators the item store does not know
     * @param recencyScaleHours         time constant of the recency decay
     * @param freshWindowHours          age under which an item counts as fresh for viral potential
     * @param staleFreshness            freshness multiplier for items past the fresh window
     */
    public record Scoring(
            ScoringWeights weights,
            Double explorationBoostThreshold,
            Double explorationBoost,
            Double defaultCreatorTrust,
            Double recencyScaleHours,
            Double freshWindowHours,
            Double staleFreshness
    ) {
        public Scoring {
            if (weights == null) weights = ScoringWeights.defaults();
            if (explorationBoostThreshold == null) explorationBoostThreshold = 0.7;
            if (explorationBoost == null) explorationBoost = 1.2;
            if (defaultCreatorTrust == null) defaultCreatorTrust = 0.5;
            if (recencyScaleHours == null) recencyScaleHours = 168.0;
            if (freshWindowHours == null) freshWindowHours = 24.0;
            if (staleFreshness == null) staleFreshness = 0.8;
            if (recencyScaleHours <= 0) {
                throw new IllegalArgumentException("feed.scoring.recency-scale-hours must be positive");
            }
        }
    }

    /**
     * Profile builder settings.
     *
     * @param affinityAlpha               EMA factor for category affinity updates
     * @param coldStartExplorationAppetite appetite of a user with no history
     * @param maxEventsPerUser            per-user event log capacity
     */
    public record Profile(
            Double affinityAlpha,
            Double coldStartExplorationAppetite,
            Integer maxEventsPerUser
    ) {
        public Profile {
            if (affinityAlpha == null) affinityAlpha = 0.1;
            if (coldStartExplorationAppetite == null) coldStartExplorationAppetite = 0.8;
            if (maxEventsPerUser == null) maxEventsPerUser = 1000;
            if (affinityAlpha <= 0.0 || affinityAlpha > 1.0) {
                throw new IllegalArgumentException("feed.profile.affinity-alpha must be in (0, 1], got " + affinityAlpha);
            }
            if (maxEventsPerUser < 1) {
                throw new IllegalArgumentException("feed.profile.max-events-per-user must be >= 1");
            }
        }
    }

    /**
     * Trend tracker settings.
     *
     * @param decayBase            momentum multiplier per elapsed decay unit
     * @param decayUnit            wall-clock length of one decay unit
     * @param evictionEpsilon      momentum under which an entry is dropped
     * @param viralRemixThreshold  remix/usage ratio that marks a viral crossing
     * @param viralAmplification   momentum multiplier applied once per crossing
     * @param sweepIntervalMinutes period of the recurring eviction sweep
     * @param sweepEnabled         whether the sweep job is registered at start-up
     */
    public record Trend(
            Double decayBase,
            Duration decayUnit,
            Double evictionEpsilon,
            Double viralRemixThreshold,
            Double viralAmplification,
            Integer sweepIntervalMinutes,
            Boolean sweepEnabled
    ) {
        public Trend {
            if (decayBase == null) decayBase = 0.99;
            if (decayUnit == null) decayUnit = Duration.ofMinutes(1);
            if (evictionEpsilon == null) evictionEpsilon = 0.01;
            if (viralRemixThreshold == null) viralRemixThreshold = 0.10;
            if (viralAmplification == null) viralAmplification = 2.0;
            if (sweepIntervalMinutes == null) sweepIntervalMinutes = 10;
            if (sweepEnabled == null) sweepEnabled = true;
            if (decayBase <= 0.0 || decayBase > 1.0) {
                throw new IllegalArgumentException("feed.trend.decay-base must be in (0, 1], got " + decayBase);
            }
            if (decayUnit.isZero() || decayUnit.isNegative()) {
                throw new IllegalArgumentException("feed.trend.decay-unit must be positive");
            }
            if (sweepIntervalMinutes < 1) {
                throw new IllegalArgumentException(
                        "feed.trend.sweep-interval-minutes must be >= 1, got " + sweepIntervalMinutes);
            }
        }
    }

    /**
     * Diversity caps among accepted feed items.
     */
    public record Diversity(Integer maxPerCreator, Integer maxPerCategory) {
        public Diversity {
            if (maxPerCreator == null) maxPerCreator = 2;
            if (maxPerCategory == null) maxPerCategory = 5;
            if (maxPerCreator < 1 || maxPerCategory < 1) {
                throw new IllegalArgumentException("feed.diversity caps must be >= 1");
            }
        }
    }

    /**
     * Exploration injection settings.
     *
     * @param ratio    share of the target count reserved for exploration
     * @param minSlots lower bound on exploration slots
     * @param policy   how exploration items take positions in a full feed
     */
    public record Exploration(Double ratio, Integer minSlots, ExplorationPolicy policy) {
        public Exploration {
            if (ratio == null) ratio = 0.1;
            if (minSlots == null) minSlots = 2;
            if (policy == null) policy = ExplorationPolicy.RANDOM_OVERWRITE;
            if (ratio < 0.0 || ratio > 1.0) {
                throw new IllegalArgumentException("feed.exploration.ratio must be in [0, 1], got " + ratio);
            }
        }
    }

    /**
     * Seed catalog for the in-memory item store. A blank path starts with an empty catalog.
     */
    public record Catalog(String path) {
        public Catalog {
            if (path == null) path = "";
        }
    }
}
