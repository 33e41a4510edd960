package io.promptfeed.scoring;

/**
 * The six normalized sub-scores of a candidate and the weighted total they produce.
 *
 * @param effectiveness  item effectiveness
 * @param novelty        {@code 1 / (1 + exposures)} for the candidate's category
 * @param viralPotential remix rate, retention, momentum and freshness blend
 * @param userAffinity   category affinity clamped to [0,1]
 * @param recency        exponential age decay
 * @param creatorTrust   creator trust in [0,1]
 * @param boosted        whether the exploration boost was applied
 * @param total          final score
 */
public record ScoreBreakdown(
        double effectiveness,
        double novelty,
        double viralPotential,
        double userAffinity,
        double recency,
        double creatorTrust,
        boolean boosted,
        double total
) {
}
