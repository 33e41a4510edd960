package io.promptfeed.scoring;

/**
 * Weight vector combining the six scoring signals.
 *
 * <p>Binds to {@code feed.scoring.weights} in application.yml. Unset weights take their
 * defaults; the resulting vector must be non-negative and sum to 1.0.</p>
 *
 * @param effectiveness  weight of the item's own effectiveness score (default 0.30)
 * @param novelty        weight of category novelty for the user (default 0.20)
 * @param viralPotential weight of remix rate, retention and momentum (default 0.20)
 * @param userAffinity   weight of the user's category affinity (default 0.15)
 * @param recency        weight of age decay (default 0.10)
 * @param creatorTrust   weight of the creator's trust score (default 0.05)
 */
public record ScoringWeights(
        Double effectiveness,
        Double novelty,
        Double viralPotential,
        Double userAffinity,
        Double recency,
        Double creatorTrust
) {
    static final double SUM_TOLERANCE = 1e-6;

    public ScoringWeights {
        if (effectiveness == null) effectiveness = 0.30;
        if (novelty == null) novelty = 0.20;
        if (viralPotential == null) viralPotential = 0.20;
        if (userAffinity == null) userAffinity = 0.15;
        if (recency == null) recency = 0.10;
        if (creatorTrust == null) creatorTrust = 0.05;

        double sum = 0.0;
        for (double w : new double[]{effectiveness, novelty, viralPotential, userAffinity, recency, creatorTrust}) {
            if (w < 0.0 || Double.isNaN(w)) {
                throw new IllegalArgumentException("Scoring weights must be non-negative, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Scoring weights must sum to 1.0, got " + sum);
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(null, null, null, null, null, null);
    }
}
