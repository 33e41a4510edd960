package io.promptfeed.feed;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only snapshot of a prompt as supplied by the item store for one ranking pass.
 *
 * @param id                 unique item identifier
 * @param creatorId          creator identifier
 * @param template           raw prompt template, used for categorization
 * @param category           explicit category label, or null to derive it from the template
 * @param effectivenessScore effectiveness in [0,1]
 * @param usageCount         number of uses
 * @param remixCount         number of remixes
 * @param uniqueUserCount    number of distinct users
 * @param trendingMomentum   current momentum, clamped to be non-negative
 * @param createdAt          creation time
 */
public record CandidateItem(
        String id,
        String creatorId,
        String template,
        String category,
        double effectivenessScore,
        long usageCount,
        long remixCount,
        long uniqueUserCount,
        double trendingMomentum,
        Instant createdAt
) {
    public CandidateItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(creatorId, "creatorId");
        Objects.requireNonNull(createdAt, "createdAt");
        if (template == null) template = "";
        if (usageCount < 0 || remixCount < 0 || uniqueUserCount < 0) {
            throw new IllegalArgumentException("Counts must be non-negative for item " + id);
        }
        effectivenessScore = Math.max(0.0, Math.min(1.0, effectivenessScore));
        if (trendingMomentum < 0.0 || Double.isNaN(trendingMomentum)) trendingMomentum = 0.0;
    }

    public CandidateItem withTrendingMomentum(double momentum) {
        return new CandidateItem(id, creatorId, template, category, effectivenessScore,
                usageCount, remixCount, uniqueUserCount, momentum, createdAt);
    }

    /** Remixes per use, 0 when the item has never been used. */
    public double remixRate() {
        return usageCount == 0 ? 0.0 : (double) remixCount / usageCount;
    }

    /** Distinct users per use, 0 when the item has never been used. */
    public double retention() {
        return usageCount == 0 ? 0.0 : (double) uniqueUserCount / usageCount;
    }
}
