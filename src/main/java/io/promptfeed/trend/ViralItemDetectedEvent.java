package io.promptfeed.trend;

import java.time.Instant;

/**
 * Published when an item crosses the viral remix-rate threshold and has its momentum amplified.
 *
 * @param itemId     the item
 * @param creatorId  the item's creator
 * @param remixRate  remix rate that triggered the crossing
 * @param momentum   momentum after amplification
 * @param detectedAt when the crossing was detected
 */
public record ViralItemDetectedEvent(
        String itemId,
        String creatorId,
        double remixRate,
        double momentum,
        Instant detectedAt
) {
}
