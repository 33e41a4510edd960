package io.promptfeed.source;

import io.promptfeed.feed.CandidateItem;

import java.util.List;

/**
 * Pool of pre-vetted, high-quality items that are not personalized.
 */
@FunctionalInterface
public interface ExplorationSource {

    /**
     * Samples up to {@code n} items.
     */
    List<CandidateItem> sampleHighQuality(int n);
}
