package io.promptfeed.feed;

/**
 * A candidate paired with its utility score for one feed request.
 */
public record ScoredCandidate(double score, CandidateItem item) {
}
