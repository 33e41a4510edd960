package io.promptfeed.source;

import io.promptfeed.feed.CandidateItem;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read access to the external prompt store.
 *
 * <p>Implementations signal outages by throwing {@link UpstreamUnavailableException};
 * the feed engine also wraps any other runtime failure into one.</p>
 */
public interface ItemStore {

    /**
     * Fetches candidate items for a user's feed.
     *
     * @param userId the requesting user
     * @param limit  maximum number of candidates
     */
    List<CandidateItem> fetchCandidates(String userId, int limit);

    /**
     * Looks up a single item by id.
     */
    Optional<CandidateItem> findItem(String itemId);

    /**
     * Trust score of a creator in [0,1], or empty for unknown creators.
     */
    OptionalDouble creatorTrust(String creatorId);
}
