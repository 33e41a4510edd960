package io.promptfeed.diversity;

import io.promptfeed.category.Categorizer;
import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import io.promptfeed.feed.ScoredCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy, order-preserving cap on per-creator and per-category repetition.
 *
 * <p>Walks a score-sorted list once and accepts each candidate unless its creator or its
 * category has already reached its cap among accepted items. Rejected candidates are dropped,
 * not deferred. Ties keep their input order.</p>
 */
public class DiversityFilter {

    private final int maxPerCreator;
    private final int maxPerCategory;
    private final Categorizer categorizer;

    public DiversityFilter(FeedProperties.Diversity config, Categorizer categorizer) {
        this.maxPerCreator = config.maxPerCreator();
        this.maxPerCategory = config.maxPerCategory();
        this.categorizer = categorizer;
    }

    /**
     * @param sortedCandidates candidates sorted by descending score
     * @param targetCount      maximum number of items to accept
     * @return accepted items in input order, at most {@code targetCount}
     */
    public List<CandidateItem> filter(List<ScoredCandidate> sortedCandidates, int targetCount) {
        List<CandidateItem> selected = new ArrayList<>(Math.min(targetCount, sortedCandidates.size()));
        if (targetCount <= 0) return selected;

        Map<String, Integer> perCreator = new HashMap<>();
        Map<String, Integer> perCategory = new HashMap<>();

        for (ScoredCandidate candidate : sortedCandidates) {
            CandidateItem item = candidate.item();
            if (perCreator.getOrDefault(item.creatorId(), 0) >= maxPerCreator) {
                continue;
            }
            String category = categorizer.categoryOf(item);
            if (perCategory.getOrDefault(category, 0) >= maxPerCategory) {
                continue;
            }

            selected.add(item);
            perCreator.merge(item.creatorId(), 1, Integer::sum);
            perCategory.merge(category, 1, Integer::sum);

            if (selected.size() >= targetCount) {
                break;
            }
        }
        return selected;
    }
}
