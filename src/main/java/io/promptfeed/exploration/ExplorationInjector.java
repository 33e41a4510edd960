package io.promptfeed.exploration;

import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import io.promptfeed.source.ExplorationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Mixes non-personalized exploration items into a ranked feed.
 *
 * <p>The slot count is {@code max(minSlots, round(targetCount * ratio))}. While the feed is
 * shorter than the target, exploration items are appended. Once it is full, the
 * {@link ExplorationPolicy} decides which positions they overwrite; with
 * {@link ExplorationPolicy#RANDOM_OVERWRITE} a ranked item may be evicted by the draw.</p>
 *
 * <p>Exploration items already present in the feed are skipped.</p>
 */
public class ExplorationInjector {

    private static final Logger log = LoggerFactory.getLogger(ExplorationInjector.class);

    private final double ratio;
    private final int minSlots;
    private final ExplorationPolicy policy;
    private final Random random;

    public ExplorationInjector(FeedProperties.Exploration config, Random random) {
        this.ratio = config.ratio();
        this.minSlots = config.minSlots();
        this.policy = config.policy();
        this.random = random;
    }

    /**
     * Number of exploration slots for a feed of the given target length.
     */
    public int slotCount(int targetCount) {
        return (int) Math.max(minSlots, Math.round(targetCount * ratio));
    }

    /**
     * @param feed        ranked feed; not modified
     * @param targetCount requested feed length
     * @param source      exploration pool
     * @return a new list of length {@code min(targetCount, feed length after injection)}
     */
    public List<CandidateItem> inject(List<CandidateItem> feed, int targetCount, ExplorationSource source) {
        List<CandidateItem> result = new ArrayList<>(feed);
        if (targetCount <= 0) return List.of();

        int slots = slotCount(targetCount);
        List<CandidateItem> exploration = source.sampleHighQuality(slots);

        Set<String> present = new HashSet<>();
        for (CandidateItem item : result) {
            present.add(item.id());
        }

        int injected = 0;
        int tailCursor = Math.min(result.size(), targetCount) - 1;
        for (CandidateItem candidate : exploration) {
            if (injected >= slots) break;
            if (!present.add(candidate.id())) continue;

            if (result.size() >= targetCount) {
                int index = policy == ExplorationPolicy.RANDOM_OVERWRITE
                        ? random.nextInt(targetCount)
                        : Math.max(0, tailCursor--);
                present.remove(result.get(index).id());
                result.set(index, candidate);
            } else {
                result.add(candidate);
            }
            injected++;
        }

        log.debug("Injected {} of {} exploration slots ({} sampled, policy {})",
                injected, slots, exploration.size(), policy);
        return result.size() > targetCount ? new ArrayList<>(result.subList(0, targetCount)) : result;
    }
}
