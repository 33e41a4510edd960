package io.promptfeed.exploration;

import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import io.promptfeed.source.ExplorationSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static io.promptfeed.support.Items.item;
import static org.junit.jupiter.api.Assertions.*;

class ExplorationInjectorTest {

    private static ExplorationInjector injector(ExplorationPolicy policy) {
        return new ExplorationInjector(new FeedProperties.Exploration(null, null, policy), new Random(7));
    }

    private static List<CandidateItem> ranked(int n) {
        List<CandidateItem> items = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            items.add(item("r" + i, "creator-" + i, "technical"));
        }
        return items;
    }

    private static ExplorationSource pool(int size) {
        return n -> {
            List<CandidateItem> items = new ArrayList<>();
            for (int i = 0; i < Math.min(n, size); i++) {
                items.add(item("x" + i, "curator", "general", 0.9));
            }
            return items;
        };
    }

    private static long explorationCount(List<CandidateItem> feed) {
        return feed.stream().filter(i -> i.id().startsWith("x")).count();
    }

    @Test
    void shouldComputeSlotCount() {
        var injector = injector(ExplorationPolicy.RANDOM_OVERWRITE);

        assertEquals(2, injector.slotCount(1));
        assertEquals(2, injector.slotCount(10));
        assertEquals(2, injector.slotCount(20));
        assertEquals(3, injector.slotCount(25));
        assertEquals(3, injector.slotCount(30));
        assertEquals(10, injector.slotCount(100));
    }

    @Test
    void shouldMatchSlotFormulaForAllTargets() {
        var injector = injector(ExplorationPolicy.RANDOM_OVERWRITE);
        for (int target = 1; target <= 300; target++) {
            assertEquals(Math.max(2, Math.round(0.1 * target)), injector.slotCount(target));
        }
    }

    @Test
    void shouldAppendWhenFeedIsShort() {
        var result = injector(ExplorationPolicy.RANDOM_OVERWRITE).inject(ranked(5), 10, pool(10));

        assertEquals(7, result.size());
        assertEquals(List.of("r0", "r1", "r2", "r3", "r4", "x0", "x1"),
                result.stream().map(CandidateItem::id).toList());
    }

    @Test
    void shouldOverwriteRandomPositionsWhenFull() {
        var feed = ranked(20);

        var result = injector(ExplorationPolicy.RANDOM_OVERWRITE).inject(feed, 20, pool(10));

        assertEquals(20, result.size());
        assertTrue(explorationCount(result) >= 1);
        assertTrue(explorationCount(result) <= 2);
        assertEquals(20, feed.size(), "input feed must not be modified");
        assertEquals("r0", feed.get(0).id());
    }

    @Test
    void shouldReplaceTailWhenConfigured() {
        var result = injector(ExplorationPolicy.REPLACE_TAIL).inject(ranked(20), 20, pool(10));

        assertEquals(20, result.size());
        assertEquals("r17", result.get(17).id());
        assertEquals("x1", result.get(18).id());
        assertEquals("x0", result.get(19).id());
        assertEquals("r0", result.get(0).id());
    }

    @Test
    void shouldFillUpThenOverwrite() {
        var result = injector(ExplorationPolicy.REPLACE_TAIL).inject(ranked(19), 20, pool(10));

        assertEquals(20, result.size());
        assertEquals("x0", result.get(19).id());
        assertEquals("x1", result.get(18).id());
    }

    @Test
    void shouldNeverExceedTargetCount() {
        var result = injector(ExplorationPolicy.RANDOM_OVERWRITE).inject(ranked(30), 20, pool(10));

        assertEquals(20, result.size());
    }

    @Test
    void shouldHandleEmptyExplorationPool() {
        var result = injector(ExplorationPolicy.RANDOM_OVERWRITE).inject(ranked(3), 10, pool(0));

        assertEquals(3, result.size());
    }

    @Test
    void shouldSkipExplorationItemsAlreadyInFeed() {
        var feed = List.of(item("x0", "curator", "general"));

        var result = injector(ExplorationPolicy.RANDOM_OVERWRITE).inject(feed, 10, pool(2));

        assertEquals(List.of("x0", "x1"), result.stream().map(CandidateItem::id).toList());
    }

    @Test
    void shouldRequestExactlySlotCountFromSource() {
        List<Integer> requested = new ArrayList<>();
        ExplorationSource recording = n -> {
            requested.add(n);
            return List.of();
        };

        injector(ExplorationPolicy.RANDOM_OVERWRITE).inject(ranked(5), 40, recording);

        assertEquals(List.of(4), requested);
    }
}
