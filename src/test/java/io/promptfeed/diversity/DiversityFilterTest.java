package io.promptfeed.diversity;

import io.promptfeed.category.KeywordCategorizer;
import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import io.promptfeed.feed.ScoredCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static io.promptfeed.support.Items.NOW;
import static io.promptfeed.support.Items.item;
import static org.junit.jupiter.api.Assertions.*;

class DiversityFilterTest {

    private DiversityFilter filter;

    @BeforeEach
    void setUp() {
        filter = new DiversityFilter(FeedProperties.defaults().diversity(), new KeywordCategorizer());
    }

    private static List<ScoredCandidate> ranked(CandidateItem... items) {
        List<ScoredCandidate> result = new ArrayList<>();
        double score = items.length;
        for (CandidateItem item : items) {
            result.add(new ScoredCandidate(score--, item));
        }
        return result;
    }

    private static List<String> ids(List<CandidateItem> items) {
        return items.stream().map(CandidateItem::id).toList();
    }

    @Test
    void shouldCapItemsPerCreator() {
        var result = filter.filter(ranked(
                item("a1", "alice", "technical"),
                item("a2", "alice", "creative"),
                item("a3", "alice", "business"),
                item("b1", "bob", "technical")), 10);

        assertEquals(List.of("a1", "a2", "b1"), ids(result));
    }

    @Test
    void shouldCapItemsPerCategory() {
        List<CandidateItem> items = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            items.add(item("t" + i, "creator-" + i, "technical"));
        }
        items.add(item("c0", "creator-x", "creative"));

        var result = filter.filter(ranked(items.toArray(CandidateItem[]::new)), 10);

        assertEquals(List.of("t0", "t1", "t2", "t3", "t4", "c0"), ids(result));
    }

    @Test
    void shouldStopAtTargetCount() {
        var result = filter.filter(ranked(
                item("a", "c1", "technical"),
                item("b", "c2", "creative"),
                item("c", "c3", "business")), 2);

        assertEquals(List.of("a", "b"), ids(result));
    }

    @Test
    void shouldPreserveScoreOrderIncludingTies() {
        var first = item("first", "c1", "technical");
        var second = item("second", "c2", "technical");
        var input = List.of(new ScoredCandidate(0.5, first), new ScoredCandidate(0.5, second));

        assertEquals(List.of("first", "second"), ids(filter.filter(input, 5)));
    }

    @Test
    void shouldReturnEmptyForEmptyInput() {
        assertTrue(filter.filter(List.of(), 10).isEmpty());
    }

    @Test
    void shouldUseTemplateCategoryWhenNoExplicitCategory() {
        var config = new FeedProperties.Diversity(5, 1);
        var strict = new DiversityFilter(config, new KeywordCategorizer());
        var story = new CandidateItem("s1", "c1", "Write a story", null, 0.5, 0, 0, 0, 0, NOW);
        var poem = new CandidateItem("s2", "c2", "Write a poem", null, 0.5, 0, 0, 0, 0, NOW);

        assertEquals(List.of("s1"), ids(strict.filter(ranked(story, poem), 5)));
    }

    @Test
    void shouldNeverExceedCapsOnRandomInput() {
        Random random = new Random(42);
        String[] creators = {"a", "b", "c", "d"};
        String[] categories = {"business", "technical", "creative", "analytical", "general"};

        for (int round = 0; round < 50; round++) {
            List<CandidateItem> items = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                items.add(item("i" + i, creators[random.nextInt(creators.length)],
                        categories[random.nextInt(categories.length)]));
            }
            var result = filter.filter(ranked(items.toArray(CandidateItem[]::new)), 1 + random.nextInt(30));

            Map<String, Integer> perCreator = new HashMap<>();
            Map<String, Integer> perCategory = new HashMap<>();
            for (CandidateItem accepted : result) {
                perCreator.merge(accepted.creatorId(), 1, Integer::sum);
                perCategory.merge(accepted.category(), 1, Integer::sum);
            }
            perCreator.values().forEach(n -> assertTrue(n <= 2));
            perCategory.values().forEach(n -> assertTrue(n <= 5));
        }
    }
}
