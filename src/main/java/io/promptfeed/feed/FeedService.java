package io.promptfeed.feed;

import io.promptfeed.category.Categorizer;
import io.promptfeed.config.FeedProperties;
import io.promptfeed.diversity.DiversityFilter;
import io.promptfeed.exploration.ExplorationInjector;
import io.promptfeed.interaction.InteractionEvent;
import io.promptfeed.interaction.InteractionKind;
import io.promptfeed.interaction.InteractionLog;
import io.promptfeed.interaction.InteractionValidator;
import io.promptfeed.profile.UserProfile;
import io.promptfeed.profile.UserProfileBuilder;
import io.promptfeed.scoring.CandidateScorer;
import io.promptfeed.source.ExplorationSource;
import io.promptfeed.source.ItemStore;
import io.promptfeed.source.UpstreamUnavailableException;
import io.promptfeed.trend.TrendTracker;
import io.promptfeed.trend.ViralItemDetectedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Feed orchestrator: the two entry points of the ranking engine.
 *
 * <p>{@link #getFeed} builds the user's profile, scores every candidate from the item store,
 * sorts by score, applies the diversity filter, mixes in exploration items, and records the
 * served items as impressions.</p>
 *
 * <p>{@link #recordInteraction} appends to the user's event log, updates the item's trend
 * momentum, and runs the viral check. Both paths lock per user and per item only.</p>
 */
@Service
public class FeedService {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);
    static final String ITEM_STORE = "item-store";
    static final String EXPLORATION_SOURCE = "exploration-source";

    private final ItemStore itemStore;
    private final ExplorationSource explorationSource;
    private final Categorizer categorizer;
    private final UserProfileBuilder profileBuilder;
    private final CandidateScorer scorer;
    private final DiversityFilter diversityFilter;
    private final ExplorationInjector explorationInjector;
    private final TrendTracker trendTracker;
    private final InteractionLog interactionLog;
    private final InteractionValidator validator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int candidateMultiplier;

    public FeedService(ItemStore itemStore,
                       ExplorationSource explorationSource,
                       Categorizer categorizer,
                       UserProfileBuilder profileBuilder,
                       CandidateScorer scorer,
                       DiversityFilter diversityFilter,
                       ExplorationInjector explorationInjector,
                       TrendTracker trendTracker,
                       InteractionLog interactionLog,
                       InteractionValidator validator,
                       ApplicationEventPublisher eventPublisher,
                       Clock clock,
                       FeedProperties properties) {
        this.itemStore = itemStore;
        this.explorationSource = explorationSource;
        this.categorizer = categorizer;
        this.profileBuilder = profileBuilder;
        this.scorer = scorer;
        this.diversityFilter = diversityFilter;
        this.explorationInjector = explorationInjector;
        this.trendTracker = trendTracker;
        this.interactionLog = interactionLog;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.candidateMultiplier = properties.candidateMultiplier();
    }

    /**
     * Generates a personalized feed.
     *
     * @param userId the requesting user
     * @param count  requested length, at least 1
     * @return ordered items, at most {@code count}
     * @throws UpstreamUnavailableException if the item store or exploration source fails
     * @throws IllegalArgumentException     on invalid input
     */
    public List<CandidateItem> getFeed(String userId, int count) {
        String user = validator.requireId("userId", userId);
        validator.validateCount(count);
        Instant now = clock.instant();

        UserProfile profile = buildProfile(user);
        List<CandidateItem> candidates = callUpstream(ITEM_STORE,
                () -> itemStore.fetchCandidates(user, count * candidateMultiplier));

        Map<String, OptionalDouble> trustByCreator = new HashMap<>();
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (CandidateItem candidate : candidates) {
            CandidateItem snapshot = candidate.withTrendingMomentum(trendTracker.momentum(candidate.id()));
            OptionalDouble trust = trustByCreator.computeIfAbsent(candidate.creatorId(),
                    creator -> callUpstream(ITEM_STORE, () -> itemStore.creatorTrust(creator)));
            Double creatorTrust = trust.isPresent() ? trust.getAsDouble() : null;
            scored.add(new ScoredCandidate(scorer.score(snapshot, profile, creatorTrust, now), snapshot));
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());

        List<CandidateItem> diverse = diversityFilter.filter(scored, count);
        List<CandidateItem> feed = explorationInjector.inject(diverse, count,
                n -> callUpstream(EXPLORATION_SOURCE, () -> explorationSource.sampleHighQuality(n)));

        interactionLog.recordImpressions(user, feed.stream().map(categorizer::categoryOf).toList());

        log.debug("Feed for '{}': {} candidates, {} after diversity, {} served (appetite {})",
                user, candidates.size(), diverse.size(), feed.size(),
                "%.2f".formatted(profile.explorationAppetite()));
        return List.copyOf(feed);
    }

    /**
     * Records a user interaction. Unknown kinds are ignored without touching any state.
     *
     * @param userId   the acting user
     * @param itemId   the item interacted with
     * @param kind     one of view, use, remix, skip, share
     * @param metadata opaque metadata, may be null
     * @throws IllegalArgumentException on invalid ids or oversized metadata
     */
    public void recordInteraction(String userId, String itemId, String kind, Map<String, Object> metadata) {
        String user = validator.requireId("userId", userId);
        String item = validator.requireId("itemId", itemId);
        Map<String, Object> meta = validator.validateMetadata(metadata);

        Optional<InteractionKind> parsed = InteractionKind.fromString(kind);
        if (parsed.isEmpty()) {
            log.debug("Ignoring unknown interaction kind '{}' from '{}' on '{}'", kind, user, item);
            return;
        }
        InteractionKind interactionKind = parsed.get();

        Optional<CandidateItem> snapshot = lookupItem(item);
        String category = snapshot.map(categorizer::categoryOf).orElse(null);

        interactionLog.append(new InteractionEvent(user, item, interactionKind, category, clock.instant(), meta));
        trendTracker.recordEvent(item, interactionKind);

        snapshot.ifPresent(this::checkViral);
        log.debug("Recorded {} by '{}' on '{}' (category {})", interactionKind, user, item, category);
    }

    /**
     * Builds the profile the scorer would use for this user right now.
     */
    public UserProfile buildProfile(String userId) {
        return profileBuilder.build(userId, interactionLog.events(userId), interactionLog.exposures(userId));
    }

    /**
     * Item ids with the highest current momentum.
     */
    public List<String> trending(int limit) {
        return trendTracker.topTrending(limit);
    }

    private void checkViral(CandidateItem item) {
        if (trendTracker.viralCheck(item.id(), item.usageCount(), item.remixCount())) {
            eventPublisher.publishEvent(new ViralItemDetectedEvent(
                    item.id(), item.creatorId(), item.remixRate(), trendTracker.momentum(item.id()), clock.instant()));
        }
    }

    private Optional<CandidateItem> lookupItem(String itemId) {
        try {
            return itemStore.findItem(itemId);
        } catch (RuntimeException e) {
            log.warn("Item lookup for '{}' failed, recording without category or viral check: {}",
                    itemId, e.getMessage());
            return Optional.empty();
        }
    }

    private static <T> T callUpstream(String upstream, Supplier<T> call) {
        try {
            return call.get();
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(upstream, upstream + " unavailable: " + e.getMessage(), e);
        }
    }
}
