package io.promptfeed.profile;

import io.promptfeed.config.FeedProperties;
import io.promptfeed.interaction.InteractionEvent;
import io.promptfeed.interaction.InteractionKind;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregates a user's event log into a {@link UserProfile}.
 *
 * <p>Category affinity is an exponential moving average replayed in timestamp order:
 * {@code affinity = affinity * (1 - alpha) + weight * alpha}, where the weight comes from
 * {@link InteractionKind#affinityWeight()}. Kinds with zero affinity weight (views, shares)
 * and events without a resolved category do not move affinity.</p>
 *
 * <p>Exploration appetite blends the cold-start appetite with the share of known categories
 * the user has touched; the blend leans on history as the log grows.</p>
 */
public class UserProfileBuilder {

    private static final double HISTORY_SCALE = 10.0;

    private final double alpha;
    private final double coldStartAppetite;
    private final int categoryCount;
    private final ZoneId zone;

    public UserProfileBuilder(FeedProperties.Profile config, int categoryCount) {
        this(config, categoryCount, ZoneOffset.UTC);
    }

    public UserProfileBuilder(FeedProperties.Profile config, int categoryCount, ZoneId zone) {
        if (categoryCount < 1) {
            throw new IllegalArgumentException("categoryCount must be >= 1");
        }
        this.alpha = config.affinityAlpha();
        this.coldStartAppetite = config.coldStartExplorationAppetite();
        this.categoryCount = categoryCount;
        this.zone = zone;
    }

    /**
     * Builds a profile from the user's events and category exposures.
     *
     * @param userId    the user
     * @param events    the user's event log, in any order
     * @param exposures category exposure counts from served feeds
     * @return the derived profile; a cold-start profile when {@code events} is empty
     */
    public UserProfile build(String userId, List<InteractionEvent> events, Map<String, Integer> exposures) {
        if (events.isEmpty()) {
            UserProfile cold = UserProfile.coldStart(userId, coldStartAppetite);
            return exposures.isEmpty() ? cold : new UserProfile(userId, Map.of(), exposures, Map.of(),
                    cold.skillLevel(), cold.explorationAppetite(), cold.timePattern());
        }

        List<InteractionEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(InteractionEvent::timestamp));

        Map<String, Double> affinities = new HashMap<>();
        Map<InteractionKind, Integer> counts = new EnumMap<>(InteractionKind.class);
        Map<TimeOfDay, Integer> activeTimes = new EnumMap<>(TimeOfDay.class);
        Set<String> touched = new HashSet<>();

        for (InteractionEvent event : ordered) {
            counts.merge(event.kind(), 1, Integer::sum);
            activeTimes.merge(TimeOfDay.fromHour(event.timestamp().atZone(zone).getHour()), 1, Integer::sum);

            String category = event.category();
            if (category == null) continue;
            touched.add(category);

            double weight = event.kind().affinityWeight();
            if (weight != 0.0) {
                affinities.merge(category, weight * alpha,
                        (current, ignored) -> current * (1.0 - alpha) + weight * alpha);
            }
        }

        int volume = counts.getOrDefault(InteractionKind.USE, 0) + 2 * counts.getOrDefault(InteractionKind.REMIX, 0);

        return new UserProfile(
                userId,
                affinities,
                exposures,
                counts,
                SkillLevel.fromVolume(volume),
                explorationAppetite(ordered.size(), touched.size()),
                dominant(activeTimes)
        );
    }

    double explorationAppetite(int eventCount, int distinctCategories) {
        double coldWeight = 1.0 / (1.0 + eventCount / HISTORY_SCALE);
        double variety = Math.min(1.0, (double) distinctCategories / categoryCount);
        return coldWeight * coldStartAppetite + (1.0 - coldWeight) * variety;
    }

    private static TimeOfDay dominant(Map<TimeOfDay, Integer> activeTimes) {
        TimeOfDay best = TimeOfDay.ANYTIME;
        int bestCount = 0;
        for (Map.Entry<TimeOfDay, Integer> entry : activeTimes.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
