package io.promptfeed.profile;

import io.promptfeed.interaction.InteractionKind;

import java.util.Map;

/**
 * A user's derived preferences, built fresh from the event log for every feed request.
 *
 * @param userId              the user
 * @param categoryAffinities  category to EMA affinity; may be negative
 * @param categoryExposures   category to number of items of that category already served
 * @param interactionCounts   events per interaction kind
 * @param skillLevel          estimate from usage volume
 * @param explorationAppetite appetite for unfamiliar content in [0,1]
 * @param timePattern         most active part of the day
 */
public record UserProfile(
        String userId,
        Map<String, Double> categoryAffinities,
        Map<String, Integer> categoryExposures,
        Map<InteractionKind, Integer> interactionCounts,
        SkillLevel skillLevel,
        double explorationAppetite,
        TimeOfDay timePattern
) {
    public UserProfile {
        categoryAffinities = categoryAffinities == null ? Map.of() : Map.copyOf(categoryAffinities);
        categoryExposures = categoryExposures == null ? Map.of() : Map.copyOf(categoryExposures);
        interactionCounts = interactionCounts == null ? Map.of() : Map.copyOf(interactionCounts);
        if (skillLevel == null) skillLevel = SkillLevel.BEGINNER;
        if (timePattern == null) timePattern = TimeOfDay.ANYTIME;
        explorationAppetite = Math.max(0.0, Math.min(1.0, explorationAppetite));
    }

    /**
     * Profile of a user with no recorded history.
     */
    public static UserProfile coldStart(String userId, double explorationAppetite) {
        return new UserProfile(userId, Map.of(), Map.of(), Map.of(),
                SkillLevel.BEGINNER, explorationAppetite, TimeOfDay.ANYTIME);
    }

    public double affinity(String category) {
        return categoryAffinities.getOrDefault(category, 0.0);
    }

    public int exposures(String category) {
        return categoryExposures.getOrDefault(category, 0);
    }

    public int totalInteractions() {
        return interactionCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
