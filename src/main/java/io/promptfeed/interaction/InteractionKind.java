package io.promptfeed.interaction;

import java.util.Optional;

/**
 * Kinds of user interaction with a prompt.
 *
 * <p>Each kind carries two weights: its contribution to an item's trend momentum, and its
 * contribution to the user's category affinity. Views and shares move momentum only.</p>
 */
public enum InteractionKind {
    VIEW(0.1, 0.0),
    USE(0.5, 1.0),
    REMIX(2.0, 2.0),
    SHARE(1.5, 0.0),
    SKIP(-0.3, -0.5);

    private final double trendWeight;
    private final double affinityWeight;

    InteractionKind(double trendWeight, double affinityWeight) {
        this.trendWeight = trendWeight;
        this.affinityWeight = affinityWeight;
    }

    public double trendWeight() {
        return trendWeight;
    }

    public double affinityWeight() {
        return affinityWeight;
    }

    /**
     * Parses a kind name case-insensitively. Unknown or blank names yield empty.
     */
    public static Optional<InteractionKind> fromString(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        return switch (s.trim().toLowerCase()) {
            case "view" -> Optional.of(VIEW);
            case "use" -> Optional.of(USE);
            case "remix" -> Optional.of(REMIX);
            case "share" -> Optional.of(SHARE);
            case "skip" -> Optional.of(SKIP);
            default -> Optional.empty();
        };
    }
}
