package io.promptfeed.category;

import io.promptfeed.feed.CandidateItem;

import java.util.Set;

/**
 * Maps prompt templates to one of a fixed set of category labels.
 * Implementations must be pure: the same template always yields the same label.
 */
public interface Categorizer {

    String GENERAL = "general";

    /**
     * Categorizes a raw template. Unmatched or empty input yields {@link #GENERAL}.
     */
    String categorize(String template);

    /**
     * The complete label set this categorizer can return, {@link #GENERAL} included.
     */
    Set<String> labels();

    /**
     * The item's explicit category when present, otherwise the category of its template.
     */
    default String categoryOf(CandidateItem item) {
        String explicit = item.category();
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim().toLowerCase();
        }
        return categorize(item.template());
    }
}
