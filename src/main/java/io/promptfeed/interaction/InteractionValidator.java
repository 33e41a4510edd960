package io.promptfeed.interaction;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Validates caller input for the feed entry points.
 */
@Component
public class InteractionValidator {

    static final int MAX_ID_LENGTH = 256;
    static final int MAX_METADATA_ENTRIES = 64;
    static final int MAX_FEED_COUNT = 500;

    /**
     * Validates a user or item identifier.
     *
     * @param field name used in the error message
     * @param id    the identifier
     * @return the trimmed identifier
     * @throws IllegalArgumentException if blank, too long, or containing control characters
     */
    public String requireId(String field, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        String trimmed = id.trim();
        if (trimmed.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                    field + " too long: " + trimmed.length() + " (max " + MAX_ID_LENGTH + ")");
        }
        if (trimmed.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException(field + " must not contain control characters");
        }
        return trimmed;
    }

    /**
     * Validates the requested feed length.
     *
     * @throws IllegalArgumentException if below 1 or above the per-request maximum
     */
    public void validateCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        if (count > MAX_FEED_COUNT) {
            throw new IllegalArgumentException("count too large: " + count + " (max " + MAX_FEED_COUNT + ")");
        }
    }

    /**
     * Validates the metadata size. Null is treated as empty.
     */
    public Map<String, Object> validateMetadata(Map<String, Object> metadata) {
        if (metadata == null) return Map.of();
        if (metadata.size() > MAX_METADATA_ENTRIES) {
            throw new IllegalArgumentException(
                    "Too many metadata entries: " + metadata.size() + " (max " + MAX_METADATA_ENTRIES + ")");
        }
        return metadata;
    }
}
