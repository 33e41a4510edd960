package io.promptfeed.interaction;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single recorded interaction. Immutable once appended to a user's log.
 *
 * @param userId    the acting user
 * @param itemId    the prompt interacted with
 * @param kind      interaction kind
 * @param category  category of the item at record time, or null when it could not be resolved
 * @param timestamp when the interaction happened
 * @param metadata  opaque caller-supplied metadata
 */
public record InteractionEvent(
        String userId,
        String itemId,
        InteractionKind kind,
        String category,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public InteractionEvent {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
