package io.promptfeed.interaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user interaction state: an append-only event log plus category exposure counts.
 *
 * <p>Each user's state is guarded by its own lock, so writers for different users never
 * contend. Readers receive copies and may observe a state that is one event behind a
 * concurrent writer.</p>
 *
 * <p>Each log keeps at most {@code maxEventsPerUser} events; appending beyond the limit drops
 * the oldest entries. Exposure counts are never compacted.</p>
 */
public class InteractionLog {

    private static final Logger log = LoggerFactory.getLogger(InteractionLog.class);

    private final Map<String, UserActivity> users = new ConcurrentHashMap<>();
    private final int maxEventsPerUser;

    public InteractionLog(int maxEventsPerUser) {
        if (maxEventsPerUser < 1) {
            throw new IllegalArgumentException("maxEventsPerUser must be >= 1");
        }
        this.maxEventsPerUser = maxEventsPerUser;
    }

    /**
     * Appends an event to its user's log.
     */
    public void append(InteractionEvent event) {
        UserActivity activity = users.computeIfAbsent(event.userId(), id -> new UserActivity());
        synchronized (activity) {
            activity.events.addLast(event);
            int dropped = 0;
            while (activity.events.size() > maxEventsPerUser) {
                activity.events.removeFirst();
                dropped++;
            }
            if (dropped > 0) {
                log.debug("Compacted event log for user '{}': dropped {} oldest events", event.userId(), dropped);
            }
        }
    }

    /**
     * Returns a chronological copy of the user's events. Empty for unknown users.
     */
    public List<InteractionEvent> events(String userId) {
        UserActivity activity = users.get(userId);
        if (activity == null) return List.of();
        synchronized (activity) {
            return List.copyOf(activity.events);
        }
    }

    /**
     * Counts one exposure per category entry (duplicates count once each).
     */
    public void recordImpressions(String userId, Collection<String> categories) {
        if (categories.isEmpty()) return;
        UserActivity activity = users.computeIfAbsent(userId, id -> new UserActivity());
        synchronized (activity) {
            for (String category : categories) {
                activity.exposures.merge(category, 1, Integer::sum);
            }
        }
    }

    /**
     * Returns a copy of the user's exposure count per category.
     */
    public Map<String, Integer> exposures(String userId) {
        UserActivity activity = users.get(userId);
        if (activity == null) return Map.of();
        synchronized (activity) {
            return Map.copyOf(activity.exposures);
        }
    }

    /**
     * Number of users with any recorded state.
     */
    public int userCount() {
        return users.size();
    }

    private static final class UserActivity {
        private final Deque<InteractionEvent> events = new ArrayDeque<>();
        private final Map<String, Integer> exposures = new HashMap<>();
    }
}
