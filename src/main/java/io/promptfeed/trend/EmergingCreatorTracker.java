package io.promptfeed.trend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers creators who produced at least one viral item.
 */
@Component
public class EmergingCreatorTracker {

    private static final Logger log = LoggerFactory.getLogger(EmergingCreatorTracker.class);

    private final Set<String> creators = ConcurrentHashMap.newKeySet();

    @EventListener
    public void onViralItem(ViralItemDetectedEvent event) {
        if (creators.add(event.creatorId())) {
            log.info("Creator '{}' is emerging: item '{}' went viral", event.creatorId(), event.itemId());
        }
    }

    public boolean isEmerging(String creatorId) {
        return creators.contains(creatorId);
    }

    public Set<String> emergingCreators() {
        return Set.copyOf(creators);
    }
}
