package io.promptfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PromptFeed: personalized prompt feed ranking with trend and viral detection.
 * Exposes {@link io.promptfeed.feed.FeedService} as the entry point for embedding callers.
 */
@SpringBootApplication
public class PromptFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptFeedApplication.class, args);
    }
}
