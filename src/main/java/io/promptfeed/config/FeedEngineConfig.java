package io.promptfeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.promptfeed.category.Categorizer;
import io.promptfeed.diversity.DiversityFilter;
import io.promptfeed.exploration.ExplorationInjector;
import io.promptfeed.interaction.InteractionLog;
import io.promptfeed.profile.UserProfileBuilder;
import io.promptfeed.scoring.CandidateScorer;
import io.promptfeed.source.InMemoryItemStore;
import io.promptfeed.trend.TrendTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the ranking engine components from {@link FeedProperties}.
 * The shared state stores ({@link InteractionLog}, {@link TrendTracker}) are singletons
 * injected into the orchestrator rather than held as static state.
 */
@Configuration
@EnableConfigurationProperties(FeedProperties.class)
public class FeedEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(FeedEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random explorationRandom() {
        return new Random();
    }

    @Bean
    public InteractionLog interactionLog(FeedProperties properties) {
        return new InteractionLog(properties.profile().maxEventsPerUser());
    }

    @Bean
    public UserProfileBuilder userProfileBuilder(FeedProperties properties, Categorizer categorizer) {
        return new UserProfileBuilder(properties.profile(), categorizer.labels().size());
    }

    @Bean
    public CandidateScorer candidateScorer(FeedProperties properties, Categorizer categorizer) {
        log.info("Candidate scorer weights: {}", properties.scoring().weights());
        return new CandidateScorer(properties.scoring(), categorizer);
    }

    @Bean
    public DiversityFilter diversityFilter(FeedProperties properties, Categorizer categorizer) {
        return new DiversityFilter(properties.diversity(), categorizer);
    }

    @Bean
    public ExplorationInjector explorationInjector(FeedProperties properties, Random explorationRandom) {
        log.info("Exploration policy: {}", properties.exploration().policy());
        return new ExplorationInjector(properties.exploration(), explorationRandom);
    }

    @Bean
    public TrendTracker trendTracker(FeedProperties properties, Clock clock) {
        return new TrendTracker(properties.trend(), clock);
    }

    @Bean
    public InMemoryItemStore inMemoryItemStore(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                               FeedProperties properties, Random explorationRandom) {
        return new InMemoryItemStore(objectMapper, resourceLoader, properties, explorationRandom);
    }
}
