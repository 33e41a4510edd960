package io.promptfeed.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.promptfeed.config.FeedProperties;
import io.promptfeed.feed.CandidateItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process item store and exploration pool, optionally seeded from a JSON catalog.
 *
 * <p>Catalog format:</p>
 * <pre>
 * {
 *   "creators": { "alice": 0.9 },
 *   "items": [
 *     { "id": "p1", "creatorId": "alice", "template": "Write a story about {topic}",
 *       "effectivenessScore": 0.8, "usageCount": 120, "remixCount": 14,
 *       "uniqueUserCount": 90, "createdAt": "2026-10-01T09:00:00Z" }
 *   ]
 * }
 * </pre>
 *
 * <p>Candidates are served by descending effectiveness. Exploration samples are drawn
 * uniformly from items at or above the quality floor.</p>
 */
public class InMemoryItemStore implements ItemStore, ExplorationSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryItemStore.class);
    static final double QUALITY_FLOOR = 0.7;

    /**
     * JSON shape of a seed catalog.
     */
    public record Catalog(Map<String, Double> creators, List<CandidateItem> items) {
        public Catalog {
            if (creators == null) creators = Map.of();
            if (items == null) items = List.of();
        }
    }

    private final Map<String, CandidateItem> items = new ConcurrentHashMap<>();
    private final Map<String, Double> creatorTrust = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String catalogPath;
    private final Random random;

    public InMemoryItemStore(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                             FeedProperties properties, Random random) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.catalogPath = properties.catalog().path();
        this.random = random;
    }

    @PostConstruct
    public void init() {
        if (catalogPath.isBlank()) {
            log.info("No seed catalog configured, item store starts empty");
            return;
        }
        Resource resource = resourceLoader.getResource(catalogPath);
        if (!resource.exists()) {
            log.warn("Seed catalog not found at {}, item store starts empty", catalogPath);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            load(objectMapper.readValue(in, Catalog.class));
            log.info("Loaded seed catalog from {}: {} items, {} creators", catalogPath, items.size(), creatorTrust.size());
        } catch (IOException e) {
            log.error("Failed to load seed catalog from {}", catalogPath, e);
            throw new IllegalStateException("Seed catalog could not be loaded: " + catalogPath, e);
        }
    }

    public void load(Catalog catalog) {
        catalog.items().forEach(this::put);
        catalog.creators().forEach(this::setCreatorTrust);
    }

    public void put(CandidateItem item) {
        items.put(item.id(), item);
    }

    public void setCreatorTrust(String creatorId, double trust) {
        creatorTrust.put(creatorId, Math.max(0.0, Math.min(1.0, trust)));
    }

    @Override
    public List<CandidateItem> fetchCandidates(String userId, int limit) {
        if (limit <= 0) return List.of();
        return items.values().stream()
                .sorted(Comparator.comparingDouble(CandidateItem::effectivenessScore).reversed()
                        .thenComparing(CandidateItem::id))
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<CandidateItem> findItem(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public OptionalDouble creatorTrust(String creatorId) {
        Double trust = creatorTrust.get(creatorId);
        return trust == null ? OptionalDouble.empty() : OptionalDouble.of(trust);
    }

    @Override
    public List<CandidateItem> sampleHighQuality(int n) {
        if (n <= 0) return List.of();
        List<CandidateItem> pool = new ArrayList<>();
        for (CandidateItem item : items.values()) {
            if (item.effectivenessScore() >= QUALITY_FLOOR) {
                pool.add(item);
            }
        }
        pool.sort(Comparator.comparing(CandidateItem::id));
        synchronized (random) {
            Collections.shuffle(pool, random);
        }
        return List.copyOf(pool.subList(0, Math.min(n, pool.size())));
    }

    public int size() {
        return items.size();
    }
}
