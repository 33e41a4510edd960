package io.promptfeed.trend;

import io.promptfeed.config.FeedProperties;
import io.promptfeed.interaction.InteractionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decayed, event-weighted momentum per item, plus viral-crossing detection.
 *
 * <p>Momentum decays as {@code momentum * decayBase ^ (elapsed / decayUnit)}. Decay is applied
 * lazily whenever an entry is recorded or read, using the entry's last-update time, so the
 * tracker needs no background thread. Entries that decay below the eviction epsilon are
 * removed.</p>
 *
 * <p>All updates go through {@link ConcurrentHashMap#compute}, so contention is scoped to
 * the item being touched.</p>
 *
 * <p>Viral detection amplifies an item's momentum once per threshold crossing. The
 * "already amplified" flags live in their own set so that evicting a momentum entry cannot
 * re-arm a crossing; a flag clears only when the item's remix rate falls back to or below
 * the threshold.</p>
 */
public class TrendTracker {

    private static final Logger log = LoggerFactory.getLogger(TrendTracker.class);

    private final Map<String, TrendEntry> entries = new ConcurrentHashMap<>();
    private final Set<String> amplified = ConcurrentHashMap.newKeySet();
    private final FeedProperties.Trend config;
    private final Clock clock;
    private final double unitNanos;

    /**
     * Momentum of one item as of {@code lastUpdated}.
     */
    public record TrendEntry(double momentum, Instant lastUpdated) {
    }

    public TrendTracker(FeedProperties.Trend config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.unitNanos = config.decayUnit().toNanos();
    }

    /**
     * Records an interaction: decays the item's momentum to now, then adds the kind's trend weight.
     * Momentum never drops below zero.
     */
    public void recordEvent(String itemId, InteractionKind kind) {
        Instant now = clock.instant();
        TrendEntry updated = entries.compute(itemId, (id, existing) -> {
            double current = existing == null ? 0.0 : decayed(existing, now);
            double next = Math.max(0.0, current + kind.trendWeight());
            return next < config.evictionEpsilon() ? null : new TrendEntry(next, now);
        });
        if (updated == null) {
            log.debug("Trend entry for '{}' at zero after {}, not tracked", itemId, kind);
        }
    }

    /**
     * Current momentum of an item, decayed to now. Zero for untracked items.
     */
    public double momentum(String itemId) {
        TrendEntry entry = entries.computeIfPresent(itemId, (id, existing) -> decayTo(existing, clock.instant()));
        return entry == null ? 0.0 : entry.momentum();
    }

    /**
     * Checks an item's remix rate against the viral threshold and amplifies its momentum
     * the first time it crosses.
     *
     * @param itemId     the item
     * @param usageCount total uses of the item
     * @param remixCount total remixes of the item
     * @return true only on the call that detected the crossing and amplified the momentum
     */
    public boolean viralCheck(String itemId, long usageCount, long remixCount) {
        double remixRate = usageCount <= 0 ? 0.0 : (double) remixCount / usageCount;

        if (remixRate <= config.viralRemixThreshold()) {
            if (amplified.remove(itemId)) {
                log.debug("Item '{}' fell back under viral threshold ({}), crossing re-armed", itemId, remixRate);
            }
            return false;
        }

        if (amplified.contains(itemId)) {
            return false;
        }

        // The flag is only claimed while an entry exists, so a crossing is never spent on zero momentum.
        Instant now = clock.instant();
        boolean[] fired = {false};
        TrendEntry entry = entries.computeIfPresent(itemId, (id, existing) -> {
            if (!amplified.add(id)) {
                return existing;
            }
            fired[0] = true;
            double boosted = decayed(existing, now) * config.viralAmplification();
            return boosted < config.evictionEpsilon() ? null : new TrendEntry(boosted, now);
        });
        if (!fired[0]) {
            log.debug("Item '{}' over viral threshold but not amplified: no momentum yet or crossing already claimed",
                    itemId);
            return false;
        }
        log.info("Viral threshold crossed for '{}': remix rate {} > {}, momentum now {}",
                itemId, "%.3f".formatted(remixRate), config.viralRemixThreshold(),
                entry == null ? 0.0 : entry.momentum());
        return true;
    }

    /**
     * Whether the item has been amplified for its current crossing.
     */
    public boolean isAmplified(String itemId) {
        return amplified.contains(itemId);
    }

    /**
     * Decays every entry to now and evicts those under the epsilon.
     *
     * @return number of evicted entries
     */
    public int sweep() {
        Instant now = clock.instant();
        int evicted = 0;
        for (String itemId : List.copyOf(entries.keySet())) {
            boolean[] dropped = {false};
            entries.computeIfPresent(itemId, (id, existing) -> {
                TrendEntry next = decayTo(existing, now);
                dropped[0] = next == null;
                return next;
            });
            if (dropped[0]) evicted++;
        }
        log.debug("Trend sweep evicted {} entries, {} remain", evicted, entries.size());
        return evicted;
    }

    /**
     * Item ids with the highest current momentum, strongest first.
     */
    public List<String> topTrending(int limit) {
        if (limit <= 0) return List.of();
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), decayed(e.getValue(), now)))
                .filter(e -> e.getValue() >= config.evictionEpsilon())
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Number of tracked items.
     */
    public int size() {
        return entries.size();
    }

    private TrendEntry decayTo(TrendEntry existing, Instant now) {
        double value = decayed(existing, now);
        if (value < config.evictionEpsilon()) {
            return null;
        }
        if (!now.isAfter(existing.lastUpdated())) {
            return existing;
        }
        return new TrendEntry(value, now);
    }

    private double decayed(TrendEntry entry, Instant now) {
        long elapsed = Duration.between(entry.lastUpdated(), now).toNanos();
        if (elapsed <= 0) {
            return entry.momentum();
        }
        return entry.momentum() * Math.pow(config.decayBase(), elapsed / unitNanos);
    }
}
