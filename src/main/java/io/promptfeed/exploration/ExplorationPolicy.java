package io.promptfeed.exploration;

/**
 * How exploration candidates take positions once the ranked feed already fills the target count.
 *
 * <ul>
 *   <li>{@code RANDOM_OVERWRITE}: each candidate overwrites a uniformly random position.
 *       Lossy: a highly ranked item can be evicted by the draw, trading precision for serendipity.</li>
 *   <li>{@code REPLACE_TAIL}: candidates overwrite the lowest-ranked positions, keeping the head intact.</li>
 * </ul>
 */
public enum ExplorationPolicy {
    RANDOM_OVERWRITE,
    REPLACE_TAIL
}
