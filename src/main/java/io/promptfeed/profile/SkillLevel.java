package io.promptfeed.profile;

/**
 * Coarse skill estimate derived from usage volume.
 */
public enum SkillLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    static SkillLevel fromVolume(int volume) {
        if (volume < 5) return BEGINNER;
        if (volume < 25) return INTERMEDIATE;
        return ADVANCED;
    }
}
