package io.promptfeed.profile;

/**
 * Part of the day in which a user is most active. {@code ANYTIME} when there is no history.
 */
public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING,
    NIGHT,
    ANYTIME;

    static TimeOfDay fromHour(int hour) {
        if (hour >= 5 && hour < 12) return MORNING;
        if (hour >= 12 && hour < 17) return AFTERNOON;
        if (hour >= 17 && hour < 22) return EVENING;
        return NIGHT;
    }
}
