package io.promptfeed.trend;

import io.promptfeed.config.FeedProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the trend sweep as a JobRunr recurring job on application start-up.
 */
@Service
public class TrendSweepService {

    private static final Logger log = LoggerFactory.getLogger(TrendSweepService.class);
    static final String SWEEP_JOB_ID = "trend-sweep";

    private final JobScheduler jobScheduler;
    private final TrendSweepJob sweepJob;
    private final int intervalMinutes;
    private final boolean enabled;

    public TrendSweepService(JobScheduler jobScheduler, TrendSweepJob sweepJob, FeedProperties properties) {
        this.jobScheduler = jobScheduler;
        this.sweepJob = sweepJob;
        this.intervalMinutes = properties.trend().sweepIntervalMinutes();
        this.enabled = properties.trend().sweepEnabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Trend sweep disabled via configuration");
            return;
        }

        String cronExpression = buildCronExpression(intervalMinutes);
        jobScheduler.<TrendSweepJob>scheduleRecurrently(SWEEP_JOB_ID, cronExpression, x -> x.execute());
        log.info("Trend sweep job registered with cron: {}", cronExpression);
    }

    /**
     * Runs a sweep immediately, outside the schedule.
     */
    public void sweepNow() {
        log.info("Triggering immediate trend sweep");
        sweepJob.execute();
    }

    public void stop() {
        jobScheduler.deleteRecurringJob(SWEEP_JOB_ID);
        log.info("Trend sweep job stopped");
    }

    /**
     * Cron expression for the given interval. Intervals under an hour run on a minute step.
     * Longer intervals are rounded to the nearest whole hour, and a day or more runs daily.
     */
    static String buildCronExpression(int intervalMinutes) {
        if (intervalMinutes <= 0) throw new IllegalArgumentException("Interval must be positive");
        if (intervalMinutes < 60) {
            return "*/%d * * * *".formatted(intervalMinutes);
        }
        long hours = Math.round(intervalMinutes / 60.0);
        if (hours >= 24) {
            return "0 0 * * *";
        }
        return "0 */%d * * *".formatted(hours);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
