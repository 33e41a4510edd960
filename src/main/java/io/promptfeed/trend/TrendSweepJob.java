package io.promptfeed.trend;

import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recurring JobRunr job that evicts decayed trend entries, so items that stop receiving
 * events do not linger in the momentum map.
 */
@Component
public class TrendSweepJob {

    private static final Logger log = LoggerFactory.getLogger(TrendSweepJob.class);

    private final TrendTracker trendTracker;

    public TrendSweepJob(TrendTracker trendTracker) {
        this.trendTracker = trendTracker;
    }

    @Job(name = "Trend sweep")
    public void execute() {
        int evicted = trendTracker.sweep();
        if (evicted > 0) {
            log.info("Trend sweep evicted {} decayed entries ({} tracked)", evicted, trendTracker.size());
        }
    }
}
