package villagecompute.captions.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.services.JobDispatchService;

import java.util.Map;

/**
 * Scheduler for the periodic bandit feedback update.
 *
 * <p>
 * <b>Schedule:</b> {@code bandit.feedback.cron}, every 6 hours by default
 *
 * <p>
 * <b>Queue:</b> DEFAULT
 *
 * <p>
 * Overlapping triggers are skipped, both by the scheduler and by the dispatcher's per-type guard, which also covers
 * runs started from the admin API.
 *
 * @see FeedbackUpdateJobHandler
 * @see JobType#FEEDBACK_UPDATE
 */
@ApplicationScoped
public class FeedbackUpdateScheduler {

    private static final Logger LOG = Logger.getLogger(FeedbackUpdateScheduler.class);

    @Inject
    JobDispatchService jobDispatchService;

    @Scheduled(
            cron = "{bandit.feedback.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleFeedbackUpdate() {
        if (jobDispatchService.dispatch(JobType.FEEDBACK_UPDATE, Map.of()).isEmpty()) {
            LOG.info("Skipped scheduled feedback update, a run is already in progress");
        }
    }
}
