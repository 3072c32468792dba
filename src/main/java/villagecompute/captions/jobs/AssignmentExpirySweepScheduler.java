package villagecompute.captions.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.services.JobDispatchService;

import java.util.Map;

/**
 * Scheduler for the hourly reservation expiry sweep.
 *
 * <p>
 * <b>Schedule:</b> {@code bandit.assignment.sweep-cron}, quarter past every hour by default
 *
 * <p>
 * <b>Queue:</b> LOW
 *
 * @see AssignmentExpirySweepJobHandler
 */
@ApplicationScoped
public class AssignmentExpirySweepScheduler {

    private static final Logger LOG = Logger.getLogger(AssignmentExpirySweepScheduler.class);

    @Inject
    JobDispatchService jobDispatchService;

    @Scheduled(
            cron = "{bandit.assignment.sweep-cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleExpirySweep() {
        if (jobDispatchService.dispatch(JobType.ASSIGNMENT_EXPIRY_SWEEP, Map.of()).isEmpty()) {
            LOG.info("Skipped scheduled expiry sweep, a run is already in progress");
        }
    }
}
