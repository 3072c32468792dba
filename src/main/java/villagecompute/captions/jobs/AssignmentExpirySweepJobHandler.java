package villagecompute.captions.jobs;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.observability.LoggingConfig;
import villagecompute.captions.observability.ObservabilityMetrics;
import villagecompute.captions.services.AssignmentLockService;
import villagecompute.captions.services.SweepResult;

import java.time.Instant;
import java.util.Map;

/**
 * Deactivates caption reservations that can no longer be sent and releases their day claims.
 *
 * <p>
 * <b>Execution Strategy:</b>
 * <ul>
 * <li>Assignments whose expiry horizon passed are deactivated with reason EXPIRED</li>
 * <li>Assignments whose claimed cooldown window ended before today are deactivated with reason PAST_SEND_DATE</li>
 * <li>The active-reservation gauge is refreshed from the remaining count</li>
 * </ul>
 *
 * <p>
 * <b>Alerting:</b> a sweep of more than {@value #SWEEP_VOLUME_WARNING} rows, or an active count above
 * {@value #ACTIVE_WARNING}/{@value #ACTIVE_CRITICAL}, is logged for investigation.
 *
 * @see AssignmentExpirySweepScheduler
 */
@ApplicationScoped
public class AssignmentExpirySweepJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(AssignmentExpirySweepJobHandler.class);

    static final int SWEEP_VOLUME_WARNING = 1000;
    static final long ACTIVE_WARNING = 5000;
    static final long ACTIVE_CRITICAL = 10000;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    AssignmentLockService assignmentLockService;

    @Inject
    ObservabilityMetrics metrics;

    @Override
    public JobType handlesType() {
        return JobType.ASSIGNMENT_EXPIRY_SWEEP;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        LoggingConfig.setJobId(jobId);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SweepResult result = assignmentLockService.sweepExpired(Instant.now());

            meterRegistry.counter("captions_assignments_swept_total", "reason", "expired")
                    .increment(result.expired());
            meterRegistry.counter("captions_assignments_swept_total", "reason", "past_send_date")
                    .increment(result.pastSendDate());
            metrics.setActiveAssignments(result.activeRemaining());

            if (result.total() > SWEEP_VOLUME_WARNING) {
                LOG.warnf("Expiry sweep deactivated %d reservations in one run, check the scheduling pipeline",
                        result.total());
            }
            if (result.activeRemaining() > ACTIVE_CRITICAL) {
                LOG.errorf("Active reservations at %d, above the critical threshold of %d", result.activeRemaining(),
                        ACTIVE_CRITICAL);
            } else if (result.activeRemaining() > ACTIVE_WARNING) {
                LOG.warnf("Active reservations at %d, above the warning threshold of %d", result.activeRemaining(),
                        ACTIVE_WARNING);
            }

            LOG.infof("Expiry sweep completed: expired=%d, past_send_date=%d, active=%d", result.expired(),
                    result.pastSendDate(), result.activeRemaining());
        } finally {
            sample.stop(Timer.builder("captions_assignment_sweep_duration").register(meterRegistry));
            LoggingConfig.clearMDC();
        }
    }
}
