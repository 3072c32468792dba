package villagecompute.captions.jobs;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.api.types.FeedbackRunResultType;
import villagecompute.captions.observability.LoggingConfig;
import villagecompute.captions.services.FeedbackUpdateService;

import java.time.Instant;
import java.util.Map;

/**
 * Folds pending delivery outcomes into the decayed bandit ledger.
 *
 * <p>
 * <b>Execution Strategy:</b>
 * <ul>
 * <li>Reads unprocessed outcomes received within {@code bandit.feedback.max-lookback-hours}, capped at
 * {@code bandit.feedback.max-batch-size}</li>
 * <li>Classifies each delivery against the creator's trailing median EMV</li>
 * <li>Decays and updates the success/failure counts, bounds and percentiles</li>
 * <li>Marks the outcomes processed in the same transaction</li>
 * </ul>
 *
 * <p>
 * <b>Metrics Emitted:</b>
 * <ul>
 * <li>captions_feedback_outcomes_processed_total (counter)</li>
 * <li>captions_feedback_stats_updated_total (counter)</li>
 * <li>captions_feedback_duration (timer)</li>
 * </ul>
 *
 * @see FeedbackUpdateScheduler
 * @see FeedbackUpdateService#runUpdate(Instant)
 */
@ApplicationScoped
public class FeedbackUpdateJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(FeedbackUpdateJobHandler.class);

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    FeedbackUpdateService feedbackUpdateService;

    @Override
    public JobType handlesType() {
        return JobType.FEEDBACK_UPDATE;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        LoggingConfig.setJobId(jobId);
        LOG.infof("Starting feedback update job (jobId=%d)", jobId);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            FeedbackRunResultType result = feedbackUpdateService.runUpdate(Instant.now());

            meterRegistry.counter("captions_feedback_outcomes_processed_total").increment(result.outcomesProcessed());
            meterRegistry.counter("captions_feedback_stats_updated_total").increment(result.statsUpdated());

            LOG.infof("Feedback update completed: outcomes=%d, stats_updated=%d, stats_decayed=%d, creators=%d",
                    result.outcomesProcessed(), result.statsUpdated(), result.statsDecayed(),
                    result.creatorsTouched());
        } finally {
            sample.stop(Timer.builder("captions_feedback_duration").register(meterRegistry));
            LoggingConfig.clearMDC();
        }
    }
}
