package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import villagecompute.captions.api.types.DeliveryOutcomeType;
import villagecompute.captions.api.types.FeedbackRunResultType;
import villagecompute.captions.config.BanditConfig;
import villagecompute.captions.data.models.CaptionBanditStat;
import villagecompute.captions.data.models.CaptionDeliveryOutcome;
import villagecompute.captions.observability.LoggingConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Folds delivery outcomes into the decayed bandit ledger.
 *
 * <p>
 * <b>Run algorithm:</b>
 * <ol>
 * <li>Take unprocessed outcomes received within {@code bandit.feedback.max-lookback-hours}, at most
 * {@code bandit.feedback.max-batch-size}, oldest first</li>
 * <li>Per creator, compute the median EMV of the trailing {@code bandit.feedback.median-window-days} (outcomes with at
 * least one view)</li>
 * <li>Per (caption, creator): deliveries whose EMV beats the median are successes, the rest failures</li>
 * <li>Decay existing counts by {@code 0.5^(1 / (halfLifeDays × updatesPerDay))}, add the new counts, clamp to
 * {@code [0, countCap]}</li>
 * <li>Refresh Wilson bounds, averages and revenue; decay the creator's other rows; recompute percentiles</li>
 * <li>Mark the outcomes processed</li>
 * </ol>
 *
 * <p>
 * A run is one transaction: either every outcome in the batch is folded in and marked, or none is. Overlapping runs
 * are prevented by {@link JobDispatchService}.
 */
@ApplicationScoped
public class FeedbackUpdateService {

    private static final Logger LOG = Logger.getLogger(FeedbackUpdateService.class);

    @Inject
    BanditConfig banditConfig;

    @Inject
    BanditStatService banditStatService;

    /**
     * Per-run multiplier that halves a count every {@code halfLifeDays} at {@code updatesPerDay} runs a day.
     */
    public double decayFactor(double halfLifeDays, double updatesPerDay) {
        return Math.pow(0.5, 1.0 / (halfLifeDays * updatesPerDay));
    }

    /**
     * Decays a count, adds new observations and clamps the result to {@code [0, cap]}.
     */
    public double applyDecay(double count, double decay, double newObservations, double cap) {
        return Math.min(cap, Math.max(0.0, count * decay + newObservations));
    }

    /**
     * Median of the values; the mean of the middle pair for even sizes, 0 for an empty list.
     */
    public double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
    }

    /**
     * Stores inbound delivery outcomes for the next run.
     *
     * @param events
     *            validated delivery results
     * @param receivedAt
     *            arrival time, used for the run's lookback window
     * @return number of stored outcomes
     */
    @Transactional
    public int recordOutcomes(List<DeliveryOutcomeType> events, Instant receivedAt) {
        for (DeliveryOutcomeType event : events) {
            CaptionDeliveryOutcome outcome = new CaptionDeliveryOutcome();
            outcome.captionId = event.captionId();
            outcome.creatorId = event.creatorId();
            outcome.sentCount = event.sentCount();
            outcome.viewedCount = event.viewedCount();
            outcome.purchasedCount = Math.min(event.purchasedCount(), Math.max(event.viewedCount(), 0));
            outcome.earnings = event.earnings();
            outcome.sentAt = event.sentAt();
            outcome.receivedAt = receivedAt;
            outcome.processed = false;
            if (event.purchasedCount() > event.viewedCount()) {
                LOG.warnf("Outcome for caption %d / creator %s reports %d purchases from %d views, capping",
                        event.captionId(), event.creatorId(), event.purchasedCount(), event.viewedCount());
            }
            outcome.persist();
        }
        LOG.infof("Recorded %d delivery outcomes", events.size());
        return events.size();
    }

    /**
     * Executes one feedback run.
     *
     * @param now
     *            reference instant for lookback windows and timestamps
     * @return run summary
     */
    @Transactional
    public FeedbackRunResultType runUpdate(Instant now) {
        Instant lookback = now.minus(Duration.ofHours(banditConfig.getMaxLookbackHours()));
        List<CaptionDeliveryOutcome> batch = CaptionDeliveryOutcome.findUnprocessed(lookback,
                banditConfig.getMaxBatchSize());
        if (batch.isEmpty()) {
            LOG.debug("No unprocessed delivery outcomes, nothing to fold in");
            return FeedbackRunResultType.empty();
        }

        double decay = decayFactor(banditConfig.getHalfLifeDays(), banditConfig.getUpdatesPerDay());
        Instant medianSince = now.minus(Duration.ofDays(banditConfig.getMedianWindowDays()));

        Map<String, List<CaptionDeliveryOutcome>> byCreator = batch.stream()
                .collect(Collectors.groupingBy(o -> o.creatorId, LinkedHashMap::new, Collectors.toList()));

        int statsUpdated = 0;
        int statsDecayed = 0;
        for (Map.Entry<String, List<CaptionDeliveryOutcome>> creatorEntry : byCreator.entrySet()) {
            String creatorId = creatorEntry.getKey();
            LoggingConfig.setCreatorId(creatorId);
            try {
                double creatorMedian = median(CaptionDeliveryOutcome.findViewedForCreatorSince(creatorId, medianSince)
                        .stream().map(CaptionDeliveryOutcome::emv).toList());

                Map<Long, List<CaptionDeliveryOutcome>> byCaption = creatorEntry.getValue().stream()
                        .collect(Collectors.groupingBy(o -> o.captionId, LinkedHashMap::new, Collectors.toList()));

                Set<UUID> touched = new HashSet<>();
                for (Map.Entry<Long, List<CaptionDeliveryOutcome>> captionEntry : byCaption.entrySet()) {
                    CaptionBanditStat stat = banditStatService.findOrCreate(captionEntry.getKey(), creatorId);
                    foldOutcomes(stat, captionEntry.getValue(), creatorMedian, decay, now);
                    touched.add(stat.id);
                    statsUpdated++;
                }

                for (CaptionBanditStat stat : CaptionBanditStat.findByCreator(creatorId)) {
                    if (touched.contains(stat.id)) {
                        continue;
                    }
                    stat.successes = applyDecay(stat.successes, decay, 0.0, banditConfig.getCountCap());
                    stat.failures = applyDecay(stat.failures, decay, 0.0, banditConfig.getCountCap());
                    banditStatService.refreshBounds(stat, now);
                    statsDecayed++;
                }

                banditStatService.recomputePercentiles(creatorId);
                LOG.debugf("Folded %d outcomes for creator %s (median EMV %.4f, %d captions)",
                        creatorEntry.getValue().size(), creatorId, creatorMedian, byCaption.size());
            } finally {
                MDC.remove(LoggingConfig.MDC_CREATOR_ID);
            }
        }

        CaptionDeliveryOutcome.markProcessed(batch.stream().map(o -> o.id).toList());

        LOG.infof("Feedback run folded %d outcomes: %d stats updated, %d decayed, %d creators", batch.size(),
                statsUpdated, statsDecayed, byCreator.size());
        return new FeedbackRunResultType(batch.size(), statsUpdated, statsDecayed, byCreator.size());
    }

    private void foldOutcomes(CaptionBanditStat stat, List<CaptionDeliveryOutcome> outcomes, double creatorMedian,
            double decay, Instant now) {
        int newSuccesses = 0;
        double emvSum = 0.0;
        double conversionSum = 0.0;
        double revenue = 0.0;
        for (CaptionDeliveryOutcome outcome : outcomes) {
            double emv = outcome.emv();
            if (emv > creatorMedian) {
                newSuccesses++;
            }
            emvSum += emv;
            conversionSum += outcome.sentCount > 0 ? (double) outcome.purchasedCount / outcome.sentCount : 0.0;
            revenue += outcome.earnings;
        }
        int newFailures = outcomes.size() - newSuccesses;

        double cap = banditConfig.getCountCap();
        stat.successes = applyDecay(stat.successes, decay, newSuccesses, cap);
        stat.failures = applyDecay(stat.failures, decay, newFailures, cap);

        long previous = stat.totalObservations;
        long total = previous + outcomes.size();
        stat.avgEmv = (stat.avgEmv * previous + emvSum) / total;
        stat.avgConversionRate = (stat.avgConversionRate * previous + conversionSum) / total;
        stat.totalRevenue += revenue;
        stat.totalObservations = total;

        banditStatService.refreshBounds(stat, now);
    }
}
