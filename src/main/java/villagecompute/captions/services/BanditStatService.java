package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.config.BanditConfig;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionBanditStat;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read and write access to the per (caption, creator) bandit ledger.
 *
 * <p>
 * Selection only reads committed rows; the feedback job is the only writer. A caption without a row for the creator is
 * scored at the uniform prior with a cold-start EMV estimate.
 */
@ApplicationScoped
public class BanditStatService {

    private static final Logger LOG = Logger.getLogger(BanditStatService.class);

    @Inject
    BanditConfig banditConfig;

    @Inject
    WilsonScoreService wilsonScoreService;

    /**
     * Loads a creator's stats for the given captions, keyed by caption id.
     */
    public Map<Long, CaptionBanditStat> loadStats(String creatorId, Collection<Long> captionIds) {
        return CaptionBanditStat.findForCreator(creatorId, captionIds).stream()
                .collect(Collectors.toMap(s -> s.captionId, Function.identity()));
    }

    /**
     * Returns the expected monetary value of sending a caption.
     *
     * <p>
     * Observed arms use their average EMV. Unobserved arms use the caption's ingested average revenue, or failing
     * that the tier's typical price times the cold-start conversion rate.
     *
     * @param stat
     *            the creator's stat row, or null
     * @param caption
     *            the caption
     * @return EMV in currency units
     */
    public double expectedValue(CaptionBanditStat stat, Caption caption) {
        if (stat != null && stat.totalObservations > 0) {
            return stat.avgEmv;
        }
        if (caption.avgRevenue != null) {
            return caption.avgRevenue.doubleValue();
        }
        return banditConfig.priceBaseFor(caption.priceTier) * banditConfig.getColdStartConversion();
    }

    /**
     * Finds the stat row of an arm, creating and persisting one at the prior when absent. Must be called within a
     * transaction.
     */
    public CaptionBanditStat findOrCreate(Long captionId, String creatorId) {
        return CaptionBanditStat.findByCaptionAndCreator(captionId, creatorId).orElseGet(() -> {
            CaptionBanditStat stat = CaptionBanditStat.prior(captionId, creatorId);
            stat.persist();
            LOG.debugf("Created bandit stat for caption %d, creator %s", captionId, creatorId);
            return stat;
        });
    }

    /**
     * Recomputes the Wilson bounds and exploration bonus of a row from its current counts.
     */
    public void refreshBounds(CaptionBanditStat stat, Instant now) {
        WilsonBounds bounds = wilsonScoreService.calculateBounds(stat.successes, stat.failures,
                banditConfig.getConfidenceLevel());
        stat.confidenceLower = bounds.lower();
        stat.confidenceUpper = bounds.upper();
        stat.explorationBonus = bounds.explorationBonus();
        stat.lastUpdated = now;
    }

    /**
     * Reassigns each of the creator's rows its percentile rank of average EMV, {@code PERCENT_RANK × 100}. Tied rows
     * share the lowest rank. A creator with a single row gets 0. Must be called within a transaction.
     *
     * @param creatorId
     *            creator whose rows are ranked
     * @return rows ranked
     */
    public int recomputePercentiles(String creatorId) {
        List<CaptionBanditStat> stats = CaptionBanditStat.findByCreator(creatorId);
        stats.sort(Comparator.comparingDouble(s -> s.avgEmv));

        int n = stats.size();
        int rank = 0;
        for (int i = 0; i < n; i++) {
            if (i == 0 || stats.get(i).avgEmv != stats.get(i - 1).avgEmv) {
                rank = i;
            }
            stats.get(i).performancePercentile = n <= 1 ? 0 : (int) Math.round(100.0 * rank / (n - 1));
        }
        return n;
    }
}
