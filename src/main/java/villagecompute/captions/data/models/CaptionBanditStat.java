package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decayed performance ledger for one (caption, creator) arm of the bandit.
 *
 * <p>
 * Database mapping: caption_bandit_stats table (unique on caption_id + creator_id)
 * </p>
 *
 * <p>
 * {@code successes} and {@code failures} are real-valued because every feedback run multiplies them by the decay
 * factor before adding new observations. They stay within {@code [0, bandit.feedback.count-cap]}. A missing row is
 * equivalent to the uniform prior Beta(1,1); rows are created on the first observation and never deleted.
 * </p>
 *
 * <p>
 * Bounds invariant: {@code 0 <= confidenceLower <= confidenceUpper <= 1}.
 * </p>
 *
 * @see villagecompute.captions.services.BanditStatService
 * @see villagecompute.captions.services.FeedbackUpdateService
 */
@Entity
@Table(
        name = "caption_bandit_stats",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_caption_bandit_stats_caption_creator",
                columnNames = {"caption_id", "creator_id"}))
public class CaptionBanditStat extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "caption_id",
            nullable = false)
    public Long captionId;

    @Column(
            name = "creator_id",
            nullable = false,
            length = 100)
    public String creatorId;

    @Column(
            nullable = false)
    public double successes;

    @Column(
            nullable = false)
    public double failures;

    @Column(
            name = "total_observations",
            nullable = false)
    public long totalObservations;

    @Column(
            name = "avg_emv",
            nullable = false)
    public double avgEmv;

    @Column(
            name = "avg_conversion_rate",
            nullable = false)
    public double avgConversionRate;

    @Column(
            name = "total_revenue",
            nullable = false)
    public double totalRevenue;

    @Column(
            name = "confidence_lower",
            nullable = false)
    public double confidenceLower;

    @Column(
            name = "confidence_upper",
            nullable = false)
    public double confidenceUpper;

    @Column(
            name = "exploration_bonus",
            nullable = false)
    public double explorationBonus;

    @Column(
            name = "performance_percentile",
            nullable = false)
    public int performancePercentile;

    @Column(
            name = "last_updated",
            nullable = false)
    public Instant lastUpdated;

    /**
     * Finds the stat row for a single arm.
     */
    public static Optional<CaptionBanditStat> findByCaptionAndCreator(Long captionId, String creatorId) {
        return find("captionId = ?1 AND creatorId = ?2", captionId, creatorId).firstResultOptional();
    }

    /**
     * Finds a creator's stats for the given captions. Captions without observations have no row.
     *
     * @param creatorId
     *            creator identifier
     * @param captionIds
     *            captions of interest
     * @return existing stat rows
     */
    public static List<CaptionBanditStat> findForCreator(String creatorId, Collection<Long> captionIds) {
        if (captionIds == null || captionIds.isEmpty()) {
            return List.of();
        }
        return find("creatorId = ?1 AND captionId IN ?2", creatorId, captionIds).list();
    }

    /**
     * Finds every stat row owned by a creator.
     */
    public static List<CaptionBanditStat> findByCreator(String creatorId) {
        return find("creatorId = ?1 ORDER BY captionId", creatorId).list();
    }

    /**
     * Creates an unsaved row at the uniform prior: zero decayed counts, full-width bounds, maximum exploration bonus.
     */
    public static CaptionBanditStat prior(Long captionId, String creatorId) {
        CaptionBanditStat stat = new CaptionBanditStat();
        stat.captionId = captionId;
        stat.creatorId = creatorId;
        stat.successes = 0.0;
        stat.failures = 0.0;
        stat.totalObservations = 0L;
        stat.avgEmv = 0.0;
        stat.avgConversionRate = 0.0;
        stat.totalRevenue = 0.0;
        stat.confidenceLower = 0.0;
        stat.confidenceUpper = 1.0;
        stat.explorationBonus = 1.0;
        stat.performancePercentile = 50;
        stat.lastUpdated = Instant.now();
        return stat;
    }
}
