package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Delivery result of a caption sent by a creator, as reported by the messaging pipeline.
 *
 * <p>
 * Database mapping: caption_delivery_outcomes table
 * </p>
 *
 * <p>
 * Outcomes are appended by {@code POST /api/captions/feedback} and folded into {@link CaptionBanditStat} by the
 * feedback job, which then flips {@code processed}. Processed rows stay available as the trailing window for the
 * creator's median EMV.
 * </p>
 */
@Entity
@Table(
        name = "caption_delivery_outcomes",
        indexes = {@Index(
                name = "idx_outcomes_unprocessed",
                columnList = "processed, received_at"),
                @Index(
                        name = "idx_outcomes_creator_sent",
                        columnList = "creator_id, sent_at")})
public class CaptionDeliveryOutcome extends PanacheEntityBase {

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
            name = "sent_count",
            nullable = false)
    public int sentCount;

    @Column(
            name = "viewed_count",
            nullable = false)
    public int viewedCount;

    @Column(
            name = "purchased_count",
            nullable = false)
    public int purchasedCount;

    @Column(
            nullable = false)
    public double earnings;

    @Column(
            name = "sent_at",
            nullable = false)
    public Instant sentAt;

    @Column(
            name = "received_at",
            nullable = false)
    public Instant receivedAt;

    @Column(
            nullable = false)
    public boolean processed;

    /**
     * Expected monetary value of this delivery: {@code purchased / viewed * earnings}. Zero when nothing was viewed.
     */
    public double emv() {
        if (viewedCount <= 0) {
            return 0.0;
        }
        return ((double) purchasedCount / viewedCount) * earnings;
    }

    /**
     * Finds unprocessed outcomes received since the given instant, oldest first.
     *
     * @param receivedSince
     *            lookback boundary
     * @param limit
     *            maximum rows returned
     * @return outcomes awaiting a feedback run
     */
    public static List<CaptionDeliveryOutcome> findUnprocessed(Instant receivedSince, int limit) {
        return find("processed = false AND receivedAt >= ?1 ORDER BY receivedAt, id", receivedSince).page(0, limit)
                .list();
    }

    /**
     * Finds a creator's outcomes with at least one view, sent since the given instant.
     */
    public static List<CaptionDeliveryOutcome> findViewedForCreatorSince(String creatorId, Instant sentSince) {
        return find("creatorId = ?1 AND sentAt >= ?2 AND viewedCount > 0", creatorId, sentSince).list();
    }

    public static long markProcessed(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0L;
        }
        return update("processed = true WHERE id IN ?1", ids);
    }

    public static long countUnprocessed() {
        return count("processed = false");
    }
}
