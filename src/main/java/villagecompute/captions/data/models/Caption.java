package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Caption entity representing one piece of promotional message content in the shared caption pool.
 *
 * <p>
 * Database mapping: captions table
 * </p>
 *
 * <p>
 * Captions are written by the ingestion pipeline and are read-only to the selection engine. The
 * {@code excludedCreatorIds} column holds raw restriction text as ingested (a JSON array or a comma separated list of
 * creator ids). It is parsed leniently by {@code CandidateFilterService}; unreadable values mean "no restriction".
 * </p>
 *
 * @see CaptionBanditStat
 * @see ActiveAssignment
 */
@Entity
@Table(
        name = "captions")
public class Caption extends PanacheEntityBase {

    public static final String QUERY_FIND_ACTIVE = "active = true ORDER BY id";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            name = "caption_text",
            nullable = false,
            length = 4000)
    public String text;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "price_tier",
            nullable = false,
            length = 20)
    public PriceTier priceTier;

    @Column(
            name = "content_category",
            nullable = false,
            length = 100)
    public String category;

    @Column(
            name = "trigger_tag",
            length = 50)
    public String triggerTag;

    @Column(
            nullable = false)
    public boolean active;

    @Column(
            name = "excluded_creator_ids",
            length = 4000)
    public String excludedCreatorIds;

    /**
     * Average revenue observed for this caption during ingestion, used as the expected monetary value before any
     * per-creator observations exist.
     */
    @Column(
            name = "avg_revenue",
            precision = 12,
            scale = 2)
    public BigDecimal avgRevenue;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Finds all active captions ordered by id.
     *
     * @return active captions
     */
    public static List<Caption> findActive() {
        return find(QUERY_FIND_ACTIVE).list();
    }

    /**
     * Finds captions by id, in no particular order. Missing ids are silently absent from the result.
     *
     * @param ids
     *            caption ids
     * @return the captions that exist
     */
    public static List<Caption> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return find("id IN ?1", ids).list();
    }

    /**
     * Creates and persists a new active caption. Must be called within a transaction.
     *
     * @param text
     *            caption text
     * @param priceTier
     *            price tier of the promoted offer
     * @param category
     *            content category
     * @param triggerTag
     *            psychological trigger tag, or null when untagged
     * @return the persisted caption
     */
    public static Caption create(String text, PriceTier priceTier, String category, String triggerTag) {
        Caption caption = new Caption();
        caption.text = text;
        caption.priceTier = priceTier;
        caption.category = category;
        caption.triggerTag = triggerTag;
        caption.active = true;
        caption.createdAt = Instant.now();
        caption.persist();
        return caption;
    }
}
