package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Audit record of a caption removed or penalised by a creator restriction rule during one selection request.
 *
 * <p>
 * Database mapping: caption_filter_audit_log table
 * </p>
 */
@Entity
@Table(
        name = "caption_filter_audit_log",
        indexes = @Index(
                name = "idx_filter_audit_creator",
                columnList = "creator_id, filtered_at"))
public class CaptionFilterAuditLog extends PanacheEntityBase {

    public enum RuleType {
        NOT_ALLOWED_CATEGORY, NOT_ALLOWED_PRICE_TIER, CATEGORY, PRICE_TIER, PATTERN_HARD, PATTERN_SOFT, CREATOR_EXCLUDED
    }

    public enum Enforcement {
        HARD, SOFT
    }

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "creator_id",
            nullable = false,
            length = 100)
    public String creatorId;

    @Column(
            name = "request_id",
            nullable = false)
    public UUID requestId;

    @Column(
            name = "caption_id",
            nullable = false)
    public Long captionId;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "rule_type",
            nullable = false,
            length = 30)
    public RuleType ruleType;

    @Column(
            name = "rule_value",
            length = 1000)
    public String ruleValue;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 10)
    public Enforcement enforcement;

    @Column(
            name = "pool_size_before",
            nullable = false)
    public int poolSizeBefore;

    @Column(
            name = "pool_size_after",
            nullable = false)
    public int poolSizeAfter;

    @Column(
            name = "filtered_at",
            nullable = false)
    public Instant filteredAt;

    public static List<CaptionFilterAuditLog> findByRequest(UUID requestId) {
        return find("requestId = ?1 ORDER BY captionId", requestId).list();
    }
}
