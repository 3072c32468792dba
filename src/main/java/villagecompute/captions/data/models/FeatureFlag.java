package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Optional;

/**
 * Operator-controlled kill switch.
 *
 * <p>
 * Database mapping: feature_flags table
 * </p>
 *
 * <p>
 * Flags are read on every request, so flipping {@code enabled} takes effect without a restart. A missing row means the
 * configured default applies.
 * </p>
 */
@Entity
@Table(
        name = "feature_flags")
public class FeatureFlag extends PanacheEntityBase {

    /** Master switch for creator allow-lists and restriction profiles. */
    public static final String CAPTION_RESTRICTIONS_ENABLED = "caption_restrictions_enabled";

    @Id
    @Column(
            name = "flag_key",
            nullable = false,
            length = 100)
    public String flagKey;

    @Column(
            nullable = false)
    public boolean enabled;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt = Instant.now();

    @Column(
            name = "updated_by",
            length = 100)
    public String updatedBy;

    public static Optional<FeatureFlag> findByKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return find("flagKey = ?1", key).firstResultOptional();
    }

    /**
     * Creates or updates a flag. Must be called within a transaction.
     */
    public static FeatureFlag set(String key, boolean enabled, String updatedBy) {
        FeatureFlag flag = findByKey(key).orElseGet(() -> {
            FeatureFlag created = new FeatureFlag();
            created.flagKey = key;
            return created;
        });
        flag.enabled = enabled;
        flag.updatedAt = Instant.now();
        flag.updatedBy = updatedBy;
        flag.persist();
        return flag;
    }
}
