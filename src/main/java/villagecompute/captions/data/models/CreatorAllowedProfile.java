package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-creator allow-list of content categories and price tiers.
 *
 * <p>
 * Database mapping: creator_allowed_profiles table
 * </p>
 *
 * <p>
 * A blank list allows everything; a non-empty list keeps only captions whose category (or tier) it names, compared
 * case-insensitively. The allow-list is applied before the hard restrictions of {@link CreatorRestriction}. Rows are
 * versioned: a creator may have several, and the most recently updated active row wins.
 * </p>
 */
@Entity
@Table(
        name = "creator_allowed_profiles",
        indexes = @Index(
                name = "idx_allowed_profiles_creator",
                columnList = "creator_id, active"))
public class CreatorAllowedProfile extends PanacheEntityBase {

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
            name = "allowed_categories",
            length = 4000)
    public String allowedCategories;

    @Column(
            name = "allowed_price_tiers",
            length = 1000)
    public String allowedPriceTiers;

    @Column(
            nullable = false)
    public boolean active;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "updated_by",
            length = 100)
    public String updatedBy;

    @Column(
            length = 2000)
    public String notes;

    public static Optional<CreatorAllowedProfile> findLatestActiveForCreator(String creatorId) {
        return find("creatorId = ?1 AND active = true ORDER BY updatedAt DESC", creatorId).firstResultOptional();
    }
}
