package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-creator content restriction profile.
 *
 * <p>
 * Database mapping: creator_caption_restrictions table
 * </p>
 *
 * <p>
 * All list columns hold raw text as entered by account managers: a JSON array or a comma separated list. Hard patterns
 * are case-insensitive regular expressions that exclude a caption; soft patterns only lower its score. Entries that
 * cannot be parsed or compiled are skipped by {@code CandidateFilterService} and never block selection.
 * </p>
 */
@Entity
@Table(
        name = "creator_caption_restrictions")
public class CreatorRestriction extends PanacheEntityBase {

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "creator_id",
            nullable = false,
            unique = true,
            length = 100)
    public String creatorId;

    @Column(
            name = "hard_patterns",
            length = 4000)
    public String hardPatterns;

    @Column(
            name = "soft_patterns",
            length = 4000)
    public String softPatterns;

    @Column(
            name = "restricted_categories",
            length = 4000)
    public String restrictedCategories;

    @Column(
            name = "restricted_price_tiers",
            length = 1000)
    public String restrictedPriceTiers;

    @Column(
            nullable = false)
    public boolean active;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static Optional<CreatorRestriction> findActiveForCreator(String creatorId) {
        return find("creatorId = ?1 AND active = true", creatorId).firstResultOptional();
    }
}
