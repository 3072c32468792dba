package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.LocalDate;
import java.util.Collection;
import java.util.UUID;

/**
 * One calendar day held by an active assignment.
 *
 * <p>
 * Database mapping: caption_day_claims table (unique on caption_id + claim_date)
 * </p>
 *
 * <p>
 * An assignment on date D claims D through D + cooldown. Two assignments of the same caption conflict exactly when
 * their dates are within the cooldown of each other, which is exactly when their claim ranges share a day. The unique
 * index therefore rejects the second writer inside the database, with no prior read.
 * </p>
 */
@Entity
@Table(
        name = "caption_day_claims",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_caption_day_claims_caption_date",
                columnNames = {"caption_id", "claim_date"}))
public class CaptionDayClaim extends PanacheEntityBase {

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
            name = "claim_date",
            nullable = false)
    public LocalDate claimDate;

    @Column(
            name = "assignment_id",
            nullable = false)
    public UUID assignmentId;

    public static CaptionDayClaim of(Long captionId, LocalDate claimDate, UUID assignmentId) {
        CaptionDayClaim claim = new CaptionDayClaim();
        claim.captionId = captionId;
        claim.claimDate = claimDate;
        claim.assignmentId = assignmentId;
        return claim;
    }

    public static long deleteByAssignmentIds(Collection<UUID> assignmentIds) {
        if (assignmentIds == null || assignmentIds.isEmpty()) {
            return 0L;
        }
        return delete("assignmentId IN ?1", assignmentIds);
    }

    public static long countForCaption(Long captionId) {
        return count("captionId = ?1", captionId);
    }
}
