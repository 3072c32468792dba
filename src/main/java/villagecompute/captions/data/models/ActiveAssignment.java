package villagecompute.captions.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Reservation of a caption for one creator's scheduled delivery slot.
 *
 * <p>
 * Database mapping: active_caption_assignments table
 * </p>
 *
 * <p>
 * System-wide invariant: for a caption, no two active assignments exist whose scheduled dates are within the cooldown
 * window of each other, regardless of creator. The invariant is enforced by the {@link CaptionDayClaim} unique index,
 * not by queries against this table.
 * </p>
 *
 * <p>
 * Lifecycle:
 * <ul>
 * <li>created active by {@code AssignmentLockService.lock}</li>
 * <li>active → inactive with reason EXPIRED or PAST_SEND_DATE by the hourly sweep</li>
 * <li>active → inactive with reason CANCELLED when the owning schedule is cancelled</li>
 * </ul>
 * Rows are retained after deactivation and feed the creator's diversity window and trigger budget. Only
 * {@link #activeKey} is unique, and it is cleared on deactivation, so a released (creator, caption, date, hour) tuple
 * can be reserved again.
 *
 * @see CaptionDayClaim
 */
@Entity
@Table(
        name = "active_caption_assignments",
        indexes = {@Index(
                name = "idx_assignments_creator_date",
                columnList = "creator_id, scheduled_date"),
                @Index(
                        name = "idx_assignments_schedule",
                        columnList = "schedule_id"),
                @Index(
                        name = "idx_assignments_key",
                        columnList = "assignment_key")})
public class ActiveAssignment extends PanacheEntityBase {

    /** Why an assignment stopped holding its caption. */
    public enum DeactivationReason {
        EXPIRED, PAST_SEND_DATE, CANCELLED
    }

    private static final String NOT_CANCELLED = "(deactivationReason IS NULL OR deactivationReason <> ?%d)";

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
            name = "schedule_id",
            nullable = false,
            length = 100)
    public String scheduleId;

    @Column(
            name = "scheduled_date",
            nullable = false)
    public LocalDate scheduledDate;

    @Column(
            name = "scheduled_hour",
            nullable = false)
    public int scheduledHour;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "price_tier",
            nullable = false,
            length = 20)
    public PriceTier priceTier;

    @Column(
            name = "assignment_key",
            nullable = false,
            length = 64)
    public String assignmentKey;

    /**
     * Copy of {@link #assignmentKey} while the row is active, null afterwards.
     */
    @Column(
            name = "active_key",
            unique = true,
            length = 64)
    public String activeKey;

    @Column(
            nullable = false)
    public boolean active;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "deactivated_at")
    public Instant deactivatedAt;

    @Enumerated(EnumType.STRING)
    @Column(
            name = "deactivation_reason",
            length = 20)
    public DeactivationReason deactivationReason;

    /**
     * Finds active, unexpired assignments of any creator whose date falls within {@code [from, to]}.
     *
     * @param from
     *            first date of the window (inclusive)
     * @param to
     *            last date of the window (inclusive)
     * @param now
     *            reference instant for expiry
     * @return assignments holding captions in the window
     */
    public static List<ActiveAssignment> findActiveInWindow(LocalDate from, LocalDate to, Instant now) {
        return find("active = true AND expiresAt > ?1 AND scheduledDate >= ?2 AND scheduledDate <= ?3", now, from, to)
                .list();
    }

    /**
     * Finds a creator's most recent non-cancelled assignments on or after {@code since}, newest first.
     *
     * @param creatorId
     *            creator identifier
     * @param since
     *            earliest scheduled date to include
     * @param limit
     *            maximum rows returned
     * @return recent assignments ordered by date, hour and creation time descending
     */
    public static List<ActiveAssignment> findRecentForCreator(String creatorId, LocalDate since, int limit) {
        return find("creatorId = ?1 AND scheduledDate >= ?2 AND " + String.format(NOT_CANCELLED, 3)
                + " ORDER BY scheduledDate DESC, scheduledHour DESC, createdAt DESC", creatorId, since,
                DeactivationReason.CANCELLED).page(0, limit).list();
    }

    /**
     * Finds a creator's non-cancelled assignments with dates in {@code [from, to]}.
     */
    public static List<ActiveAssignment> findForCreatorBetween(String creatorId, LocalDate from, LocalDate to) {
        return find("creatorId = ?1 AND scheduledDate >= ?2 AND scheduledDate <= ?3 AND "
                + String.format(NOT_CANCELLED, 4), creatorId, from, to, DeactivationReason.CANCELLED).list();
    }

    public static List<ActiveAssignment> findActiveBySchedule(String scheduleId) {
        return find("scheduleId = ?1 AND active = true", scheduleId).list();
    }

    /**
     * Finds assignments of a schedule created at or after the given instant, active or not.
     */
    public static List<ActiveAssignment> findByScheduleCreatedSince(String scheduleId, Instant since) {
        return find("scheduleId = ?1 AND createdAt >= ?2", scheduleId, since).list();
    }

    public static List<ActiveAssignment> findActiveByAssignmentKeys(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        return find("activeKey IN ?1", keys).list();
    }

    /**
     * Finds active assignments that reached their expiry horizon.
     */
    public static List<ActiveAssignment> findExpired(Instant now) {
        return find("active = true AND expiresAt <= ?1", now).list();
    }

    /**
     * Finds active assignments whose claimed window ended before {@code lastClaimDate}.
     */
    public static List<ActiveAssignment> findPastSendDate(LocalDate lastClaimDate) {
        return find("active = true AND scheduledDate < ?1", lastClaimDate).list();
    }

    /**
     * Finds active but expired assignments for the given captions.
     */
    public static List<ActiveAssignment> findExpiredForCaptions(Collection<Long> captionIds, Instant now) {
        if (captionIds == null || captionIds.isEmpty()) {
            return List.of();
        }
        return find("active = true AND expiresAt <= ?1 AND captionId IN ?2", now, captionIds).list();
    }

    public static long countActive() {
        return count("active = true");
    }

    /**
     * Marks this assignment inactive and releases its day claims and its active key. Must be called within a
     * transaction.
     *
     * @param reason
     *            why the assignment is released
     * @param now
     *            deactivation timestamp
     */
    public void deactivate(DeactivationReason reason, Instant now) {
        this.active = false;
        this.deactivatedAt = now;
        this.deactivationReason = reason;
        this.activeKey = null;
        CaptionDayClaim.deleteByAssignmentIds(List.of(this.id));
    }

    /**
     * Computes the idempotency key of a reservation: SHA-256 over {@code creator|caption|date|hour}, hex encoded.
     */
    public static String assignmentKey(String creatorId, Long captionId, LocalDate date, int hour) {
        String raw = creatorId + "|" + captionId + "|" + date + "|" + hour;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
