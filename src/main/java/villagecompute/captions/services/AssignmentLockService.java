package villagecompute.captions.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.captions.api.types.AssignmentItemType;
import villagecompute.captions.config.BanditConfig;
import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.data.models.ActiveAssignment.DeactivationReason;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionDayClaim;
import villagecompute.captions.exceptions.AssignmentConflictException;
import villagecompute.captions.exceptions.ResourceNotFoundException;
import villagecompute.captions.exceptions.ValidationException;
import villagecompute.captions.observability.ObservabilityMetrics;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reserves captions for a creator's schedule, all or nothing, without ever double-booking a caption system-wide.
 *
 * <p>
 * <b>Reservation protocol:</b>
 * <ol>
 * <li>Reject the batch if two of its own tuples hold the same caption within the cooldown</li>
 * <li>Release the day claims of expired assignments of the requested captions</li>
 * <li>Insert each tuple in its own short transaction: the assignment row plus one {@link CaptionDayClaim} per day of
 * its window. A unique violation on the claims (or the active idempotency key) is the rejection signal; nothing is read
 * first and no table lock is taken</li>
 * <li>On any rejection, delete every row this batch inserted and raise {@link AssignmentConflictException}</li>
 * <li>Verify that exactly as many active rows exist for the batch as were requested</li>
 * </ol>
 *
 * <p>
 * Because two assignments of a caption conflict exactly when their claim ranges share a day, concurrent batches
 * serialise only on the individual (caption, day) keys they both want, and exactly one of them wins each key.
 *
 * <p>
 * A batch whose tuples all already exist, active, under the same schedule is treated as a retried request and returns
 * the existing assignments.
 */
@ApplicationScoped
public class AssignmentLockService {

    private static final Logger LOG = Logger.getLogger(AssignmentLockService.class);

    private static final int MAX_CAUSE_DEPTH = 20;

    /**
     * Clock skew allowance when collecting rows of a failed batch.
     */
    private static final long COMPENSATION_GRACE_SECONDS = 5;

    @Inject
    BanditConfig banditConfig;

    @Inject
    ObservabilityMetrics metrics;

    /**
     * Reserves every tuple or none.
     *
     * <p>
     * Must not be called inside a caller-managed transaction that holds uncommitted captions: each insert runs in a
     * new transaction and cannot see them.
     *
     * @param scheduleId
     *            schedule the reservations belong to
     * @param creatorId
     *            creator the captions are reserved for
     * @param items
     *            (caption, date, hour) tuples
     * @return the created (or replayed) assignments, in request order
     * @throws ValidationException
     *             if the request is malformed
     * @throws ResourceNotFoundException
     *             if a caption id does not exist
     * @throws AssignmentConflictException
     *             if any caption is already held within its cooldown; nothing is reserved
     */
    public List<ActiveAssignment> lock(String scheduleId, String creatorId, List<AssignmentItemType> items) {
        validate(scheduleId, creatorId, items);
        Instant now = Instant.now();

        List<Long> internalConflicts = findInternalConflicts(items);
        if (!internalConflicts.isEmpty()) {
            metrics.recordLockBatch("conflict");
            LOG.infof("Rejected batch for schedule %s: captions %s requested twice within cooldown", scheduleId,
                    internalConflicts);
            throw new AssignmentConflictException("Captions requested twice within the cooldown window",
                    internalConflicts);
        }

        Set<Long> captionIds = items.stream().map(AssignmentItemType::captionId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<Long, Caption> captions = QuarkusTransaction.requiringNew().call(() -> Caption.findByIds(captionIds)
                .stream().collect(Collectors.toMap(c -> c.id, Function.identity())));
        List<Long> unknown = captionIds.stream().filter(id -> !captions.containsKey(id)).toList();
        if (!unknown.isEmpty()) {
            throw new ResourceNotFoundException("Unknown caption ids: " + unknown);
        }

        Optional<List<ActiveAssignment>> replay = findReplay(scheduleId, creatorId, items);
        if (replay.isPresent()) {
            metrics.recordLockBatch("replayed");
            LOG.infof("Schedule %s re-requested %d identical reservations, returning existing rows", scheduleId,
                    items.size());
            return replay.get();
        }

        int released = releaseExpiredClaims(captionIds, now);
        if (released > 0) {
            LOG.debugf("Released %d expired reservations before locking schedule %s", released, scheduleId);
        }

        Instant batchStart = Instant.now();
        List<UUID> inserted = new ArrayList<>(items.size());
        Set<Long> conflicts = new LinkedHashSet<>();

        for (AssignmentItemType item : items) {
            Caption caption = captions.get(item.captionId());
            try {
                inserted.add(QuarkusTransaction.requiringNew()
                        .call(() -> insertReservation(scheduleId, creatorId, item, caption)));
            } catch (RuntimeException e) {
                if (!isConflict(e)) {
                    LOG.errorf(e, "Reservation of caption %d for schedule %s failed unexpectedly", item.captionId(),
                            scheduleId);
                    compensate(scheduleId, creatorId, items, inserted, batchStart);
                    throw e;
                }
                conflicts.add(item.captionId());
                LOG.debugf("Caption %d already held near %s, rejecting schedule %s", item.captionId(), item.date(),
                        scheduleId);
            }
        }

        if (!conflicts.isEmpty()) {
            compensate(scheduleId, creatorId, items, inserted, batchStart);
            metrics.recordLockBatch("conflict");
            LOG.infof("Rejected batch for schedule %s: %d of %d captions already reserved %s", scheduleId,
                    conflicts.size(), items.size(), conflicts);
            throw new AssignmentConflictException("Captions already reserved", new ArrayList<>(conflicts));
        }

        List<ActiveAssignment> created = QuarkusTransaction.requiringNew()
                .call(() -> ActiveAssignment.<ActiveAssignment> list("id IN ?1 AND active = true", inserted));
        if (created.size() != items.size()) {
            Set<UUID> present = created.stream().map(a -> a.id).collect(Collectors.toSet());
            List<Long> missing = new ArrayList<>();
            for (int i = 0; i < inserted.size(); i++) {
                if (!present.contains(inserted.get(i))) {
                    missing.add(items.get(i).captionId());
                }
            }
            compensate(scheduleId, creatorId, items, inserted, batchStart);
            metrics.recordLockBatch("conflict");
            LOG.warnf("Schedule %s verification found %d active rows for %d requested, rolled back", scheduleId,
                    created.size(), items.size());
            throw new AssignmentConflictException("Reservation verification failed", missing);
        }

        metrics.recordLockBatch("locked");
        LOG.infof("Reserved %d captions for creator %s, schedule %s", items.size(), creatorId, scheduleId);
        return orderAs(inserted, created);
    }

    /**
     * Deactivates every active assignment of a schedule and releases its claims.
     *
     * @param scheduleId
     *            schedule to cancel
     * @return number of assignments cancelled
     */
    @Transactional
    public int cancel(String scheduleId) {
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new ValidationException("schedule_id is required");
        }
        Instant now = Instant.now();
        List<ActiveAssignment> active = ActiveAssignment.findActiveBySchedule(scheduleId);
        for (ActiveAssignment assignment : active) {
            assignment.deactivate(DeactivationReason.CANCELLED, now);
        }
        LOG.infof("Cancelled %d reservations of schedule %s", active.size(), scheduleId);
        return active.size();
    }

    /**
     * Deactivates assignments whose expiry horizon passed or whose claimed window ended.
     *
     * @param now
     *            reference instant
     * @return counts per reason and the active count afterwards
     */
    @Transactional
    public SweepResult sweepExpired(Instant now) {
        int expired = 0;
        for (ActiveAssignment assignment : ActiveAssignment.findExpired(now)) {
            assignment.deactivate(DeactivationReason.EXPIRED, now);
            expired++;
        }

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        int pastSendDate = 0;
        for (ActiveAssignment assignment : ActiveAssignment
                .findPastSendDate(today.minusDays(banditConfig.getCooldownDays()))) {
            assignment.deactivate(DeactivationReason.PAST_SEND_DATE, now);
            pastSendDate++;
        }

        return new SweepResult(expired, pastSendDate, ActiveAssignment.countActive());
    }

    private UUID insertReservation(String scheduleId, String creatorId, AssignmentItemType item, Caption caption) {
        ActiveAssignment assignment = new ActiveAssignment();
        assignment.captionId = item.captionId();
        assignment.creatorId = creatorId;
        assignment.scheduleId = scheduleId;
        assignment.scheduledDate = item.date();
        assignment.scheduledHour = item.hour();
        assignment.priceTier = caption.priceTier;
        assignment.assignmentKey = ActiveAssignment.assignmentKey(creatorId, item.captionId(), item.date(),
                item.hour());
        assignment.activeKey = assignment.assignmentKey;
        assignment.active = true;
        assignment.createdAt = Instant.now();
        assignment.expiresAt = item.date().plusDays(banditConfig.getExpiryDays()).atStartOfDay(ZoneOffset.UTC)
                .toInstant();
        assignment.persist();

        for (int day = 0; day <= banditConfig.getCooldownDays(); day++) {
            CaptionDayClaim.of(item.captionId(), item.date().plusDays(day), assignment.id).persist();
        }
        ActiveAssignment.flush();
        return assignment.id;
    }

    private int releaseExpiredClaims(Set<Long> captionIds, Instant now) {
        return QuarkusTransaction.requiringNew().call(() -> {
            List<ActiveAssignment> expired = ActiveAssignment.findExpiredForCaptions(captionIds, now);
            for (ActiveAssignment assignment : expired) {
                assignment.deactivate(DeactivationReason.EXPIRED, now);
            }
            return expired.size();
        });
    }

    /**
     * Deletes the rows and claims of a failed batch: the ids it recorded plus any active row of the same schedule and
     * tuple created since the batch started, which covers an insert whose commit outcome was unknown.
     */
    private void compensate(String scheduleId, String creatorId, List<AssignmentItemType> items, List<UUID> inserted,
            Instant batchStart) {
        Set<String> batchKeys = items.stream()
                .map(i -> ActiveAssignment.assignmentKey(creatorId, i.captionId(), i.date(), i.hour()))
                .collect(Collectors.toSet());

        int removed = QuarkusTransaction.requiringNew().call(() -> {
            Set<UUID> ids = new LinkedHashSet<>(inserted);
            for (ActiveAssignment row : ActiveAssignment.findByScheduleCreatedSince(scheduleId,
                    batchStart.minusSeconds(COMPENSATION_GRACE_SECONDS))) {
                if (row.active && batchKeys.contains(row.assignmentKey)) {
                    ids.add(row.id);
                }
            }
            if (ids.isEmpty()) {
                return 0;
            }
            CaptionDayClaim.deleteByAssignmentIds(ids);
            return (int) ActiveAssignment.delete("id IN ?1", ids);
        });

        if (removed > 0) {
            metrics.incrementLockCompensation();
            LOG.warnf("Rolled back %d reservations of failed batch for schedule %s", removed, scheduleId);
        }
    }

    private Optional<List<ActiveAssignment>> findReplay(String scheduleId, String creatorId,
            List<AssignmentItemType> items) {
        List<String> keys = items.stream()
                .map(i -> ActiveAssignment.assignmentKey(creatorId, i.captionId(), i.date(), i.hour())).toList();
        List<ActiveAssignment> existing = QuarkusTransaction.requiringNew()
                .call(() -> ActiveAssignment.findActiveByAssignmentKeys(keys));
        if (existing.size() != keys.size()) {
            return Optional.empty();
        }
        boolean sameBatch = existing.stream().allMatch(a -> a.active && scheduleId.equals(a.scheduleId));
        if (!sameBatch) {
            return Optional.empty();
        }
        Map<String, ActiveAssignment> byKey = existing.stream()
                .collect(Collectors.toMap(a -> a.assignmentKey, Function.identity()));
        return Optional.of(keys.stream().map(byKey::get).toList());
    }

    /**
     * Returns caption ids that the request itself holds twice within the cooldown.
     */
    List<Long> findInternalConflicts(List<AssignmentItemType> items) {
        int cooldown = banditConfig.getCooldownDays();
        Map<Long, List<LocalDate>> datesByCaption = new HashMap<>();
        Set<Long> conflicts = new LinkedHashSet<>();
        for (AssignmentItemType item : items) {
            List<LocalDate> dates = datesByCaption.computeIfAbsent(item.captionId(), id -> new ArrayList<>());
            for (LocalDate other : dates) {
                if (Math.abs(other.toEpochDay() - item.date().toEpochDay()) <= cooldown) {
                    conflicts.add(item.captionId());
                }
            }
            dates.add(item.date());
        }
        return new ArrayList<>(conflicts);
    }

    private void validate(String scheduleId, String creatorId, List<AssignmentItemType> items) {
        if (scheduleId == null || scheduleId.isBlank()) {
            throw new ValidationException("schedule_id is required");
        }
        if (creatorId == null || creatorId.isBlank()) {
            throw new ValidationException("creator_id is required");
        }
        if (items == null || items.isEmpty()) {
            throw new ValidationException("assignments must not be empty");
        }
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        for (AssignmentItemType item : items) {
            if (item == null || item.captionId() == null || item.date() == null || item.hour() == null) {
                throw new ValidationException("each assignment needs caption_id, date and hour");
            }
            if (item.hour() < 0 || item.hour() > 23) {
                throw new ValidationException("hour must be between 0 and 23, got " + item.hour());
            }
            if (item.date().isBefore(today)) {
                throw new ValidationException("date " + item.date() + " is in the past");
            }
        }
    }

    /**
     * True when the failure means another reservation holds the key: a unique violation, or a lock wait that timed
     * out behind a concurrent writer.
     */
    static boolean isConflict(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof org.hibernate.exception.ConstraintViolationException
                    || current instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (current instanceof SQLException sqlException && isConflictState(sqlException.getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isConflictState(String sqlState) {
        if (sqlState == null) {
            return false;
        }
        // 23xxx integrity violation, 40001 serialization failure, 40P01 deadlock, 55P03/HYT00 lock timeout,
        // 90131 H2 concurrent update
        return sqlState.startsWith("23") || sqlState.equals("40001") || sqlState.equals("40P01")
                || sqlState.equals("55P03") || sqlState.equals("HYT00") || sqlState.equals("90131");
    }

    private static List<ActiveAssignment> orderAs(List<UUID> order, List<ActiveAssignment> rows) {
        Map<UUID, ActiveAssignment> byId = rows.stream().collect(Collectors.toMap(a -> a.id, Function.identity()));
        return order.stream().map(byId::get).filter(Objects::nonNull).toList();
    }
}
