package villagecompute.captions;

import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionBanditStat;
import villagecompute.captions.data.models.CaptionDayClaim;
import villagecompute.captions.data.models.CaptionDeliveryOutcome;
import villagecompute.captions.data.models.CaptionFilterAuditLog;
import villagecompute.captions.data.models.CreatorAllowedProfile;
import villagecompute.captions.data.models.CreatorRestriction;
import villagecompute.captions.data.models.FeatureFlag;
import villagecompute.captions.data.models.PriceTier;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for caption test data. All methods persist and must be called within a transaction.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    /**
     * Deletes every row the engine writes, children first.
     */
    public static void clearAll() {
        CaptionFilterAuditLog.deleteAll();
        CaptionDayClaim.deleteAll();
        ActiveAssignment.deleteAll();
        CaptionDeliveryOutcome.deleteAll();
        CaptionBanditStat.deleteAll();
        CreatorRestriction.deleteAll();
        CreatorAllowedProfile.deleteAll();
        FeatureFlag.deleteAll();
        Caption.deleteAll();
    }

    public static Caption caption(PriceTier tier, String category, String triggerTag) {
        return Caption.create("Caption " + tier.getValue() + " " + category + " " + triggerTag, tier, category,
                triggerTag);
    }

    /**
     * Creates {@code count} untagged captions of one tier, cycling through a few categories.
     */
    public static List<Caption> captions(PriceTier tier, int count) {
        String[] categories = {"tease", "lifestyle", "promo", "chat", "custom"};
        List<Caption> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created.add(caption(tier, categories[i % categories.length], null));
        }
        return created;
    }

    /**
     * Persists an active assignment directly, without day claims, for tests that only read assignment history.
     */
    public static ActiveAssignment assignment(Caption caption, String creatorId, LocalDate date, int hour) {
        ActiveAssignment assignment = new ActiveAssignment();
        assignment.captionId = caption.id;
        assignment.creatorId = creatorId;
        assignment.scheduleId = "fixture-" + creatorId;
        assignment.scheduledDate = date;
        assignment.scheduledHour = hour;
        assignment.priceTier = caption.priceTier;
        assignment.assignmentKey = ActiveAssignment.assignmentKey(creatorId, caption.id, date, hour);
        assignment.activeKey = assignment.assignmentKey;
        assignment.active = true;
        assignment.createdAt = Instant.now();
        assignment.expiresAt = date.plusDays(7).atStartOfDay(ZoneOffset.UTC).toInstant();
        assignment.persist();
        return assignment;
    }

    public static CaptionDeliveryOutcome outcome(Long captionId, String creatorId, int viewed, int purchased,
            double earnings, Instant receivedAt) {
        CaptionDeliveryOutcome outcome = new CaptionDeliveryOutcome();
        outcome.captionId = captionId;
        outcome.creatorId = creatorId;
        outcome.sentCount = Math.max(viewed, 1);
        outcome.viewedCount = viewed;
        outcome.purchasedCount = purchased;
        outcome.earnings = earnings;
        outcome.sentAt = receivedAt.minusSeconds(3600);
        outcome.receivedAt = receivedAt;
        outcome.processed = false;
        outcome.persist();
        return outcome;
    }
}
