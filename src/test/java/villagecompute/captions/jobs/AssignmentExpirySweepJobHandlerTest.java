package villagecompute.captions.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.captions.TestFixtures;
import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.data.models.ActiveAssignment.DeactivationReason;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionDayClaim;
import villagecompute.captions.data.models.PriceTier;
import villagecompute.captions.observability.ObservabilityMetrics;
import villagecompute.captions.testing.H2TestResource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AssignmentExpirySweepJobHandler}.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class AssignmentExpirySweepJobHandlerTest {

    @Inject
    AssignmentExpirySweepJobHandler handler;

    @Inject
    ObservabilityMetrics metrics;

    private UUID expiredId;
    private UUID pastSendId;
    private UUID upcomingId;
    private Long expiredCaptionId;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.clearAll();
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        Caption expiredCaption = TestFixtures.caption(PriceTier.BUDGET, "tease", null);
        ActiveAssignment expired = TestFixtures.assignment(expiredCaption, "alice", today.minusDays(10), 10);
        for (int day = 0; day <= 7; day++) {
            CaptionDayClaim.of(expiredCaption.id, expired.scheduledDate.plusDays(day), expired.id).persist();
        }
        expiredId = expired.id;
        expiredCaptionId = expiredCaption.id;

        // claimed window ended but the expiry horizon is still ahead
        ActiveAssignment pastSend = TestFixtures.assignment(TestFixtures.caption(PriceTier.MID, "chat", null), "alice",
                today.minusDays(9), 12);
        pastSend.expiresAt = Instant.now().plus(1, ChronoUnit.DAYS);
        pastSendId = pastSend.id;

        upcomingId = TestFixtures.assignment(TestFixtures.caption(PriceTier.VIP, "promo", null), "bob",
                today.plusDays(2), 20).id;
    }

    private ActiveAssignment load(UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> ActiveAssignment.<ActiveAssignment> findById(id));
    }

    @Test
    void testExecute_deactivatesWithReasonAndReleasesClaims() throws Exception {
        handler.execute(1L, Map.of());

        ActiveAssignment expired = load(expiredId);
        assertFalse(expired.active);
        assertEquals(DeactivationReason.EXPIRED, expired.deactivationReason);
        assertNotNull(expired.deactivatedAt);

        ActiveAssignment pastSend = load(pastSendId);
        assertFalse(pastSend.active);
        assertEquals(DeactivationReason.PAST_SEND_DATE, pastSend.deactivationReason);

        assertTrue(load(upcomingId).active);
        long claims = QuarkusTransaction.requiringNew().call(() -> CaptionDayClaim.countForCaption(expiredCaptionId));
        assertEquals(0, claims);
        assertEquals(1, metrics.getActiveAssignments());
    }

    @Test
    void testExecute_secondRun_isNoOp() throws Exception {
        handler.execute(1L, Map.of());
        handler.execute(2L, Map.of());

        assertEquals(DeactivationReason.EXPIRED, load(expiredId).deactivationReason);
        long active = QuarkusTransaction.requiringNew().call(ActiveAssignment::countActive);
        assertEquals(1, active);
    }
}
