package villagecompute.captions.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.captions.TestFixtures;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionBanditStat;
import villagecompute.captions.data.models.CaptionDeliveryOutcome;
import villagecompute.captions.data.models.PriceTier;
import villagecompute.captions.testing.H2TestResource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FeedbackUpdateJobHandler} running the feedback update against the database.
 *
 * <p>
 * Alice's winner earns an EMV of 50 per delivery and her loser 1, so the creator median (25.5) separates them.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class FeedbackUpdateJobHandlerTest {

    private static final double DECAY = Math.pow(0.5, 1.0 / 56.0);

    @Inject
    FeedbackUpdateJobHandler handler;

    private Long winnerId;
    private Long loserId;
    private Long idleId;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.clearAll();
        Instant received = Instant.now().minus(1, ChronoUnit.HOURS);

        Caption winner = TestFixtures.caption(PriceTier.PREMIUM, "tease", "scarcity");
        Caption loser = TestFixtures.caption(PriceTier.BUDGET, "chat", null);
        Caption idle = TestFixtures.caption(PriceTier.MID, "promo", null);
        winnerId = winner.id;
        loserId = loser.id;
        idleId = idle.id;

        TestFixtures.outcome(winnerId, "alice", 10, 5, 100.0, received);
        TestFixtures.outcome(winnerId, "alice", 10, 5, 100.0, received);
        TestFixtures.outcome(loserId, "alice", 10, 1, 10.0, received);
        TestFixtures.outcome(loserId, "alice", 10, 1, 10.0, received);

        // outside the 48 hour lookback, and unviewed so it stays out of the median
        TestFixtures.outcome(idleId, "alice", 0, 0, 0.0, Instant.now().minus(3, ChronoUnit.DAYS));

        CaptionBanditStat idleStat = CaptionBanditStat.prior(idleId, "alice");
        idleStat.successes = 10.0;
        idleStat.failures = 10.0;
        idleStat.totalObservations = 20;
        idleStat.avgEmv = 5.0;
        idleStat.persist();
    }

    private CaptionBanditStat stat(Long captionId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> CaptionBanditStat.findByCaptionAndCreator(captionId, "alice").orElseThrow());
    }

    @Test
    void testExecute_classifiesAgainstCreatorMedian() throws Exception {
        handler.execute(1L, Map.of());

        CaptionBanditStat winner = stat(winnerId);
        assertEquals(2.0, winner.successes, 1e-9);
        assertEquals(0.0, winner.failures, 1e-9);
        assertEquals(2, winner.totalObservations);
        assertEquals(50.0, winner.avgEmv, 1e-9);
        assertEquals(200.0, winner.totalRevenue, 1e-9);

        CaptionBanditStat loser = stat(loserId);
        assertEquals(0.0, loser.successes, 1e-9);
        assertEquals(2.0, loser.failures, 1e-9);
        assertEquals(1.0, loser.avgEmv, 1e-9);
    }

    @Test
    void testExecute_untouchedStatsDecayTowardPrior() throws Exception {
        handler.execute(1L, Map.of());

        CaptionBanditStat idle = stat(idleId);
        assertEquals(10.0 * DECAY, idle.successes, 1e-9);
        assertEquals(10.0 * DECAY, idle.failures, 1e-9);
        assertEquals(20, idle.totalObservations);
    }

    @Test
    void testExecute_recomputesPercentilesAndBounds() throws Exception {
        handler.execute(1L, Map.of());

        // avg EMV: loser 1, idle 5, winner 50
        assertEquals(0, stat(loserId).performancePercentile);
        assertEquals(50, stat(idleId).performancePercentile);
        CaptionBanditStat winner = stat(winnerId);
        assertEquals(100, winner.performancePercentile);
        assertTrue(winner.confidenceLower > 0.0);
        assertEquals(1.0, winner.confidenceUpper, 1e-9);
        assertEquals(1.0 / Math.sqrt(3.0), winner.explorationBonus, 1e-9);
    }

    @Test
    void testExecute_marksBatchProcessedOnce() throws Exception {
        handler.execute(1L, Map.of());

        long unprocessed = QuarkusTransaction.requiringNew().call(CaptionDeliveryOutcome::countUnprocessed);
        assertEquals(1, unprocessed);

        handler.execute(2L, Map.of());
        assertEquals(2.0, stat(winnerId).successes, 1e-9);
    }
}
