package villagecompute.captions.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.captions.TestFixtures;
import villagecompute.captions.api.types.CaptionSelectionRequestType;
import villagecompute.captions.api.types.CaptionSelectionResultType;
import villagecompute.captions.api.types.SelectedCaptionType;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionBanditStat;
import villagecompute.captions.data.models.PriceTier;
import villagecompute.captions.exceptions.PoolExhaustionException;
import villagecompute.captions.exceptions.ValidationException;
import villagecompute.captions.testing.H2TestResource;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link CaptionSelectionService} against the database.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class CaptionSelectionServiceTest {

    @Inject
    CaptionSelectionService selectionService;

    private LocalDate targetDate;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.clearAll();
        targetDate = LocalDate.now(ZoneOffset.UTC).plusDays(3);
    }

    private CaptionSelectionRequestType request(String creatorId, int count, Map<String, Integer> quotas,
            Boolean failOnShortfall) {
        return new CaptionSelectionRequestType(creatorId, count, 30, "neutral", quotas, targetDate, failOnShortfall);
    }

    private void seedAlicePool() {
        QuarkusTransaction.requiringNew().run(() -> {
            TestFixtures.captions(PriceTier.BUDGET, 40);
            TestFixtures.captions(PriceTier.STANDARD, 60);
            TestFixtures.captions(PriceTier.PREMIUM, 100);
        });
    }

    @Test
    void testSelect_tierQuotas_filledExactly() {
        seedAlicePool();

        CaptionSelectionResultType result = selectionService
                .select(request("alice", 30, Map.of("budget", 10, "standard", 15, "premium", 5), false));

        assertEquals(CaptionSelectionResultType.STATUS_OK, result.status());
        assertNull(result.reason());
        assertEquals(30, result.items().size());
        Map<String, Long> byTier = result.items().stream()
                .collect(Collectors.groupingBy(SelectedCaptionType::priceTier, Collectors.counting()));
        assertEquals(Map.of("budget", 10L, "standard", 15L, "premium", 5L), byTier);

        assertEquals(200, result.poolHealth().totalAvailable());
        assertEquals(200, result.poolHealth().afterBudgetFilter());
        assertEquals(30, result.poolHealth().finalSelected());
        assertTrue(result.poolHealth().tierShortfalls().isEmpty());

        Set<Long> distinct = new HashSet<>();
        result.items().forEach(item -> assertTrue(distinct.add(item.captionId()), "duplicate caption in result"));
    }

    @Test
    void testSelect_coldStartCaptions_explorePrior() {
        seedAlicePool();

        CaptionSelectionResultType result = selectionService.select(request("alice", 5, null, null));

        for (SelectedCaptionType item : result.items()) {
            assertEquals(SelectionRankingService.STRATEGY_EXPLORE, item.selectionStrategy());
            assertEquals(0.0, item.wilsonBounds().lower(), 1e-9);
            assertEquals(1.0, item.wilsonBounds().upper(), 1e-9);
        }
    }

    @Test
    void testSelect_tierPoolTooSmall_partialWithShortfall() {
        seedSmallPool();

        CaptionSelectionResultType result = selectionService
                .select(request("alice", 5, Map.of("premium", 5), false));

        assertTrue(result.isShortfall());
        assertEquals(CaptionSelectionResultType.REASON_INSUFFICIENT, result.reason());
        assertEquals(Map.of("premium", 3), result.poolHealth().tierShortfalls());
        assertEquals(5, result.items().size());
    }

    @Test
    void testSelect_failOnShortfall_throwsWithPartialResult() {
        seedSmallPool();

        PoolExhaustionException error = assertThrows(PoolExhaustionException.class,
                () -> selectionService.select(request("alice", 10, null, true)));

        assertEquals(6, error.getPartialResult().items().size());
        assertEquals(CaptionSelectionResultType.STATUS_INSUFFICIENT, error.getPartialResult().status());
    }

    private void seedSmallPool() {
        QuarkusTransaction.requiringNew().run(() -> {
            TestFixtures.captions(PriceTier.PREMIUM, 2);
            TestFixtures.captions(PriceTier.BUDGET, 2);
            TestFixtures.captions(PriceTier.STANDARD, 2);
        });
    }

    @Test
    void testSelect_weeklyCapAndCooldown_applied() {
        seedBudgetScenario();

        CaptionSelectionResultType result = selectionService.select(request("alice", 3, null, false));

        assertEquals(6, result.poolHealth().totalAvailable());
        assertEquals(4, result.poolHealth().afterCooldownFilter());
        assertEquals(4, result.poolHealth().afterRestrictionFilter());
        assertEquals(3, result.poolHealth().afterBudgetFilter());
        assertEquals(CaptionSelectionResultType.STATUS_OK, result.status());
        assertTrue(result.items().stream().noneMatch(i -> "flash_sale".equals(i.triggerTag())));
    }

    private void seedBudgetScenario() {
        QuarkusTransaction.requiringNew().run(this::persistBudgetScenario);
    }

    private void persistBudgetScenario() {
        Caption sent1 = TestFixtures.caption(PriceTier.BUDGET, "tease", "flash_sale");
        Caption sent2 = TestFixtures.caption(PriceTier.STANDARD, "chat", "flash_sale");
        TestFixtures.caption(PriceTier.MID, "promo", "flash_sale");
        TestFixtures.caption(PriceTier.BUDGET, "lifestyle", null);
        TestFixtures.caption(PriceTier.STANDARD, "custom", null);
        TestFixtures.caption(PriceTier.MID, "bundle", null);
        TestFixtures.assignment(sent1, "alice", targetDate, 10);
        TestFixtures.assignment(sent2, "alice", targetDate, 14);
    }

    @Test
    void testSelect_observedWinner_rankedFirst() {
        Long winner = seedWinnerScenario();

        CaptionSelectionResultType result = selectionService.select(request("alice", 3, null, false));

        assertEquals(winner, result.items().get(0).captionId());
        assertEquals(SelectionRankingService.STRATEGY_EXPLOIT, result.items().get(0).selectionStrategy());
    }

    private Long seedWinnerScenario() {
        return QuarkusTransaction.requiringNew().call(this::persistWinnerScenario);
    }

    private Long persistWinnerScenario() {
        List<Caption> pool = TestFixtures.captions(PriceTier.STANDARD, 3);
        Caption winner = pool.get(1);
        CaptionBanditStat stat = CaptionBanditStat.prior(winner.id, "alice");
        stat.successes = 90;
        stat.failures = 5;
        stat.totalObservations = 95;
        stat.avgEmv = 60.0;
        stat.confidenceLower = 0.88;
        stat.confidenceUpper = 0.97;
        stat.explorationBonus = 0.1;
        stat.persist();
        return winner.id;
    }

    @Test
    void testSelect_invalidQuotas_rejected() {
        assertThrows(ValidationException.class,
                () -> selectionService.select(request("alice", 5, Map.of("platinum", 1), false)));
        assertThrows(ValidationException.class,
                () -> selectionService.select(request("alice", 5, Map.of("budget", 4, "premium", 3), false)));
        assertThrows(ValidationException.class,
                () -> selectionService.select(request("alice", 5, Map.of("budget", -1), false)));
    }
}
