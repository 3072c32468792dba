package villagecompute.captions.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.captions.data.models.PriceTier;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for diversity scoring and the hard sequencing rules.
 */
public class DiversityScoringServiceTest {

    private DiversityScoringService diversityScoringService;

    @BeforeEach
    public void setup() {
        diversityScoringService = new DiversityScoringService();
    }

    private static PatternEntry entry(long captionId, PriceTier tier, String tag, String category) {
        return new PatternEntry(captionId, tier, tag, category);
    }

    /**
     * An empty history rewards novelty on both the trigger and the category axis.
     */
    @Test
    public void testScore_emptyWindow_noveltyReward() {
        double score = diversityScoringService.score(PriceTier.PREMIUM, "urgency", "tease",
                RecentPatternWindow.empty());
        assertEquals(0.2, score, 1e-9);
    }

    /**
     * Repeating the last trigger and category, with the tier seen twice, stacks every penalty.
     */
    @Test
    public void testScore_repeatedPattern_penalised() {
        RecentPatternWindow window = new RecentPatternWindow(
                List.of(entry(1, PriceTier.PREMIUM, "urgency", "tease"), entry(2, PriceTier.PREMIUM, null, "chat")));
        double score = diversityScoringService.score(PriceTier.PREMIUM, "URGENCY", "tease", window);
        assertEquals(-0.3 - 0.2 - 0.2, score, 1e-9);
    }

    /**
     * A category last seen four assignments ago is outside the category lookback and counts as novel.
     */
    @Test
    public void testScore_categoryOutsideLookback_novel() {
        RecentPatternWindow window = new RecentPatternWindow(List.of(entry(1, PriceTier.BUDGET, null, "a"),
                entry(2, PriceTier.BUDGET, null, "b"), entry(3, PriceTier.BUDGET, null, "c"),
                entry(4, PriceTier.BUDGET, null, "tease")));
        double score = diversityScoringService.score(PriceTier.VIP, null, "tease", window);
        assertEquals(0.2, score, 1e-9);
    }

    /**
     * A third consecutive caption of the same tier breaks the tier-run rule.
     */
    @Test
    public void testCheckHardRules_thirdConsecutiveTier_violation() {
        List<PatternEntry> sequence = List.of(entry(1, PriceTier.PREMIUM, null, "a"),
                entry(2, PriceTier.PREMIUM, null, "b"));
        EnumSet<DiversityRule> violations = diversityScoringService
                .checkHardRules(entry(3, PriceTier.PREMIUM, null, "c"), sequence);
        assertEquals(EnumSet.of(DiversityRule.TIER_RUN), violations);
    }

    /**
     * A trigger used in the last three picks, or the same category as the previous pick, breaks a rule.
     */
    @Test
    public void testCheckHardRules_triggerAndCategoryRepeat() {
        List<PatternEntry> sequence = List.of(entry(1, PriceTier.BUDGET, "scarcity", "a"),
                entry(2, PriceTier.STANDARD, null, "b"), entry(3, PriceTier.MID, null, "c"));
        EnumSet<DiversityRule> violations = diversityScoringService
                .checkHardRules(entry(4, PriceTier.VIP, "Scarcity", "C"), sequence);
        assertEquals(EnumSet.of(DiversityRule.TRIGGER_REPEAT, DiversityRule.CATEGORY_REPEAT), violations);
    }

    /**
     * A trigger last used four picks ago is allowed again.
     */
    @Test
    public void testCheckHardRules_triggerOutsideLookback_allowed() {
        List<PatternEntry> sequence = List.of(entry(1, PriceTier.BUDGET, "scarcity", "a"),
                entry(2, PriceTier.STANDARD, null, "b"), entry(3, PriceTier.MID, null, "c"),
                entry(4, PriceTier.LUXURY, null, "d"));
        assertTrue(diversityScoringService.checkHardRules(entry(5, PriceTier.VIP, "scarcity", "e"), sequence)
                .isEmpty());
    }

    /**
     * The window keeps only the newest ten entries.
     */
    @Test
    public void testRecentPatternWindow_truncatesToMaxEntries() {
        List<PatternEntry> many = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            many.add(entry(i, PriceTier.BUDGET, null, "c" + i));
        }
        RecentPatternWindow window = new RecentPatternWindow(many);
        assertEquals(RecentPatternWindow.MAX_ENTRIES, window.entries().size());
        assertEquals(0L, (long) window.entries().get(0).captionId());
        assertEquals(9L, (long) window.chronological().get(0).captionId());
    }
}
