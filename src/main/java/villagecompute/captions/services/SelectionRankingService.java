package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.data.models.PriceTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Combines candidate scores into a composite and picks the final selection under tier quotas.
 *
 * <p>
 * <b>Composite:</b> {@code (0.70 × thompson + 0.15 × diversity + 0.15 × avgEmv/100 + budgetPenalty + softPenalty) ×
 * segmentMultiplier}, where the segment multiplier is 1.3 for PREMIUM/LUXURY with price-insensitive audiences, 1.2 for
 * BUDGET/STANDARD with price-sensitive audiences and 1.0 otherwise.
 *
 * <p>
 * <b>Quota fill:</b> every tier in the quota map is filled up to its quota (or its eligible pool, whichever is
 * smaller). Remaining slots, {@code countNeeded − Σ effective quota}, are filled in global rank order. A tier whose
 * pool is smaller than its quota is reported in {@link RankingOutcome#tierShortfalls()}.
 *
 * <p>
 * <b>Ordering:</b> picks are made one at a time, always the best allowed candidate by {@link ScoredCandidate#BY_RANK}.
 * A pick that would break a hard {@link DiversityRule} against the creator's recent window and the picks so far is
 * swapped for the next-best allowed candidate that breaks none. When no such candidate exists the pick is kept and
 * flagged. Quotas take precedence over hard diversity rules.
 */
@ApplicationScoped
public class SelectionRankingService {

    private static final Logger LOG = Logger.getLogger(SelectionRankingService.class);

    static final double THOMPSON_WEIGHT = 0.70;
    static final double DIVERSITY_WEIGHT = 0.15;
    static final double EMV_WEIGHT = 0.15;
    static final double EMV_SCALE = 100.0;

    static final long EXPLORE_OBSERVATION_THRESHOLD = 10;
    static final double EXPLORE_WIDTH_THRESHOLD = 0.3;
    static final double EXPLOIT_EMV_THRESHOLD = 25.0;
    static final double EXPLOIT_LOWER_THRESHOLD = 0.15;

    public static final String STRATEGY_EXPLORE = "explore";
    public static final String STRATEGY_EXPLOIT = "exploit";
    public static final String STRATEGY_BALANCED = "balanced";

    @Inject
    DiversityScoringService diversityScoringService;

    public SelectionRankingService() {
    }

    public SelectionRankingService(DiversityScoringService diversityScoringService) {
        this.diversityScoringService = diversityScoringService;
    }

    /**
     * Calculates the composite ranking score.
     */
    public double compositeScore(double thompsonScore, double diversityScore, double avgEmv, double budgetPenalty,
            double softPenalty, PriceTier tier, BehavioralSegment segment) {
        double base = THOMPSON_WEIGHT * thompsonScore + DIVERSITY_WEIGHT * diversityScore
                + EMV_WEIGHT * (avgEmv / EMV_SCALE) + budgetPenalty + softPenalty;
        return base * segment.multiplierFor(tier);
    }

    /**
     * Labels why a candidate ranks where it does: arms with little or uncertain data are explored, proven earners
     * exploited.
     */
    public String strategyFor(long totalObservations, WilsonBounds bounds, double avgEmv) {
        if (totalObservations < EXPLORE_OBSERVATION_THRESHOLD || bounds.width() > EXPLORE_WIDTH_THRESHOLD) {
            return STRATEGY_EXPLORE;
        }
        if (avgEmv > EXPLOIT_EMV_THRESHOLD && bounds.lower() > EXPLOIT_LOWER_THRESHOLD) {
            return STRATEGY_EXPLOIT;
        }
        return STRATEGY_BALANCED;
    }

    /**
     * Picks up to {@code countNeeded} candidates.
     *
     * @param candidates
     *            scored eligible captions, any order
     * @param quotas
     *            minimum picks per tier; tiers absent from the map have no quota
     * @param countNeeded
     *            total picks wanted
     * @param window
     *            creator's recent assignments
     * @return picks in selection order and per-tier shortfalls
     */
    public RankingOutcome rank(List<ScoredCandidate> candidates, Map<PriceTier, Integer> quotas, int countNeeded,
            RecentPatternWindow window) {
        List<ScoredCandidate> remaining = new ArrayList<>(candidates);
        remaining.sort(ScoredCandidate.BY_RANK);

        Map<PriceTier, Integer> available = new EnumMap<>(PriceTier.class);
        for (ScoredCandidate candidate : remaining) {
            available.merge(candidate.priceTier(), 1, Integer::sum);
        }

        Map<PriceTier, Integer> quotaRemaining = new EnumMap<>(PriceTier.class);
        Map<PriceTier, Integer> shortfalls = new EnumMap<>(PriceTier.class);
        int quotaTotal = 0;
        for (Map.Entry<PriceTier, Integer> quota : quotas.entrySet()) {
            int wanted = quota.getValue() == null ? 0 : quota.getValue();
            if (wanted <= 0) {
                continue;
            }
            int pool = available.getOrDefault(quota.getKey(), 0);
            int effective = Math.min(wanted, pool);
            if (effective > 0) {
                quotaRemaining.put(quota.getKey(), effective);
            }
            if (pool < wanted) {
                shortfalls.put(quota.getKey(), wanted - pool);
            }
            quotaTotal += effective;
        }
        int globalRemaining = Math.max(0, countNeeded - quotaTotal);

        List<PatternEntry> sequence = new ArrayList<>(window.chronological());
        List<RankedPick> picks = new ArrayList<>(Math.min(countNeeded, remaining.size()));
        int flagged = 0;

        while (picks.size() < countNeeded && !remaining.isEmpty()) {
            boolean anyTier = globalRemaining > 0;
            ScoredCandidate best = null;
            ScoredCandidate clean = null;
            EnumSet<DiversityRule> bestViolations = EnumSet.noneOf(DiversityRule.class);

            for (ScoredCandidate candidate : remaining) {
                if (!anyTier && quotaRemaining.getOrDefault(candidate.priceTier(), 0) <= 0) {
                    continue;
                }
                EnumSet<DiversityRule> violations = diversityScoringService
                        .checkHardRules(candidate.toPatternEntry(), sequence);
                if (best == null) {
                    best = candidate;
                    bestViolations = violations;
                }
                if (violations.isEmpty()) {
                    clean = candidate;
                    break;
                }
            }

            if (best == null) {
                break;
            }

            ScoredCandidate chosen = clean != null ? clean : best;
            boolean violation = clean == null;
            if (violation) {
                flagged++;
                LOG.debugf("No alternative satisfies %s for caption %d at position %d, keeping it flagged",
                        bestViolations, best.captionId(), picks.size());
            } else if (chosen != best) {
                LOG.tracef("Swapped caption %d (%s) for %d at position %d", best.captionId(), bestViolations,
                        chosen.captionId(), picks.size());
            }

            remove(remaining, chosen);
            picks.add(new RankedPick(chosen, violation));
            sequence.add(chosen.toPatternEntry());

            int tierQuota = quotaRemaining.getOrDefault(chosen.priceTier(), 0);
            if (tierQuota > 0) {
                quotaRemaining.put(chosen.priceTier(), tierQuota - 1);
            } else {
                globalRemaining--;
            }
        }

        LOG.debugf("Ranked %d candidates into %d picks (needed %d, flagged %d, shortfalls %s)", candidates.size(),
                picks.size(), countNeeded, flagged, shortfalls);
        return new RankingOutcome(Collections.unmodifiableList(picks), Collections.unmodifiableMap(shortfalls));
    }

    private static void remove(List<ScoredCandidate> remaining, ScoredCandidate chosen) {
        Iterator<ScoredCandidate> iterator = remaining.iterator();
        while (iterator.hasNext()) {
            if (iterator.next() == chosen) {
                iterator.remove();
                return;
            }
        }
    }
}
