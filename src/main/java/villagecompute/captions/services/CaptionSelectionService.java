package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.captions.api.types.CaptionSelectionRequestType;
import villagecompute.captions.api.types.CaptionSelectionResultType;
import villagecompute.captions.api.types.PoolHealthType;
import villagecompute.captions.api.types.SelectedCaptionType;
import villagecompute.captions.api.types.WilsonBoundsType;
import villagecompute.captions.config.BanditConfig;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.CaptionBanditStat;
import villagecompute.captions.data.models.PriceTier;
import villagecompute.captions.exceptions.PoolExhaustionException;
import villagecompute.captions.exceptions.ValidationException;
import villagecompute.captions.observability.LoggingConfig;
import villagecompute.captions.observability.ObservabilityMetrics;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chooses the captions a creator should send next.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Filter the active pool (cooldown, restrictions, trigger budget)</li>
 * <li>Score every eligible caption: Thompson sample, diversity against the creator's recent pattern, expected value,
 * penalties and the segment multiplier</li>
 * <li>Rank with tier quotas first, then the remaining slots globally, honouring the hard diversity rules</li>
 * </ol>
 *
 * <p>
 * Selection never reserves anything; callers lock the chosen captions through {@link AssignmentLockService}.
 */
@ApplicationScoped
public class CaptionSelectionService {

    private static final Logger LOG = Logger.getLogger(CaptionSelectionService.class);

    public static final String STATUS_FAILED_SHORTFALL = "failed_shortfall";

    @Inject
    BanditConfig banditConfig;

    @Inject
    CandidateFilterService candidateFilterService;

    @Inject
    TriggerBudgetService triggerBudgetService;

    @Inject
    DiversityScoringService diversityScoringService;

    @Inject
    ThompsonSamplingService thompsonSamplingService;

    @Inject
    BanditStatService banditStatService;

    @Inject
    SelectionRankingService selectionRankingService;

    @Inject
    ObservabilityMetrics metrics;

    /**
     * Selects captions for one creator.
     *
     * @param request
     *            selection request
     * @return ranked captions with pool health; status {@code insufficient_eligible} when the pool could not fill the
     *         request
     * @throws ValidationException
     *             if the quota map is invalid
     * @throws PoolExhaustionException
     *             if the request asked to fail on shortfall and one occurred
     */
    @Transactional(
            dontRollbackOn = PoolExhaustionException.class)
    public CaptionSelectionResultType select(CaptionSelectionRequestType request) {
        String creatorId = request.creatorId();
        int countNeeded = request.countNeeded();
        Map<PriceTier, Integer> quotas = resolveQuotas(request.priceTierQuotaMap(), countNeeded);
        BehavioralSegment segment = BehavioralSegment.fromValue(request.behavioralSegment());

        Instant now = Instant.now();
        LocalDate targetDate = request.targetDate() != null
                ? request.targetDate()
                : LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1);
        UUID requestId = UUID.randomUUID();

        LoggingConfig.setCreatorId(creatorId);
        LOG.infof("Selecting %d captions for creator %s on %s (request %s, segment %s)", countNeeded, creatorId,
                targetDate, requestId, segment);

        List<Caption> pool = Caption.findActive();
        Map<String, Integer> weeklyUsage = triggerBudgetService.loadWeeklyUsage(creatorId, targetDate);
        FilterResult filtered = candidateFilterService.filter(requestId, creatorId, targetDate, pool, weeklyUsage,
                now);

        RecentPatternWindow window = diversityScoringService.loadWindow(creatorId,
                targetDate.minusDays(request.lookbackDaysOrDefault()));
        Map<Long, CaptionBanditStat> stats = banditStatService.loadStats(creatorId,
                filtered.eligible().stream().map(e -> e.caption().id).toList());

        List<ScoredCandidate> scored = new ArrayList<>(filtered.eligible().size());
        for (EligibleCaption eligible : filtered.eligible()) {
            scored.add(score(eligible, stats.get(eligible.caption().id), window, segment));
        }

        RankingOutcome outcome = selectionRankingService.rank(scored, quotas, countNeeded, window);
        CaptionSelectionResultType result = buildResult(requestId, filtered, outcome, countNeeded);

        Map<String, Integer> removedByStage = new LinkedHashMap<>();
        removedByStage.put("cooldown", filtered.totalAvailable() - filtered.afterCooldownFilter());
        removedByStage.put("restriction", filtered.afterCooldownFilter() - filtered.afterRestrictionFilter());
        removedByStage.put("budget", filtered.afterRestrictionFilter() - filtered.afterBudgetFilter());

        if (result.isShortfall()) {
            LOG.warnf("Selection %s for creator %s short: %d of %d selected, tier shortfalls %s", requestId,
                    creatorId, outcome.picks().size(), countNeeded, result.poolHealth().tierShortfalls());
            if (request.failOnShortfallOrDefault()) {
                metrics.recordSelection(STATUS_FAILED_SHORTFALL, removedByStage);
                throw new PoolExhaustionException(CaptionSelectionResultType.REASON_INSUFFICIENT, result);
            }
        }

        metrics.recordSelection(result.status(), removedByStage);
        LOG.infof("Selection %s for creator %s returned %d captions (pool %d, eligible %d)", requestId, creatorId,
                result.items().size(), filtered.totalAvailable(), filtered.afterBudgetFilter());
        return result;
    }

    ScoredCandidate score(EligibleCaption eligible, CaptionBanditStat stat, RecentPatternWindow window,
            BehavioralSegment segment) {
        Caption caption = eligible.caption();
        double successes = stat != null ? stat.successes : 0.0;
        double failures = stat != null ? stat.failures : 0.0;
        long observations = stat != null ? stat.totalObservations : 0L;
        WilsonBounds bounds = stat != null && observations > 0
                ? new WilsonBounds(stat.confidenceLower, stat.confidenceUpper, stat.explorationBonus)
                : WilsonBounds.NO_DATA;

        double thompson = thompsonSamplingService.sample(successes, failures, banditConfig.getExplorationRate());
        double diversity = diversityScoringService.score(caption.priceTier, caption.triggerTag, caption.category,
                window);
        double emv = banditStatService.expectedValue(stat, caption);
        double composite = selectionRankingService.compositeScore(thompson, diversity, emv, eligible.budgetPenalty(),
                eligible.softPatternPenalty(), caption.priceTier, segment);
        String strategy = selectionRankingService.strategyFor(observations, bounds, emv);

        return new ScoredCandidate(caption.id, caption.text, caption.priceTier, caption.triggerTag, caption.category,
                thompson, diversity, emv, observations, bounds, composite, strategy);
    }

    /**
     * Resolves quota keys to tiers. Unknown tiers, negative quotas and quotas summing past the count are rejected.
     */
    Map<PriceTier, Integer> resolveQuotas(Map<String, Integer> raw, int countNeeded) {
        Map<PriceTier, Integer> quotas = new EnumMap<>(PriceTier.class);
        if (raw == null || raw.isEmpty()) {
            return quotas;
        }
        int total = 0;
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            PriceTier tier = PriceTier.fromValue(entry.getKey())
                    .orElseThrow(() -> new ValidationException("Unknown price tier in quota map: " + entry.getKey()));
            int quota = entry.getValue() == null ? 0 : entry.getValue();
            if (quota < 0) {
                throw new ValidationException("Quota for " + entry.getKey() + " must not be negative");
            }
            quotas.merge(tier, quota, Integer::sum);
            total += quota;
        }
        if (total > countNeeded) {
            throw new ValidationException(
                    "price_tier_quota_map sums to " + total + ", more than count_needed " + countNeeded);
        }
        return quotas;
    }

    private CaptionSelectionResultType buildResult(UUID requestId, FilterResult filtered, RankingOutcome outcome,
            int countNeeded) {
        List<SelectedCaptionType> items = new ArrayList<>(outcome.picks().size());
        for (RankedPick pick : outcome.picks()) {
            ScoredCandidate c = pick.candidate();
            items.add(new SelectedCaptionType(c.captionId(), c.text(), c.priceTier().getValue(), c.triggerTag(),
                    c.category(), c.compositeScore(), c.strategy(), WilsonBoundsType.fromBounds(c.bounds()),
                    pick.diversityViolation()));
        }

        Map<String, Integer> tierShortfalls = new LinkedHashMap<>();
        outcome.tierShortfalls().forEach((tier, missing) -> tierShortfalls.put(tier.getValue(), missing));

        PoolHealthType health = new PoolHealthType(filtered.totalAvailable(), filtered.afterCooldownFilter(),
                filtered.afterRestrictionFilter(), filtered.afterBudgetFilter(), items.size(), tierShortfalls);

        boolean shortfall = outcome.hasShortfall(countNeeded);
        return new CaptionSelectionResultType(requestId, items, health,
                shortfall ? CaptionSelectionResultType.STATUS_INSUFFICIENT : CaptionSelectionResultType.STATUS_OK,
                shortfall ? CaptionSelectionResultType.REASON_INSUFFICIENT : null);
    }
}
