package villagecompute.captions.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.data.models.Caption;
import villagecompute.captions.data.models.PriceTier;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scores candidates against a creator's recent assignment pattern and checks the hard diversity rules.
 *
 * <p>
 * <b>Soft score</b> (added to the composite with weight 0.15):
 * <ul>
 * <li>trigger tag seen in the last 5 assignments: −0.3, otherwise +0.1 (untagged captions get +0.1)</li>
 * <li>category seen in the last 3 assignments: −0.2, otherwise +0.1</li>
 * <li>−0.1 for every occurrence of the caption's tier in the last 7 assignments</li>
 * </ul>
 *
 * <p>
 * <b>Hard rules</b> (enforced by {@link SelectionRankingService} while ordering picks):
 * <ul>
 * <li>{@link DiversityRule#TIER_RUN}: the same tier at most twice consecutively</li>
 * <li>{@link DiversityRule#TRIGGER_REPEAT}: a trigger tag may not recur within 3 assignments</li>
 * <li>{@link DiversityRule#CATEGORY_REPEAT}: no category back-to-back</li>
 * </ul>
 */
@ApplicationScoped
public class DiversityScoringService {

    private static final Logger LOG = Logger.getLogger(DiversityScoringService.class);

    static final int TRIGGER_LOOKBACK = 5;
    static final int CATEGORY_LOOKBACK = 3;
    static final int TIER_LOOKBACK = 7;

    static final double TRIGGER_REPEAT_PENALTY = -0.3;
    static final double CATEGORY_REPEAT_PENALTY = -0.2;
    static final double NOVELTY_REWARD = 0.1;
    static final double TIER_OCCURRENCE_PENALTY = -0.1;

    static final int MAX_CONSECUTIVE_TIER = 2;
    static final int HARD_TRIGGER_LOOKBACK = 3;

    /**
     * Calculates the soft diversity score of a candidate.
     *
     * @param tier
     *            candidate price tier
     * @param triggerTag
     *            candidate trigger tag, or null
     * @param category
     *            candidate category
     * @param window
     *            creator's recent assignments
     * @return score, typically within [−1.2, 0.2]
     */
    public double score(PriceTier tier, String triggerTag, String category, RecentPatternWindow window) {
        double score = 0.0;

        if (triggerTag != null && window.containsTriggerTag(triggerTag, TRIGGER_LOOKBACK)) {
            score += TRIGGER_REPEAT_PENALTY;
        } else {
            score += NOVELTY_REWARD;
        }

        if (window.containsCategory(category, CATEGORY_LOOKBACK)) {
            score += CATEGORY_REPEAT_PENALTY;
        } else {
            score += NOVELTY_REWARD;
        }

        score += TIER_OCCURRENCE_PENALTY * window.countTier(tier, TIER_LOOKBACK);
        return score;
    }

    /**
     * Returns the hard rules a candidate would break if appended to the sequence.
     *
     * @param candidate
     *            the pick under consideration
     * @param sequence
     *            prior assignments and picks, oldest first
     * @return violated rules, empty when the pick is allowed
     */
    public EnumSet<DiversityRule> checkHardRules(PatternEntry candidate, List<PatternEntry> sequence) {
        EnumSet<DiversityRule> violations = EnumSet.noneOf(DiversityRule.class);
        int size = sequence.size();

        if (size >= MAX_CONSECUTIVE_TIER) {
            boolean run = true;
            for (int i = size - MAX_CONSECUTIVE_TIER; i < size; i++) {
                if (!Objects.equals(sequence.get(i).priceTier(), candidate.priceTier())) {
                    run = false;
                    break;
                }
            }
            if (run) {
                violations.add(DiversityRule.TIER_RUN);
            }
        }

        if (candidate.triggerTag() != null) {
            for (int i = Math.max(0, size - HARD_TRIGGER_LOOKBACK); i < size; i++) {
                if (candidate.triggerTag().equalsIgnoreCase(sequence.get(i).triggerTag())) {
                    violations.add(DiversityRule.TRIGGER_REPEAT);
                    break;
                }
            }
        }

        if (size > 0 && candidate.category() != null
                && candidate.category().equalsIgnoreCase(sequence.get(size - 1).category())) {
            violations.add(DiversityRule.CATEGORY_REPEAT);
        }

        return violations;
    }

    /**
     * Loads the creator's recent assignment pattern. Must be called within a transaction or request context.
     *
     * @param creatorId
     *            creator identifier
     * @param since
     *            earliest scheduled date considered
     * @return window of at most {@link RecentPatternWindow#MAX_ENTRIES} entries, newest first
     */
    public RecentPatternWindow loadWindow(String creatorId, LocalDate since) {
        List<ActiveAssignment> recent = ActiveAssignment.findRecentForCreator(creatorId, since,
                RecentPatternWindow.MAX_ENTRIES);
        if (recent.isEmpty()) {
            return RecentPatternWindow.empty();
        }

        Map<Long, Caption> captions = Caption.findByIds(recent.stream().map(a -> a.captionId).distinct().toList())
                .stream().collect(Collectors.toMap(c -> c.id, Function.identity()));

        List<PatternEntry> entries = new ArrayList<>(recent.size());
        for (ActiveAssignment assignment : recent) {
            Caption caption = captions.get(assignment.captionId);
            if (caption == null) {
                LOG.warnf("Assignment %s references missing caption %d, tag and category unknown", assignment.id,
                        assignment.captionId);
            }
            entries.add(new PatternEntry(assignment.captionId, assignment.priceTier,
                    caption != null ? caption.triggerTag : null, caption != null ? caption.category : null));
        }

        LOG.debugf("Loaded diversity window for creator %s: %d entries since %s", creatorId, entries.size(), since);
        return new RecentPatternWindow(entries);
    }
}
