/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.captions.services;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.captions.config.BanditConfig;
import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.data.models.Caption;

/**
 * Enforces weekly caps on psychological trigger tags per creator.
 *
 * <p>
 * Overusing a trigger (scarcity, urgency, ...) trains subscribers to ignore it, so each tag has a weekly cap
 * ({@code bandit.trigger.weekly-caps}). Usage counts the creator's non-cancelled assignments in the ISO week (Monday
 * to Sunday) of the target date.
 *
 * <p>
 * <b>Thresholds:</b>
 * <ul>
 * <li>usage ≥ cap → {@link TriggerBudgetAction#EXCLUDE} (−1.0, caption filtered out)</li>
 * <li>usage ≥ 0.8 × cap → {@link TriggerBudgetAction#WARNING} (−0.5)</li>
 * <li>usage ≥ 0.6 × cap → {@link TriggerBudgetAction#CAUTION} (−0.2)</li>
 * <li>otherwise → {@link TriggerBudgetAction#NORMAL} (0.0)</li>
 * </ul>
 * Untagged captions and tags missing from the cap table are never penalised.
 */
@ApplicationScoped
public class TriggerBudgetService {

    private static final Logger LOG = Logger.getLogger(TriggerBudgetService.class);

    private static final double WARNING_THRESHOLD = 0.8;
    private static final double CAUTION_THRESHOLD = 0.6;

    @Inject
    BanditConfig banditConfig;

    /**
     * Determines the budget action for a usage count against a cap.
     *
     * @param usage
     *            assignments already using the tag this week
     * @param cap
     *            weekly cap of the tag
     * @return action for the next use of the tag
     */
    public TriggerBudgetAction getBudgetAction(int usage, int cap) {
        if (usage >= cap) {
            return TriggerBudgetAction.EXCLUDE;
        } else if (usage >= WARNING_THRESHOLD * cap) {
            return TriggerBudgetAction.WARNING;
        } else if (usage >= CAUTION_THRESHOLD * cap) {
            return TriggerBudgetAction.CAUTION;
        }
        return TriggerBudgetAction.NORMAL;
    }

    /**
     * Calculates the penalty of using a tag once more.
     *
     * @param triggerTag
     *            the tag, or null when untagged
     * @param usage
     *            assignments already using the tag this week
     * @param cap
     *            the tag's weekly cap, empty when uncapped
     * @return 0.0, −0.2, −0.5 or −1.0
     */
    public double calculatePenalty(String triggerTag, int usage, OptionalInt cap) {
        if (triggerTag == null || cap.isEmpty()) {
            return 0.0;
        }
        return getBudgetAction(usage, cap.getAsInt()).getPenalty();
    }

    /**
     * Calculates the penalty of a tag using the configured cap table.
     *
     * @param triggerTag
     *            the tag, or null when untagged
     * @param weeklyUsage
     *            usage per normalised tag, as returned by {@link #loadWeeklyUsage}
     */
    public double calculatePenalty(String triggerTag, Map<String, Integer> weeklyUsage) {
        if (triggerTag == null) {
            return 0.0;
        }
        String normalized = normalize(triggerTag);
        return calculatePenalty(normalized, weeklyUsage.getOrDefault(normalized, 0),
                banditConfig.weeklyCapFor(normalized));
    }

    public boolean isExcluded(double penalty) {
        return penalty <= TriggerBudgetAction.EXCLUDE.getPenalty();
    }

    /**
     * Counts the creator's assignments per trigger tag within the ISO week containing {@code targetDate}.
     *
     * @param creatorId
     *            creator identifier
     * @param targetDate
     *            date whose week is measured
     * @return usage per lower-cased tag; untagged assignments are not counted
     */
    public Map<String, Integer> loadWeeklyUsage(String creatorId, LocalDate targetDate) {
        LocalDate weekStart = targetDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate weekEnd = weekStart.plusDays(6);

        List<ActiveAssignment> assignments = ActiveAssignment.findForCreatorBetween(creatorId, weekStart, weekEnd);
        if (assignments.isEmpty()) {
            return Map.of();
        }

        Map<Long, Caption> captions = Caption.findByIds(assignments.stream().map(a -> a.captionId).distinct().toList())
                .stream().collect(Collectors.toMap(c -> c.id, Function.identity()));

        Map<String, Integer> usage = new HashMap<>();
        for (ActiveAssignment assignment : assignments) {
            Caption caption = captions.get(assignment.captionId);
            if (caption != null && caption.triggerTag != null && !caption.triggerTag.isBlank()) {
                usage.merge(normalize(caption.triggerTag), 1, Integer::sum);
            }
        }

        LOG.debugf("Trigger usage for creator %s in week %s..%s: %s", creatorId, weekStart, weekEnd, usage);
        return usage;
    }

    private static String normalize(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }
}
