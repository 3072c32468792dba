package villagecompute.captions.services;

import java.util.List;

/**
 * Eligible pool of a selection request and its size after each stage.
 */
public record FilterResult(List<EligibleCaption> eligible, int totalAvailable, int afterCooldownFilter,
        int afterRestrictionFilter, int afterBudgetFilter) {
}
